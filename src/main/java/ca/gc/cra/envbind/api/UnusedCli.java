package ca.gc.cra.envbind.api;

import ca.gc.cra.envbind.application.pipeline.EnvConfig;
import ca.gc.cra.envbind.config.InspectConfig;
import ca.gc.cra.envbind.domain.failure.EnvConfigException;
import ca.gc.cra.envbind.logging.LoggingConfigurator;
import ca.gc.cra.envbind.logging.Logs;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists keys under the prefix that no field of a configuration class reads.
 *
 * @since 0.1.0
 */
public final class UnusedCli {
  private static final Logger log = LoggerFactory.getLogger(UnusedCli.class);
  static final String SUMMARY_USAGE =
      "usage: envbind unused spec=CLASS [prefix=NAME] [envFile=PATH] [yaml=PATH] [--no-system-env]";
  private static final String HELP_TEXT = """
      envbind unused

      Prints, one per line, every key under PREFIX_ that the configuration class does
      not read. Without a prefix every key of the layered sources is considered.

      Options:
        spec=CLASS       Fully qualified configuration class (required)
        prefix=NAME      Key prefix, letters, digits and underscore
        envFile=PATH     KEY=VALUE file, below the process environment
        yaml=PATH        YAML file, below the KEY=VALUE file
        --no-system-env  Ignore the process environment
        --verbose        Enable DEBUG logging
        --help           Show this message
      """;

  private UnusedCli() {}

  /**
   * Runs the command.
   *
   * @param args arguments after the command word
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for unused command");
    }
    Optional<InspectConfig> parsed = InspectCliSupport.parseConfig(input, SUMMARY_USAGE);
    if (parsed.isEmpty()) {
      return ExitCode.INVALID_ARGS;
    }
    InspectConfig config = parsed.get();

    Object spec;
    try {
      spec = InspectCliSupport.instantiate(config.specClass());
    } catch (ReflectiveOperationException | LinkageError ex) {
      log.error("Unable to load configuration class {}: {}", config.specClass(), ex.toString());
      return ExitCode.INVALID_ARGS;
    }

    try {
      List<String> unused =
          new EnvConfig(InspectCliSupport.buildSource(config)).unused(config.prefix(), spec);
      log.debug("{} unused keys under prefix '{}'", unused.size(), config.prefix());
      CliPrinter.printLines(unused);
      return ExitCode.SUCCESS;
    } catch (EnvConfigException ex) {
      log.error("Unable to inspect {}: {}", config.specClass(),
          Logs.summarize(ex));
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read input file", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid input file: {}", Logs.summarize(ex));
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while inspecting {}", config.specClass(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
