package ca.gc.cra.envbind.api;

import ca.gc.cra.envbind.application.pipeline.EnvConfig;
import ca.gc.cra.envbind.application.port.EnvironmentSource;
import ca.gc.cra.envbind.config.InspectConfig;
import ca.gc.cra.envbind.domain.failure.EnvConfigException;
import ca.gc.cra.envbind.logging.LoggingConfigurator;
import ca.gc.cra.envbind.logging.Logs;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds the layered environment onto a fresh configuration object and reports the first failure.
 *
 * @since 0.1.0
 */
public final class CheckCli {
  private static final Logger log = LoggerFactory.getLogger(CheckCli.class);
  static final String SUMMARY_USAGE =
      "usage: envbind check spec=CLASS [prefix=NAME] [envFile=PATH] [yaml=PATH] [--no-system-env]";
  private static final String HELP_TEXT = """
      envbind check

      Binds the environment onto a new instance of a configuration class and exits
      with status 4 on the first missing required key or conversion failure.

      Options:
        spec=CLASS       Fully qualified configuration class (required)
        prefix=NAME      Key prefix, letters, digits and underscore
        envFile=PATH     KEY=VALUE file, below the process environment
        yaml=PATH        YAML file, below the KEY=VALUE file
        --no-system-env  Ignore the process environment
        --verbose        Enable DEBUG logging, including where each key was resolved
        --help           Show this message
      """;

  private CheckCli() {}

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
      log.debug("Verbose logging enabled for check command");
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
      EnvironmentSource source = InspectCliSupport.buildSource(config);
      EnvConfig envConfig = new EnvConfig(source);
      int variables = envConfig.gather(config.prefix(), spec).size();
      envConfig.process(config.prefix(), InspectCliSupport.instantiate(config.specClass()));
      CliPrinter.println("OK: " + variables + " variables checked for " + config.specClass());
      return ExitCode.SUCCESS;
    } catch (EnvConfigException ex) {
      log.error("Configuration check failed: {}",
          Logs.summarize(ex));
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read input file", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid input file: {}", Logs.summarize(ex));
      return ExitCode.CONFIG_ERROR;
    } catch (ReflectiveOperationException ex) {
      log.error("Unable to load configuration class {}: {}", config.specClass(), ex.toString());
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while checking {}", config.specClass(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
