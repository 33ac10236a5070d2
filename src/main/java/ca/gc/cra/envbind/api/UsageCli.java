package ca.gc.cra.envbind.api;

import ca.gc.cra.envbind.application.pipeline.EnvConfig;
import ca.gc.cra.envbind.application.walk.VariableInfo;
import ca.gc.cra.envbind.config.InspectConfig;
import ca.gc.cra.envbind.domain.failure.EnvConfigException;
import ca.gc.cra.envbind.infrastructure.usage.UsagePrinter;
import ca.gc.cra.envbind.infrastructure.usage.UsageRow;
import ca.gc.cra.envbind.infrastructure.usage.UsageTemplate;
import ca.gc.cra.envbind.logging.LoggingConfigurator;
import ca.gc.cra.envbind.logging.Logs;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the environment variables a configuration class reads.
 *
 * @since 0.1.0
 */
public final class UsageCli {
  private static final Logger log = LoggerFactory.getLogger(UsageCli.class);
  static final String SUMMARY_USAGE =
      "usage: envbind usage spec=CLASS [prefix=NAME] [format=table|list|json|custom] "
          + "[template=PATTERN] [envFile=PATH] [yaml=PATH] [--no-system-env]";
  private static final String HELP_TEXT = """
      envbind usage

      Prints every environment variable a configuration class reads, with its type,
      default, required flag and description.

      Options:
        spec=CLASS              Fully qualified configuration class (required)
        prefix=NAME             Key prefix, letters, digits and underscore
        format=table|list|json|custom
                                Output layout (default table)
        template=PATTERN        Per-variable layout for format=custom, with {key} {alias}
                                {type} {default} {required} {description}, \\n and \\t
        envFile=PATH            KEY=VALUE file, used to size indexed lists
        yaml=PATH               YAML file, used to size indexed lists
        --no-system-env         Ignore the process environment
        --verbose               Enable DEBUG logging
        --help                  Show this message
      """;

  private UsageCli() {}

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
      log.debug("Verbose logging enabled for usage command");
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
      EnvConfig envConfig = new EnvConfig(InspectCliSupport.buildSource(config));
      List<VariableInfo> infos = envConfig.gather(config.prefix(), spec);
      UsagePrinter printer = new UsagePrinter();
      List<UsageRow> rows = UsagePrinter.rows(infos);
      if (config.template().isPresent()) {
        UsageTemplate template = config.template().get();
        CliPrinter.render(out -> printer.print(rows, template, out));
      } else {
        CliPrinter.render(out -> printer.print(rows, config.format(), out));
      }
      return ExitCode.SUCCESS;
    } catch (EnvConfigException ex) {
      log.error("Unable to document {}: {}", config.specClass(),
          Logs.summarize(ex));
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read input file or write usage", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid input file: {}", Logs.summarize(ex));
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while documenting {}", config.specClass(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
