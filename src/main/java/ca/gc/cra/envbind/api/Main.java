package ca.gc.cra.envbind.api;

import ca.gc.cra.envbind.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * envbind CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: envbind <usage|check|unused> [options]";
  private static final String HELP_TEXT = """
      envbind command dispatcher

      Usage:
        envbind <command> spec=CLASS [options]

      Commands:
        usage    Print the variables a configuration class reads (usage --help for details)
        check    Bind the environment onto a configuration class and report failures
        unused   List keys under the prefix that no field reads

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first positional token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = withoutFirst(args, remainder[0]);

    return switch (command) {
      case "usage" -> UsageCli.run(delegateArgs);
      case "check" -> CheckCli.run(delegateArgs);
      case "unused" -> UnusedCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  // Flags stay with the subcommand; only the command word is removed.
  private static String[] withoutFirst(String[] args, String token) {
    List<String> out = new ArrayList<>(args.length);
    boolean removed = false;
    for (String arg : args) {
      if (!removed && arg != null && arg.trim().equals(token)) {
        removed = true;
        continue;
      }
      out.add(arg);
    }
    return out.toArray(new String[0]);
  }
}
