package ca.gc.cra.dfmet.api;

import ca.gc.cra.dfmet.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DFMET CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: dfmet <convert> [options]";
  private static final String HELP_TEXT = """
      DFMET command dispatcher

      Usage:
        dfmet <command> [options]

      Commands:
        convert     Convert a flight log to a per-second met table (convert --help for details)

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
   * <p>Everything after the command token, flags included, is handed to the subcommand unchanged.</p>
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] safe = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safe.length; i++) {
      if (safe[i] != null && !safe[i].isBlank() && !safe[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }

    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safe);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CliInput globals = CliInput.parse(Arrays.copyOfRange(safe, 0, commandIndex));
    if (globals.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (!globals.unknownFlags().isEmpty()) {
      log.error("Unknown option(s) before command: {}", String.join(", ", globals.unknownFlags()));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (globals.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = safe[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safe, commandIndex + 1, safe.length);

    return switch (command) {
      case "convert" -> ConvertCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
