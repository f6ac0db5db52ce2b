package ca.gc.cra.relay.api;

import ca.gc.cra.relay.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RELAY CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: relay serve targetHost=HOST [options]";
  private static final String HELP_TEXT = """
      RELAY command dispatcher

      Usage:
        relay <command> [options]

      Commands:
        serve       Listen for HTTP clients and relay them to one target (serve --help for details)

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
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(safeArgs);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[safeArgs.length - 1];
    System.arraycopy(safeArgs, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(safeArgs, commandIndex + 1, delegateArgs, commandIndex, safeArgs.length - commandIndex - 1);
    log.debug("Dispatching {} with {}", command, Arrays.toString(delegateArgs));

    return switch (command) {
      case "serve" -> ServeCli.run(delegateArgs);
      default -> {
        if (CliInput.parse(safeArgs).verbose()) {
          LoggingConfigurator.enableVerboseLogging();
        }
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=") && !arg.equalsIgnoreCase("help")) {
        return i;
      }
    }
    return -1;
  }
}
