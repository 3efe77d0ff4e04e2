package ca.gc.cra.tide.api;

import ca.gc.cra.tide.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TIDE CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: tide <stream|decode> [options]";
  private static final String HELP_TEXT = """
      TIDE command dispatcher

      Usage:
        tide <command> [options]

      Commands:
        stream      Stream a logical replication slot to logging subscribers (stream --help for details)
        decode      Decode one hex-encoded pgoutput message

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
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
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token names the command
   * @return exit code reported by the command
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
    String[] delegateArgs = forwardedArgs(args, remainder[0]);
    return switch (command) {
      case "stream" -> StreamCli.run(delegateArgs);
      case "decode" -> DecodeCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] forwardedArgs(String[] args, String command) {
    String[] copy = Arrays.stream(args)
        .filter(arg -> arg != null && !arg.isBlank())
        .map(String::trim)
        .toArray(String[]::new);
    for (int i = 0; i < copy.length; i++) {
      if (copy[i].equals(command)) {
        String[] result = new String[copy.length - 1];
        System.arraycopy(copy, 0, result, 0, i);
        System.arraycopy(copy, i + 1, result, i, copy.length - i - 1);
        return result;
      }
    }
    return copy;
  }
}
