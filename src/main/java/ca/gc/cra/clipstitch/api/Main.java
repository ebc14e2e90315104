package ca.gc.cra.clipstitch.api;

import ca.gc.cra.clipstitch.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Top-level dispatcher for the ClipStitch command line.
 *
 * <p>The first argument names the command; the remaining arguments are passed to it unchanged.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: clipstitch <cut|combine|probe> [options]";
  private static final String HELP_TEXT = """
      ClipStitch

      Usage:
        clipstitch <command> [options]

      Commands:
        cut      Split one video into fixed-length clips (clip_01.mp4, clip_02.mp4, ...)
        combine  Join clips end to end into one video
        probe    Print the duration and track layout of a video

      Run 'clipstitch <command> --help' for command options.
      Exit codes: 0 ok, 2 invalid arguments, 3 I/O, 4 configuration, 5 runtime, 6 media.
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    if (args == null || args.length == 0 || args[0] == null || args[0].isBlank()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = args[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);
    return switch (command) {
      case "cut" -> CutCli.run(delegateArgs);
      case "combine" -> CombineCli.run(delegateArgs);
      case "probe" -> ProbeCli.run(delegateArgs);
      case "--help", "-h", "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      case "--verbose", "-v" -> {
        LoggingConfigurator.enableVerboseLogging();
        yield run(delegateArgs);
      }
      default -> {
        log.error("Unknown command: {}", args[0]);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
