package ca.gc.cra.continuum.api;

import ca.gc.cra.continuum.config.EnvironmentConfig;
import ca.gc.cra.continuum.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code continuum} command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: continuum <analyze|feedback|status> [options]";
  private static final String HELP_TEXT = """
      Continuum audit service

      Usage:
        continuum <command> [options]

      Commands:
        analyze    Analyze text or replay captured verdicts (analyze --help)
        feedback   Record feedback for an analysis (feedback --help)
        status     Validate the license and print health (status --help)

      Global flags:
        --help     Show this message
        --verbose  Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return run(args, EnvironmentConfig.system());
  }

  static ExitCode run(String[] args, EnvironmentConfig environment) {
    String[] safe = args == null ? new String[0] : args;
    if (safe.length == 0 || safe[0] == null || safe[0].isBlank()) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String first = safe[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safe, 1, safe.length);
    if (first.startsWith("-")) {
      CliInput input = CliInput.parse(safe);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      if (input.verbose() && delegateArgs.length > 0) {
        LoggingConfigurator.enableVerboseLogging();
        log.debug("Verbose logging enabled for dispatcher");
        return run(delegateArgs, environment);
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    return switch (first) {
      case "analyze" -> AnalyzeCli.run(delegateArgs, environment);
      case "feedback" -> FeedbackCli.run(delegateArgs, environment);
      case "status" -> StatusCli.run(delegateArgs, environment);
      default -> {
        log.error("Unknown command: {}", first);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
