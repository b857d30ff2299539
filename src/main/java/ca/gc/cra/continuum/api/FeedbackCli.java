package ca.gc.cra.continuum.api;

import ca.gc.cra.continuum.application.json.JsonSupport;
import ca.gc.cra.continuum.application.pipeline.InvalidRequestException;
import ca.gc.cra.continuum.config.CompositionRoot;
import ca.gc.cra.continuum.config.ContinuumConfig;
import ca.gc.cra.continuum.config.ContinuumRuntime;
import ca.gc.cra.continuum.config.EnvironmentConfig;
import ca.gc.cra.continuum.logging.LoggingConfigurator;
import ca.gc.cra.continuum.validation.Numbers;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code continuum feedback}: records feedback about an earlier analysis.
 *
 * @since 0.1.0
 */
public final class FeedbackCli {
  private static final Logger log = LoggerFactory.getLogger(FeedbackCli.class);
  private static final String SUMMARY_USAGE =
      "usage: feedback log_id=ID accuracy=0..5 helpful=0..5 accepted=true|false [config=FILE] [key=value ...]";
  private static final String HELP_TEXT = """
      Continuum feedback

      Usage:
        feedback log_id=ID accuracy=N helpful=N accepted=BOOL [options]

      Arguments:
        log_id=ID        log_id returned by analyze
        accuracy=N       0..5
        helpful=N        0..5
        accepted=BOOL    true|false

      Options:
        config=FILE      YAML configuration (common + feedback sections)
        store.kind=KIND  auto|github|kafka|file|none
        --verbose        Enable DEBUG logging
        --help           Show this message
      """;

  private FeedbackCli() {}

  public static void main(String[] args) {
    System.exit(run(args, EnvironmentConfig.system()).code());
  }

  static ExitCode run(String[] args, EnvironmentConfig environment) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String logId;
    int accuracy;
    int helpful;
    boolean accepted;
    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      logId = kv.remove("log_id");
      accuracy = Numbers.parseInt("accuracy", kv.remove("accuracy"), Integer.MIN_VALUE, Integer.MAX_VALUE);
      helpful = Numbers.parseInt("helpful", kv.remove("helpful"), Integer.MIN_VALUE, Integer.MAX_VALUE);
      accepted = ConfigCliUtils.parseBoolean("accepted", kv.remove("accepted"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ContinuumConfig config;
    try {
      config = ConfigCliUtils.resolve("feedback", kv, environment);
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try (ContinuumRuntime runtime = new CompositionRoot(config, environment).build()) {
      GovernanceApi api = new GovernanceApi(runtime);
      CliPrinter.println(new JsonSupport().write(api.feedback(logId, accuracy, helpful, accepted)));
      return ExitCode.SUCCESS;
    } catch (InvalidRequestException ex) {
      log.error("Feedback rejected: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure in feedback", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
