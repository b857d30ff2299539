package ca.gc.cra.continuum.api;

import ca.gc.cra.continuum.application.json.JsonSupport;
import ca.gc.cra.continuum.application.license.LicensePolicyException;
import ca.gc.cra.continuum.application.pipeline.InvalidRequestException;
import ca.gc.cra.continuum.application.pipeline.ServiceUnavailableException;
import ca.gc.cra.continuum.application.port.DecisionEngineException;
import ca.gc.cra.continuum.config.CompositionRoot;
import ca.gc.cra.continuum.config.ContinuumConfig;
import ca.gc.cra.continuum.config.ContinuumRuntime;
import ca.gc.cra.continuum.config.EnvironmentConfig;
import ca.gc.cra.continuum.domain.decision.Verdict;
import ca.gc.cra.continuum.infrastructure.engine.VerdictParser;
import ca.gc.cra.continuum.logging.LoggingConfigurator;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code continuum analyze}: analyzes one text through the Decision Engine, or replays captured verdicts from an
 * NDJSON file and prints a metrics summary.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: analyze (text=TEXT | in=FILE.ndjson) [config=FILE] [key=value ...] [--pretty]";
  private static final String HELP_TEXT = """
      Continuum analyze

      Usage:
        analyze text=TEXT [options]      Evaluate TEXT through engine.url
        analyze in=FILE.ndjson [options] Replay lines of {"text": ..., "verdict": {...}}

      Options:
        config=FILE        YAML configuration (common + analyze sections)
        engine.url=URL     Decision Engine endpoint (required for text=)
        store.kind=KIND    auto|github|kafka|file|none
        license.mode=MODE  degrade|stop
        --pretty           Pretty-print JSON output
        --verbose          Enable DEBUG logging
        --help             Show this message

      Responses are printed only; events written to the store carry fingerprints, never text.
      """;

  private AnalyzeCli() {}

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
    boolean pretty = input.hasFlag("--pretty");

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String text = kv.remove("text");
    String in = kv.remove("in");
    if ((text == null) == (in == null)) {
      log.error("Exactly one of text= or in= is required");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ContinuumConfig config;
    try {
      config = ConfigCliUtils.resolve("analyze", kv, environment);
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    JsonSupport json = new JsonSupport();
    try (ContinuumRuntime runtime = new CompositionRoot(config, environment).build()) {
      runtime.start();
      GovernanceApi api = new GovernanceApi(runtime);
      if (text != null) {
        CliPrinter.println(json.write(api.analyze(text), pretty));
      } else {
        ReplaySummary summary = replay(api, Path.of(in), json, pretty);
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("replayed", summary.replayed());
        report.put("rejected", summary.rejected());
        report.put("metrics", api.metrics());
        report.put("stats", api.stats());
        CliPrinter.println(json.write(report, pretty));
      }
      return ExitCode.SUCCESS;
    } catch (InvalidRequestException ex) {
      log.error("Request rejected: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (ServiceUnavailableException ex) {
      log.error("{}; set engine.url or replay with in=", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (LicensePolicyException ex) {
      log.error("License rejected request: {}", ex.reason());
      return ExitCode.LICENSE_INVALID;
    } catch (DecisionEngineException ex) {
      log.error("Decision engine failure: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("Replay input could not be read: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure in analyze", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static ReplaySummary replay(GovernanceApi api, Path file, JsonSupport json, boolean pretty) throws IOException {
    long replayed = 0;
    long rejected = 0;
    long lineNumber = 0;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        String text;
        Verdict verdict;
        try {
          Map<String, Object> doc = json.parseObject(line);
          Object rawText = doc.get("text");
          Object rawVerdict = doc.get("verdict");
          if (!(rawText instanceof String s) || !(rawVerdict instanceof Map<?, ?> verdictDoc)) {
            throw new IllegalArgumentException("line needs a string text and an object verdict");
          }
          text = s;
          verdict = VerdictParser.parse(verdictDoc);
        } catch (IllegalArgumentException ex) {
          log.warn("Skipping replay line {}: {}", lineNumber, ex.getMessage());
          rejected++;
          continue;
        }
        try {
          CliPrinter.println(json.write(api.replay(text, verdict), pretty));
          replayed++;
        } catch (InvalidRequestException ex) {
          log.warn("Replay line {} rejected: {}", lineNumber, ex.getMessage());
          rejected++;
        }
      }
    }
    log.info("Replay of {} finished: {} recorded, {} rejected", file.getFileName(), replayed, rejected);
    return new ReplaySummary(replayed, rejected);
  }

  record ReplaySummary(long replayed, long rejected) {}
}
