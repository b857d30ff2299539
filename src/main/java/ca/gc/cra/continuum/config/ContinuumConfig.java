package ca.gc.cra.continuum.config;

import ca.gc.cra.continuum.application.pipeline.AnalyzeUseCase;
import ca.gc.cra.continuum.application.metrics.MetricsAggregator;
import ca.gc.cra.continuum.domain.license.EnforcementMode;
import ca.gc.cra.continuum.logging.Logs;
import ca.gc.cra.continuum.validation.Numbers;
import ca.gc.cra.continuum.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated settings for one audit service process.
 * <p><strong>Why:</strong> Adapters are built from typed values only; string parsing and cross-field checks
 * happen once here so a bad key fails at startup with its name in the message.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param fingerprintSalt salt prepended to fingerprinted text; empty for unsalted fingerprints
 * @param maxInputLength maximum request length in characters
 * @param metricsWindowSize latency window capacity
 * @param license license settings
 * @param store event store settings
 * @param engine Decision Engine settings
 * @param telemetry metrics export settings
 * @since 0.1.0
 */
public record ContinuumConfig(
    String fingerprintSalt,
    int maxInputLength,
    int metricsWindowSize,
    License license,
    Store store,
    Engine engine,
    Telemetry telemetry) {

  public ContinuumConfig {
    fingerprintSalt = fingerprintSalt == null ? "" : fingerprintSalt;
    Objects.requireNonNull(license, "license");
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(engine, "engine");
    Objects.requireNonNull(telemetry, "telemetry");
  }

  /**
   * Embedded defaults: degrade mode, no store, no engine, no metrics export.
   *
   * @return default configuration
   */
  public static ContinuumConfig defaults() {
    return fromMap(Defaults.asFlatMap());
  }

  /**
   * Builds a configuration from flattened {@code key=value} settings.
   *
   * @param args merged settings; missing keys fall back to defaults
   * @return validated configuration
   * @throws IllegalArgumentException naming the offending key when a value is invalid
   */
  public static ContinuumConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Map<String, String> defaults = Defaults.asFlatMap();
    Settings s = key -> {
      String value = args.get(key);
      return value == null ? defaults.get(key) : value;
    };

    int maxInput = Numbers.parseInt("input.maxLength", s.get("input.maxLength"), 1, 1_000_000);
    int window = Numbers.parseInt("metrics.windowSize", s.get("metrics.windowSize"), 1, 1_000_000);
    return new ContinuumConfig(
        s.get("fingerprint.salt"),
        maxInput,
        window,
        License.from(s),
        Store.from(s),
        Engine.from(s),
        Telemetry.from(s));
  }

  @Override
  public String toString() {
    return "ContinuumConfig[fingerprintSalt=" + Logs.redact(fingerprintSalt)
        + ", maxInputLength=" + maxInputLength
        + ", metricsWindowSize=" + metricsWindowSize
        + ", license=" + license
        + ", store=" + store
        + ", engine=" + engine
        + ", telemetry=" + telemetry + "]";
  }

  @FunctionalInterface
  interface Settings {
    String get(String key);

    default String optional(String key) {
      return Strings.trimToNull(get(key));
    }

    default Duration millis(String key, long min, long max) {
      return Duration.ofMillis(Numbers.parseLong(key, get(key), min, max));
    }
  }

  /** Where license grants come from. */
  public enum LicenseBackend {
    /** Grant declared in configuration. */
    STATIC,
    /** Grant fetched from a licensing service. */
    HTTP;

    static LicenseBackend from(String raw) {
      String value = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
      if (value.isEmpty()) {
        return STATIC;
      }
      try {
        return valueOf(value);
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("license.backend must be static or http (was " + raw + ")", ex);
      }
    }
  }

  /**
   * License settings.
   *
   * @param mode enforcement mode
   * @param key license key; empty when absent
   * @param backend grant source
   * @param endpoint licensing service URL for the http backend
   * @param licenseId declared license id for the static backend
   * @param expiry declared expiry for the static backend; {@code null} for none
   * @param quota declared quota for the static backend; {@code null} for unlimited
   * @param watchdogInterval watchdog period before clamping
   * @param timeout http backend call timeout
   */
  public record License(
      EnforcementMode mode,
      String key,
      LicenseBackend backend,
      String endpoint,
      String licenseId,
      LocalDate expiry,
      Long quota,
      Duration watchdogInterval,
      Duration timeout) {

    static License from(Settings s) {
      LicenseBackend backend = LicenseBackend.from(s.get("license.backend"));
      String endpoint = s.optional("license.endpoint");
      if (backend == LicenseBackend.HTTP && endpoint == null) {
        throw new IllegalArgumentException("license.endpoint is required when license.backend=http");
      }
      String quota = s.optional("license.quota");
      return new License(
          EnforcementMode.from(s.get("license.mode")),
          Objects.requireNonNullElse(s.optional("license.key"), ""),
          backend,
          endpoint,
          s.optional("license.id"),
          parseDate("license.expiry", s.optional("license.expiry")),
          quota == null ? null : Numbers.parseLong("license.quota", quota, 0, Long.MAX_VALUE),
          Duration.ofSeconds(
              Numbers.parseLong("license.watchdogIntervalSeconds", s.get("license.watchdogIntervalSeconds"),
                  1, 86_400)),
          s.millis("license.timeoutMillis", 100, 120_000));
    }

    private static LocalDate parseDate(String key, String raw) {
      if (raw == null) {
        return null;
      }
      try {
        return LocalDate.parse(raw);
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException(key + " must be yyyy-MM-dd (was " + raw + ")", ex);
      }
    }

    @Override
    public String toString() {
      return "License[mode=" + mode + ", key=" + Logs.redact(key) + ", backend=" + backend
          + ", endpoint=" + endpoint + ", licenseId=" + licenseId + ", expiry=" + expiry
          + ", quota=" + quota + ", watchdogInterval=" + watchdogInterval + "]";
    }
  }

  /** Event store backend. */
  public enum StoreKind {
    /** GitHub when credentials are present, otherwise none. */
    AUTO,
    GITHUB,
    KAFKA,
    FILE,
    NONE;

    static StoreKind from(String raw) {
      String value = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
      if (value.isEmpty()) {
        return AUTO;
      }
      try {
        return valueOf(value);
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(
            "store.kind must be auto, github, kafka, file or none (was " + raw + ")", ex);
      }
    }
  }

  /**
   * Event store settings. {@code kind} is already resolved; it is never {@link StoreKind#AUTO}.
   *
   * @param kind resolved backend
   * @param githubRepo {@code owner/name}
   * @param githubToken API token
   * @param githubBranch target branch; {@code null} for the default branch
   * @param githubApiUrl API base URL
   * @param timeout single-write timeout
   * @param kafkaBootstrap Kafka bootstrap servers
   * @param kafkaTopic Kafka topic
   * @param fileDir local directory
   */
  public record Store(
      StoreKind kind,
      String githubRepo,
      String githubToken,
      String githubBranch,
      String githubApiUrl,
      Duration timeout,
      String kafkaBootstrap,
      String kafkaTopic,
      Path fileDir) {

    static Store from(Settings s) {
      StoreKind kind = StoreKind.from(s.get("store.kind"));
      String repo = s.optional("store.github.repo");
      String token = s.optional("store.github.token");
      if (kind == StoreKind.AUTO) {
        kind = repo != null && token != null ? StoreKind.GITHUB : StoreKind.NONE;
      }
      Duration timeout = s.millis("store.timeoutMillis", 100, 120_000);
      switch (kind) {
        case GITHUB -> {
          if (repo == null || token == null) {
            throw new IllegalArgumentException(
                "store.kind=github requires store.github.repo and store.github.token");
          }
          repo = Strings.requireRepoSlug("store.github.repo", repo);
        }
        case KAFKA -> {
          if (s.optional("store.kafka.bootstrap") == null) {
            throw new IllegalArgumentException("store.kafka.bootstrap is required when store.kind=kafka");
          }
          Strings.sanitizeTopic("store.kafka.topic", s.get("store.kafka.topic"));
        }
        case FILE -> {
          if (s.optional("store.file.dir") == null) {
            throw new IllegalArgumentException("store.file.dir is required when store.kind=file");
          }
        }
        default -> {
          // nothing to check
        }
      }
      return new Store(
          kind,
          repo,
          token,
          s.optional("store.github.branch"),
          Objects.requireNonNullElse(s.optional("store.github.apiUrl"), "https://api.github.com"),
          timeout,
          s.optional("store.kafka.bootstrap"),
          s.optional("store.kafka.topic"),
          toPath(s.optional("store.file.dir")));
    }

    private static Path toPath(String raw) {
      if (raw == null) {
        return null;
      }
      try {
        return Path.of(raw);
      } catch (InvalidPathException ex) {
        throw new IllegalArgumentException("store.file.dir is not a valid path: " + raw, ex);
      }
    }

    @Override
    public String toString() {
      return "Store[kind=" + kind + ", githubRepo=" + githubRepo + ", githubToken=" + Logs.redact(githubToken)
          + ", githubBranch=" + githubBranch + ", githubApiUrl=" + githubApiUrl + ", timeout=" + timeout
          + ", kafkaBootstrap=" + kafkaBootstrap + ", kafkaTopic=" + kafkaTopic + ", fileDir=" + fileDir + "]";
    }
  }

  /**
   * Decision Engine settings.
   *
   * @param url evaluation endpoint; {@code null} when no engine is configured
   * @param timeout call timeout
   */
  public record Engine(String url, Duration timeout) {
    static Engine from(Settings s) {
      return new Engine(s.optional("engine.url"), s.millis("engine.timeoutMillis", 100, 600_000));
    }

    public boolean configured() {
      return url != null;
    }
  }

  /**
   * Metrics export settings.
   *
   * @param exporter {@code otlp} or {@code none}
   * @param endpoint OTLP endpoint; {@code null} for the exporter default
   * @param resourceAttributes extra resource attributes
   */
  public record Telemetry(String exporter, String endpoint, String resourceAttributes) {
    static Telemetry from(Settings s) {
      String exporter = Objects.requireNonNullElse(s.optional("metricsExporter"), "none")
          .toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + exporter + ")");
      }
      return new Telemetry(exporter, s.optional("otelEndpoint"), s.optional("otelResourceAttributes"));
    }
  }

  static int defaultMaxInputLength() {
    return AnalyzeUseCase.DEFAULT_MAX_INPUT_LENGTH;
  }

  static int defaultWindowSize() {
    return MetricsAggregator.DEFAULT_WINDOW_SIZE;
  }
}
