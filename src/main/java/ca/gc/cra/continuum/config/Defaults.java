package ca.gc.cra.continuum.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embedded defaults for every configuration key, flattened to strings.
 *
 * <p>The same table serves all CLI commands; YAML, environment and CLI values are layered on top.</p>
 */
public final class Defaults {
  private static final Map<String, String> DEFAULTS = build();

  private Defaults() {}

  /**
   * Returns the default settings.
   *
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> build() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("fingerprint.salt", "");
    map.put("input.maxLength", Integer.toString(ContinuumConfig.defaultMaxInputLength()));
    map.put("license.mode", "degrade");
    map.put("license.key", "");
    map.put("license.backend", "static");
    map.put("license.endpoint", "");
    map.put("license.id", "");
    map.put("license.expiry", "");
    map.put("license.quota", "");
    map.put("license.watchdogIntervalSeconds", "300");
    map.put("license.timeoutMillis", "5000");
    map.put("metrics.windowSize", Integer.toString(ContinuumConfig.defaultWindowSize()));
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("store.kind", "auto");
    map.put("store.github.repo", "");
    map.put("store.github.token", "");
    map.put("store.github.branch", "");
    map.put("store.github.apiUrl", "https://api.github.com");
    map.put("store.timeoutMillis", "10000");
    map.put("store.kafka.bootstrap", "");
    map.put("store.kafka.topic", "continuum.audit.events");
    map.put("store.file.dir", "");
    map.put("engine.url", "");
    map.put("engine.timeoutMillis", "30000");
    return Map.copyOf(map);
  }
}
