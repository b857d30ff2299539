package ca.gc.cra.continuum.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Layers configuration sources with precedence CLI &gt; environment &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings map.
   *
   * @param yaml YAML settings, when a config file was given
   * @param env settings contributed by the environment
   * @param cli CLI {@code key=value} overrides
   * @param defaults embedded defaults
   * @param warn receives a message whenever a CLI value replaces one from YAML or the environment
   * @return immutable merged map
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> env,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Map<String, String> yamlValues = yaml == null ? Map.of() : yaml.orElse(Map.of());
    Map<String, String> envValues = env == null ? Map.of() : env;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlValues);
    merged.putAll(envValues);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        if (warn != null && (yamlValues.containsKey(key) || envValues.containsKey(key))) {
          warn.accept("CLI overrides configured value for key: " + key);
        }
        merged.put(key, value);
      });
    }
    return Map.copyOf(merged);
  }
}
