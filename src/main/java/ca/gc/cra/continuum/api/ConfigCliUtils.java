package ca.gc.cra.continuum.api;

import ca.gc.cra.continuum.config.ConfigMerger;
import ca.gc.cra.continuum.config.ContinuumConfig;
import ca.gc.cra.continuum.config.Defaults;
import ca.gc.cra.continuum.config.EnvironmentConfig;
import ca.gc.cra.continuum.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the effective configuration for a command from CLI arguments, environment, YAML and defaults.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  /**
   * Builds the configuration. {@code config=PATH} is consumed from {@code args}; a named file that does not exist
   * is an error.
   *
   * @param command active command, selects the YAML section
   * @param args CLI settings; command-specific keys must already be removed
   * @param environment environment view
   * @return validated configuration
   * @throws IOException when the YAML file cannot be read
   * @throws IllegalArgumentException when a value is invalid
   */
  static ContinuumConfig resolve(String command, Map<String, String> args, EnvironmentConfig environment)
      throws IOException {
    String configPath = extractConfigPath(args);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      yaml = YamlConfigLoader.load(Path.of(configPath), command);
      if (yaml.isEmpty()) {
        throw new IllegalArgumentException("config file not found: " + configPath);
      }
    }
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        yaml, environment.asFlatMap(), args, Defaults.asFlatMap(), log::warn);
    ContinuumConfig config = ContinuumConfig.fromMap(merged);
    log.debug("Effective configuration: {}", config);
    return config;
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(String key, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    String trimmed = value.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was " + trimmed + ")");
  }
}
