package ca.gc.cra.continuum.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps process environment variables onto configuration keys.
 *
 * <p>GitHub credentials accept both naming schemes: {@code GITHUB_TOKEN}/{@code GITHUB_REPO} first, then the
 * legacy {@code GH_TOKEN}/{@code GH_REPO}.</p>
 */
public final class EnvironmentConfig {
  private static final Map<String, String> DIRECT = Map.of(
      "CONTINUUM_FINGERPRINT_SALT", "fingerprint.salt",
      "CONTINUUM_LICENSE_KEY", "license.key",
      "CONTINUUM_LICENSE_MODE", "license.mode",
      "CONTINUUM_LICENSE_ENDPOINT", "license.endpoint",
      "CONTINUUM_ENGINE_URL", "engine.url",
      "CONTINUUM_STORE_KIND", "store.kind",
      "GITHUB_BRANCH", "store.github.branch");

  private final Map<String, String> env;

  public EnvironmentConfig(Map<String, String> env) {
    this.env = Map.copyOf(Objects.requireNonNull(env, "env"));
  }

  /**
   * Reads the current process environment.
   *
   * @return environment view
   */
  public static EnvironmentConfig system() {
    return new EnvironmentConfig(System.getenv());
  }

  /**
   * Returns the settings contributed by the environment; unset or blank variables are omitted.
   *
   * @return flat configuration map
   */
  public Map<String, String> asFlatMap() {
    Map<String, String> out = new LinkedHashMap<>();
    DIRECT.forEach((variable, key) -> {
      String value = value(variable);
      if (value != null) {
        out.put(key, value);
      }
    });
    String token = githubToken();
    if (token != null) {
      out.put("store.github.token", token);
    }
    String repo = githubRepo();
    if (repo != null) {
      out.put("store.github.repo", repo);
    }
    return out;
  }

  public String githubToken() {
    return firstPresent("GITHUB_TOKEN", "GH_TOKEN");
  }

  public String githubRepo() {
    return firstPresent("GITHUB_REPO", "GH_REPO");
  }

  /**
   * Indicates whether both a GitHub token and repository are set under either naming scheme.
   *
   * @return {@code true} when the GitHub store can be enabled from the environment
   */
  public boolean githubPresent() {
    return githubToken() != null && githubRepo() != null;
  }

  private String firstPresent(String preferred, String legacy) {
    String value = value(preferred);
    return value != null ? value : value(legacy);
  }

  private String value(String variable) {
    String raw = env.get(variable);
    return raw == null || raw.isBlank() ? null : raw.trim();
  }
}
