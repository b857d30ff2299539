package ca.gc.cra.continuum.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvironmentConfigTest {

  @Test
  void mapsVariablesToConfigKeys() {
    EnvironmentConfig env = new EnvironmentConfig(Map.of(
        "CONTINUUM_LICENSE_KEY", " abc ",
        "CONTINUUM_ENGINE_URL", "http://engine:8080/analyze",
        "CONTINUUM_FINGERPRINT_SALT", "",
        "UNRELATED", "x"));

    assertEquals(
        Map.of("license.key", "abc", "engine.url", "http://engine:8080/analyze"),
        env.asFlatMap());
  }

  @Test
  void legacyGithubNamesAreFallbacks() {
    EnvironmentConfig legacy = new EnvironmentConfig(Map.of("GH_TOKEN", "t1", "GH_REPO", "o/r"));
    EnvironmentConfig both = new EnvironmentConfig(Map.of("GH_TOKEN", "t1", "GITHUB_TOKEN", "t2"));

    assertTrue(legacy.githubPresent());
    assertEquals("o/r", legacy.asFlatMap().get("store.github.repo"));
    assertEquals("t2", both.githubToken());
    assertFalse(both.githubPresent());
  }
}
