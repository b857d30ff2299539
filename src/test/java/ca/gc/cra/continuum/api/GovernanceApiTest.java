package ca.gc.cra.continuum.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.continuum.application.pipeline.InvalidRequestException;
import ca.gc.cra.continuum.config.CompositionRoot;
import ca.gc.cra.continuum.config.ContinuumConfig;
import ca.gc.cra.continuum.config.ContinuumRuntime;
import ca.gc.cra.continuum.config.EnvironmentConfig;
import ca.gc.cra.continuum.domain.decision.Verdict;
import ca.gc.cra.continuum.domain.license.LicenseStatus;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GovernanceApiTest {
  @TempDir Path dir;

  private static final Verdict NEUTRAL =
      Verdict.builder().freqType("Neutral").mode("no-op").confidence(0.9, 0.8).build();

  private ContinuumRuntime runtime(String... pairs) {
    Map<String, String> args = new HashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      args.put(pairs[i], pairs[i + 1]);
    }
    EnvironmentConfig env = new EnvironmentConfig(Map.of("GITHUB_REPO", "acme/audit"));
    return new CompositionRoot(ContinuumConfig.fromMap(args), env).build(text -> NEUTRAL);
  }

  @Test
  void rootDescribesService() {
    try (ContinuumRuntime runtime = runtime()) {
      Map<String, Object> root = new GovernanceApi(runtime).root();

      assertEquals("Continuum API", root.get("name"));
      assertEquals("2.0.0", root.get("version"));
      assertEquals("active", root.get("status"));
    }
  }

  @Test
  void healthReportsStoreAndLicenseWithoutSecrets() {
    try (ContinuumRuntime runtime = runtime("store.kind", "file", "store.file.dir", dir.toString())) {
      runtime.start();
      Map<String, Object> health = new GovernanceApi(runtime).health();

      assertEquals("healthy", health.get("status"));
      assertEquals(true, health.get("engine_ready"));
      assertEquals(true, health.get("store_enabled"));
      assertEquals("file", health.get("store_kind"));
      assertEquals(false, health.get("github_env_present"));
      assertEquals("acme/audit", health.get("github_repo_effective"));
      assertEquals(false, health.get("license_valid"));
      assertFalse(health.toString().contains("token"));
    }
  }

  @Test
  void analyzeFeedsStatsAndMetrics() throws Exception {
    try (ContinuumRuntime runtime = runtime("store.kind", "file", "store.file.dir", dir.toString())) {
      runtime.start();
      GovernanceApi api = new GovernanceApi(runtime);

      Map<String, Object> response = api.analyze("please review the draft");
      String logId = (String) response.get("log_id");
      api.feedback(logId, 4, 5, true);

      assertEquals("ALLOW", response.get("decision_state"));
      assertEquals("written", response.get("write_status"));
      Map<String, Object> stats = api.stats();
      assertEquals(1L, stats.get("total_analyses"));
      assertEquals(1L, stats.get("feedback_count"));
      assertEquals(2L, stats.get("write_successes"));
      assertEquals(0L, stats.get("write_failures"));
      assertEquals(1L, api.metrics().get("total_analyses"));
    }
  }

  @Test
  void replayRecordsSuppliedVerdict() {
    try (ContinuumRuntime runtime = runtime()) {
      GovernanceApi api = new GovernanceApi(runtime);

      Map<String, Object> response = api.replay("hold on", Verdict.builder()
          .freqType("Urgent").mode("block").confidence(0.95, 0.9).build());

      assertEquals("BLOCK", response.get("decision_state"));
      assertEquals("skipped", response.get("write_status"));
      assertThrows(InvalidRequestException.class, () -> api.replay("", NEUTRAL));
    }
  }

  @Test
  void licenseViewCarriesModeAndHaltFlag() {
    try (ContinuumRuntime runtime = runtime("license.key", "k", "license.id", "lic-1")) {
      runtime.start();
      Map<String, Object> license = new GovernanceApi(runtime).license();

      assertEquals(true, license.get("valid"));
      assertEquals(LicenseStatus.REASON_OK, license.get("reason"));
      assertEquals("lic-1", license.get("license_id"));
      assertEquals("degrade", license.get("mode"));
      assertEquals(false, license.get("halted"));
      assertFalse(license.containsKey("key"));
      assertTrue(license.containsKey("checked_at_utc"));
    }
  }
}
