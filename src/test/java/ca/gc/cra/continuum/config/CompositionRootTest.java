package ca.gc.cra.continuum.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.continuum.application.license.LicensePolicyException;
import ca.gc.cra.continuum.application.pipeline.AnalyzeResult;
import ca.gc.cra.continuum.application.store.WriteReceipt;
import ca.gc.cra.continuum.domain.decision.Verdict;
import ca.gc.cra.continuum.domain.license.LicenseStatus;
import ca.gc.cra.continuum.infrastructure.engine.HttpDecisionEngine;
import ca.gc.cra.continuum.infrastructure.license.HttpLicenseBackend;
import ca.gc.cra.continuum.infrastructure.license.StaticLicenseBackend;
import ca.gc.cra.continuum.infrastructure.store.FileEventStore;
import ca.gc.cra.continuum.infrastructure.store.GitHubContentEventStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path dir;

  private static ContinuumConfig config(String... pairs) {
    Map<String, String> args = new HashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      args.put(pairs[i], pairs[i + 1]);
    }
    return ContinuumConfig.fromMap(args);
  }

  private static CompositionRoot root(ContinuumConfig config) {
    return new CompositionRoot(config, new EnvironmentConfig(Map.of()));
  }

  @Test
  void selectsAdaptersFromConfig() {
    assertNull(root(ContinuumConfig.defaults()).eventStore());
    assertNull(root(ContinuumConfig.defaults()).engine());
    assertInstanceOf(StaticLicenseBackend.class, root(ContinuumConfig.defaults()).licenseBackend());

    assertInstanceOf(FileEventStore.class,
        root(config("store.kind", "file", "store.file.dir", dir.toString())).eventStore());
    assertInstanceOf(GitHubContentEventStore.class,
        root(config("store.github.repo", "o/r", "store.github.token", "t")).eventStore());
    assertInstanceOf(HttpDecisionEngine.class,
        root(config("engine.url", "http://localhost:9/analyze")).engine());
    assertInstanceOf(HttpLicenseBackend.class,
        root(config("license.backend", "http", "license.endpoint", "http://localhost:9/license")).licenseBackend());
  }

  @Test
  void runtimeAnalyzesAndWritesToFileStore() throws Exception {
    ContinuumConfig config = config(
        "store.kind", "file",
        "store.file.dir", dir.toString(),
        "license.key", "k",
        "license.id", "lic-local");
    Verdict verdict = Verdict.builder().freqType("Neutral").mode("no-op").confidence(0.7, 0.6).build();

    try (ContinuumRuntime runtime = root(config).build(text -> verdict)) {
      LicenseStatus status = runtime.start();
      assertTrue(status.valid());
      assertTrue(runtime.watchdog().running());

      AnalyzeResult result = runtime.analyze().analyze("hello there");

      assertEquals(WriteReceipt.Status.WRITTEN, result.writeReceipt().status());
      assertTrue(Files.exists(dir.resolve(result.writeReceipt().path())));
      assertEquals(1L, runtime.metrics().totalAnalyses());
      assertEquals("file", runtime.writer().kind());
    }
    try (Stream<Path> files = Files.walk(dir)) {
      assertEquals(1L, files.filter(Files::isRegularFile).count());
    }
  }

  @Test
  void stopModeWithoutKeyFailsStartup() {
    ContinuumConfig config = config("license.mode", "stop");

    try (ContinuumRuntime runtime = root(config).build(text -> Verdict.builder().build())) {
      LicensePolicyException ex = assertThrows(LicensePolicyException.class, runtime::start);
      assertEquals(LicenseStatus.REASON_MISSING_KEY, ex.reason());
      assertFalse(runtime.watchdog().running());
    }
  }

  @Test
  void closeStopsWatchdog() {
    ContinuumRuntime runtime = root(ContinuumConfig.defaults()).build(null);
    runtime.start();

    runtime.close();

    assertFalse(runtime.watchdog().running());
    assertFalse(runtime.analyze().engineReady());
  }
}
