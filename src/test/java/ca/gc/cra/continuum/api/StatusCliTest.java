package ca.gc.cra.continuum.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import ca.gc.cra.continuum.application.json.JsonSupport;
import ca.gc.cra.continuum.config.EnvironmentConfig;
import ca.gc.cra.continuum.domain.license.LicenseStatus;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StatusCliTest {
  private StringWriter out;

  @BeforeEach
  void captureOutput() {
    out = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> section(String name) {
    return (Map<String, Object>) new JsonSupport().parseObject(out.toString().trim()).get(name);
  }

  @Test
  void reportsValidLicenseFromEnvironment() {
    EnvironmentConfig env = new EnvironmentConfig(Map.of("CONTINUUM_LICENSE_KEY", "secret-key-value"));

    ExitCode exit = StatusCli.run(new String[] {"license.id=lic-9"}, env);

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals("Continuum API", section("service").get("name"));
    assertEquals("healthy", section("health").get("status"));
    assertEquals(true, section("license").get("valid"));
    assertEquals("lic-9", section("license").get("license_id"));
    assertFalse(out.toString().contains("secret-key-value"));
  }

  @Test
  void stopModeWithoutKeyStillPrintsReport() {
    ExitCode exit = StatusCli.run(new String[] {"license.mode=stop"}, new EnvironmentConfig(Map.of()));

    assertEquals(ExitCode.LICENSE_INVALID, exit);
    assertEquals(false, section("license").get("valid"));
    assertEquals(LicenseStatus.REASON_MISSING_KEY, section("license").get("reason"));
    assertEquals("stop", section("license").get("mode"));
  }

  @Test
  void invalidStoreConfigurationIsConfigError() {
    ExitCode exit = StatusCli.run(new String[] {"store.kind=kafka"}, new EnvironmentConfig(Map.of()));

    assertEquals(ExitCode.CONFIG_ERROR, exit);
  }
}
