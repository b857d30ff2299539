package ca.gc.cra.continuum.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void describeReportsOnlyLength() {
    assertEquals("len=11", Logs.describe("hello world"));
    assertEquals("<null>", Logs.describe(null));
  }

  @Test
  void redactHidesAnySetValue() {
    assertEquals("[REDACTED]", Logs.redact("ghp_123"));
    assertEquals("<unset>", Logs.redact(""));
  }
}
