package ca.gc.cra.continuum.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.continuum.config.EnvironmentConfig;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private static final EnvironmentConfig EMPTY_ENV = new EnvironmentConfig(Map.of());

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

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0], EMPTY_ENV));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(null, EMPTY_ENV));
    assertTrue(out.toString().contains("usage: continuum"));
  }

  @Test
  void helpFlagSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}, EMPTY_ENV));
    assertTrue(out.toString().contains("Commands:"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"launch"}, EMPTY_ENV));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"--bogus"}, EMPTY_ENV));
  }

  @Test
  void dispatchesToCommandHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"Analyze", "--help"}, EMPTY_ENV));
    assertTrue(out.toString().contains("Continuum analyze"));

    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"feedback", "-h"}, EMPTY_ENV));
    assertTrue(out.toString().contains("Continuum feedback"));

    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"status", "help"}, EMPTY_ENV));
    assertTrue(out.toString().contains("Continuum status"));
  }

  @Test
  void exitCodesAreStable() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(2, ExitCode.INVALID_ARGS.code());
    assertEquals(6, ExitCode.LICENSE_INVALID.code());
  }
}
