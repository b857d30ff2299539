package ca.gc.cra.continuum.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parsesWithinRange() {
    assertEquals(42L, Numbers.parseLong("n", " 42 ", 0, 100));
    assertEquals(1, Numbers.parseInt("n", "1", 1, 1));
  }

  @Test
  void rejectsBlankMalformedAndOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("n", "", 0, 10));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("n", "4x", 0, 10));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("input.maxLength", "0", 1, 10));
    assertTrue(ex.getMessage().startsWith("input.maxLength must be between 1 and 10"));
  }
}
