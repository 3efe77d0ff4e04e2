package ca.gc.cra.tide.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {
  @Test
  void acceptsInclusiveBounds() {
    assertEquals(1L, Numbers.requireRange("port", 1, 1, 65_535));
    assertEquals(65_535L, Numbers.requireRange("port", 65_535, 1, 65_535));
  }

  @Test
  void rejectsOutOfRangeWithDiagnostic() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("port", 0, 1, 65_535));
    assertEquals("port must be between 1 and 65535 (was 0)", ex.getMessage());
  }

  @Test
  void parseRangeTrimsAndValidates() {
    assertEquals(42L, Numbers.parseRange("ackMessages", " 42 ", 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRange("ackMessages", "", 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRange("ackMessages", "4x", 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRange("ackMessages", "101", 1, 100));
  }
}
