package ca.gc.cra.tide.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {
  @Test
  void requireNonBlankTrims() {
    assertEquals("host", Strings.requireNonBlank("host", "  host "));
  }

  @Test
  void requireNonBlankRejectsBlankNullAndControlCharacters() {
    IllegalArgumentException blank = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireNonBlank("host", "   "));
    assertEquals("host must not be blank", blank.getMessage());
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("host", null));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("host", "db\u0000"));
  }

  @Test
  void identifiersFollowReplicationSlotRules() {
    assertEquals("slot_1", Strings.requireIdentifier("slotName", "slot_1"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("slotName", "1slot"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("slotName", "slot-1"));
    IllegalArgumentException tooLong = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireIdentifier("slotName", "s".repeat(64)));
    assertTrue(tooLong.getMessage().contains("63"));
  }

  @Test
  void printableAsciiRejectsNonAscii() {
    assertEquals("abc", Strings.requirePrintableAscii("name", "abc", 10));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("name", "café", 10));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("name", "abcdef", 3));
  }
}
