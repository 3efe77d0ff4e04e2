package ca.gc.cra.tide.domain.replication;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LsnTest {
  @Test
  void parsesAndFormatsHighLowNotation() {
    Lsn lsn = Lsn.parse("16/B374D848");

    assertEquals((0x16L << 32) | 0xB374D848L, lsn.value());
    assertEquals("16/B374D848", lsn.toString());
  }

  @Test
  void comparesAsUnsigned() {
    Lsn low = Lsn.of(1L);
    Lsn high = Lsn.of(0x8000_0000_0000_0000L);

    assertTrue(high.compareTo(low) > 0);
    assertSame(high, low.max(high));
    assertSame(high, high.max(low));
  }

  @Test
  void invalidIsZero() {
    assertFalse(Lsn.INVALID.isValid());
    assertTrue(Lsn.of(42).isValid());
    assertEquals("0/0", Lsn.INVALID.toString());
  }

  @Test
  void rejectsMalformedText() {
    assertThrows(IllegalArgumentException.class, () -> Lsn.parse("16B374D848"));
    assertThrows(IllegalArgumentException.class, () -> Lsn.parse("16/"));
    assertThrows(IllegalArgumentException.class, () -> Lsn.parse("G/1"));
    assertThrows(IllegalArgumentException.class, () -> Lsn.parse("1/2/3"));
    assertThrows(IllegalArgumentException.class, () -> Lsn.parse("100000000/0"));
  }
}
