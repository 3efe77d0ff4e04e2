package ca.gc.cra.tide.application.coercion;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tide.domain.events.UnchangedToast;
import ca.gc.cra.tide.domain.protocol.pgoutput.TupleField;
import ca.gc.cra.tide.testutil.RecordingMetricsPort;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ValueCoercerTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ValueCoercer coercer = new ValueCoercer(metrics);

  @Test
  void parsesNumericTypes() {
    assertEquals(1990, coercer.coerce(PgTypes.INT4, TupleField.text("1990")));
    assertEquals((short) 7, coercer.coerce(PgTypes.INT2, TupleField.text("7")));
    assertEquals(9_000_000_000L, coercer.coerce(PgTypes.INT8, TupleField.text("9000000000")));
    assertEquals(1.5d, coercer.coerce(PgTypes.FLOAT8, TupleField.text("1.5")));
    assertEquals(new BigDecimal("12.340"), coercer.coerce(PgTypes.NUMERIC, TupleField.text("12.340")));
  }

  @Test
  void parsesBooleansFromServerText() {
    assertEquals(Boolean.TRUE, coercer.coerce(PgTypes.BOOL, TupleField.text("t")));
    assertEquals(Boolean.FALSE, coercer.coerce(PgTypes.BOOL, TupleField.text("f")));
  }

  @Test
  void parsesDatesAndTimestamps() {
    assertEquals(LocalDate.of(2024, 1, 2), coercer.coerce(PgTypes.DATE, TupleField.text("2024-01-02")));
    assertEquals(LocalDateTime.of(2024, 1, 2, 3, 4, 5, 123_456_000),
        coercer.coerce(PgTypes.TIMESTAMP, TupleField.text("2024-01-02 03:04:05.123456")));
    assertEquals(OffsetDateTime.of(2024, 1, 2, 3, 4, 5, 0, ZoneOffset.UTC),
        coercer.coerce(PgTypes.TIMESTAMPTZ, TupleField.text("2024-01-02 03:04:05+00")));
    assertEquals(OffsetDateTime.of(2024, 1, 2, 3, 4, 5, 0, ZoneOffset.ofHoursMinutes(5, 30)),
        coercer.coerce(PgTypes.TIMESTAMPTZ, TupleField.text("2024-01-02 03:04:05+05:30")));
  }

  @Test
  void parsesJsonDocuments() {
    Object object = coercer.coerce(PgTypes.JSONB, TupleField.text("{\"a\":1,\"b\":[true,null,\"x\"]}"));
    assertEquals(Map.of("a", 1, "b", Arrays.asList(true, null, "x")), object);

    Object array = coercer.coerce(PgTypes.JSON, TupleField.text("[1, 2.5]"));
    assertTrue(array instanceof List);
    assertEquals(2, ((List<?>) array).size());
  }

  @Test
  void parsesUuid() {
    UUID id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
    assertEquals(id, coercer.coerce(PgTypes.UUID, TupleField.text(id.toString())));
  }

  @Test
  void keepsRawTextWhenParsingFails() {
    Object value = coercer.coerce(PgTypes.INT4, TupleField.text("not-a-number"));

    assertEquals("not-a-number", value);
    assertEquals(1, metrics.count("coerce.failure"));
    assertEquals(1, metrics.count("coerce.failure.23"));
  }

  @Test
  void rejectsNonServerBooleanText() {
    assertEquals("yes", coercer.coerce(PgTypes.BOOL, TupleField.text("yes")));
    assertEquals(1, metrics.count("coerce.failure.16"));
  }

  @Test
  void mapsNullToastAndBinaryKinds() {
    assertNull(coercer.coerce(PgTypes.INT4, TupleField.NULL));
    assertSame(UnchangedToast.VALUE, coercer.coerce(PgTypes.TEXT, TupleField.UNCHANGED_TOAST));
    assertArrayEquals(new byte[] {1, 2, 3},
        (byte[]) coercer.coerce(PgTypes.INT4, TupleField.binary(new byte[] {1, 2, 3})));
    assertFalse(metrics.hasCounter("coerce.failure"));
  }

  @Test
  void unmappedTypesKeepText() {
    int inet = 869;
    assertFalse(ValueCoercer.isMapped(inet));
    assertEquals("10.0.0.1", coercer.coerce(inet, TupleField.text("10.0.0.1")));
  }

  @Test
  void staticParseRaisesCoercionException() {
    CoercionException ex = assertThrows(CoercionException.class, () -> ValueCoercer.parse(PgTypes.DATE, "2024-13-40"));
    assertTrue(ex.getMessage().contains("1082"), ex.getMessage());
  }
}
