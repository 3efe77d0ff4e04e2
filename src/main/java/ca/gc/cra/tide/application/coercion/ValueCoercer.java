package ca.gc.cra.tide.application.coercion;

import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.domain.events.UnchangedToast;
import ca.gc.cra.tide.domain.protocol.pgoutput.TupleField;
import ca.gc.cra.tide.logging.Logs;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts tuple field values into Java values according to the column's type OID.
 * <p><strong>Why:</strong> Subscribers receive {@code Integer}, {@code BigDecimal}, {@code LocalDate} and friends
 * rather than the text the server's output functions produce.</p>
 * <p><strong>Role:</strong> Application service used by {@code ChangeEventBuilder} for every column of every row.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map SQL null to {@code null} and unchanged toast to {@link UnchangedToast#VALUE}.</li>
 *   <li>Dispatch text values through a static OID table; unmapped types keep their text.</li>
 *   <li>Keep the raw text when parsing fails instead of dropping the event.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe metrics port.</p>
 * <p><strong>Performance:</strong> One map lookup and one parse per value.</p>
 * <p><strong>Observability:</strong> Failures log at WARN and increment {@code coerce.failure} and
 * {@code coerce.failure.<oid>}.</p>
 *
 * @since 0.1.0
 */
public final class ValueCoercer {
  private static final Logger log = LoggerFactory.getLogger(ValueCoercer.class);
  private static final int MAX_LOGGED_VALUE_BYTES = 64;

  private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .appendLiteral(' ')
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .toFormatter();
  private static final DateTimeFormatter TIMESTAMP_TZ = new DateTimeFormatterBuilder()
      .append(TIMESTAMP)
      .appendOffset("+HH:mm", "Z")
      .toFormatter();

  private static final Map<Integer, ValueParser> PARSERS = buildParsers();

  private final MetricsPort metrics;

  /**
   * Creates a coercer.
   *
   * @param metrics metrics sink for coercion failures; must not be {@code null}
   */
  public ValueCoercer(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Converts one field value.
   *
   * @param typeOid column type OID from the relation schema
   * @param field wire value; never {@code null}
   * @return {@code null} for SQL null, {@link UnchangedToast#VALUE} for unchanged toast, a copy of the bytes for
   *     binary values, otherwise the parsed value (or the raw text when parsing fails or the type is unmapped)
   */
  public Object coerce(int typeOid, TupleField field) {
    Objects.requireNonNull(field, "field");
    switch (field.kind()) {
      case NULL:
        return null;
      case UNCHANGED_TOAST:
        return UnchangedToast.VALUE;
      case BINARY:
        return field.bytes();
      default:
        break;
    }
    String text = field.text();
    try {
      return parse(typeOid, text);
    } catch (CoercionException ex) {
      metrics.increment("coerce.failure");
      metrics.increment("coerce.failure." + typeOid);
      log.warn("Keeping raw text for type {} value '{}': {}",
          typeOid, Logs.truncate(text, MAX_LOGGED_VALUE_BYTES), ex.getMessage());
      return text;
    }
  }

  /**
   * Parses a text value for a type OID.
   *
   * @param typeOid column type OID
   * @param text non-null text value
   * @return parsed value, or {@code text} itself when the OID has no dedicated parser
   * @throws CoercionException when the text does not match the type's format
   */
  public static Object parse(int typeOid, String text) {
    Objects.requireNonNull(text, "text");
    ValueParser parser = PARSERS.get(typeOid);
    if (parser == null) {
      return text;
    }
    try {
      return parser.parse(text);
    } catch (CoercionException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new CoercionException(typeOid, ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(), ex);
    }
  }

  /**
   * Indicates whether an OID has a dedicated parser.
   *
   * @param typeOid column type OID
   * @return {@code true} when values of the type are converted rather than kept as text
   */
  public static boolean isMapped(int typeOid) {
    return PARSERS.containsKey(typeOid);
  }

  private static Map<Integer, ValueParser> buildParsers() {
    Map<Integer, ValueParser> parsers = new HashMap<>();
    parsers.put(PgTypes.BOOL, ValueCoercer::parseBoolean);
    parsers.put(PgTypes.INT2, Short::valueOf);
    parsers.put(PgTypes.INT4, Integer::valueOf);
    parsers.put(PgTypes.INT8, Long::valueOf);
    parsers.put(PgTypes.TEXT, text -> text);
    parsers.put(PgTypes.BPCHAR, text -> text);
    parsers.put(PgTypes.VARCHAR, text -> text);
    parsers.put(PgTypes.FLOAT4, Float::valueOf);
    parsers.put(PgTypes.FLOAT8, Double::valueOf);
    parsers.put(PgTypes.NUMERIC, BigDecimal::new);
    parsers.put(PgTypes.DATE, LocalDate::parse);
    parsers.put(PgTypes.TIMESTAMP, text -> LocalDateTime.parse(text, TIMESTAMP));
    parsers.put(PgTypes.TIMESTAMPTZ, text -> OffsetDateTime.parse(text, TIMESTAMP_TZ));
    JsonSupport json = new JsonSupport();
    parsers.put(PgTypes.JSON, json::parse);
    parsers.put(PgTypes.JSONB, json::parse);
    parsers.put(PgTypes.UUID, UUID::fromString);
    return Map.copyOf(parsers);
  }

  private static Boolean parseBoolean(String text) {
    if ("t".equals(text)) {
      return Boolean.TRUE;
    }
    if ("f".equals(text)) {
      return Boolean.FALSE;
    }
    throw new IllegalArgumentException("boolean must be 't' or 'f' (was '" + text + "')");
  }
}
