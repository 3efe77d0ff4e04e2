package ca.gc.cra.tide.api;

import ca.gc.cra.tide.application.port.DecodeException;
import ca.gc.cra.tide.application.port.MessageDecoder;
import ca.gc.cra.tide.domain.protocol.pgoutput.PgOutputMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.RelationMessage;
import ca.gc.cra.tide.domain.schema.ColumnDescriptor;
import ca.gc.cra.tide.domain.schema.RelationSchema;
import ca.gc.cra.tide.infrastructure.protocol.pgoutput.PgOutputMessageDecoder;
import ca.gc.cra.tide.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes one hex-encoded {@code pgoutput} message and prints its structure.
 *
 * <p>Useful with the output of {@code pg_logical_slot_peek_binary_changes}; whitespace, colons and a leading
 * {@code \x} are ignored.</p>
 *
 * @since 0.1.0
 */
public final class DecodeCli {
  private static final Logger log = LoggerFactory.getLogger(DecodeCli.class);
  private static final String SUMMARY_USAGE = "usage: decode hex=HEX";
  private static final String HELP_TEXT = """
      TIDE decode command

      Usage:
        decode hex=HEX

      Options:
        hex=HEX     pgoutput message bytes in hexadecimal (e.g. 42000000000000...)
        --verbose   Enable DEBUG logging
        --help      Show this message
      """;

  private DecodeCli() {}

  static ExitCode run(String[] args) {
    return run(args, new PgOutputMessageDecoder());
  }

  static ExitCode run(String[] args, MessageDecoder decoder) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    byte[] payload;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      String hex = kv.get("hex");
      if (hex == null || hex.isBlank()) {
        throw new IllegalArgumentException("hex is required");
      }
      payload = parseHex(hex);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      PgOutputMessage message = decoder.decode(payload);
      CliPrinter.printLines(render(message).toArray(String[]::new));
      return ExitCode.SUCCESS;
    } catch (DecodeException ex) {
      log.error("Unable to decode {} bytes: {}", payload.length, ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static byte[] parseHex(String raw) {
    String cleaned = raw.replaceAll("[\\s:]", "");
    if (cleaned.startsWith("\\x") || cleaned.startsWith("0x")) {
      cleaned = cleaned.substring(2);
    }
    if (cleaned.isEmpty() || cleaned.length() % 2 != 0) {
      throw new IllegalArgumentException("hex must contain an even, non-zero number of digits");
    }
    try {
      return HexFormat.of().parseHex(cleaned);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("hex contains non-hexadecimal characters", ex);
    }
  }

  static List<String> render(PgOutputMessage message) {
    List<String> lines = new ArrayList<>();
    lines.add(message.tag() + ": " + message);
    if (message instanceof RelationMessage relation) {
      RelationSchema schema = relation.schema();
      lines.add(" relation " + Integer.toUnsignedString(schema.relationId()) + " " + schema.qualifiedName()
          + " replica identity " + schema.replicaIdentity());
      for (ColumnDescriptor column : schema.columns()) {
        lines.add("  " + (column.key() ? "*" : " ") + " " + column.name()
            + " oid=" + Integer.toUnsignedString(column.typeOid()) + " typmod=" + column.typeModifier());
      }
    }
    return lines;
  }
}
