package ca.gc.cra.tide.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tide.application.coercion.PgTypes;
import ca.gc.cra.tide.testutil.PgOutputFixtures;
import ca.gc.cra.tide.testutil.PgOutputFixtures.Column;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.HexFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DecodeCliTest {
  private final StringWriter buffer = new StringWriter();

  @BeforeEach
  void captureOutput() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void rendersRelationColumnsWithKeyMarkers() {
    byte[] relation = PgOutputFixtures.relation(16384, "public", "actors", 'd',
        Column.key("nconst", PgTypes.TEXT), Column.of("birthyear", PgTypes.INT4));

    ExitCode code = DecodeCli.run(new String[] {"hex=" + HexFormat.of().formatHex(relation)});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.startsWith("RELATION: "), output);
    assertTrue(output.contains("relation 16384 public.actors"), output);
    assertTrue(output.contains("* nconst oid=25"), output);
    assertTrue(output.contains("  birthyear oid=23"), output);
  }

  @Test
  void rendersHighRelationIdsUnsigned() {
    byte[] relation = PgOutputFixtures.relation(0xF000_0000, "public", "actors", 'f',
        Column.key("nconst", PgTypes.TEXT));

    ExitCode code = DecodeCli.run(new String[] {"hex=" + HexFormat.of().formatHex(relation)});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("relation 4026531840 public.actors"), buffer.toString());
  }

  @Test
  void missingHexIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, DecodeCli.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: decode hex=HEX"));
  }

  @Test
  void undecodableBytesFail() {
    assertEquals(ExitCode.RUNTIME_FAILURE, DecodeCli.run(new String[] {"hex=5a00"}));
  }

  @Test
  void parseHexAcceptsCommonPrefixesAndSeparators() {
    assertArrayEquals(new byte[] {0x42, 0x0a}, DecodeCli.parseHex("\\x42 0a"));
    assertArrayEquals(new byte[] {0x42, 0x0a}, DecodeCli.parseHex("0x42:0A"));
    assertThrows(IllegalArgumentException.class, () -> DecodeCli.parseHex("420"));
    assertThrows(IllegalArgumentException.class, () -> DecodeCli.parseHex("zz"));
    assertThrows(IllegalArgumentException.class, () -> DecodeCli.parseHex("0x"));
  }
}
