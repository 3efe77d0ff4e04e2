package ca.gc.cra.tide.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"slotName=orders", "host = db.internal "});
    assertEquals("orders", map.get("slotName"));
    assertEquals("db.internal", map.get("host"));
  }

  @Test
  void valuesMayContainEqualsSigns() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=env=prod,team=tide"});
    assertEquals("env=prod,team=tide", map.get("otelResourceAttributes"));
  }

  @Test
  void emptyValueIsKept() {
    assertEquals("", CliArgsParser.toMap(new String[] {"startLsn="}).get("startLsn"));
  }

  @Test
  void rejectsArgumentsWithoutValue() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"invalid", "key=value"}));
    assertTrue(ex.getMessage().contains("key=value"));
  }

  @Test
  void rejectsBadKeys() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
  }
}
