package ca.gc.cra.tide.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir
  Path tempDir;

  @Test
  void sectionOverridesCommonValues() throws Exception {
    Path file = write("tide.yaml", String.join("\n",
        "common:",
        "  host: common-host",
        "  database: app",
        "stream:",
        "  host: stream-host",
        "  subscriptions:",
        "    - INSERT:public.orders",
        "    - DELETE:public.orders",
        "decode:",
        "  hex: ignored",
        ""));

    Map<String, String> values = YamlConfigLoader.load(file, "stream").orElseThrow();

    assertEquals("stream-host", values.get("host"));
    assertEquals("app", values.get("database"));
    assertEquals("INSERT:public.orders,DELETE:public.orders", values.get("subscriptions"));
    assertFalse(values.containsKey("hex"));
  }

  @Test
  void nestedMappingsFlattenToDottedKeys() throws Exception {
    Path file = write("nested.yaml", "stream:\n  ack:\n    messages: 5\n");

    assertEquals("5", YamlConfigLoader.load(file, "STREAM").orElseThrow().get("ack.messages"));
  }

  @Test
  void missingFileIsEmpty() throws Exception {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "stream"));
  }

  @Test
  void emptyDocumentYieldsNoValues() throws Exception {
    Path file = write("empty.yaml", "");

    assertTrue(YamlConfigLoader.load(file, "stream").orElseThrow().isEmpty());
  }

  @Test
  void malformedYamlIsRejected() throws Exception {
    Path file = write("bad.yaml", "stream: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "stream"));
  }

  @Test
  void nonMappingRootIsRejected() throws Exception {
    Path file = write("list.yaml", "- a\n- b\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "stream"));
  }

  private Path write(String name, String content) throws Exception {
    Path file = tempDir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }
}
