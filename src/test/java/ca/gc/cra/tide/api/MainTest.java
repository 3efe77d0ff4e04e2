package ca.gc.cra.tide.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
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
  void helpWithoutCommandSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("TIDE command dispatcher"));
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: tide <stream|decode> [options]"));
  }

  @Test
  void unknownCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"replay"}));
    assertTrue(buffer.toString().contains("usage: tide"));
  }

  @Test
  void forwardsFlagsToSubcommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"decode", "--help"}));
    assertTrue(buffer.toString().contains("TIDE decode command"));
  }

  @Test
  void dispatchesDecodeWithArguments() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"DECODE", "hex=4f0000000000000100736f7572636500"}));
    assertTrue(buffer.toString().startsWith("ORIGIN: "), buffer.toString());
  }
}
