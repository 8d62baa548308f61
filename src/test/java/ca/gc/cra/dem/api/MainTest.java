package ca.gc.cra.dem.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: dem"));
  }

  @Test
  void unknownCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"waffle"}));
    assertTrue(buffer.toString().contains("usage: dem"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    String text = buffer.toString();
    assertTrue(text.contains("uncertainty"));
    assertTrue(text.contains("spatial"));
  }

  @Test
  void dispatchesToSubcommandHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"GRID", "--help"}));
    assertTrue(buffer.toString().contains("dem grid"));
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"catalog", "-h"}));
    assertTrue(buffer.toString().contains("dem catalog"));
  }
}
