package ca.gc.cra.dem.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CatalogCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private Path datalist;

  @BeforeEach
  void setUp() throws IOException {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    Files.writeString(tempDir.resolve("a.xyz"), "1 1 -5\n2 2 -7\n");
    datalist = Files.writeString(tempDir.resolve("root.datalist"), "a.xyz 168 2\n");
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void listPrintsEntriesToStdout() {
    ExitCode code = CatalogCli.run(new String[] {"datalist=" + datalist});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().trim().endsWith("a.xyz points 2.0"), buffer.toString());
  }

  @Test
  void dumpWritesToOutputFile() throws IOException {
    Path out = tempDir.resolve("records.xyz");

    ExitCode code = CatalogCli.run(new String[] {
        "datalist=" + datalist, "action=dump", "weights=true", "dumpWeights=true", "upper=-6", "out=" + out});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("2.0 2.0 -7.0 2.0"), Files.readAllLines(out));
  }

  @Test
  void unknownActionIsInvalidArgs() {
    ExitCode code = CatalogCli.run(new String[] {"datalist=" + datalist, "action=purge"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: catalog"));
  }

  @Test
  void nonCatalogRootIsConfigurationError() {
    ExitCode code = CatalogCli.run(new String[] {"datalist=" + tempDir.resolve("a.xyz")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }
}
