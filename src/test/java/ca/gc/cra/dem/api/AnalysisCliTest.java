package ca.gc.cra.dem.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnalysisCliTest {
  @TempDir Path tempDir;

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
  void uncertaintyNeedsReadableRasters() {
    ExitCode code = UncertaintyCli.run(new String[] {
        "dem=" + tempDir.resolve("dem.asc"), "mask=" + tempDir.resolve("dem_msk.asc")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: uncertainty"));
  }

  @Test
  void uncertaintyDryRunPrintsEstimator() throws IOException {
    Path dem = Files.writeString(tempDir.resolve("dem.asc"), "placeholder\n");
    Path mask = Files.writeString(tempDir.resolve("dem_msk.asc"), "placeholder\n");

    ExitCode code = UncertaintyCli.run(new String[] {
        "dem=" + dem, "mask=" + mask, "sims=3", "outDir=" + tempDir.resolve("unc"), "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Uncertainty dry-run"));
    assertTrue(buffer.toString().contains("simulations=3"));
    assertFalse(Files.exists(tempDir.resolve("unc")));
  }

  @Test
  void spatialDryRunUsesDryRunSetting() {
    ExitCode code = SpatialMetadataCli.run(new String[] {
        "datalist=root.datalist", "region=0/1/0/1", "inc=1s", "name=coast", "outDir=" + tempDir.resolve("sm"),
        "dryRun=true"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("coast_sm.geojson"));
    assertFalse(Files.exists(tempDir.resolve("sm")));
  }

  @Test
  void spatialWritesEmptyLayerForEmptyCatalog() throws IOException {
    Path datalist = Files.writeString(tempDir.resolve("root.datalist"), "# nothing\n");

    ExitCode code = SpatialMetadataCli.run(new String[] {
        "datalist=" + datalist, "region=0/1/0/1", "inc=0.5", "name=coast", "outDir=" + tempDir, "workers=1"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(tempDir.resolve("coast_sm.geojson")));
  }
}
