package ca.gc.cra.dem.infrastructure.interpolation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dem.application.port.ExternalToolFailureException;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.infrastructure.raster.AsciiGridRasterAdapter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class ExternalProcessGridEngineTest {
  @TempDir Path dir;

  private final GridSpec grid = GridSpec.of(Region.of(0, 2, 0, 1), 1);
  private final ExternalProcessGridEngine engine =
      new ExternalProcessGridEngine(new AsciiGridRasterAdapter(), "asc");

  @Test
  void commandLineFillsPlaceholdersPerToken() {
    List<String> argv = ExternalProcessGridEngine.commandLine("surface", " -R{region}  -I{inc} -G{out} {width}x{height} ",
        GridSpec.of(Region.of(-70, -69, 40, 40.5), 0.25), Path.of("/tmp/out.asc"));

    assertEquals(List.of("surface", "-R-70/-69/40/40.5", "-I0.25", "-G/tmp/out.asc", "4x2"), argv);
    assertEquals(List.of("surface"), ExternalProcessGridEngine.commandLine("surface", "", grid, Path.of("o")));
  }

  @Test
  void missingCommandIsAFailure() {
    ExternalToolFailureException ex = assertThrows(ExternalToolFailureException.class,
        () -> engine.interpolate(grid, PointStream.of(List.of()), Map.of()));
    assertTrue(ex.getMessage().contains("cmd"));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void readsTheRasterTheCommandWrites() throws Exception {
    Path script = script("ok.sh",
        "#!/bin/sh",
        "cat > \"$(dirname \"$1\")/input.xyz\"",
        "test \"$(wc -l < \"$(dirname \"$1\")/input.xyz\")\" -eq 2 || exit 4",
        "printf 'ncols %s\\nnrows %s\\nxllcorner 0\\nyllcorner 0\\ncellsize 1\\nNODATA_value -1\\n7 -1\\n' \"$2\" \"$3\" > \"$1\"");

    Raster out = engine.interpolate(grid, points(), Map.of("cmd", script.toString(), "args", "{out} {width} {height}"));

    assertEquals(7d, out.get(0, 0), 1e-6);
    assertTrue(out.isNoData(out.get(1, 0)));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void nonZeroExitCarriesTheConsoleTail() throws Exception {
    Path script = script("fail.sh", "#!/bin/sh", "cat > /dev/null", "echo 'surface: no convergence'", "exit 3");

    ExternalToolFailureException ex = assertThrows(ExternalToolFailureException.class,
        () -> engine.interpolate(grid, points(), Map.of("cmd", script.toString())));

    assertTrue(ex.getMessage().contains("exited with 3"), ex.getMessage());
    assertTrue(ex.getMessage().contains("no convergence"), ex.getMessage());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void wrongOutputShapeIsRejected() throws Exception {
    Path script = script("shape.sh",
        "#!/bin/sh",
        "cat > /dev/null",
        "printf 'ncols 1\\nnrows 1\\nxllcorner 0\\nyllcorner 0\\ncellsize 1\\n5\\n' > \"$1\"");

    ExternalToolFailureException ex = assertThrows(ExternalToolFailureException.class,
        () -> engine.interpolate(grid, points(), Map.of("cmd", script.toString(), "args", "{out}")));

    assertTrue(ex.getMessage().contains("1x1"), ex.getMessage());
  }

  private static PointStream points() {
    return PointStream.of(List.of(PointRecord.of(0.5, 0.5, 7), PointRecord.of(1.5, 0.5, 9)));
  }

  private Path script(String name, String... lines) throws Exception {
    Path script = dir.resolve(name);
    Files.writeString(script, String.join("\n", lines) + "\n");
    Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
    return script;
  }
}
