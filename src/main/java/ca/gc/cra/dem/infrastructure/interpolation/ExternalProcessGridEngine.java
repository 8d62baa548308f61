package ca.gc.cra.dem.infrastructure.interpolation;

import ca.gc.cra.dem.application.port.ExternalToolFailureException;
import ca.gc.cra.dem.application.port.InterpolationEngine;
import ca.gc.cra.dem.application.port.RasterInfo;
import ca.gc.cra.dem.application.port.RasterIoPort;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.grid.SourceWindow;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.RegionFormat;
import ca.gc.cra.dem.logging.Logs;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Delegates gridding to an external command.
 * <p><strong>How:</strong> The command is started with an argument list (never through a shell). Records are
 * written to its standard input as {@code x y z w} lines; the command must write a raster readable by the
 * configured {@link RasterIoPort} to {@code {out}} on the exact target grid.</p>
 *
 * <p>Method parameters: {@code cmd} executable (required), {@code args} space separated argument template,
 * {@code timeout} seconds (default {@code 600}). Template placeholders: {@code {region}} as
 * {@code west/east/south/north}, {@code {inc}}, {@code {out}}, {@code {width}}, {@code {height}}.</p>
 *
 * @since 0.1.0
 */
public final class ExternalProcessGridEngine implements InterpolationEngine {
  private static final Logger log = LoggerFactory.getLogger(ExternalProcessGridEngine.class);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final int DEFAULT_TIMEOUT_SECONDS = 600;

  private final RasterIoPort rasterIo;
  private final String outputExtension;

  /**
   * Creates the engine.
   *
   * @param rasterIo reader for the command's output raster
   * @param outputExtension file extension of the output raster, without the dot
   */
  public ExternalProcessGridEngine(RasterIoPort rasterIo, String outputExtension) {
    this.rasterIo = Objects.requireNonNull(rasterIo, "rasterIo");
    this.outputExtension = Objects.requireNonNull(outputExtension, "outputExtension");
  }

  @Override
  public String name() {
    return "process";
  }

  @Override
  public Raster interpolate(GridSpec grid, PointStream points, Map<String, String> methodParams)
      throws ExternalToolFailureException {
    Objects.requireNonNull(grid, "grid");
    Objects.requireNonNull(points, "points");
    MethodParams params = new MethodParams(name(), methodParams);
    String command = params.text("cmd", null);
    if (command == null) {
      throw new ExternalToolFailureException("process engine needs a 'cmd' parameter");
    }
    int timeout = params.integer("timeout", DEFAULT_TIMEOUT_SECONDS);

    Path workDir = null;
    try (points) {
      workDir = Files.createTempDirectory("dem-process-");
      Path output = workDir.resolve("out." + outputExtension);
      Path console = workDir.resolve("console.log");
      List<String> argv = commandLine(command, params.text("args", ""), grid, output);
      log.debug("Running {}", argv);

      Process process = new ProcessBuilder(argv)
          .directory(workDir.toFile())
          .redirectErrorStream(true)
          .redirectOutput(console.toFile())
          .start();
      long written = feed(process, points);
      if (!process.waitFor(timeout, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new ExternalToolFailureException(command + " did not finish within " + timeout + "s");
      }
      int exit = process.exitValue();
      if (exit != 0) {
        throw new ExternalToolFailureException(
            command + " exited with " + exit + ": " + Logs.sanitize(tail(console), 512));
      }
      if (!Files.exists(output)) {
        throw new ExternalToolFailureException(command + " wrote no raster to " + output.getFileName());
      }
      log.debug("{} gridded {} records", command, written);
      return onGrid(grid, output);
    } catch (IOException ex) {
      throw new ExternalToolFailureException("process engine failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ExternalToolFailureException("interrupted while waiting for " + command, ex);
    } finally {
      deleteWorkDir(workDir);
    }
  }

  static List<String> commandLine(String command, String template, GridSpec grid, Path output) {
    List<String> argv = new ArrayList<>();
    argv.add(command);
    String trimmed = template.trim();
    if (trimmed.isEmpty()) {
      return argv;
    }
    for (String token : WHITESPACE.split(trimmed)) {
      argv.add(token
          .replace("{region}", grid.region().format(RegionFormat.STR))
          .replace("{inc}", BigDecimal.valueOf(grid.cellSize()).stripTrailingZeros().toPlainString())
          .replace("{out}", output.toString())
          .replace("{width}", Integer.toString(grid.width()))
          .replace("{height}", Integer.toString(grid.height())));
    }
    return argv;
  }

  private static long feed(Process process, PointStream points) throws IOException {
    long count = 0;
    try (BufferedWriter writer = new BufferedWriter(
        new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8))) {
      while (points.hasNext()) {
        PointRecord p = points.next();
        writer.write(p.x() + " " + p.y() + " " + p.z() + " " + p.weight());
        writer.newLine();
        count++;
      }
    }
    return count;
  }

  private Raster onGrid(GridSpec grid, Path output) throws IOException, ExternalToolFailureException {
    RasterInfo info = rasterIo.open(output);
    if (info.width() != grid.width() || info.height() != grid.height()) {
      throw new ExternalToolFailureException("output raster is " + info.width() + "x" + info.height()
          + " but the target grid is " + grid.width() + "x" + grid.height());
    }
    Raster produced = rasterIo.readWindow(output, new SourceWindow(0, 0, info.width(), info.height()));
    Raster out = Raster.empty(grid);
    for (int i = 0; i < grid.cellCount(); i++) {
      double value = produced.getAt(i);
      if (!produced.isNoData(value)) {
        out.setAt(i, value);
      }
    }
    return out;
  }

  private static String tail(Path console) {
    try {
      List<String> lines = Files.readAllLines(console, StandardCharsets.UTF_8);
      return String.join(" | ", lines.subList(Math.max(0, lines.size() - 5), lines.size()));
    } catch (IOException ex) {
      return "<no output: " + ex.getMessage() + ">";
    }
  }

  private static void deleteWorkDir(Path directory) {
    if (directory == null) {
      return;
    }
    try (Stream<Path> walk = Files.walk(directory)) {
      for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
        Files.deleteIfExists(path);
      }
    } catch (IOException ex) {
      log.warn("Could not remove work directory {}: {}", directory, ex.getMessage());
    }
  }
}
