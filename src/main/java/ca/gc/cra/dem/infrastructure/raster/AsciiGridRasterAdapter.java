package ca.gc.cra.dem.infrastructure.raster;

import ca.gc.cra.dem.application.port.RasterInfo;
import ca.gc.cra.dem.application.port.RasterIoPort;
import ca.gc.cra.dem.domain.grid.GeoTransform;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.grid.SourceWindow;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RasterIoPort} for ESRI ASCII grids ({@code .asc}).
 * <p><strong>Why:</strong> A plain-text raster codec lets the toolkit run end to end without native raster
 * libraries; heavier formats plug in behind the same port.</p>
 * <p><strong>Thread-safety:</strong> Stateless. Writes go to a temporary sibling that is moved into place,
 * so concurrent readers never see a partial grid.</p>
 *
 * <p>Both {@code xllcorner}/{@code yllcorner} and {@code xllcenter}/{@code yllcenter} headers are read; grids
 * are always written with corners. A {@code .prj} sidecar, when present, becomes the projection.</p>
 *
 * @since 0.1.0
 */
public final class AsciiGridRasterAdapter implements RasterIoPort {
  private static final Logger log = LoggerFactory.getLogger(AsciiGridRasterAdapter.class);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  @Override
  public RasterInfo open(Path path) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.US_ASCII)) {
      return readHeader(reader, path).info(projectionOf(path));
    }
  }

  @Override
  public Raster readWindow(Path path, SourceWindow window) throws IOException {
    Objects.requireNonNull(window, "window");
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.US_ASCII)) {
      Header header = readHeader(reader, path);
      GridSpec full = header.info(Optional.empty()).toGridSpec();
      GridSpec sub = full.subGrid(window);
      float[] data = new float[sub.cellCount()];
      int row = 0;
      int column = 0;
      String line = header.pendingLine;
      while (row < header.rows && line != null) {
        for (String token : WHITESPACE.split(line.strip())) {
          if (token.isEmpty()) {
            continue;
          }
          if (row >= header.rows) {
            break;
          }
          int dx = column - window.xOffset();
          int dy = row - window.yOffset();
          if (dx >= 0 && dy >= 0 && dx < window.xSize() && dy < window.ySize()) {
            data[dy * window.xSize() + dx] = parseValue(token, path, row);
          }
          if (++column == header.columns) {
            column = 0;
            row++;
          }
        }
        if (row >= window.yOffset() + window.ySize()) {
          break;
        }
        line = reader.readLine();
      }
      if (row < Math.min(header.rows, window.yOffset() + window.ySize())) {
        throw new IOException(path + " ends after " + row + " of " + header.rows + " rows");
      }
      return new Raster(sub, data);
    }
  }

  @Override
  public Path write(Raster raster, Path path) throws IOException {
    Objects.requireNonNull(raster, "raster");
    Path target = path.toAbsolutePath();
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
    GridSpec spec = raster.spec();
    try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.US_ASCII)) {
      writer.write("ncols " + spec.width() + "\n");
      writer.write("nrows " + spec.height() + "\n");
      writer.write("xllcorner " + headerNumber(spec.region().west()) + "\n");
      writer.write("yllcorner " + headerNumber(spec.region().south()) + "\n");
      writer.write("cellsize " + headerNumber(spec.cellSize()) + "\n");
      writer.write("NODATA_value " + headerNumber(spec.nodataValue()) + "\n");
      StringBuilder line = new StringBuilder(spec.width() * 8);
      for (int row = 0; row < spec.height(); row++) {
        line.setLength(0);
        for (int col = 0; col < spec.width(); col++) {
          if (col > 0) {
            line.append(' ');
          }
          double value = raster.get(col, row);
          line.append(raster.isNoData(value) ? plain(spec.nodataValue()) : plain(value));
        }
        line.append('\n');
        writer.write(line.toString());
      }
    } catch (IOException ex) {
      Files.deleteIfExists(temp);
      throw ex;
    }
    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    log.debug("Wrote {}x{} grid to {}", spec.width(), spec.height(), target);
    return target;
  }

  private static Header readHeader(BufferedReader reader, Path path) throws IOException {
    Header header = new Header();
    String line;
    while ((line = reader.readLine()) != null) {
      String trimmed = line.strip();
      if (trimmed.isEmpty()) {
        continue;
      }
      String[] parts = WHITESPACE.split(trimmed);
      String key = parts[0].toLowerCase(Locale.ROOT);
      if (parts.length != 2 || !Character.isLetter(key.charAt(0))) {
        header.pendingLine = trimmed;
        break;
      }
      double value = parseHeaderValue(parts[1], key, path);
      switch (key) {
        case "ncols" -> header.columns = (int) value;
        case "nrows" -> header.rows = (int) value;
        case "xllcorner" -> header.xll = value;
        case "yllcorner" -> header.yll = value;
        case "xllcenter" -> {
          header.xll = value;
          header.centred = true;
        }
        case "yllcenter" -> {
          header.yll = value;
          header.centred = true;
        }
        case "cellsize" -> header.cellSize = value;
        case "nodata_value" -> header.nodata = OptionalDouble.of(value);
        default -> log.debug("Ignoring header key {} in {}", key, path);
      }
    }
    if (header.columns < 1 || header.rows < 1 || !(header.cellSize > 0d)
        || Double.isNaN(header.xll) || Double.isNaN(header.yll)) {
      throw new IOException(path + " is not an ESRI ASCII grid");
    }
    if (header.centred) {
      header.xll -= header.cellSize / 2d;
      header.yll -= header.cellSize / 2d;
    }
    return header;
  }

  private static double parseHeaderValue(String raw, String key, Path path) throws IOException {
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException ex) {
      throw new IOException("bad " + key + " '" + raw + "' in " + path, ex);
    }
  }

  private static float parseValue(String token, Path path, int row) throws IOException {
    try {
      return Float.parseFloat(token);
    } catch (NumberFormatException ex) {
      throw new IOException("bad cell value '" + token + "' in row " + row + " of " + path, ex);
    }
  }

  private static Optional<String> projectionOf(Path path) throws IOException {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    Path prj = path.resolveSibling((dot > 0 ? name.substring(0, dot) : name) + ".prj");
    if (!Files.isRegularFile(prj)) {
      return Optional.empty();
    }
    String text = Files.readString(prj, StandardCharsets.UTF_8).strip();
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  private static String headerNumber(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  static String plain(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return new BigDecimal(Float.toString((float) value)).stripTrailingZeros().toPlainString();
  }

  /** Parsed header plus the first data line when it shared the header loop. */
  private static final class Header {
    int columns;
    int rows;
    double xll = Double.NaN;
    double yll = Double.NaN;
    double cellSize;
    boolean centred;
    OptionalDouble nodata = OptionalDouble.empty();
    String pendingLine;

    RasterInfo info(Optional<String> projection) {
      GeoTransform transform = GeoTransform.northUp(xll, yll + rows * cellSize, cellSize);
      return new RasterInfo(columns, rows, 1, transform, projection, nodata);
    }
  }
}
