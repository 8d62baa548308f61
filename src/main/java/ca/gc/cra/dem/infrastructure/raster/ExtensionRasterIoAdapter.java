package ca.gc.cra.dem.infrastructure.raster;

import ca.gc.cra.dem.application.port.RasterInfo;
import ca.gc.cra.dem.application.port.RasterIoPort;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.grid.SourceWindow;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> {@link RasterIoPort} that picks a codec from the file extension.
 * <p><strong>Why:</strong> GeoTIFF is the working format while ESRI ASCII grids stay readable and writable.</p>
 * <p><strong>Thread-safety:</strong> Immutable; delegates carry their own guarantees.</p>
 *
 * @since 0.1.0
 */
public final class ExtensionRasterIoAdapter implements RasterIoPort {
  private final Map<String, RasterIoPort> codecs;
  private final RasterIoPort fallback;

  /**
   * Creates the adapter.
   *
   * @param codecs codecs keyed by lower-case extension without the dot
   * @param fallback codec for any other extension
   */
  public ExtensionRasterIoAdapter(Map<String, RasterIoPort> codecs, RasterIoPort fallback) {
    this.codecs = Map.copyOf(Objects.requireNonNull(codecs, "codecs"));
    this.fallback = Objects.requireNonNull(fallback, "fallback");
  }

  /**
   * GeoTIFF for {@code tif}/{@code tiff} and every unknown extension, ESRI ASCII for {@code asc}.
   *
   * @return default adapter
   */
  public static ExtensionRasterIoAdapter standard() {
    GeoTiffRasterAdapter tiff = new GeoTiffRasterAdapter();
    return new ExtensionRasterIoAdapter(
        Map.of("tif", tiff, "tiff", tiff, "asc", new AsciiGridRasterAdapter()), tiff);
  }

  @Override
  public RasterInfo open(Path path) throws IOException {
    return codecFor(path).open(path);
  }

  @Override
  public Raster readWindow(Path path, SourceWindow window) throws IOException {
    return codecFor(path).readWindow(path, window);
  }

  @Override
  public Path write(Raster raster, Path path) throws IOException {
    return codecFor(path).write(raster, path);
  }

  RasterIoPort codecFor(Path path) {
    Path name = path.getFileName();
    if (name == null) {
      return fallback;
    }
    String text = name.toString();
    int dot = text.lastIndexOf('.');
    if (dot < 0) {
      return fallback;
    }
    return codecs.getOrDefault(text.substring(dot + 1).toLowerCase(Locale.ROOT), fallback);
  }
}
