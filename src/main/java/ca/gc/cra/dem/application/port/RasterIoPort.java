package ca.gc.cra.dem.application.port;

import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.grid.SourceWindow;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port for reading and writing single band rasters.
 * <p><strong>Why:</strong> Keeps raster codecs out of the resolver, binner and uncertainty estimator.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent calls on different paths; callers
 * serialize writes to one path.</p>
 *
 * @since 0.1.0
 */
public interface RasterIoPort {
  /**
   * Reads the header of a raster.
   *
   * @param path raster file
   * @return header information
   * @throws IOException when the file is missing or not a supported raster
   */
  RasterInfo open(Path path) throws IOException;

  /**
   * Reads a pixel window of the first band.
   *
   * @param path raster file
   * @param window window inside the raster
   * @return window raster; nodata cells carry the source nodata marker
   * @throws IOException when the file cannot be read
   */
  Raster readWindow(Path path, SourceWindow window) throws IOException;

  /**
   * Writes a raster, replacing any existing file.
   *
   * @param raster raster to persist
   * @param path destination
   * @return written path
   * @throws IOException when the destination cannot be written
   */
  Path write(Raster raster, Path path) throws IOException;
}
