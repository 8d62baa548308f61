package ca.gc.cra.dem.application.port;

import ca.gc.cra.dem.domain.extent.Extent;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Storage of extent caches beside their sources.
 *
 * @since 0.1.0
 */
public interface ExtentCachePort {
  /**
   * Reads the cached extent of a source.
   *
   * @param source source file
   * @return cached extent, or empty when no cache exists or it cannot be parsed
   * @throws IOException when an existing cache cannot be read
   */
  Optional<Extent> read(Path source) throws IOException;

  /**
   * Stores the extent of a source, replacing any previous cache.
   *
   * @param source source file
   * @param extent extent to persist
   * @throws IOException when the cache cannot be written
   */
  void write(Path source, Extent extent) throws IOException;
}
