package ca.gc.cra.dem.application.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Files and counters of one grid run.
 *
 * @param dem DEM raster; empty when no chunk produced data
 * @param mask data mask raster when requested
 * @param uncertaintyFiles uncertainty outputs when the estimate ran and succeeded
 * @param chunks processed chunks
 * @param validChunks chunks that contributed data
 * @param failedChunks chunks dropped because the gridding module failed
 * @since 0.1.0
 */
public record GridResult(
    Optional<Path> dem,
    Optional<Path> mask,
    List<Path> uncertaintyFiles,
    int chunks,
    int validChunks,
    int failedChunks) {

  public GridResult {
    dem = Objects.requireNonNullElse(dem, Optional.empty());
    mask = Objects.requireNonNullElse(mask, Optional.empty());
    uncertaintyFiles = uncertaintyFiles == null ? List.of() : List.copyOf(uncertaintyFiles);
  }
}
