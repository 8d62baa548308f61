package ca.gc.cra.dem.domain.catalog;

import java.nio.file.Path;

/**
 * Entries backed by a local file, the only ones that carry an extent-cache sidecar.
 *
 * @since 0.1.0
 */
public sealed interface FileEntry extends CatalogEntry permits CatalogRef, PointEntry, RasterEntry {
  /** Absolute or catalog-relative-resolved path of the source. */
  Path path();

  @Override
  default String sourceRef() {
    return path().toString();
  }
}
