package ca.gc.cra.dem.domain.catalog;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Raster file scanned cell by cell into point records.
 *
 * @param path source file
 * @param weight optional entry weight
 * @param metadata ordered metadata strings
 * @since 0.1.0
 */
public record RasterEntry(Path path, OptionalDouble weight, List<String> metadata) implements FileEntry {
  public RasterEntry {
    Objects.requireNonNull(path, "path");
    weight = CatalogEntry.requireWeight(weight, path.toString());
    metadata = CatalogEntry.boundedMetadata(metadata);
  }

  @Override
  public FormatKind kind() {
    return FormatKind.RASTER;
  }
}
