package ca.gc.cra.dem.domain.catalog;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Delimited text point file.
 *
 * @param path source file
 * @param weight optional entry weight
 * @param metadata ordered metadata strings
 * @since 0.1.0
 */
public record PointEntry(Path path, OptionalDouble weight, List<String> metadata) implements FileEntry {
  public PointEntry {
    Objects.requireNonNull(path, "path");
    weight = CatalogEntry.requireWeight(weight, path.toString());
    metadata = CatalogEntry.boundedMetadata(metadata);
  }

  @Override
  public FormatKind kind() {
    return FormatKind.POINTS;
  }
}
