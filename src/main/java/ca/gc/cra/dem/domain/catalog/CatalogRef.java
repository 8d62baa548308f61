package ca.gc.cra.dem.domain.catalog;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Reference to a nested catalog file.
 *
 * @param path source file
 * @param weight optional entry weight
 * @param metadata ordered metadata strings
 * @since 0.1.0
 */
public record CatalogRef(Path path, OptionalDouble weight, List<String> metadata) implements FileEntry {
  public CatalogRef {
    Objects.requireNonNull(path, "path");
    weight = CatalogEntry.requireWeight(weight, path.toString());
    metadata = CatalogEntry.boundedMetadata(metadata);
  }

  @Override
  public FormatKind kind() {
    return FormatKind.CATALOG;
  }
}
