package ca.gc.cra.dem.domain.catalog;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Entry fetched through a remote plugin keyed by {@code scheme}.
 *
 * @param scheme plugin key such as {@code https} or {@code nos}
 * @param sourceRef reference exactly as written in the catalog
 * @param args plugin arguments parsed from {@code scheme:key=value:...}, or {@code url} for URLs
 * @param weight optional entry weight
 * @param metadata ordered metadata strings
 * @since 0.1.0
 */
public record RemoteEntry(
    String scheme,
    String sourceRef,
    Map<String, String> args,
    OptionalDouble weight,
    List<String> metadata) implements CatalogEntry {

  public RemoteEntry {
    Objects.requireNonNull(scheme, "scheme");
    Objects.requireNonNull(sourceRef, "sourceRef");
    args = args == null ? Map.of() : Map.copyOf(args);
    weight = CatalogEntry.requireWeight(weight, sourceRef);
    metadata = CatalogEntry.boundedMetadata(metadata);
  }

  @Override
  public FormatKind kind() {
    return FormatKind.REMOTE;
  }
}
