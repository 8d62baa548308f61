package ca.gc.cra.dem.domain.catalog;

import java.util.List;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> One parsed catalog line.
 * <p><strong>Role:</strong> Closed variant set dispatched by the resolver with a {@code switch} on the
 * concrete type; numeric legacy codes never travel past {@link CatalogLineParser}.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface CatalogEntry permits FileEntry, RemoteEntry {
  /** Maximum number of metadata strings kept per entry. */
  int MAX_METADATA = 8;

  /** Source reference as written (resolved path for file entries). */
  String sourceRef();

  /** Entry weight; empty means the caller's weight passes through unchanged. */
  OptionalDouble weight();

  /** Ordered metadata strings, at most {@link #MAX_METADATA}. */
  List<String> metadata();

  /** Family of the entry. */
  FormatKind kind();

  /** Multiplicative weight factor, {@code 1} when no weight was given. */
  default double weightFactor() {
    return weight().orElse(1d);
  }

  /** Copies metadata, keeping at most {@link #MAX_METADATA} values. */
  static List<String> boundedMetadata(List<String> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return List.of();
    }
    return List.copyOf(metadata.size() > MAX_METADATA ? metadata.subList(0, MAX_METADATA) : metadata);
  }

  /** Validates an optional weight. */
  static OptionalDouble requireWeight(OptionalDouble weight, String sourceRef) {
    if (weight == null) {
      return OptionalDouble.empty();
    }
    if (weight.isPresent() && !(weight.getAsDouble() > 0d && Double.isFinite(weight.getAsDouble()))) {
      throw new IllegalArgumentException("weight for " + sourceRef + " must be > 0 (was "
          + weight.getAsDouble() + ")");
    }
    return weight;
  }
}
