package ca.gc.cra.dem.domain.extent;

import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.region.RegionFormat;
import ca.gc.cra.dem.domain.region.ZBounds;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Cached bounding box and elevation range of a source, persisted as a {@code .inf} sidecar.
 *
 * <p>Unlike {@link Region}, an extent may be degenerate: a file holding one point has zero width.</p>
 *
 * @param xMin minimum x
 * @param xMax maximum x
 * @param yMin minimum y
 * @param yMax maximum y
 * @param zMin optional minimum elevation
 * @param zMax optional maximum elevation
 * @since 0.1.0
 */
public record Extent(
    double xMin,
    double xMax,
    double yMin,
    double yMax,
    OptionalDouble zMin,
    OptionalDouble zMax) {

  public Extent {
    Objects.requireNonNull(zMin, "zMin");
    Objects.requireNonNull(zMax, "zMax");
    if (xMin > xMax || yMin > yMax) {
      throw new IllegalArgumentException("extent minimum exceeds maximum");
    }
    if (zMin.isPresent() != zMax.isPresent()) {
      throw new IllegalArgumentException("extent z range requires both zMin and zMax");
    }
  }

  /**
   * Creates an extent with an elevation range.
   *
   * @param xMin minimum x
   * @param xMax maximum x
   * @param yMin minimum y
   * @param yMax maximum y
   * @param zMin minimum z
   * @param zMax maximum z
   * @return extent
   */
  public static Extent of(double xMin, double xMax, double yMin, double yMax, double zMin, double zMax) {
    return new Extent(xMin, xMax, yMin, yMax, OptionalDouble.of(zMin), OptionalDouble.of(zMax));
  }

  /**
   * Creates a horizontal-only extent.
   *
   * @param xMin minimum x
   * @param xMax maximum x
   * @param yMin minimum y
   * @param yMax maximum y
   * @return extent
   */
  public static Extent of(double xMin, double xMax, double yMin, double yMax) {
    return new Extent(xMin, xMax, yMin, yMax, OptionalDouble.empty(), OptionalDouble.empty());
  }

  /**
   * Parses a sidecar line of 4 to 6 whitespace separated numbers.
   *
   * <p>A fifth value without a sixth is ignored.</p>
   *
   * @param line sidecar content
   * @return parsed extent
   * @throws IllegalArgumentException when fewer than 4 numbers are present or a value is not numeric
   */
  public static Extent parseSidecar(String line) {
    if (line == null) {
      throw new IllegalArgumentException("extent line must not be null");
    }
    String[] parts = line.trim().split("\\s+");
    if (parts.length < 4) {
      throw new IllegalArgumentException("extent line needs at least 4 values: '" + line.trim() + "'");
    }
    double[] v = new double[Math.min(parts.length, 6)];
    for (int i = 0; i < v.length; i++) {
      try {
        v[i] = Double.parseDouble(parts[i]);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("extent value '" + parts[i] + "' is not a number", ex);
      }
    }
    return v.length == 6 ? of(v[0], v[1], v[2], v[3], v[4], v[5]) : of(v[0], v[1], v[2], v[3]);
  }

  /** Renders the sidecar line {@code xmin xmax ymin ymax [zmin zmax]}. */
  public String toSidecarLine() {
    return toRegion().format(RegionFormat.INF);
  }

  /** Returns {@code true} when the elevation range is known. */
  public boolean hasZRange() {
    return zMin.isPresent();
  }

  /**
   * Smallest extent enclosing both; the z range survives only when both carry one.
   *
   * @param other extent to merge
   * @return union
   */
  public Extent union(Extent other) {
    Objects.requireNonNull(other, "other");
    double x0 = Math.min(xMin, other.xMin);
    double x1 = Math.max(xMax, other.xMax);
    double y0 = Math.min(yMin, other.yMin);
    double y1 = Math.max(yMax, other.yMax);
    if (hasZRange() && other.hasZRange()) {
      return of(x0, x1, y0, y1,
          Math.min(zMin.getAsDouble(), other.zMin.getAsDouble()),
          Math.max(zMax.getAsDouble(), other.zMax.getAsDouble()));
    }
    return of(x0, x1, y0, y1);
  }

  /**
   * Inclusive overlap test used for pruning; touching boxes overlap.
   *
   * @param region query region, or {@code null} for no horizontal filter
   * @param zBounds elevation filter
   * @return {@code false} only when no record of the source can pass both filters
   */
  public boolean overlaps(Region region, ZBounds zBounds) {
    if (region != null) {
      if (xMin > region.east() || xMax < region.west() || yMin > region.north() || yMax < region.south()) {
        return false;
      }
    }
    if (zBounds != null && hasZRange()) {
      return zBounds.overlaps(zMin.getAsDouble(), zMax.getAsDouble());
    }
    return true;
  }

  /** Converts to a region (which may be degenerate). */
  public Region toRegion() {
    return new Region(xMin, xMax, yMin, yMax, zMin, zMax);
  }
}
