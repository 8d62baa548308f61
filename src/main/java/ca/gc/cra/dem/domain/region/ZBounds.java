package ca.gc.cra.dem.domain.region;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Optional elevation filter applied to point records and cached extents.
 *
 * @param lower inclusive lower bound when present
 * @param upper inclusive upper bound when present
 * @since 0.1.0
 */
public record ZBounds(OptionalDouble lower, OptionalDouble upper) {
  private static final ZBounds NONE = new ZBounds(OptionalDouble.empty(), OptionalDouble.empty());

  public ZBounds {
    Objects.requireNonNull(lower, "lower");
    Objects.requireNonNull(upper, "upper");
    if (lower.isPresent() && upper.isPresent() && lower.getAsDouble() > upper.getAsDouble()) {
      throw new IllegalArgumentException(
          "z lower bound " + lower.getAsDouble() + " exceeds upper bound " + upper.getAsDouble());
    }
  }

  /** Returns the filter that accepts every elevation. */
  public static ZBounds none() {
    return NONE;
  }

  /**
   * Builds bounds from nullable values.
   *
   * @param lower lower bound or {@code null}
   * @param upper upper bound or {@code null}
   * @return bounds instance
   */
  public static ZBounds of(Double lower, Double upper) {
    if (lower == null && upper == null) {
      return NONE;
    }
    return new ZBounds(
        lower == null ? OptionalDouble.empty() : OptionalDouble.of(lower),
        upper == null ? OptionalDouble.empty() : OptionalDouble.of(upper));
  }

  /** Returns {@code true} when neither bound is set. */
  public boolean isUnbounded() {
    return lower.isEmpty() && upper.isEmpty();
  }

  /**
   * Tests a single elevation.
   *
   * @param z elevation value
   * @return {@code true} when {@code z} lies within the bounds
   */
  public boolean accepts(double z) {
    if (lower.isPresent() && z < lower.getAsDouble()) {
      return false;
    }
    return upper.isEmpty() || z <= upper.getAsDouble();
  }

  /**
   * Tests whether an elevation range could contain accepted values.
   *
   * @param zMin minimum elevation of the range
   * @param zMax maximum elevation of the range
   * @return {@code false} only when the whole range falls outside the bounds
   */
  public boolean overlaps(double zMin, double zMax) {
    if (lower.isPresent() && zMax < lower.getAsDouble()) {
      return false;
    }
    return upper.isEmpty() || zMin <= upper.getAsDouble();
  }
}
