package ca.gc.cra.dem.domain.region;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Immutable axis-aligned bounding box with an optional elevation range.
 * <p><strong>Why:</strong> Every stage works in regions: the resolver prunes and filters by them, the grid
 * pipeline derives processing, output and chunk regions from them, and the uncertainty estimator tiles them.</p>
 * <p><strong>Role:</strong> Value type; all operations return new instances.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>A region is valid when {@code west < east} and {@code south < north}. Intersections may legitimately be
 * degenerate, so construction does not enforce validity; callers use {@link #isValid()} or
 * {@link #requireValid(String)} where it matters.</p>
 *
 * @param west minimum x
 * @param east maximum x
 * @param south minimum y
 * @param north maximum y
 * @param zMin optional minimum elevation
 * @param zMax optional maximum elevation
 * @since 0.1.0
 */
public record Region(
    double west,
    double east,
    double south,
    double north,
    OptionalDouble zMin,
    OptionalDouble zMax) {

  public Region {
    Objects.requireNonNull(zMin, "zMin");
    Objects.requireNonNull(zMax, "zMax");
    if (Double.isNaN(west) || Double.isNaN(east) || Double.isNaN(south) || Double.isNaN(north)) {
      throw new InvalidRegionException("region bounds must not be NaN");
    }
    if (zMin.isPresent() != zMax.isPresent()) {
      throw new InvalidRegionException("region z range requires both zMin and zMax");
    }
  }

  /**
   * Creates a 2-D region.
   *
   * @param west minimum x
   * @param east maximum x
   * @param south minimum y
   * @param north maximum y
   * @return region without z range
   */
  public static Region of(double west, double east, double south, double north) {
    return new Region(west, east, south, north, OptionalDouble.empty(), OptionalDouble.empty());
  }

  /**
   * Creates a region carrying an elevation range.
   *
   * @param west minimum x
   * @param east maximum x
   * @param south minimum y
   * @param north maximum y
   * @param zMin minimum elevation
   * @param zMax maximum elevation
   * @return region with z range
   */
  public static Region of(double west, double east, double south, double north, double zMin, double zMax) {
    return new Region(west, east, south, north, OptionalDouble.of(zMin), OptionalDouble.of(zMax));
  }

  /**
   * Parses {@code west/east/south/north[/zmin/zmax]}, optionally prefixed with {@code -R}.
   *
   * @param text region text
   * @return parsed, valid region
   * @throws InvalidRegionException when the text is malformed or describes a degenerate box
   */
  public static Region parse(String text) {
    if (text == null || text.isBlank()) {
      throw new InvalidRegionException("region must not be blank");
    }
    String body = text.trim();
    if (body.startsWith("-R")) {
      body = body.substring(2);
    }
    String[] parts = body.split("/");
    if (parts.length != 4 && parts.length != 6) {
      throw new InvalidRegionException("region must have 4 or 6 '/'-separated values: " + text);
    }
    double[] values = new double[parts.length];
    for (int i = 0; i < parts.length; i++) {
      try {
        values[i] = Double.parseDouble(parts[i].trim());
      } catch (NumberFormatException ex) {
        throw new InvalidRegionException("region value '" + parts[i] + "' is not a number", ex);
      }
    }
    Region region = values.length == 6
        ? of(values[0], values[1], values[2], values[3], values[4], values[5])
        : of(values[0], values[1], values[2], values[3]);
    return region.requireValid("parsed region " + text);
  }

  /** Returns {@code true} when {@code west < east} and {@code south < north}. */
  public boolean isValid() {
    return west < east && south < north;
  }

  /**
   * Returns this region when valid.
   *
   * @param context description used in the failure message
   * @return this region
   * @throws InvalidRegionException when degenerate
   */
  public Region requireValid(String context) {
    if (!isValid()) {
      throw new InvalidRegionException(context + " is degenerate: " + format(RegionFormat.STR));
    }
    return this;
  }

  /** Returns {@code true} when the region carries a z range. */
  public boolean hasZRange() {
    return zMin.isPresent();
  }

  public double width() {
    return east - west;
  }

  public double height() {
    return north - south;
  }

  public double centerX() {
    return west + width() / 2d;
  }

  public double centerY() {
    return south + height() / 2d;
  }

  /**
   * Intersects two regions. The result may be degenerate when they do not overlap.
   *
   * @param other region to intersect with
   * @return the largest region contained in both
   */
  public Region reduce(Region other) {
    Objects.requireNonNull(other, "other");
    double w = Math.max(west, other.west);
    double e = Math.min(east, other.east);
    double s = Math.max(south, other.south);
    double n = Math.min(north, other.north);
    if (hasZRange() && other.hasZRange()) {
      return of(w, e, s, n,
          Math.max(zMin.getAsDouble(), other.zMin.getAsDouble()),
          Math.min(zMax.getAsDouble(), other.zMax.getAsDouble()));
    }
    return of(w, e, s, n);
  }

  /**
   * Smallest region containing both regions; z ranges merge when both carry one.
   *
   * @param other region to merge with
   * @return enclosing region
   */
  public Region merge(Region other) {
    Objects.requireNonNull(other, "other");
    double w = Math.min(west, other.west);
    double e = Math.max(east, other.east);
    double s = Math.min(south, other.south);
    double n = Math.max(north, other.north);
    if (hasZRange() && other.hasZRange()) {
      return of(w, e, s, n,
          Math.min(zMin.getAsDouble(), other.zMin.getAsDouble()),
          Math.max(zMax.getAsDouble(), other.zMax.getAsDouble()));
    }
    return of(w, e, s, n);
  }

  /**
   * Expands all four edges.
   *
   * @param value buffer distance, or a percentage when {@code isPercentage} is set
   * @param isPercentage when {@code true} the distance is {@code ((east-west)+(north-south)) * value / 2}
   *     with {@code value} given in percent
   * @return buffered region keeping the z range
   */
  public Region buffer(double value, boolean isPercentage) {
    double distance = isPercentage ? percentDistance(value) : value;
    return new Region(west - distance, east + distance, south - distance, north + distance, zMin, zMax);
  }

  private double percentDistance(double percent) {
    double ew = width() * (percent * .01);
    double ns = height() * (percent * .01);
    return (ew + ns) / 2d;
  }

  /**
   * Tests whether two regions overlap with a positive area.
   *
   * @param other region to test
   * @return {@code true} when the intersection is valid
   */
  public boolean intersects(Region other) {
    return other != null && reduce(other).isValid();
  }

  /**
   * Inclusive point containment.
   *
   * @param x easting or longitude
   * @param y northing or latitude
   * @return {@code true} when the point lies inside or on the boundary
   */
  public boolean contains(double x, double y) {
    return x >= west && x <= east && y >= south && y <= north;
  }

  /**
   * Splits the region into tiles of {@code tileCellCount} cells of {@code cellIncrement} each.
   *
   * <p>Tiles are ordered row-major from the south-west corner. The final row and column end exactly on the
   * region bounds, so the tiles cover the region without gaps and share only their edges.</p>
   *
   * @param cellIncrement cell size in region units; must be positive
   * @param tileCellCount tile edge length in cells; must be positive
   * @return ordered tiles
   */
  public List<Region> tile(double cellIncrement, int tileCellCount) {
    if (!(cellIncrement > 0d) || Double.isInfinite(cellIncrement)) {
      throw new IllegalArgumentException("cellIncrement must be positive (was " + cellIncrement + ")");
    }
    if (tileCellCount < 1) {
      throw new IllegalArgumentException("tileCellCount must be >= 1 (was " + tileCellCount + ")");
    }
    requireValid("tiled region");
    long xCells = Math.max(1L, Math.round(width() / cellIncrement));
    long yCells = Math.max(1L, Math.round(height() / cellIncrement));
    long cols = (xCells + tileCellCount - 1) / tileCellCount;
    long rows = (yCells + tileCellCount - 1) / tileCellCount;
    double step = tileCellCount * cellIncrement;
    List<Region> tiles = new ArrayList<>((int) Math.min(Integer.MAX_VALUE, rows * cols));
    for (long r = 0; r < rows; r++) {
      double s = south + r * step;
      double n = r == rows - 1 ? north : Math.min(north, s + step);
      for (long c = 0; c < cols; c++) {
        double w = west + c * step;
        double e = c == cols - 1 ? east : Math.min(east, w + step);
        tiles.add(of(w, e, s, n));
      }
    }
    return tiles;
  }

  /**
   * Drops the elevation range.
   *
   * @return 2-D copy of this region
   */
  public Region withoutZ() {
    return hasZRange() ? of(west, east, south, north) : this;
  }

  /**
   * Renders the region.
   *
   * @param format output format
   * @return formatted text
   */
  public String format(RegionFormat format) {
    return switch (format) {
      case STR -> join("/", west, east, south, north);
      case GMT -> "-R" + join("/", west, east, south, north);
      case BBOX -> join(",", west, south, east, north);
      case TE -> join(" ", west, south, east, north);
      case UL_LR -> join(" ", west, north, east, south);
      case FN -> fileNameFragment();
      case INF -> hasZRange()
          ? join(" ", west, east, south, north, zMin.getAsDouble(), zMax.getAsDouble())
          : join(" ", west, east, south, north);
    };
  }

  private String fileNameFragment() {
    String ns = north < 0 ? "s" : "n";
    String ew = west > 0 ? "e" : "w";
    return String.format(Locale.ROOT, "%s%02dx%02d_%s%03dx%02d",
        ns, Math.abs((int) north), Math.abs((int) (north * 100)) % 100,
        ew, Math.abs((int) west), Math.abs((int) (west * 100)) % 100);
  }

  private static String join(String separator, double... values) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < values.length; i++) {
      if (i > 0) {
        sb.append(separator);
      }
      sb.append(plain(values[i]));
    }
    return sb.toString();
  }

  static String plain(double value) {
    if (!Double.isFinite(value)) {
      return Double.toString(value);
    }
    String text = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    return "-0".equals(text) ? "0" : text;
  }

  @Override
  public String toString() {
    return format(hasZRange() ? RegionFormat.INF : RegionFormat.STR);
  }
}
