package ca.gc.cra.dem.config;

import ca.gc.cra.dem.domain.catalog.WeightPropagation;
import ca.gc.cra.dem.domain.point.ColumnLayout;
import ca.gc.cra.dem.validation.Numbers;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Settings of the catalog resolver shared by every command that reads catalogs.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param columns column layout of point files
 * @param weightPropagation how weight overrides travel through nested catalogs
 * @param overwriteExtentCache recompute {@code .inf} sidecars even when present
 * @param remotePaddingPercent percentage the query region is padded by before remote fetches
 * @param sourceEpsg EPSG code of point sources, when reprojection is requested
 * @param targetEpsg EPSG code of the output grid, when reprojection is requested
 * @since 0.1.0
 */
public record ResolverConfig(
    ColumnLayout columns,
    WeightPropagation weightPropagation,
    boolean overwriteExtentCache,
    double remotePaddingPercent,
    OptionalInt sourceEpsg,
    OptionalInt targetEpsg) {

  public ResolverConfig {
    columns = Objects.requireNonNullElse(columns, ColumnLayout.defaults());
    weightPropagation = Objects.requireNonNullElse(weightPropagation, WeightPropagation.COMPOUND);
    Numbers.requireRange("remotePadding", remotePaddingPercent, 0d, 100d);
    sourceEpsg = Objects.requireNonNullElse(sourceEpsg, OptionalInt.empty());
    targetEpsg = Objects.requireNonNullElse(targetEpsg, OptionalInt.empty());
    if (sourceEpsg.isPresent() != targetEpsg.isPresent()) {
      throw new IllegalArgumentException("srcEpsg and dstEpsg must be given together");
    }
  }

  /** Returns the defaults: x/y/z columns, compounding weights, cached extents, 5% remote padding. */
  public static ResolverConfig defaults() {
    return new ResolverConfig(ColumnLayout.defaults(), WeightPropagation.COMPOUND, false, 5d,
        OptionalInt.empty(), OptionalInt.empty());
  }

  /**
   * Reads resolver keys: {@code xcol}, {@code ycol}, {@code zcol}, {@code skip}, {@code delimiter},
   * {@code weightPropagation}, {@code overwriteInf}, {@code remotePadding}, {@code srcEpsg}, {@code dstEpsg}.
   *
   * @param options flattened configuration
   * @return resolver configuration
   */
  public static ResolverConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ResolverConfig defaults = defaults();
    ColumnLayout base = defaults.columns();
    ColumnLayout columns = new ColumnLayout(
        ConfigValues.parseInt("xcol", options.get("xcol"), base.xIndex()),
        ConfigValues.parseInt("ycol", options.get("ycol"), base.yIndex()),
        ConfigValues.parseInt("zcol", options.get("zcol"), base.zIndex()),
        ConfigValues.parseInt("skip", options.get("skip"), base.skipLines()),
        ConfigValues.optionalString(options.get("delimiter")).map(ResolverConfig::delimiterOf));
    return new ResolverConfig(
        columns,
        WeightPropagation.parse(options.get("weightPropagation")),
        ConfigValues.parseBoolean(options.get("overwriteInf"), defaults.overwriteExtentCache()),
        ConfigValues.parseDouble("remotePadding", options.get("remotePadding"), defaults.remotePaddingPercent()),
        ConfigValues.optionalInt("srcEpsg", options.get("srcEpsg")),
        ConfigValues.optionalInt("dstEpsg", options.get("dstEpsg")));
  }

  /** Returns {@code true} when points must be reprojected. */
  public boolean reprojects() {
    return sourceEpsg.isPresent() && sourceEpsg.getAsInt() != targetEpsg.getAsInt();
  }

  private static String delimiterOf(String raw) {
    return switch (raw.toLowerCase(Locale.ROOT)) {
      case "comma" -> ",";
      case "space" -> " ";
      case "tab" -> "\t";
      case "slash" -> "/";
      case "colon" -> ":";
      default -> raw;
    };
  }
}
