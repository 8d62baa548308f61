package ca.gc.cra.dem.config;

import ca.gc.cra.dem.domain.grid.GridSpec;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode (grid, uncertainty, catalog, spatial)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "grid" -> buildGridDefaults();
      case "uncertainty" -> buildUncertaintyDefaults();
      case "catalog" -> buildCatalogDefaults();
      case "spatial" -> buildSpatialDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    ResolverConfig resolver = ResolverConfig.defaults();
    map.put("xcol", Integer.toString(resolver.columns().xIndex()));
    map.put("ycol", Integer.toString(resolver.columns().yIndex()));
    map.put("zcol", Integer.toString(resolver.columns().zIndex()));
    map.put("skip", Integer.toString(resolver.columns().skipLines()));
    map.put("weightPropagation", resolver.weightPropagation().name());
    map.put("overwriteInf", Boolean.toString(resolver.overwriteExtentCache()));
    map.put("remotePadding", Double.toString(resolver.remotePaddingPercent()));
    return Map.copyOf(map);
  }

  private static Map<String, String> buildGridDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("name", "waffles_dem");
    map.put("outDir", ".");
    map.put("module", "mean");
    map.put("extend", "0");
    map.put("extendProc", "10");
    map.put("weights", "false");
    map.put("blockMean", "false");
    map.put("mask", "false");
    map.put("unc", "false");
    map.put("nodata", Double.toString(GridSpec.DEFAULT_NODATA));
    map.putAll(buildEstimatorDefaults());
    return map;
  }

  private static Map<String, String> buildUncertaintyDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("name", "waffles_dem");
    map.put("outDir", ".");
    map.put("engine", "idw");
    map.putAll(buildEstimatorDefaults());
    return map;
  }

  private static Map<String, String> buildEstimatorDefaults() {
    UncertaintyConfig defaults = UncertaintyConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("uncPercentile", Double.toString(defaults.percentile()));
    map.put("chunkLevel", Integer.toString(defaults.chunkLevel()));
    map.put("sims", Integer.toString(defaults.simulations()));
    map.put("maxTiles", Integer.toString(defaults.maxTilesPerZone()));
    map.put("tileBuffer", Integer.toString(defaults.tileBufferCells()));
    map.put("fitInput", defaults.fitInput().name());
    map.put("combine", defaults.combineRule().name());
    map.put("uncWorkers", Integer.toString(defaults.workers()));
    map.put("seed", Long.toString(defaults.seed()));
    return map;
  }

  private static Map<String, String> buildCatalogDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("action", "list");
    map.put("weights", "false");
    map.put("dumpWeights", "false");
    return map;
  }

  private static Map<String, String> buildSpatialDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("name", "waffles_dem");
    map.put("outDir", ".");
    map.put("extend", "0");
    map.put("extendProc", "10");
    map.put("weights", "false");
    map.put("workers", "3");
    return map;
  }
}
