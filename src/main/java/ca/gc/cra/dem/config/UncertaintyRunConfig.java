package ca.gc.cra.dem.config;

import ca.gc.cra.dem.validation.Strings;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Settings of a standalone uncertainty run over an existing DEM and its data mask.
 *
 * @param dem DEM raster
 * @param mask data mask raster on the DEM grid
 * @param name output base name
 * @param outputDirectory output directory
 * @param engine interpolation engine used by the trials ({@code idw} or {@code process})
 * @param methodParams engine parameters
 * @param estimator estimator knobs
 * @since 0.1.0
 */
public record UncertaintyRunConfig(
    Path dem,
    Path mask,
    String name,
    Path outputDirectory,
    String engine,
    Map<String, String> methodParams,
    UncertaintyConfig estimator) {

  private static final Set<String> ENGINES = Set.of("idw", "process");

  public UncertaintyRunConfig {
    Objects.requireNonNull(dem, "dem");
    Objects.requireNonNull(mask, "mask");
    name = Strings.sanitizeOutputName("name", name);
    outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").toAbsolutePath().normalize();
    engine = Strings.requireNonBlank("engine", engine).toLowerCase(Locale.ROOT);
    if (!ENGINES.contains(engine)) {
      throw new IllegalArgumentException("engine must be idw or process (was " + engine + ")");
    }
    methodParams = methodParams == null ? Map.of() : Map.copyOf(methodParams);
    estimator = Objects.requireNonNullElse(estimator, UncertaintyConfig.defaults());
  }

  public Path output(String suffix) {
    return outputDirectory.resolve(name + suffix);
  }

  /**
   * Reads {@code dem}, {@code mask}, {@code name}, {@code outDir}, {@code engine}, every {@code param.*} key
   * and the estimator keys of {@link UncertaintyConfig#fromMap(Map)}.
   *
   * @param options flattened configuration
   * @return run configuration
   */
  public static UncertaintyRunConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path dem = ConfigValues.optionalPath("dem", options.get("dem"))
        .orElseThrow(() -> new IllegalArgumentException("dem is required"));
    Path mask = ConfigValues.optionalPath("mask", options.get("mask"))
        .orElseThrow(() -> new IllegalArgumentException("mask is required"));
    Map<String, String> params = new LinkedHashMap<>();
    options.forEach((key, value) -> {
      if (key.startsWith(GridConfig.PARAM_PREFIX) && key.length() > GridConfig.PARAM_PREFIX.length()) {
        params.put(key.substring(GridConfig.PARAM_PREFIX.length()), value);
      }
    });
    return new UncertaintyRunConfig(
        dem,
        mask,
        ConfigValues.optionalString(options.get("name")).orElse("waffles_dem"),
        ConfigValues.optionalPath("outDir", options.get("outDir")).orElse(Path.of(".")),
        ConfigValues.optionalString(options.get("engine")).orElse("idw"),
        params,
        UncertaintyConfig.fromMap(options));
  }
}
