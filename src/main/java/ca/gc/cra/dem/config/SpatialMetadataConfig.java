package ca.gc.cra.dem.config;

import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.validation.Numbers;
import ca.gc.cra.dem.validation.Strings;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings of the spatial metadata run.
 * <p>Each sub-catalog of the root is masked over the output region and polygonized into one feature of the
 * {@code <name>_sm.geojson} layer.</p>
 *
 * @param datalist root catalog reference
 * @param region region of interest
 * @param cellSize mask cell size; never finer than {@link #MIN_CELL_SIZE}
 * @param name output base name
 * @param outputDirectory output directory
 * @param extend cells added around the region
 * @param extendProc further cells of input gathered around the region
 * @param weights whether catalog weights are applied
 * @param workers worker threads polygonizing sub-catalogs
 * @since 0.1.0
 */
public record SpatialMetadataConfig(
    String datalist,
    Region region,
    double cellSize,
    String name,
    Path outputDirectory,
    int extend,
    int extendProc,
    boolean weights,
    int workers) {

  /** One third of an arc-second. */
  public static final double MIN_CELL_SIZE = 0.3333333d / 3600d;

  /** Feature attribute names. */
  public static final List<String> FIELDS =
      List.of("Name", "Agency", "Date", "Type", "Resolution", "HDatum", "VDatum", "URL");

  public SpatialMetadataConfig {
    datalist = Strings.requireNonBlank("datalist", datalist);
    Objects.requireNonNull(region, "region");
    region.requireValid("region");
    Numbers.requirePositive("inc", cellSize);
    cellSize = Math.max(cellSize, MIN_CELL_SIZE);
    name = Strings.sanitizeOutputName("name", name);
    outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").toAbsolutePath().normalize();
    Numbers.requireRange("extend", extend, 0, 100_000);
    Numbers.requireRange("extendProc", extendProc, 0, 100_000);
    Numbers.requireRange("workers", workers, 1, 64);
  }

  /** Attribute values used when a sub-catalog entry does not carry all eight. */
  public static List<String> defaultAttributes(String entryName) {
    return List.of(entryName, "Unknown", "0", "xyz_elevation", "Unknown", "WGS84", "NAVD88", "URL");
  }

  /** Mask region: the region buffered by {@code extend} cells. */
  public Region maskRegion() {
    return extend == 0 ? region : region.buffer(extend * cellSize, false);
  }

  /** Query region: the region buffered by {@code extend + extendProc} cells. */
  public Region queryRegion() {
    int cells = extend + extendProc;
    return cells == 0 ? region : region.buffer(cells * cellSize, false);
  }

  public Path layerPath() {
    return outputDirectory.resolve(name + "_sm.geojson");
  }

  /**
   * Reads {@code datalist}, {@code region}, {@code inc}, {@code name}, {@code outDir}, {@code extend},
   * {@code extendProc}, {@code weights} and {@code workers}.
   *
   * @param options flattened configuration
   * @return spatial metadata configuration
   */
  public static SpatialMetadataConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Region region = ConfigValues.optionalRegion(options.get("region"))
        .orElseThrow(() -> new IllegalArgumentException("region is required (w/e/s/n)"));
    String inc = ConfigValues.optionalString(options.get("inc"))
        .orElseThrow(() -> new IllegalArgumentException("inc is required"));
    return new SpatialMetadataConfig(
        options.get("datalist"),
        region,
        ConfigValues.parseCellSize("inc", inc, 0d),
        ConfigValues.optionalString(options.get("name")).orElse("waffles_dem"),
        ConfigValues.optionalPath("outDir", options.get("outDir")).orElse(Path.of(".")),
        ConfigValues.parseInt("extend", options.get("extend"), 0),
        ConfigValues.parseInt("extendProc", options.get("extendProc"), 10),
        ConfigValues.parseBoolean(options.get("weights"), false),
        ConfigValues.parseInt("workers", options.get("workers"), 3));
  }
}
