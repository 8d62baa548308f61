package ca.gc.cra.dem.config;

import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.region.ZBounds;
import ca.gc.cra.dem.validation.Numbers;
import ca.gc.cra.dem.validation.Strings;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Settings of one grid pipeline run.
 * <p><strong>Role:</strong> Input of {@code GridUseCase}; produced by {@link #fromMap(Map)} or a
 * {@link Builder}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param datalist root catalog reference
 * @param region output region before the {@code extend} buffer
 * @param cellSize cell size in map units
 * @param name output base name
 * @param outputDirectory directory receiving every output file
 * @param module gridding module
 * @param methodParams parameters forwarded to the interpolation engine
 * @param extend cells added around the output region
 * @param extendProc further cells of input gathered around the output region
 * @param zBounds elevation filter applied to input records
 * @param weights whether catalog weights are applied (root weight {@code 1})
 * @param blockMean whether input is thinned to weighted cell means before interpolation
 * @param chunkCells edge length of processing chunks in cells; empty processes the region at once
 * @param writeMask whether the {@code _msk} data mask raster is written
 * @param uncertainty whether the interpolation uncertainty estimate runs after gridding
 * @param nodata nodata value of every output raster
 * @since 0.1.0
 */
public record GridConfig(
    String datalist,
    Region region,
    double cellSize,
    String name,
    Path outputDirectory,
    GridModule module,
    Map<String, String> methodParams,
    int extend,
    int extendProc,
    ZBounds zBounds,
    boolean weights,
    boolean blockMean,
    OptionalInt chunkCells,
    boolean writeMask,
    boolean uncertainty,
    double nodata) {

  /** Key prefix of method parameters in flattened configuration. */
  public static final String PARAM_PREFIX = "param.";

  public GridConfig {
    datalist = Strings.requireNonBlank("datalist", datalist);
    Objects.requireNonNull(region, "region");
    region.requireValid("region");
    Numbers.requirePositive("inc", cellSize);
    name = Strings.sanitizeOutputName("name", name);
    outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").toAbsolutePath().normalize();
    module = Objects.requireNonNullElse(module, GridModule.MEAN);
    methodParams = methodParams == null ? Map.of() : Map.copyOf(methodParams);
    Numbers.requireRange("extend", extend, 0, 100_000);
    Numbers.requireRange("extendProc", extendProc, 0, 100_000);
    zBounds = Objects.requireNonNullElse(zBounds, ZBounds.none());
    chunkCells = Objects.requireNonNullElse(chunkCells, OptionalInt.empty());
    if (chunkCells.isPresent()) {
      Numbers.requireRange("chunk", chunkCells.getAsInt(), 1, 1_000_000);
    }
    if (uncertainty && module.binning().isPresent()) {
      throw new IllegalArgumentException("unc=true needs an interpolating module (idw or process), not " + module);
    }
    if (Double.isNaN(nodata)) {
      throw new IllegalArgumentException("nodata must be a number");
    }
  }

  /** Output region: {@link #region()} buffered by {@code extend} cells. */
  public Region outputRegion() {
    return outputRegion(region);
  }

  /** {@code area} buffered by {@code extend} cells. */
  public Region outputRegion(Region area) {
    return extend == 0 ? area : area.buffer(extend * cellSize, false);
  }

  /** {@code area} buffered by {@code extend + extendProc} cells. */
  public Region processingRegion(Region area) {
    int cells = extend + extendProc;
    return cells == 0 ? area : area.buffer(cells * cellSize, false);
  }

  /** Grid of the final output rasters. */
  public GridSpec outputGrid() {
    return GridSpec.of(outputRegion(), cellSize, nodata);
  }

  /** Root weight override: {@code 1} when weights are enabled. */
  public OptionalDouble weightOverride() {
    return weights ? OptionalDouble.of(1d) : OptionalDouble.empty();
  }

  /** Output file for {@code suffix}, e.g. {@code "_msk.asc"}. */
  public Path output(String suffix) {
    return outputDirectory.resolve(name + suffix);
  }

  /**
   * Reads {@code datalist}, {@code region}, {@code inc}, {@code name}, {@code outDir}, {@code module},
   * {@code extend}, {@code extendProc}, {@code lower}, {@code upper}, {@code weights}, {@code blockMean},
   * {@code chunk}, {@code mask}, {@code unc}, {@code nodata} and every {@code param.*} key.
   *
   * @param options flattened configuration
   * @return grid configuration
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static GridConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String regionText = ConfigValues.optionalString(options.get("region"))
        .orElseThrow(() -> new IllegalArgumentException("region is required (w/e/s/n)"));
    String inc = ConfigValues.optionalString(options.get("inc"))
        .orElseThrow(() -> new IllegalArgumentException("inc is required"));
    Map<String, String> params = new LinkedHashMap<>();
    options.forEach((key, value) -> {
      if (key.startsWith(PARAM_PREFIX) && key.length() > PARAM_PREFIX.length()) {
        params.put(key.substring(PARAM_PREFIX.length()), value);
      }
    });
    Builder builder = builder()
        .datalist(options.get("datalist"))
        .region(Region.parse(regionText))
        .cellSize(ConfigValues.parseCellSize("inc", inc, 0d))
        .methodParams(params)
        .extend(ConfigValues.parseInt("extend", options.get("extend"), 0))
        .extendProc(ConfigValues.parseInt("extendProc", options.get("extendProc"), Builder.DEFAULT_EXTEND_PROC))
        .zBounds(ZBounds.of(
            boxed(ConfigValues.optionalDouble("lower", options.get("lower"))),
            boxed(ConfigValues.optionalDouble("upper", options.get("upper")))))
        .weights(ConfigValues.parseBoolean(options.get("weights"), false))
        .blockMean(ConfigValues.parseBoolean(options.get("blockMean"), false))
        .chunkCells(ConfigValues.optionalInt("chunk", options.get("chunk")))
        .writeMask(ConfigValues.parseBoolean(options.get("mask"), false))
        .uncertainty(ConfigValues.parseBoolean(options.get("unc"), false))
        .nodata(ConfigValues.parseDouble("nodata", options.get("nodata"), GridSpec.DEFAULT_NODATA));
    ConfigValues.optionalString(options.get("name")).ifPresent(builder::name);
    ConfigValues.optionalPath("outDir", options.get("outDir")).ifPresent(builder::outputDirectory);
    ConfigValues.optionalString(options.get("module")).map(GridModule::parse).ifPresent(builder::module);
    return builder.build();
  }

  private static Double boxed(OptionalDouble value) {
    return value.isPresent() ? value.getAsDouble() : null;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Mutable assembler of {@link GridConfig}; unset values take the documented defaults. */
  public static final class Builder {
    static final int DEFAULT_EXTEND_PROC = 10;

    private String datalist;
    private Region region;
    private double cellSize;
    private String name = "waffles_dem";
    private Path outputDirectory = Path.of(".");
    private GridModule module = GridModule.MEAN;
    private Map<String, String> methodParams = Map.of();
    private int extend;
    private int extendProc = DEFAULT_EXTEND_PROC;
    private ZBounds zBounds = ZBounds.none();
    private boolean weights;
    private boolean blockMean;
    private OptionalInt chunkCells = OptionalInt.empty();
    private boolean writeMask;
    private boolean uncertainty;
    private double nodata = GridSpec.DEFAULT_NODATA;

    private Builder() {}

    public Builder datalist(String value) {
      this.datalist = value;
      return this;
    }

    public Builder region(Region value) {
      this.region = value;
      return this;
    }

    public Builder cellSize(double value) {
      this.cellSize = value;
      return this;
    }

    public Builder name(String value) {
      this.name = value;
      return this;
    }

    public Builder outputDirectory(Path value) {
      this.outputDirectory = value;
      return this;
    }

    public Builder module(GridModule value) {
      this.module = value;
      return this;
    }

    public Builder methodParams(Map<String, String> value) {
      this.methodParams = value;
      return this;
    }

    public Builder extend(int value) {
      this.extend = value;
      return this;
    }

    public Builder extendProc(int value) {
      this.extendProc = value;
      return this;
    }

    public Builder zBounds(ZBounds value) {
      this.zBounds = value;
      return this;
    }

    public Builder weights(boolean value) {
      this.weights = value;
      return this;
    }

    public Builder blockMean(boolean value) {
      this.blockMean = value;
      return this;
    }

    public Builder chunkCells(OptionalInt value) {
      this.chunkCells = value;
      return this;
    }

    public Builder writeMask(boolean value) {
      this.writeMask = value;
      return this;
    }

    public Builder uncertainty(boolean value) {
      this.uncertainty = value;
      return this;
    }

    public Builder nodata(double value) {
      this.nodata = value;
      return this;
    }

    public GridConfig build() {
      return new GridConfig(datalist, region, cellSize, name, outputDirectory, module, methodParams, extend,
          extendProc, zBounds, weights, blockMean, chunkCells, writeMask, uncertainty, nodata);
    }
  }
}
