package ca.gc.cra.dem.config;

import ca.gc.cra.dem.domain.uncertainty.CombineRule;
import ca.gc.cra.dem.domain.uncertainty.FitInput;
import ca.gc.cra.dem.validation.Numbers;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Knobs of the split-sample interpolation uncertainty estimator.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param percentile proximity percentile used as target distance and tiling scale, in {@code (0, 100]}
 * @param chunkLevel multiplier turning the target distance into a tile edge in cells
 * @param simulations number of split-sample rounds
 * @param maxTilesPerZone training tiles used per zone and round
 * @param tileBufferCells cells of surrounding data kept around each training tile
 * @param fitInput reduction applied to error samples before fitting
 * @param combineRule optional merge of the distance and slope layers
 * @param workers trial worker threads; {@code 1} runs trials on the caller thread
 * @param seed base seed of tile shuffling and sampling
 * @since 0.1.0
 */
public record UncertaintyConfig(
    double percentile,
    int chunkLevel,
    int simulations,
    int maxTilesPerZone,
    int tileBufferCells,
    FitInput fitInput,
    CombineRule combineRule,
    int workers,
    long seed) {

  public UncertaintyConfig {
    if (!(percentile > 0d) || percentile > 100d) {
      throw new IllegalArgumentException("uncPercentile must be in (0, 100] (was " + percentile + ")");
    }
    Numbers.requireRange("chunkLevel", chunkLevel, 1, 1_000);
    Numbers.requireRange("sims", simulations, 1, 10_000);
    Numbers.requireRange("maxTiles", maxTilesPerZone, 1, 100_000);
    Numbers.requireRange("tileBuffer", tileBufferCells, 0, 10_000);
    Numbers.requireRange("uncWorkers", workers, 1, 256);
    fitInput = Objects.requireNonNullElse(fitInput, FitInput.BINNED_STD);
    combineRule = Objects.requireNonNullElse(combineRule, CombineRule.NONE);
  }

  /** 95th percentile, chunk level 4, 10 rounds over at most 25 tiles per zone, one worker, seed 1. */
  public static UncertaintyConfig defaults() {
    return new UncertaintyConfig(95d, 4, 10, 25, 20, FitInput.BINNED_STD, CombineRule.NONE, 1, 1L);
  }

  /**
   * Reads {@code uncPercentile}, {@code chunkLevel}, {@code sims}, {@code maxTiles}, {@code tileBuffer},
   * {@code fitInput}, {@code combine}, {@code uncWorkers} and {@code seed}.
   *
   * @param options flattened configuration
   * @return estimator configuration
   */
  public static UncertaintyConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    UncertaintyConfig d = defaults();
    return new UncertaintyConfig(
        ConfigValues.parseDouble("uncPercentile", options.get("uncPercentile"), d.percentile()),
        ConfigValues.parseInt("chunkLevel", options.get("chunkLevel"), d.chunkLevel()),
        ConfigValues.parseInt("sims", options.get("sims"), d.simulations()),
        ConfigValues.parseInt("maxTiles", options.get("maxTiles"), d.maxTilesPerZone()),
        ConfigValues.parseInt("tileBuffer", options.get("tileBuffer"), d.tileBufferCells()),
        ConfigValues.optionalString(options.get("fitInput")).map(UncertaintyConfig::fitInputOf)
            .orElse(d.fitInput()),
        CombineRule.parse(options.get("combine")),
        ConfigValues.parseInt("uncWorkers", options.get("uncWorkers"), d.workers()),
        ConfigValues.parseLong("seed", options.get("seed"), d.seed()));
  }

  private static FitInput fitInputOf(String raw) {
    String normalized = raw.toUpperCase(Locale.ROOT).replace('-', '_');
    if ("BINNED".equals(normalized) || "STD".equals(normalized)) {
      return FitInput.BINNED_STD;
    }
    try {
      return FitInput.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("fitInput must be binned_std or raw (was '" + raw + "')", ex);
    }
  }
}
