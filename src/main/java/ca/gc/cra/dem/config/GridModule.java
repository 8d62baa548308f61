package ca.gc.cra.dem.config;

import ca.gc.cra.dem.domain.grid.BinningMode;
import java.util.Locale;
import java.util.Optional;

/**
 * Gridding module run by the grid pipeline.
 *
 * @since 0.1.0
 */
public enum GridModule {
  /** Point count per cell. */
  NUM(BinningMode.COUNT),
  /** Weighted mean elevation per cell. */
  MEAN(BinningMode.MEAN),
  /** Data presence per cell. */
  MASK(BinningMode.PRESENCE),
  /** Built-in inverse-distance interpolation. */
  IDW(null),
  /** External gridding command. */
  PROCESS(null);

  private final BinningMode binning;

  GridModule(BinningMode binning) {
    this.binning = binning;
  }

  /** Binning mode of direct binning modules; empty for interpolating modules. */
  public Optional<BinningMode> binning() {
    return Optional.ofNullable(binning);
  }

  /** Name of the {@code InterpolationEngine} serving an interpolating module. */
  public String engineName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static GridModule parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("module must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown module '" + value.trim() + "' (expected num, mean, mask, idw or process)", ex);
    }
  }
}
