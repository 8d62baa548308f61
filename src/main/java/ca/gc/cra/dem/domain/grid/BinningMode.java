package ca.gc.cra.dem.domain.grid;

import java.util.Locale;

/**
 * Aggregation policy used when points are binned into cells.
 *
 * @since 0.1.0
 */
public enum BinningMode {
  /** Number of points per cell. */
  COUNT("n"),
  /** Weighted mean elevation per cell; empty cells stay nodata. */
  MEAN("m"),
  /** {@code 1} where at least one point fell, {@code 0} elsewhere. */
  PRESENCE("k");

  private final String code;

  BinningMode(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Parses a mode name or its one-letter code.
   *
   * @param value {@code count}, {@code mean}, {@code presence} or {@code n}, {@code m}, {@code k}
   * @return matching mode
   * @throws IllegalArgumentException when unknown
   */
  public static BinningMode parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("binning mode must not be null");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (BinningMode mode : values()) {
      if (mode.code.equals(normalized) || mode.name().toLowerCase(Locale.ROOT).equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("unknown binning mode: " + value);
  }
}
