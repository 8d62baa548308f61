package ca.gc.cra.dem.domain.catalog;

import java.util.Locale;

/**
 * How a caller-supplied weight override travels down nested catalogs.
 *
 * <p>Without an override a record always carries the weight of the entry it was read from.</p>
 *
 * @since 0.1.0
 */
public enum WeightPropagation {
  /** Every level multiplies: {@code override * w(catalog) * ... * w(leaf)}. */
  COMPOUND,
  /** The override applies once: {@code override * w(leaf)}; intermediate catalog weights are ignored. */
  ROOT_ONLY;

  /**
   * Parses {@code compound} or {@code root_only} (also {@code root}).
   *
   * @param value propagation name
   * @return propagation mode
   */
  public static WeightPropagation parse(String value) {
    if (value == null || value.isBlank()) {
      return COMPOUND;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    if ("ROOT".equals(normalized)) {
      return ROOT_ONLY;
    }
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown weight propagation: " + value, ex);
    }
  }
}
