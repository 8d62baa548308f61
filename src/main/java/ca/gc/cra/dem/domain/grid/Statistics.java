package ca.gc.cra.dem.domain.grid;

import java.util.Arrays;

/**
 * Order statistics shared by raster analysis and error-model fitting.
 *
 * @since 0.1.0
 */
public final class Statistics {
  private Statistics() {
    // Utility
  }

  /**
   * Percentile with linear interpolation between closest ranks.
   *
   * @param values input values; not modified
   * @param percent percentile in {@code [0, 100]}
   * @return percentile value
   * @throws IllegalArgumentException when {@code values} is empty
   */
  public static double percentile(double[] values, double percent) {
    if (values == null || values.length == 0) {
      throw new IllegalArgumentException("percentile of an empty sample");
    }
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    return percentileOfSorted(sorted, percent);
  }

  static double percentileOfSorted(double[] sorted, double percent) {
    if (percent < 0d || percent > 100d) {
      throw new IllegalArgumentException("percent must be within [0, 100] (was " + percent + ")");
    }
    double rank = percent / 100d * (sorted.length - 1);
    int lo = (int) Math.floor(rank);
    int hi = (int) Math.ceil(rank);
    if (lo == hi) {
      return sorted[lo];
    }
    return sorted[lo] + (rank - lo) * (sorted[hi] - sorted[lo]);
  }

  /** Median, same as the 50th percentile. */
  public static double median(double[] values) {
    return percentile(values, 50d);
  }
}
