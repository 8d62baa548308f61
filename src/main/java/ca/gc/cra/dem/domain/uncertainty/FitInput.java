package ca.gc.cra.dem.domain.uncertainty;

/**
 * How error samples are reduced before the power-law fit.
 *
 * @since 0.1.0
 */
public enum FitInput {
  /** Standard deviation of the error per histogram bin, anchored at the origin. */
  BINNED_STD,
  /** Absolute error of every sample. */
  RAW
}
