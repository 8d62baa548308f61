package ca.gc.cra.dem.domain.uncertainty;

/**
 * Explanatory variable an error model is fitted against.
 *
 * @since 0.1.0
 */
public enum ErrorAxis {
  DISTANCE("prox"),
  SLOPE("slp");

  private final String suffix;

  ErrorAxis(String suffix) {
    this.suffix = suffix;
  }

  /** Short name used in output file names. */
  public String suffix() {
    return suffix;
  }
}
