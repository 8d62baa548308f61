package ca.gc.cra.dem.domain.uncertainty;

/**
 * Power-law error model {@code error = p0 + p1 * |x|^|p2|}.
 *
 * @param p0 offset
 * @param p1 scale
 * @param p2 exponent; its absolute value is used
 * @since 0.1.0
 */
public record ErrorModel(double p0, double p1, double p2) {
  /** Starting point of every fit. */
  public static final ErrorModel INITIAL_GUESS = new ErrorModel(0d, 0.1d, 0.2d);

  public ErrorModel {
    if (!Double.isFinite(p0) || !Double.isFinite(p1) || !Double.isFinite(p2)) {
      throw new IllegalArgumentException("error model coefficients must be finite");
    }
  }

  /**
   * Evaluates the model.
   *
   * @param x distance or slope
   * @return predicted error magnitude
   */
  public double evaluate(double x) {
    return p0 + p1 * Math.pow(Math.abs(x), Math.abs(p2));
  }

  public double[] toArray() {
    return new double[] {p0, p1, p2};
  }
}
