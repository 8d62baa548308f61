package ca.gc.cra.dem.domain.region;

/**
 * Raised when a region cannot be parsed or is degenerate where a valid one is required.
 *
 * <p>Region problems are configuration errors; the operation that produced the region aborts.</p>
 *
 * @since 0.1.0
 */
public final class InvalidRegionException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a diagnostic message.
   *
   * @param message description naming the offending region
   */
  public InvalidRegionException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a diagnostic message and root cause.
   *
   * @param message description naming the offending region
   * @param cause parsing failure
   */
  public InvalidRegionException(String message, Throwable cause) {
    super(message, cause);
  }
}
