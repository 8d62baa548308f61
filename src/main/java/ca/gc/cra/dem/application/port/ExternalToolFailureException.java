package ca.gc.cra.dem.application.port;

/**
 * Signals that an external collaborator (interpolation engine, raster codec, proximity or slope service)
 * failed to produce its result.
 *
 * <p>The failing unit of work is dropped when the run is partitioned into chunks or tiles; otherwise the
 * run aborts.</p>
 *
 * @since 0.1.0
 */
public class ExternalToolFailureException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a diagnostic message.
   *
   * @param message failure description naming the collaborator
   */
  public ExternalToolFailureException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a diagnostic message and underlying cause.
   *
   * @param message failure description naming the collaborator
   * @param cause root cause such as an {@link java.io.IOException}
   */
  public ExternalToolFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
