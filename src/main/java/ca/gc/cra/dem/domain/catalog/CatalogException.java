package ca.gc.cra.dem.domain.catalog;

/**
 * Base type for failures raised while resolving catalog entries.
 *
 * <p>Subtypes tell the resolver how far a failure reaches: a record, an entry, or the whole run.</p>
 *
 * @since 0.1.0
 */
public class CatalogException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String source;

  /**
   * Creates an exception.
   *
   * @param source source reference the failure relates to
   * @param message diagnostic message
   */
  public CatalogException(String source, String message) {
    super(message);
    this.source = source;
  }

  /**
   * Creates an exception with a cause.
   *
   * @param source source reference the failure relates to
   * @param message diagnostic message
   * @param cause underlying failure
   */
  public CatalogException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
  }

  /** Returns the source reference associated with the failure. */
  public String source() {
    return source;
  }
}
