package ca.gc.cra.dem.domain.catalog;

/**
 * An entry's source is missing or unreadable. The entry is skipped and the run continues.
 *
 * @since 0.1.0
 */
public final class SourceUnavailableException extends CatalogException {
  private static final long serialVersionUID = 1L;

  public SourceUnavailableException(String source, String message) {
    super(source, message);
  }

  public SourceUnavailableException(String source, String message, Throwable cause) {
    super(source, message, cause);
  }
}
