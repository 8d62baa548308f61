package ca.gc.cra.dem.domain.catalog;

/**
 * A catalog line names a format code, extension or scheme that no handler understands.
 *
 * @since 0.1.0
 */
public final class UnsupportedFormatException extends CatalogException {
  private static final long serialVersionUID = 1L;

  public UnsupportedFormatException(String source, String message) {
    super(source, message);
  }
}
