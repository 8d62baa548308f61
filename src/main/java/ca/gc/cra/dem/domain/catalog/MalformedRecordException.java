package ca.gc.cra.dem.domain.catalog;

/**
 * A point line or catalog line could not be parsed. Only that line is skipped.
 *
 * @since 0.1.0
 */
public final class MalformedRecordException extends CatalogException {
  private static final long serialVersionUID = 1L;

  private final long lineNumber;

  /**
   * Creates an exception.
   *
   * @param source file the line came from
   * @param lineNumber one-based line number, or {@code -1} when unknown
   * @param message diagnostic message
   */
  public MalformedRecordException(String source, long lineNumber, String message) {
    super(source, message);
    this.lineNumber = lineNumber;
  }

  public long lineNumber() {
    return lineNumber;
  }
}
