package ca.gc.cra.dem.domain.catalog;

/**
 * A catalog references itself directly or through descendants. Resolution aborts.
 *
 * @since 0.1.0
 */
public final class CatalogCycleException extends CatalogException {
  private static final long serialVersionUID = 1L;

  public CatalogCycleException(String source, String message) {
    super(source, message);
  }
}
