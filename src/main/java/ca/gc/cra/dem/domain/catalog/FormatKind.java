package ca.gc.cra.dem.domain.catalog;

/**
 * Families of catalog entries the resolver can dispatch on.
 *
 * @since 0.1.0
 */
public enum FormatKind {
  CATALOG,
  POINTS,
  RASTER,
  REMOTE
}
