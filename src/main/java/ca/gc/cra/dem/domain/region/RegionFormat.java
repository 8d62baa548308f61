package ca.gc.cra.dem.domain.region;

/**
 * Textual renderings of a {@link Region}.
 *
 * @since 0.1.0
 */
public enum RegionFormat {
  /** {@code west/east/south/north}. */
  STR,
  /** {@code -Rwest/east/south/north}. */
  GMT,
  /** {@code west,south,east,north}. */
  BBOX,
  /** {@code west south east north}. */
  TE,
  /** {@code west north east south}. */
  UL_LR,
  /** File-name fragment such as {@code n40x25_w074x50}. */
  FN,
  /** Space separated bounds including the z range when present. */
  INF
}
