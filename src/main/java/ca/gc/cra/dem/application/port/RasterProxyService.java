package ca.gc.cra.dem.application.port;

import ca.gc.cra.dem.domain.grid.Raster;

/**
 * Derived rasters used by the uncertainty estimator.
 *
 * @since 0.1.0
 */
public interface RasterProxyService {
  /**
   * Distance from every cell to the nearest cell holding a non-zero value, in cells.
   *
   * @param mask presence mask; non-zero, non-nodata cells count as data
   * @return proximity raster on the same grid
   * @throws ExternalToolFailureException when the computation fails
   */
  Raster proximity(Raster mask) throws ExternalToolFailureException;

  /**
   * Local slope of a surface.
   *
   * @param dem elevation raster
   * @return slope raster on the same grid; nodata where the DEM has no data
   * @throws ExternalToolFailureException when the computation fails
   */
  Raster slope(Raster dem) throws ExternalToolFailureException;
}
