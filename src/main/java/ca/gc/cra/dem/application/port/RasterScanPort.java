package ca.gc.cra.dem.application.port;

import ca.gc.cra.dem.domain.catalog.RasterEntry;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.region.ZBounds;
import java.io.IOException;

/**
 * Turns raster cells into point records at cell centres.
 *
 * @since 0.1.0
 */
public interface RasterScanPort {
  /**
   * Opens a lazy scan over the cells of a raster entry.
   *
   * @param entry raster entry
   * @param region query region, or {@code null} for the whole raster
   * @param zBounds elevation filter
   * @return stream of data cells; nodata cells are never emitted
   * @throws IOException when the raster cannot be opened
   */
  PointStream scan(RasterEntry entry, Region region, ZBounds zBounds) throws IOException;
}
