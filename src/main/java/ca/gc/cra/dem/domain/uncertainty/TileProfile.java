package ca.gc.cra.dem.domain.uncertainty;

import ca.gc.cra.dem.domain.region.Region;
import java.util.Objects;

/**
 * Density and elevation profile of one uncertainty tile.
 *
 * @param region tile bounds
 * @param cellCount cells in the tile
 * @param dataCells cells holding measured data
 * @param densityPercent {@code 100 * dataCells / cellCount}
 * @param zMin minimum DEM elevation in the tile
 * @param zMax maximum DEM elevation in the tile
 * @param zone elevation sign profile
 * @since 0.1.0
 */
public record TileProfile(
    Region region,
    int cellCount,
    int dataCells,
    double densityPercent,
    double zMin,
    double zMax,
    Zone zone) {

  public TileProfile {
    Objects.requireNonNull(region, "region");
    Objects.requireNonNull(zone, "zone");
  }
}
