package ca.gc.cra.dem.application.uncertainty;

import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.grid.Statistics;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.uncertainty.TileProfile;
import ca.gc.cra.dem.domain.uncertainty.Zone;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Profiles uncertainty tiles by data density and elevation sign.
 *
 * @since 0.1.0
 */
final class TileClassifier {

  /**
   * Profiles every tile that holds DEM data.
   *
   * @param tiles tiles covering the region
   * @param dem interpolated surface
   * @param mask presence mask on the same grid
   * @return profiles in tile order; tiles without DEM data are left out
   */
  List<TileProfile> classify(List<Region> tiles, Raster dem, Raster mask) {
    Objects.requireNonNull(dem, "dem");
    Objects.requireNonNull(mask, "mask");
    List<TileProfile> profiles = new ArrayList<>(tiles.size());
    for (Region tile : tiles) {
      Optional<Raster> demTile = dem.cut(tile);
      Optional<Raster> maskTile = mask.cut(tile);
      if (demTile.isEmpty() || maskTile.isEmpty()) {
        continue;
      }
      Optional<double[]> range = demTile.get().valueRange();
      if (range.isEmpty()) {
        continue;
      }
      int cells = maskTile.get().spec().cellCount();
      int dataCells = dataCells(maskTile.get());
      double zMin = range.get()[0];
      double zMax = range.get()[1];
      profiles.add(new TileProfile(tile, cells, dataCells, 100d * dataCells / cells, zMin, zMax,
          Zone.of(zMin, zMax)));
    }
    return profiles;
  }

  /**
   * Sampling target of the region: 5th percentile of tile densities.
   *
   * @param profiles tile profiles
   * @return density percent, {@code 0} without tiles
   */
  static double samplingTarget(List<TileProfile> profiles) {
    if (profiles.isEmpty()) {
      return 0d;
    }
    double[] densities = new double[profiles.size()];
    for (int i = 0; i < densities.length; i++) {
      densities[i] = profiles.get(i).densityPercent();
    }
    return Statistics.percentile(densities, 5d);
  }

  /** Cells of a presence mask holding a non-zero value. */
  static int dataCells(Raster mask) {
    int count = 0;
    for (int i = 0; i < mask.spec().cellCount(); i++) {
      double v = mask.getAt(i);
      if (!mask.isNoData(v) && v != 0d) {
        count++;
      }
    }
    return count;
  }
}
