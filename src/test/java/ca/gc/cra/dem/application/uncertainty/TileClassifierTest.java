package ca.gc.cra.dem.application.uncertainty;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.uncertainty.TileProfile;
import ca.gc.cra.dem.domain.uncertainty.Zone;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class TileClassifierTest {
  private final GridSpec spec = GridSpec.of(Region.of(0, 4, 0, 4), 1);

  @Test
  void profilesDensityAndZonePerTile() {
    List<Region> tiles = spec.region().tile(1, 2);
    List<TileProfile> profiles = new TileClassifier().classify(tiles, dem(), mask());

    assertEquals(4, profiles.size());
    TileProfile northWest = find(profiles, Region.of(0, 2, 2, 4));
    assertEquals(100d, northWest.densityPercent(), 1e-9);
    assertEquals(Zone.NEGATIVE, northWest.zone());
    TileProfile southEast = find(profiles, Region.of(2, 4, 0, 2));
    assertEquals(25d, southEast.densityPercent(), 1e-9);
    assertEquals(Zone.POSITIVE, southEast.zone());
    assertEquals(0d, TileClassifier.samplingTarget(profiles), 1e-9);
  }

  @Test
  void tilesWithoutSurfaceAreLeftOut() {
    Raster dem = dem();
    for (int row = 0; row < 2; row++) {
      for (int col = 2; col < 4; col++) {
        dem.set(col, row, spec.nodataValue());
      }
    }

    List<TileProfile> profiles = new TileClassifier().classify(spec.region().tile(1, 2), dem, mask());

    assertEquals(3, profiles.size());
    assertTrue(TileClassifier.samplingTarget(List.of()) == 0d);
  }

  @Test
  void trainingTilesAreDenserThanTheirZoneMedian() {
    List<TileProfile> profiles = new TileClassifier().classify(spec.region().tile(1, 2), dem(), mask());

    Map<Zone, List<TileProfile>> training = new TrainingTileSelector(new Random(1)).select(profiles);

    assertEquals(List.of(Region.of(0, 2, 2, 4)), regions(training.get(Zone.NEGATIVE)));
    assertEquals(List.of(Region.of(2, 4, 0, 2)), regions(training.get(Zone.POSITIVE)));
    assertTrue(training.get(Zone.MIXED).isEmpty());
  }

  @Test
  void declusterKeepsEveryTile() {
    List<TileProfile> profiles = new TileClassifier().classify(spec.region().tile(1, 1), dem(), mask());

    List<TileProfile> ordered = new TrainingTileSelector(new Random(5)).decluster(profiles);

    assertEquals(profiles.size(), ordered.size());
    assertTrue(ordered.containsAll(profiles));
  }

  @Test
  void greatCircleDistanceOfOneDegreeLatitude() {
    double metres = TrainingTileSelector.distanceBetween(Region.of(0, 1, 0, 1), Region.of(0, 1, 1, 2));

    assertEquals(111_195d, metres, 1d);
  }

  /** West half at -5, east half at +5. */
  private Raster dem() {
    Raster dem = Raster.empty(spec);
    for (int row = 0; row < 4; row++) {
      for (int col = 0; col < 4; col++) {
        dem.set(col, row, col < 2 ? -5 : 5);
      }
    }
    return dem;
  }

  /** North-west tile fully measured plus one cell in the south-east tile. */
  private Raster mask() {
    Raster mask = Raster.filled(spec, 0);
    for (int row = 0; row < 2; row++) {
      for (int col = 0; col < 2; col++) {
        mask.set(col, row, 1);
      }
    }
    mask.set(3, 3, 1);
    return mask;
  }

  private static TileProfile find(List<TileProfile> profiles, Region region) {
    return profiles.stream().filter(p -> p.region().equals(region)).findFirst().orElseThrow();
  }

  private static List<Region> regions(List<TileProfile> profiles) {
    return profiles.stream().map(TileProfile::region).toList();
  }
}
