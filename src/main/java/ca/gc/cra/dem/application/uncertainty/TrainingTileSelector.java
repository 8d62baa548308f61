package ca.gc.cra.dem.application.uncertainty;

import ca.gc.cra.dem.domain.grid.Statistics;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.uncertainty.TileProfile;
import ca.gc.cra.dem.domain.uncertainty.Zone;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks and orders training tiles per zone.
 *
 * <p>Only tiles denser than their zone's median density are kept. They are then declustered: after a random
 * shuffle the first tile is taken, the remaining tiles are reshuffled and those farther from it than the
 * median great-circle distance move to the front, and the process repeats. Spatially spread tiles therefore
 * come first, so truncating the list keeps coverage.</p>
 *
 * @since 0.1.0
 */
final class TrainingTileSelector {
  private static final Logger log = LoggerFactory.getLogger(TrainingTileSelector.class);
  private static final double EARTH_RADIUS_M = 6_371_000d;

  private final Random random;

  TrainingTileSelector(Random random) {
    this.random = Objects.requireNonNull(random, "random");
  }

  /**
   * Selects training tiles.
   *
   * @param profiles classified tiles
   * @return declustered training tiles keyed by zone, in {@link Zone} order; zones without tiles map to an
   *     empty list
   */
  Map<Zone, List<TileProfile>> select(List<TileProfile> profiles) {
    Map<Zone, List<TileProfile>> byZone = new EnumMap<>(Zone.class);
    for (Zone zone : Zone.values()) {
      byZone.put(zone, new ArrayList<>());
    }
    for (TileProfile profile : profiles) {
      byZone.get(profile.zone()).add(profile);
    }
    Map<Zone, List<TileProfile>> trainers = new EnumMap<>(Zone.class);
    for (Map.Entry<Zone, List<TileProfile>> entry : byZone.entrySet()) {
      List<TileProfile> tiles = entry.getValue();
      double median = tiles.isEmpty() ? 0d : Statistics.median(densities(tiles));
      List<TileProfile> dense = new ArrayList<>();
      for (TileProfile tile : tiles) {
        if (tile.densityPercent() > median) {
          dense.add(tile);
        }
      }
      log.debug("Zone {}: median density {}, {} candidate training tiles", entry.getKey(), median,
          dense.size());
      trainers.put(entry.getKey(), decluster(dense));
    }
    return trainers;
  }

  List<TileProfile> decluster(List<TileProfile> tiles) {
    List<TileProfile> remaining = new ArrayList<>(tiles);
    List<TileProfile> ordered = new ArrayList<>(tiles.size());
    Collections.shuffle(remaining, random);
    while (!remaining.isEmpty()) {
      TileProfile anchor = remaining.remove(0);
      ordered.add(anchor);
      if (remaining.isEmpty()) {
        break;
      }
      double[] distances = new double[remaining.size()];
      for (int i = 0; i < distances.length; i++) {
        distances[i] = distanceBetween(anchor.region(), remaining.get(i).region());
      }
      double median = Statistics.median(distances);
      Collections.shuffle(remaining, random);
      remaining.sort(Comparator.comparing(
          (TileProfile t) -> distanceBetween(anchor.region(), t.region()) > median).reversed());
    }
    return ordered;
  }

  /** Great-circle distance between region centres, in metres. */
  static double distanceBetween(Region a, Region b) {
    double lat1 = Math.toRadians(a.centerY());
    double lat2 = Math.toRadians(b.centerY());
    double dLat = lat2 - lat1;
    double dLon = Math.toRadians(b.centerX() - a.centerX());
    double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
        + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
    return 2 * EARTH_RADIUS_M * Math.asin(Math.min(1d, Math.sqrt(h)));
  }

  private static double[] densities(List<TileProfile> tiles) {
    double[] values = new double[tiles.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = tiles.get(i).densityPercent();
    }
    return values;
  }
}
