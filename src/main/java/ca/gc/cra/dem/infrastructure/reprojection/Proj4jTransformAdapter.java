package ca.gc.cra.dem.infrastructure.reprojection;

import ca.gc.cra.dem.application.port.CoordinateTransformPort;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CoordinateTransformPort} backed by proj4j and its bundled EPSG registry.
 * <p><strong>Why:</strong> Surveys arrive in UTM, state plane and web mercator systems that have to meet
 * geographic grids.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use. Transforms are built once per pair and each one
 * is used under its own lock.</p>
 *
 * <p>The legacy web mercator aliases {@code 900913} and {@code 3785} resolve to {@code EPSG:3857}. Equal codes
 * pass coordinates through unchanged.</p>
 *
 * @since 0.1.0
 */
public final class Proj4jTransformAdapter implements CoordinateTransformPort {
  private static final Logger log = LoggerFactory.getLogger(Proj4jTransformAdapter.class);
  private static final Map<Integer, Integer> ALIASES = Map.of(900913, 3857, 3785, 3857);

  private final CRSFactory crsFactory = new CRSFactory();
  private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
  private final ConcurrentMap<Integer, CoordinateReferenceSystem> systems = new ConcurrentHashMap<>();
  private final ConcurrentMap<Long, CoordinateTransform> transforms = new ConcurrentHashMap<>();

  @Override
  public boolean supports(int sourceEpsg, int targetEpsg) {
    if (sourceEpsg == targetEpsg) {
      return true;
    }
    return system(sourceEpsg) != null && system(targetEpsg) != null;
  }

  @Override
  public double[] transform(double x, double y, int sourceEpsg, int targetEpsg) {
    if (sourceEpsg == targetEpsg) {
      return new double[] {x, y};
    }
    if (!supports(sourceEpsg, targetEpsg)) {
      throw new IllegalArgumentException("unsupported transform EPSG:" + sourceEpsg + " -> EPSG:" + targetEpsg);
    }
    CoordinateTransform transform = transforms.computeIfAbsent(pairKey(sourceEpsg, targetEpsg),
        key -> transformFactory.createTransform(system(sourceEpsg), system(targetEpsg)));
    ProjCoordinate src = new ProjCoordinate(x, y);
    ProjCoordinate dst = new ProjCoordinate();
    synchronized (transform) {
      transform.transform(src, dst);
    }
    return new double[] {dst.x, dst.y};
  }

  private CoordinateReferenceSystem system(int epsg) {
    int code = ALIASES.getOrDefault(epsg, epsg);
    CoordinateReferenceSystem known = systems.get(code);
    if (known != null) {
      return known;
    }
    try {
      CoordinateReferenceSystem created = crsFactory.createFromName("EPSG:" + code);
      CoordinateReferenceSystem previous = systems.putIfAbsent(code, created);
      return previous == null ? created : previous;
    } catch (Proj4jException ex) {
      log.debug("EPSG:{} is not in the proj4j registry: {}", code, ex.getMessage());
      return null;
    }
  }

  private static long pairKey(int sourceEpsg, int targetEpsg) {
    return ((long) sourceEpsg << 32) | (targetEpsg & 0xffffffffL);
  }
}
