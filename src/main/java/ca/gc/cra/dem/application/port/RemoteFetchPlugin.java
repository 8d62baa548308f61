package ca.gc.cra.dem.application.port;

import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import java.io.IOException;
import java.util.Map;

/**
 * Fetches points from a remote source identified by a scheme prefix.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader} and must have a public no-arg
 * constructor.</p>
 *
 * @since 0.1.0
 */
public interface RemoteFetchPlugin {
  /** Scheme this plugin serves, e.g. {@code https}. */
  String scheme();

  /**
   * Opens a stream of points for the query region.
   *
   * @param region padded query region, or {@code null} for no spatial restriction
   * @param args arguments parsed from the catalog reference
   * @return lazy stream of points
   * @throws IOException when the source is unreachable
   */
  PointStream fetch(Region region, Map<String, String> args) throws IOException;
}
