package ca.gc.cra.dem.application.port;

import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.point.PointStream;
import java.util.Map;

/**
 * <strong>What:</strong> Method-agnostic surface interpolation.
 * <p><strong>Why:</strong> The grid pipeline and the split-sample trials only need "points in, raster out";
 * how the surface is solved stays behind this port.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls with distinct inputs.</p>
 *
 * @since 0.1.0
 */
public interface InterpolationEngine {
  /** Short name used in configuration, e.g. {@code idw}. */
  String name();

  /**
   * Interpolates a surface over {@code grid}.
   *
   * @param grid output geometry
   * @param points weighted input points; the engine consumes but does not close the stream
   * @param methodParams engine specific parameters
   * @return interpolated raster owned by the caller
   * @throws ExternalToolFailureException when the engine fails or produces no surface
   */
  Raster interpolate(GridSpec grid, PointStream points, Map<String, String> methodParams)
      throws ExternalToolFailureException;
}
