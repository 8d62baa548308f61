/**
 * <strong>Purpose:</strong> Ports to the raster, vector, interpolation, reprojection, remote and metrics
 * collaborators of the catalog, grid and uncertainty workflows.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Performance:</strong> Point data crosses ports as lazy {@link ca.gc.cra.dem.domain.point.PointStream}s.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dem.application.port;
