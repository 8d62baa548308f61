/**
 * Grid geometry and mutable rasters.
 * <p><strong>Concurrency:</strong> {@code GridSpec} and {@code GeoTransform} are immutable; {@code Raster} is not
 * thread-safe and is owned by one pipeline stage at a time.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dem.domain.grid;
