package ca.gc.cra.dem.application.port;

import ca.gc.cra.dem.domain.grid.GeoTransform;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.region.Region;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Header information of a raster source.
 *
 * @param width number of columns
 * @param height number of rows
 * @param bandCount number of bands
 * @param transform pixel to geographic transform
 * @param projection projection description when the source carries one
 * @param nodata nodata marker when the source declares one
 * @since 0.1.0
 */
public record RasterInfo(
    int width,
    int height,
    int bandCount,
    GeoTransform transform,
    Optional<String> projection,
    OptionalDouble nodata) {

  public RasterInfo {
    Objects.requireNonNull(transform, "transform");
    Objects.requireNonNull(projection, "projection");
    Objects.requireNonNull(nodata, "nodata");
    if (width < 1 || height < 1 || bandCount < 1) {
      throw new IllegalArgumentException("raster dimensions and band count must be positive");
    }
  }

  /**
   * Grid geometry of the raster.
   *
   * @return grid specification using the declared nodata, or the default marker when none is declared
   * @throws IllegalStateException when the raster is rotated or its cells are not square
   */
  public GridSpec toGridSpec() {
    double cell = transform.pixelWidth();
    if (transform.rowRotation() != 0d || transform.columnRotation() != 0d
        || Math.abs(transform.pixelHeight() + cell) > Math.abs(cell) * 1e-9) {
      throw new IllegalStateException("only north-up rasters with square cells are supported");
    }
    double west = transform.originX();
    double north = transform.originY();
    Region region = Region.of(west, west + width * cell, north - height * cell, north);
    return new GridSpec(region, cell, width, height, transform, nodata.orElse(GridSpec.DEFAULT_NODATA));
  }
}
