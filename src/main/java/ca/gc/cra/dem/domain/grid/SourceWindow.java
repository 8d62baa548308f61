package ca.gc.cra.dem.domain.grid;

/**
 * Pixel window {@code (xOffset, yOffset, xSize, ySize)} of a raster.
 *
 * @param xOffset first column
 * @param yOffset first row
 * @param xSize number of columns
 * @param ySize number of rows
 * @since 0.1.0
 */
public record SourceWindow(int xOffset, int yOffset, int xSize, int ySize) {
  public SourceWindow {
    if (xOffset < 0 || yOffset < 0) {
      throw new IllegalArgumentException("window offsets must be >= 0");
    }
    if (xSize < 0 || ySize < 0) {
      throw new IllegalArgumentException("window sizes must be >= 0");
    }
  }

  public boolean isEmpty() {
    return xSize == 0 || ySize == 0;
  }
}
