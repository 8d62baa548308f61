package ca.gc.cra.dem.infrastructure.raster;

import ca.gc.cra.dem.application.port.RasterInfo;
import ca.gc.cra.dem.application.port.RasterIoPort;
import ca.gc.cra.dem.domain.grid.GeoTransform;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.grid.SourceWindow;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import mil.nga.tiff.util.TiffException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RasterIoPort} for single band GeoTIFF files ({@code .tif}).
 * <p><strong>Why:</strong> GeoTIFF is the default DEM output; mil.nga tiff reads and writes it without native
 * libraries.</p>
 * <p><strong>Thread-safety:</strong> Stateless. Writes go to a temporary sibling that is moved into place.</p>
 *
 * <p>Georeferencing uses the {@code ModelPixelScale} and {@code ModelTiepoint} tags; the nodata marker is the
 * {@code GDAL_NODATA} tag. Cells are written as 32-bit floats, uncompressed. Rasters without scale and
 * tiepoint tags are read in pixel space with a north-up unit transform.</p>
 *
 * @since 0.1.0
 */
public final class GeoTiffRasterAdapter implements RasterIoPort {
  private static final Logger log = LoggerFactory.getLogger(GeoTiffRasterAdapter.class);

  /** GeoKey directory header plus GTRasterTypeGeoKey = RasterPixelIsArea. */
  private static final List<Integer> GEO_KEYS = List.of(1, 1, 0, 1, 1025, 0, 1, 1);

  @Override
  public RasterInfo open(Path path) throws IOException {
    return header(directoryOf(path), path);
  }

  @Override
  public Raster readWindow(Path path, SourceWindow window) throws IOException {
    Objects.requireNonNull(window, "window");
    FileDirectory directory = directoryOf(path);
    RasterInfo info = header(directory, path);
    GridSpec sub = info.toGridSpec().subGrid(window);
    Rasters rasters;
    try {
      rasters = directory.readRasters();
    } catch (TiffException ex) {
      throw new IOException("cannot decode cells of " + path + ": " + ex.getMessage(), ex);
    }
    float[] data = new float[sub.cellCount()];
    for (int dy = 0; dy < window.ySize(); dy++) {
      for (int dx = 0; dx < window.xSize(); dx++) {
        Number value = rasters.getFirstPixelSample(window.xOffset() + dx, window.yOffset() + dy);
        data[dy * window.xSize() + dx] = value.floatValue();
      }
    }
    return new Raster(sub, data);
  }

  @Override
  public Path write(Raster raster, Path path) throws IOException {
    Objects.requireNonNull(raster, "raster");
    Path target = path.toAbsolutePath();
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    GridSpec spec = raster.spec();
    Rasters rasters = new Rasters(spec.width(), spec.height(), 1, FieldType.FLOAT);
    for (int row = 0; row < spec.height(); row++) {
      for (int col = 0; col < spec.width(); col++) {
        double value = raster.get(col, row);
        rasters.setFirstPixelSample(col, row, (float) (raster.isNoData(value) ? spec.nodataValue() : value));
      }
    }

    FileDirectory directory = new FileDirectory();
    directory.setImageWidth(spec.width());
    directory.setImageHeight(spec.height());
    directory.setBitsPerSample(FieldType.FLOAT.getBits());
    directory.setCompression(TiffConstants.COMPRESSION_NO);
    directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
    directory.setSamplesPerPixel(1);
    directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
    directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
    directory.setSampleFormat(TiffConstants.SAMPLE_FORMAT_FLOAT);
    directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelPixelScale, FieldType.DOUBLE, 3,
        List.of(spec.cellSize(), spec.cellSize(), 0d)));
    directory.addEntry(new FileDirectoryEntry(FieldTagType.ModelTiepoint, FieldType.DOUBLE, 6,
        List.of(0d, 0d, 0d, spec.region().west(), spec.region().north(), 0d)));
    directory.addEntry(new FileDirectoryEntry(FieldTagType.GeoKeyDirectory, FieldType.SHORT, GEO_KEYS.size(),
        GEO_KEYS));
    String nodata = AsciiGridRasterAdapter.plain(spec.nodataValue());
    directory.addEntry(new FileDirectoryEntry(FieldTagType.GDAL_NODATA, FieldType.ASCII, nodata.length() + 1,
        List.of(nodata)));
    directory.setWriteRasters(rasters);
    TIFFImage image = new TIFFImage();
    image.add(directory);

    Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
    try {
      TiffWriter.writeTiff(temp.toFile(), image);
    } catch (IOException | TiffException ex) {
      Files.deleteIfExists(temp);
      throw ex instanceof IOException io ? io : new IOException("cannot encode " + target, ex);
    }
    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    log.debug("Wrote {}x{} GeoTIFF to {}", spec.width(), spec.height(), target);
    return target;
  }

  private static FileDirectory directoryOf(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new NoSuchFileException(path.toString());
    }
    try {
      TIFFImage image = TiffReader.readTiff(path.toFile());
      return image.getFileDirectory();
    } catch (TiffException ex) {
      throw new IOException(path + " is not a readable TIFF: " + ex.getMessage(), ex);
    }
  }

  private static RasterInfo header(FileDirectory directory, Path path) throws IOException {
    int width = directory.getImageWidth().intValue();
    int height = directory.getImageHeight().intValue();
    Integer samples = directory.getSamplesPerPixel();
    List<Double> scale = doubles(directory.get(FieldTagType.ModelPixelScale));
    List<Double> tiepoint = doubles(directory.get(FieldTagType.ModelTiepoint));
    GeoTransform transform;
    if (scale.size() >= 2 && tiepoint.size() >= 6) {
      double originX = tiepoint.get(3) - tiepoint.get(0) * scale.get(0);
      double originY = tiepoint.get(4) + tiepoint.get(1) * scale.get(1);
      transform = new GeoTransform(originX, scale.get(0), 0d, originY, 0d, -scale.get(1));
    } else {
      log.debug("{} carries no georeferencing; reading it in pixel space", path);
      transform = GeoTransform.northUp(0d, height, 1d);
    }
    return new RasterInfo(width, height, samples == null ? 1 : samples, transform, Optional.empty(),
        nodataOf(directory.get(FieldTagType.GDAL_NODATA), path));
  }

  private static OptionalDouble nodataOf(FileDirectoryEntry entry, Path path) throws IOException {
    if (entry == null) {
      return OptionalDouble.empty();
    }
    Object values = entry.getValues();
    String text = values instanceof List<?> list && !list.isEmpty() ? String.valueOf(list.get(0))
        : String.valueOf(values);
    try {
      return OptionalDouble.of(Double.parseDouble(text.strip()));
    } catch (NumberFormatException ex) {
      throw new IOException("bad GDAL_NODATA '" + text + "' in " + path, ex);
    }
  }

  private static List<Double> doubles(FileDirectoryEntry entry) {
    List<Double> out = new ArrayList<>();
    if (entry == null) {
      return out;
    }
    Object values = entry.getValues();
    if (values instanceof List<?> list) {
      for (Object value : list) {
        out.add(((Number) value).doubleValue());
      }
    } else if (values instanceof Number number) {
      out.add(number.doubleValue());
    }
    return out;
  }
}
