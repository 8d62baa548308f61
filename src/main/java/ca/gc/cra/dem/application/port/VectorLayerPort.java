package ca.gc.cra.dem.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.locationtech.jts.geom.MultiPolygon;

/**
 * Creates polygon feature layers.
 *
 * @since 0.1.0
 */
public interface VectorLayerPort {

  /**
   * Appendable polygon layer. Appends are serialized by the implementation so several workers can share
   * one layer; the layer is readable only after {@link #close()}.
   */
  interface VectorLayer extends AutoCloseable {
    /**
     * Appends one feature.
     *
     * @param geometry feature geometry
     * @param attributes values in the order of the layer's field schema
     * @throws IOException when the feature cannot be written
     */
    void append(MultiPolygon geometry, List<String> attributes) throws IOException;

    /** Number of features appended so far. */
    long featureCount();

    @Override
    void close() throws IOException;
  }

  /**
   * Creates a layer, replacing an existing file.
   *
   * @param path destination
   * @param layerName layer name
   * @param fields attribute field names
   * @return open layer
   * @throws IOException when the destination cannot be created
   */
  VectorLayer create(Path path, String layerName, List<String> fields) throws IOException;
}
