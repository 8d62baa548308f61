package ca.gc.cra.dem.infrastructure.vector;

import ca.gc.cra.dem.application.port.VectorLayerPort;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes vector layers as GeoJSON {@code FeatureCollection} documents.
 * <p><strong>Thread-safety:</strong> Appends to one layer are serialized; several workers may share a
 * layer.</p>
 * <p>Features stream to {@code <path>.tmp}, which replaces {@code path} atomically when the layer is
 * closed.</p>
 *
 * @since 0.1.0
 */
public final class GeoJsonLayerAdapter implements VectorLayerPort {
  private static final Logger log = LoggerFactory.getLogger(GeoJsonLayerAdapter.class);

  private final JsonFactory jsonFactory = new JsonFactory();

  @Override
  public VectorLayer create(Path path, String layerName, List<String> fields) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(layerName, "layerName");
    List<String> schema = List.copyOf(fields);
    Path absolute = path.toAbsolutePath();
    if (absolute.getParent() != null) {
      Files.createDirectories(absolute.getParent());
    }
    Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
    JsonGenerator gen = jsonFactory.createGenerator(temp.toFile(), JsonEncoding.UTF8);
    gen.writeStartObject();
    gen.writeStringField("type", "FeatureCollection");
    gen.writeStringField("name", layerName);
    gen.writeArrayFieldStart("features");
    log.debug("Opened layer {} at {} with fields {}", layerName, absolute, schema);
    return new GeoJsonLayer(absolute, temp, gen, schema);
  }

  private static final class GeoJsonLayer implements VectorLayer {
    private final Path target;
    private final Path temp;
    private final JsonGenerator gen;
    private final List<String> fields;
    private long features;
    private boolean closed;

    GeoJsonLayer(Path target, Path temp, JsonGenerator gen, List<String> fields) {
      this.target = target;
      this.temp = temp;
      this.gen = gen;
      this.fields = fields;
    }

    @Override
    public synchronized void append(MultiPolygon geometry, List<String> attributes) throws IOException {
      Objects.requireNonNull(geometry, "geometry");
      Objects.requireNonNull(attributes, "attributes");
      if (closed) {
        throw new IOException("layer " + target + " is closed");
      }
      if (attributes.size() != fields.size()) {
        throw new IllegalArgumentException(
            "expected " + fields.size() + " attributes but got " + attributes.size());
      }
      gen.writeStartObject();
      gen.writeStringField("type", "Feature");
      gen.writeObjectFieldStart("properties");
      for (int i = 0; i < fields.size(); i++) {
        gen.writeStringField(fields.get(i), attributes.get(i));
      }
      gen.writeEndObject();
      gen.writeObjectFieldStart("geometry");
      gen.writeStringField("type", "MultiPolygon");
      gen.writeArrayFieldStart("coordinates");
      for (int i = 0; i < geometry.getNumGeometries(); i++) {
        Polygon polygon = (Polygon) geometry.getGeometryN(i);
        gen.writeStartArray();
        writeRing(polygon.getExteriorRing(), true);
        for (int h = 0; h < polygon.getNumInteriorRing(); h++) {
          writeRing(polygon.getInteriorRingN(h), false);
        }
        gen.writeEndArray();
      }
      gen.writeEndArray();
      gen.writeEndObject();
      gen.writeEndObject();
      features++;
    }

    private void writeRing(LinearRing ring, boolean counterClockwise) throws IOException {
      Coordinate[] vertices = ring.getCoordinates();
      boolean reverse = Orientation.isCCW(vertices) != counterClockwise;
      gen.writeStartArray();
      for (int i = 0; i < vertices.length; i++) {
        Coordinate vertex = vertices[reverse ? vertices.length - 1 - i : i];
        gen.writeStartArray();
        gen.writeNumber(vertex.x);
        gen.writeNumber(vertex.y);
        gen.writeEndArray();
      }
      gen.writeEndArray();
    }

    @Override
    public synchronized long featureCount() {
      return features;
    }

    @Override
    public synchronized void close() throws IOException {
      if (closed) {
        return;
      }
      closed = true;
      try (gen) {
        gen.writeEndArray();
        gen.writeEndObject();
      }
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.info("Wrote {} features to {}", features, target);
    }
  }
}
