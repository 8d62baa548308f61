package ca.gc.cra.dem.infrastructure.vector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dem.application.port.VectorLayerPort.VectorLayer;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;

class GeoJsonLayerAdapterTest {
  @TempDir Path dir;

  private final GeoJsonLayerAdapter adapter = new GeoJsonLayerAdapter();
  private final GeometryFactory factory = new GeometryFactory();

  @Test
  void writesFeatureCollectionOnClose() throws Exception {
    Path path = dir.resolve("out/coast_sm.geojson");
    MultiPolygon square = factory.createMultiPolygon(
        new Polygon[] {(Polygon) factory.toGeometry(new Envelope(0, 1, 0, 1))});

    try (VectorLayer layer = adapter.create(path, "coast_sm", List.of("Name", "Agency"))) {
      layer.append(square, List.of("survey", "NOAA"));
      layer.append(square, List.of("other", "Unknown"));
      assertEquals(2, layer.featureCount());
      assertFalse(Files.exists(path));
    }

    assertTrue(Files.exists(path));
    assertFalse(Files.exists(dir.resolve("out/coast_sm.geojson.tmp")));
    List<String> strings = new ArrayList<>();
    try (JsonParser parser = new JsonFactory().createParser(path.toFile())) {
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        if (token == JsonToken.VALUE_STRING) {
          strings.add(parser.getText());
        }
      }
    }
    assertEquals(List.of("FeatureCollection", "coast_sm", "Feature", "survey", "NOAA", "MultiPolygon",
        "Feature", "other", "Unknown", "MultiPolygon"), strings);
    assertEquals(20, numbers(path).size());
  }

  @Test
  void shellsAreCounterClockwiseAndHolesClockwise() throws Exception {
    LinearRing shell = factory.createLinearRing(new Coordinate[] {
        new Coordinate(0, 0), new Coordinate(0, 3), new Coordinate(3, 3), new Coordinate(3, 0),
        new Coordinate(0, 0)});
    LinearRing hole = factory.createLinearRing(new Coordinate[] {
        new Coordinate(1, 1), new Coordinate(2, 1), new Coordinate(2, 2), new Coordinate(1, 2),
        new Coordinate(1, 1)});
    MultiPolygon framed = factory.createMultiPolygon(
        new Polygon[] {factory.createPolygon(shell, new LinearRing[] {hole})});
    Path path = dir.resolve("framed.geojson");

    try (VectorLayer layer = adapter.create(path, "framed", List.of())) {
      layer.append(framed, List.of());
    }

    List<Double> values = numbers(path);
    assertEquals(20, values.size());
    assertTrue(signedArea(values.subList(0, 10)) > 0);
    assertTrue(signedArea(values.subList(10, 20)) < 0);
    assertEquals(9d, signedArea(values.subList(0, 10)), 1e-9);
  }

  @Test
  void rejectsWrongAttributeCountAndAppendsAfterClose() throws Exception {
    VectorLayer layer = adapter.create(dir.resolve("layer.geojson"), "layer", List.of("Name"));
    MultiPolygon empty = factory.createMultiPolygon();

    assertThrows(IllegalArgumentException.class, () -> layer.append(empty, List.of("a", "b")));
    layer.close();
    layer.close();
    assertThrows(IOException.class, () -> layer.append(empty, List.of("a")));
  }

  private static List<Double> numbers(Path path) throws IOException {
    List<Double> values = new ArrayList<>();
    try (JsonParser parser = new JsonFactory().createParser(path.toFile())) {
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        if (token == JsonToken.VALUE_NUMBER_FLOAT || token == JsonToken.VALUE_NUMBER_INT) {
          values.add(parser.getDoubleValue());
        }
      }
    }
    return values;
  }

  /** Shoelace area of a closed ring given as x0, y0, x1, y1, ...; positive when counter-clockwise. */
  private static double signedArea(List<Double> ring) {
    double twice = 0;
    for (int i = 0; i + 3 < ring.size(); i += 2) {
      twice += ring.get(i) * ring.get(i + 3) - ring.get(i + 2) * ring.get(i + 1);
    }
    return twice / 2;
  }
}
