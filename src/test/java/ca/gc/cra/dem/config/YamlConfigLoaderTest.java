package ca.gc.cra.dem.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("dem.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          xcol: 1
        grid:
          datalist: survey.datalist
          inc: 1s
          xcol: 2
        catalog:
          action: dump
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "grid");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("survey.datalist", map.get("datalist"));
    assertEquals("2", map.get("xcol"));
    assertFalse(map.containsKey("action"));
  }

  @Test
  void loadFlattensMethodParameters() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        GRID:
          module: idw
          param:
            power: 3
            radius: 12
          lower:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "grid").orElseThrow();

    assertEquals("3", map.get("param.power"));
    assertEquals("12", map.get("param.radius"));
    assertEquals("", map.get("lower"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "grid").isEmpty());
  }

  @Test
  void emptyDocumentLoadsAsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "catalog").orElseThrow());
  }

  @Test
  void sequencesAreRejected() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, """
        grid:
          datalist:
            - a.datalist
            - b.datalist
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "grid"));
  }

  @Test
  void malformedYamlIsReportedAsInvalidArgument() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "grid: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "grid"));
  }

  @Test
  void scalarSectionIsRejected() throws IOException {
    Path yaml = tempDir.resolve("scalar.yaml");
    Files.writeString(yaml, "grid: 5\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "grid"));
  }
}
