package ca.gc.cra.dem.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.dem.application.catalog.RemoteFetchRegistry;
import ca.gc.cra.dem.application.port.RecordingMetricsPort;
import ca.gc.cra.dem.application.port.RemoteFetchPlugin;
import ca.gc.cra.dem.config.CatalogConfig.Action;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.region.ZBounds;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path dir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void registersBothInterpolationEngines() {
    try (CompositionRoot root = root()) {
      assertEquals(Set.of("idw", "process"), root.engines().keySet());
      assertSame(metrics, root.metrics());
    }
  }

  @Test
  void buildsEveryUseCase() throws Exception {
    Path datalist = Files.writeString(dir.resolve("root.datalist"), "# empty\n");
    Region region = Region.of(0, 1, 0, 1);
    try (CompositionRoot root = root()) {
      GridConfig grid = GridConfig.builder()
          .datalist(datalist.toString())
          .region(region)
          .cellSize(0.1)
          .module(GridModule.IDW)
          .uncertainty(true)
          .outputDirectory(dir)
          .build();
      assertNotNull(root.gridUseCase(grid, UncertaintyConfig.defaults()));
      assertNotNull(root.uncertaintyUseCase(new UncertaintyRunConfig(dir.resolve("dem.asc"),
          dir.resolve("dem_msk.asc"), "dem", dir, "process", Map.of(), null)));
      assertNotNull(root.catalogUseCase(new CatalogConfig(Action.LIST, datalist.toString(), Optional.empty(),
          ZBounds.none(), false, false, Optional.empty())));
      assertNotNull(root.spatialMetadataUseCase(new SpatialMetadataConfig(datalist.toString(), region, 0.1, "dem",
          dir, 0, 0, false, 1)));
    }
  }

  @Test
  void uncertaintyGridNeedsEstimatorKnobs() {
    GridConfig grid = GridConfig.builder()
        .datalist("root.datalist")
        .region(Region.of(0, 1, 0, 1))
        .cellSize(0.1)
        .module(GridModule.IDW)
        .uncertainty(true)
        .build();
    try (CompositionRoot root = root()) {
      assertThrows(NullPointerException.class, () -> root.gridUseCase(grid, null));
    }
  }

  @Test
  void pluginSchemesBecomeRemoteEntries() throws Exception {
    Path datalist = Files.writeString(dir.resolve("root.datalist"), "emodnet:tile=7\n");
    RemoteFetchPlugin plugin = new RemoteFetchPlugin() {
      @Override
      public String scheme() {
        return "emodnet";
      }

      @Override
      public PointStream fetch(Region region, Map<String, String> args) {
        throw new UnsupportedOperationException("listing does not fetch");
      }
    };
    StringWriter out = new StringWriter();
    try (CompositionRoot root = new CompositionRoot(ResolverConfig.defaults(), metrics,
        RemoteFetchRegistry.of(List.of(plugin)))) {
      root.catalogUseCase(new CatalogConfig(Action.LIST, datalist.toString(), Optional.empty(), ZBounds.none(),
          false, false, Optional.empty())).run(out);
    }

    assertEquals("emodnet:tile=7 remote 1.0", out.toString().trim());
  }

  private CompositionRoot root() {
    return new CompositionRoot(ResolverConfig.defaults(), metrics, RemoteFetchRegistry.empty());
  }
}
