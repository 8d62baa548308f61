package ca.gc.cra.dem.application.pipeline;

import ca.gc.cra.dem.application.catalog.CatalogResolver;
import ca.gc.cra.dem.application.catalog.ExtentCacheService;
import ca.gc.cra.dem.application.catalog.PointFileReader;
import ca.gc.cra.dem.application.catalog.RemoteFetchRegistry;
import ca.gc.cra.dem.application.port.MetricsPort;
import ca.gc.cra.dem.application.port.RasterInfo;
import ca.gc.cra.dem.config.ResolverConfig;
import ca.gc.cra.dem.domain.catalog.CatalogLineParser;
import ca.gc.cra.dem.domain.catalog.FormatRegistry;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.grid.SourceWindow;
import ca.gc.cra.dem.infrastructure.extent.FileExtentCacheAdapter;
import ca.gc.cra.dem.infrastructure.raster.AsciiGridRasterAdapter;
import ca.gc.cra.dem.infrastructure.raster.RasterScanAdapter;
import ca.gc.cra.dem.infrastructure.reprojection.Proj4jTransformAdapter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Catalog stack wired from the file adapters, for pipeline tests working in a temporary directory. */
final class PipelineFixtures {
  final AsciiGridRasterAdapter rasterIo = new AsciiGridRasterAdapter();
  final CatalogLineParser parser = new CatalogLineParser(FormatRegistry.defaults());
  final PointFileReader pointReader;
  final ExtentCacheService extents;
  final CatalogResolver resolver;

  PipelineFixtures(MetricsPort metrics) {
    ResolverConfig config = ResolverConfig.defaults();
    pointReader = new PointFileReader(config.columns(), metrics);
    extents = new ExtentCacheService(new FileExtentCacheAdapter(), rasterIo, pointReader, parser);
    resolver = new CatalogResolver(config, parser, pointReader, extents, new RasterScanAdapter(rasterIo),
        RemoteFetchRegistry.empty(), new Proj4jTransformAdapter(), metrics);
  }

  static Path write(Path path, String... lines) throws IOException {
    Files.createDirectories(path.toAbsolutePath().getParent());
    return Files.write(path, String.join("\n", lines).concat("\n").getBytes(StandardCharsets.UTF_8));
  }

  Raster read(Path path) throws IOException {
    RasterInfo info = rasterIo.open(path);
    return rasterIo.readWindow(path, new SourceWindow(0, 0, info.width(), info.height()));
  }
}
