package ca.gc.cra.dem.application.pipeline;

import ca.gc.cra.dem.application.catalog.CatalogResolver;
import ca.gc.cra.dem.application.catalog.ExtentCacheService;
import ca.gc.cra.dem.application.grid.GridBinner;
import ca.gc.cra.dem.application.port.MetricsPort;
import ca.gc.cra.dem.application.port.VectorLayerPort;
import ca.gc.cra.dem.application.port.VectorLayerPort.VectorLayer;
import ca.gc.cra.dem.config.SpatialMetadataConfig;
import ca.gc.cra.dem.domain.catalog.CatalogEntry;
import ca.gc.cra.dem.domain.catalog.CatalogException;
import ca.gc.cra.dem.domain.catalog.CatalogRef;
import ca.gc.cra.dem.domain.extent.Extent;
import ca.gc.cra.dem.domain.grid.BinningMode;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.region.ZBounds;
import ca.gc.cra.dem.domain.vector.MaskPolygonizer;
import ca.gc.cra.dem.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.locationtech.jts.geom.MultiPolygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Writes a polygon layer showing where each sub-catalog of a root catalog has data.
 * <p><strong>Role:</strong> Application-layer use case behind the {@code spatial} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>List the sub-catalogs of the root and skip those whose cached extent misses the mask region.</li>
 *   <li>On a worker pool, mask each sub-catalog over the mask grid and polygonize the data cells.</li>
 *   <li>Append one feature per non-empty mask, attributed with the entry's eight metadata values or the
 *   defaults.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One run per instance at a time; workers share only the layer, whose
 * appends are serialized.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code spatial.name}; counts
 * {@code spatial.features.written}.</p>
 *
 * @since 0.1.0
 */
public final class SpatialMetadataUseCase {
  private static final Logger log = LoggerFactory.getLogger(SpatialMetadataUseCase.class);
  private static final Duration DRAIN_TIMEOUT = Duration.ofMinutes(5);

  private final SpatialMetadataConfig config;
  private final CatalogResolver resolver;
  private final ExtentCacheService extents;
  private final GridBinner binner;
  private final VectorLayerPort vectors;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param config run settings
   * @param resolver catalog resolver
   * @param extents extent cache used to skip sub-catalogs outside the region
   * @param binner grid binner producing the masks
   * @param vectors polygon layer factory
   * @param metrics metrics sink
   */
  public SpatialMetadataUseCase(
      SpatialMetadataConfig config,
      CatalogResolver resolver,
      ExtentCacheService extents,
      GridBinner binner,
      VectorLayerPort vectors,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.extents = Objects.requireNonNull(extents, "extents");
    this.binner = Objects.requireNonNull(binner, "binner");
    this.vectors = Objects.requireNonNull(vectors, "vectors");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Runs the spatial metadata pass.
   *
   * @return number of features written
   * @throws IOException when the layer cannot be written
   * @throws InterruptedException when interrupted while waiting for workers
   */
  public long run() throws IOException, InterruptedException {
    MDC.put("spatial.name", config.name());
    try {
      return execute();
    } finally {
      MDC.remove("spatial.name");
    }
  }

  private long execute() throws IOException, InterruptedException {
    Region maskRegion = config.maskRegion();
    GridSpec grid = GridSpec.of(maskRegion, config.cellSize());
    List<CatalogRef> targets = new ArrayList<>();
    for (CatalogEntry child : resolver.children(Path.of(config.datalist()))) {
      if (!(child instanceof CatalogRef ref)) {
        log.debug("Skipping {}; only sub-catalogs are described", child.sourceRef());
      } else if (overlaps(ref, maskRegion)) {
        targets.add(ref);
      }
    }
    log.info("Describing {} sub-catalog(s) of {} on a {}x{} mask", targets.size(), config.datalist(),
        grid.width(), grid.height());

    Files.createDirectories(config.outputDirectory());
    try (VectorLayer layer = vectors.create(config.layerPath(), config.name() + "_sm",
        SpatialMetadataConfig.FIELDS)) {
      ExecutorService pool = ExecutorFactories.newWorkerPool(config.workers(), "dem-spatial", null);
      try {
        List<Future<Boolean>> pending = new ArrayList<>();
        for (CatalogRef ref : targets) {
          pending.add(pool.submit(() -> describe(ref, grid, layer)));
        }
        for (Future<Boolean> future : pending) {
          await(future);
        }
      } finally {
        ExecutorFactories.shutdownAndAwait(pool, DRAIN_TIMEOUT);
      }
      return layer.featureCount();
    }
  }

  private boolean overlaps(CatalogRef ref, Region maskRegion) {
    try {
      if (extents.isOpenEnded(ref)) {
        return true;
      }
      Optional<Extent> extent = extents.extentOf(ref, false);
      if (extent.isEmpty() || !extent.get().overlaps(maskRegion, ZBounds.none())) {
        log.debug("Sub-catalog {} lies outside {}", ref.path(), maskRegion);
        return false;
      }
      return true;
    } catch (CatalogException ex) {
      metrics.increment("catalog.entries.skipped");
      log.warn("Skipping sub-catalog {}: {}", ref.path(), ex.getMessage());
      return false;
    }
  }

  private boolean describe(CatalogRef ref, GridSpec grid, VectorLayer layer) throws IOException {
    String name = entryName(ref.path());
    Raster mask;
    OptionalDouble weight = config.weights() ? OptionalDouble.of(1d) : OptionalDouble.empty();
    try (PointStream points = resolver.resolve(ref, config.queryRegion(), ZBounds.none(), weight)) {
      mask = binner.bin(points, grid, BinningMode.PRESENCE);
    } catch (CatalogException ex) {
      metrics.increment("catalog.entries.skipped");
      log.warn("Skipping sub-catalog {}: {}", ref.path(), ex.getMessage());
      return false;
    }
    MultiPolygon footprint = MaskPolygonizer.polygonize(mask);
    if (footprint.isEmpty()) {
      log.debug("Sub-catalog {} has no data in the mask region", name);
      return false;
    }
    layer.append(footprint, attributes(ref, name));
    metrics.increment("spatial.features.written");
    log.debug("Described {} with {} polygon(s)", name, footprint.getNumGeometries());
    return true;
  }

  /** Entry metadata when it carries a value for every field, otherwise the defaults for {@code name}. */
  static List<String> attributes(CatalogEntry entry, String name) {
    if (entry.metadata().size() == SpatialMetadataConfig.FIELDS.size()) {
      return entry.metadata();
    }
    return SpatialMetadataConfig.defaultAttributes(name);
  }

  static String entryName(Path path) {
    String file = path.getFileName().toString();
    int dot = file.lastIndexOf('.');
    return dot > 0 ? file.substring(0, dot) : file;
  }

  private static void await(Future<Boolean> future) throws IOException, InterruptedException {
    try {
      future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof IOException io) {
        throw io;
      }
      if (cause instanceof UncheckedIOException unchecked) {
        throw unchecked.getCause();
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("spatial metadata worker failed", cause);
    }
  }
}
