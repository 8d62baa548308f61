package ca.gc.cra.dem.config;

import ca.gc.cra.dem.application.catalog.CatalogResolver;
import ca.gc.cra.dem.application.catalog.ExtentCacheService;
import ca.gc.cra.dem.application.catalog.PointFileReader;
import ca.gc.cra.dem.application.catalog.RemoteFetchRegistry;
import ca.gc.cra.dem.application.grid.GridBinner;
import ca.gc.cra.dem.application.pipeline.CatalogUseCase;
import ca.gc.cra.dem.application.pipeline.GridUseCase;
import ca.gc.cra.dem.application.pipeline.SpatialMetadataUseCase;
import ca.gc.cra.dem.application.pipeline.UncertaintyUseCase;
import ca.gc.cra.dem.application.port.InterpolationEngine;
import ca.gc.cra.dem.application.port.MetricsPort;
import ca.gc.cra.dem.application.port.RasterIoPort;
import ca.gc.cra.dem.application.uncertainty.UncertaintyEstimator;
import ca.gc.cra.dem.domain.catalog.CatalogLineParser;
import ca.gc.cra.dem.domain.catalog.FormatRegistry;
import ca.gc.cra.dem.infrastructure.extent.FileExtentCacheAdapter;
import ca.gc.cra.dem.infrastructure.interpolation.ExternalProcessGridEngine;
import ca.gc.cra.dem.infrastructure.interpolation.InverseDistanceGridEngine;
import ca.gc.cra.dem.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.dem.infrastructure.proximity.GridProximityAdapter;
import ca.gc.cra.dem.infrastructure.raster.ExtensionRasterIoAdapter;
import ca.gc.cra.dem.infrastructure.raster.RasterScanAdapter;
import ca.gc.cra.dem.infrastructure.reprojection.Proj4jTransformAdapter;
import ca.gc.cra.dem.infrastructure.report.UncertaintyReportWriter;
import ca.gc.cra.dem.infrastructure.vector.GeoJsonLayerAdapter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the DEM use cases to concrete adapters.
 * <p><strong>Role:</strong> Adapter composition root spanning catalog resolution, gridding and output.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the shared catalog stack (parser, point reader, extent cache, resolver) from one
 *   {@link ResolverConfig}.</li>
 *   <li>Register the interpolation engines by name and construct use case graphs per command.</li>
 *   <li>Own the metrics adapter and close it with the root.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI thread; the built use cases document their
 * own concurrency.</p>
 * <p><strong>Observability:</strong> Every adapter that counts or times work shares the root's
 * {@link MetricsPort}.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  /** Extension of rasters written by this build. */
  public static final String RASTER_EXTENSION = "tif";

  private final ResolverConfig resolverConfig;
  private final MetricsPort metrics;
  private final RasterIoPort rasterIo;
  private final CatalogLineParser parser;
  private final ExtentCacheService extents;
  private final CatalogResolver resolver;
  private final GridBinner binner;

  /**
   * Creates a root exporting metrics through OpenTelemetry and discovering remote plugins on the class path.
   *
   * @param resolverConfig catalog resolution settings
   */
  public CompositionRoot(ResolverConfig resolverConfig) {
    this(resolverConfig, new OpenTelemetryMetricsAdapter(), RemoteFetchRegistry.discover());
  }

  /**
   * Creates a root with explicit metrics and remote plugins.
   *
   * @param resolverConfig catalog resolution settings
   * @param metrics metrics sink shared by every adapter
   * @param remotes remote fetch plugins
   */
  public CompositionRoot(ResolverConfig resolverConfig, MetricsPort metrics, RemoteFetchRegistry remotes) {
    this.resolverConfig = Objects.requireNonNull(resolverConfig, "resolverConfig");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(remotes, "remotes");
    this.rasterIo = ExtensionRasterIoAdapter.standard();
    FormatRegistry formats = FormatRegistry.defaults();
    for (String scheme : remotes.schemes()) {
      formats = formats.withRemoteScheme(scheme);
    }
    this.parser = new CatalogLineParser(formats);
    PointFileReader pointReader = new PointFileReader(resolverConfig.columns(), metrics);
    this.extents = new ExtentCacheService(new FileExtentCacheAdapter(), rasterIo, pointReader, parser);
    this.resolver = new CatalogResolver(resolverConfig, parser, pointReader, extents,
        new RasterScanAdapter(rasterIo), remotes, new Proj4jTransformAdapter(), metrics);
    this.binner = new GridBinner(metrics);
    log.debug("Composed catalog stack with remote schemes {}", remotes.schemes());
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /** Interpolation engines keyed by {@link InterpolationEngine#name()}. */
  public Map<String, InterpolationEngine> engines() {
    Map<String, InterpolationEngine> engines = new LinkedHashMap<>();
    register(engines, new InverseDistanceGridEngine());
    register(engines, new ExternalProcessGridEngine(rasterIo, RASTER_EXTENSION));
    return Map.copyOf(engines);
  }

  private static void register(Map<String, InterpolationEngine> target, InterpolationEngine engine) {
    target.put(engine.name(), engine);
  }

  /**
   * Builds the grid use case.
   *
   * @param config grid settings
   * @param estimatorConfig estimator knobs, used when {@code config.uncertainty()} is set
   * @return use case
   */
  public GridUseCase gridUseCase(GridConfig config, UncertaintyConfig estimatorConfig) {
    Objects.requireNonNull(config, "config");
    UncertaintyEstimator estimator = null;
    UncertaintyReportWriter writer = null;
    if (config.uncertainty()) {
      estimator = estimator(estimatorConfig, config.module().engineName());
      writer = reportWriter();
    }
    return new GridUseCase(config, resolver, binner, engines(), rasterIo, RASTER_EXTENSION, estimator, writer,
        metrics);
  }

  /**
   * Builds the standalone uncertainty use case.
   *
   * @param config uncertainty settings
   * @return use case
   */
  public UncertaintyUseCase uncertaintyUseCase(UncertaintyRunConfig config) {
    Objects.requireNonNull(config, "config");
    return new UncertaintyUseCase(config, rasterIo, estimator(config.estimator(), config.engine()),
        reportWriter());
  }

  /**
   * Builds the catalog inspection use case.
   *
   * @param config catalog settings
   * @return use case
   */
  public CatalogUseCase catalogUseCase(CatalogConfig config) {
    return new CatalogUseCase(config, parser, resolver, extents, resolverConfig.overwriteExtentCache());
  }

  /**
   * Builds the spatial metadata use case.
   *
   * @param config spatial metadata settings
   * @return use case
   */
  public SpatialMetadataUseCase spatialMetadataUseCase(SpatialMetadataConfig config) {
    return new SpatialMetadataUseCase(config, resolver, extents, binner, new GeoJsonLayerAdapter(), metrics);
  }

  private UncertaintyEstimator estimator(UncertaintyConfig estimatorConfig, String engineName) {
    InterpolationEngine engine = engines().get(engineName);
    if (engine == null) {
      throw new IllegalArgumentException("no interpolation engine named " + engineName);
    }
    return new UncertaintyEstimator(Objects.requireNonNull(estimatorConfig, "estimatorConfig"), engine,
        new GridProximityAdapter(), binner, metrics);
  }

  private UncertaintyReportWriter reportWriter() {
    return new UncertaintyReportWriter(rasterIo, RASTER_EXTENSION);
  }

  /** Flushes and closes the metrics adapter when it holds resources. */
  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
