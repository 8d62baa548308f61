package ca.gc.cra.dem.application.catalog;

import ca.gc.cra.dem.application.port.CoordinateTransformPort;
import ca.gc.cra.dem.application.port.MetricsPort;
import ca.gc.cra.dem.application.port.RasterScanPort;
import ca.gc.cra.dem.application.port.RemoteFetchPlugin;
import ca.gc.cra.dem.config.ResolverConfig;
import ca.gc.cra.dem.domain.catalog.CatalogCycleException;
import ca.gc.cra.dem.domain.catalog.CatalogEntry;
import ca.gc.cra.dem.domain.catalog.CatalogException;
import ca.gc.cra.dem.domain.catalog.CatalogLineParser;
import ca.gc.cra.dem.domain.catalog.CatalogRef;
import ca.gc.cra.dem.domain.catalog.FileEntry;
import ca.gc.cra.dem.domain.catalog.PointEntry;
import ca.gc.cra.dem.domain.catalog.RasterEntry;
import ca.gc.cra.dem.domain.catalog.RemoteEntry;
import ca.gc.cra.dem.domain.catalog.SourceUnavailableException;
import ca.gc.cra.dem.domain.catalog.UnsupportedFormatException;
import ca.gc.cra.dem.domain.catalog.WeightPropagation;
import ca.gc.cra.dem.domain.extent.Extent;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.region.ZBounds;
import ca.gc.cra.dem.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves a catalog tree into one lazy stream of filtered, weighted point records.
 * <p><strong>Why:</strong> Elevation compilations reference thousands of heterogeneous sources through nested
 * catalogs; consumers should see a flat record stream regardless of nesting.</p>
 * <p><strong>Role:</strong> Application service feeding the grid binner, interpolation engines and the
 * catalog dump command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Walk catalogs depth-first, keeping only the ancestor catalog readers and one data source open.</li>
 *   <li>Prune entries whose cached extent misses the query region or elevation bounds.</li>
 *   <li>Dispatch point files, raster scans and remote fetches, and attach weights.</li>
 *   <li>Skip unavailable or unsupported entries with a warning; abort on catalog cycles.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The resolver is shareable; each returned stream is single-threaded and
 * must be closed by its consumer.</p>
 * <p><strong>Observability:</strong> Counts {@code catalog.entries.pruned} and {@code catalog.entries.skipped};
 * observes {@code catalog.records.emitted} when a stream closes.</p>
 *
 * @since 0.1.0
 */
public final class CatalogResolver {
  private static final Logger log = LoggerFactory.getLogger(CatalogResolver.class);

  private final ResolverConfig config;
  private final CatalogLineParser parser;
  private final PointFileReader pointReader;
  private final ExtentCacheService extents;
  private final RasterScanPort rasterScan;
  private final RemoteFetchRegistry remotes;
  private final CoordinateTransformPort transforms;
  private final MetricsPort metrics;

  /**
   * Creates a resolver.
   *
   * @param config resolver settings
   * @param parser catalog line parser
   * @param pointReader point file reader
   * @param extents extent cache service used for pruning
   * @param rasterScan raster scan collaborator
   * @param remotes remote fetch plugins
   * @param transforms coordinate reprojection collaborator
   * @param metrics metrics sink
   */
  public CatalogResolver(
      ResolverConfig config,
      CatalogLineParser parser,
      PointFileReader pointReader,
      ExtentCacheService extents,
      RasterScanPort rasterScan,
      RemoteFetchRegistry remotes,
      CoordinateTransformPort transforms,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.pointReader = Objects.requireNonNull(pointReader, "pointReader");
    this.extents = Objects.requireNonNull(extents, "extents");
    this.rasterScan = Objects.requireNonNull(rasterScan, "rasterScan");
    this.remotes = Objects.requireNonNull(remotes, "remotes");
    this.transforms = Objects.requireNonNull(transforms, "transforms");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    if (config.reprojects()
        && !transforms.supports(config.sourceEpsg().getAsInt(), config.targetEpsg().getAsInt())) {
      throw new IllegalArgumentException("no coordinate transform from EPSG:" + config.sourceEpsg().getAsInt()
          + " to EPSG:" + config.targetEpsg().getAsInt());
    }
  }

  /**
   * Resolves a root reference without filters or weight override.
   *
   * @param rootRef catalog line describing the root, usually a catalog path
   * @return lazy stream of every record in the tree
   */
  public PointStream resolve(String rootRef) {
    return resolve(rootRef, null, ZBounds.none(), OptionalDouble.empty());
  }

  /**
   * Resolves a root reference.
   *
   * @param rootRef catalog line describing the root, usually a catalog path
   * @param region query region; {@code null} disables horizontal filtering and pruning
   * @param zBounds elevation filter
   * @param weightOverride override weight; when present it multiplies down the tree according to
   *     {@link ResolverConfig#weightPropagation()}
   * @return lazy stream; close it to release open sources
   * @throws UnsupportedFormatException when the root reference itself has an unknown format
   * @throws ca.gc.cra.dem.domain.catalog.MalformedRecordException when the root reference cannot be parsed
   */
  public PointStream resolve(String rootRef, Region region, ZBounds zBounds, OptionalDouble weightOverride) {
    Objects.requireNonNull(rootRef, "rootRef");
    CatalogEntry root = parser.parse(rootRef, null)
        .orElseThrow(() -> new UnsupportedFormatException(rootRef, "root reference is blank or a comment"));
    return resolve(root, region, zBounds, weightOverride);
  }

  /**
   * Resolves an already parsed entry.
   *
   * @param root root entry
   * @param region query region; {@code null} disables horizontal filtering and pruning
   * @param zBounds elevation filter
   * @param weightOverride optional override weight
   * @return lazy stream; close it to release open sources
   */
  public PointStream resolve(CatalogEntry root, Region region, ZBounds zBounds, OptionalDouble weightOverride) {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(weightOverride, "weightOverride");
    return new ResolvingStream(root, region, zBounds == null ? ZBounds.none() : zBounds, weightOverride);
  }

  /**
   * Reads the direct children of a catalog without resolving them.
   *
   * @param catalog catalog file
   * @return parsed child entries in file order; unparsable lines are logged and skipped
   * @throws SourceUnavailableException when the catalog cannot be read
   */
  public List<CatalogEntry> children(Path catalog) {
    Path real = ExtentCacheService.realPath(catalog);
    List<CatalogEntry> entries = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(real, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        try {
          parser.parse(line, real.getParent()).ifPresent(entries::add);
        } catch (CatalogException ex) {
          skipped("entry '" + Logs.sanitize(line.strip(), 200) + "' of " + real, ex);
        }
      }
    } catch (IOException ex) {
      throw new SourceUnavailableException(catalog.toString(), "cannot read catalog " + catalog, ex);
    }
    return entries;
  }

  private void skipped(String what, CatalogException ex) {
    metrics.increment("catalog.entries.skipped");
    log.warn("Skipping {}: {}", what, ex.getMessage());
  }

  private static double leafWeight(CatalogEntry entry, OptionalDouble inherited) {
    double own = entry.weightFactor();
    return inherited.isPresent() ? inherited.getAsDouble() * own : own;
  }

  private OptionalDouble childInherited(CatalogEntry catalog, OptionalDouble inherited) {
    if (inherited.isEmpty()) {
      return inherited;
    }
    if (config.weightPropagation() == WeightPropagation.COMPOUND) {
      return OptionalDouble.of(inherited.getAsDouble() * catalog.weightFactor());
    }
    return inherited;
  }

  /** One open catalog along the current ancestor chain. */
  private static final class CatalogFrame {
    final Path realPath;
    final BufferedReader reader;
    final OptionalDouble inherited;

    CatalogFrame(Path realPath, BufferedReader reader, OptionalDouble inherited) {
      this.realPath = realPath;
      this.reader = reader;
      this.inherited = inherited;
    }

    void close() {
      try {
        reader.close();
      } catch (IOException ex) {
        log.warn("Failed to close catalog {}", realPath, ex);
      }
    }
  }

  private final class ResolvingStream implements PointStream {
    private final Region region;
    private final ZBounds zBounds;
    private final Deque<CatalogFrame> frames = new ArrayDeque<>();
    private CatalogEntry rootEntry;
    private OptionalDouble rootInherited;
    private PointStream current;
    private PointRecord pending;
    private long emitted;
    private boolean closed;

    ResolvingStream(CatalogEntry root, Region region, ZBounds zBounds, OptionalDouble weightOverride) {
      this.region = region;
      this.zBounds = zBounds;
      this.rootEntry = root;
      this.rootInherited = weightOverride;
    }

    @Override
    public boolean hasNext() {
      if (pending != null) {
        return true;
      }
      if (closed) {
        return false;
      }
      pending = advance();
      if (pending == null) {
        close();
        return false;
      }
      emitted++;
      return true;
    }

    @Override
    public PointRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      PointRecord out = pending;
      pending = null;
      return out;
    }

    private PointRecord advance() {
      while (true) {
        if (current != null) {
          PointRecord record = pullCurrent();
          if (record != null) {
            return record;
          }
          continue;
        }
        if (rootEntry != null) {
          CatalogEntry entry = rootEntry;
          rootEntry = null;
          dispatch(entry, rootInherited);
          continue;
        }
        CatalogFrame frame = frames.peek();
        if (frame == null) {
          return null;
        }
        String line;
        try {
          line = frame.reader.readLine();
        } catch (IOException ex) {
          skipped("rest of catalog " + frame.realPath,
              new SourceUnavailableException(frame.realPath.toString(), ex.getMessage(), ex));
          line = null;
        }
        if (line == null) {
          frames.pop().close();
          continue;
        }
        Optional<CatalogEntry> child;
        try {
          child = parser.parse(line, frame.realPath.getParent());
        } catch (CatalogException ex) {
          skipped("entry '" + Logs.sanitize(line.strip(), 200) + "' of " + frame.realPath, ex);
          continue;
        }
        child.ifPresent(entry -> dispatch(entry, frame.inherited));
      }
    }

    private PointRecord pullCurrent() {
      try {
        if (current.hasNext()) {
          return current.next();
        }
      } catch (CatalogException ex) {
        skipped("remaining records of source", ex);
      }
      current.close();
      current = null;
      return null;
    }

    private void dispatch(CatalogEntry entry, OptionalDouble inherited) {
      try {
        if (entry instanceof FileEntry file && isPruned(file)) {
          metrics.increment("catalog.entries.pruned");
          log.debug("Pruned {}: cached extent misses the query", file.path());
          return;
        }
        if (entry instanceof CatalogRef catalog) {
          openCatalog(catalog, childInherited(catalog, inherited));
        } else if (entry instanceof PointEntry points) {
          current = filtered(reprojected(pointReader.open(points.path(), leafWeight(points, inherited))));
        } else if (entry instanceof RasterEntry raster) {
          current = openRaster(raster, leafWeight(raster, inherited));
        } else if (entry instanceof RemoteEntry remote) {
          current = openRemote(remote, leafWeight(remote, inherited));
        }
      } catch (CatalogCycleException ex) {
        throw ex;
      } catch (CatalogException ex) {
        skipped("entry " + entry.sourceRef(), ex);
      }
    }

    private boolean isPruned(FileEntry entry) {
      if ((region == null && zBounds.isUnbounded()) || config.reprojects()) {
        return false;
      }
      if (entry instanceof CatalogRef catalog && extents.isOpenEnded(catalog)) {
        return false;
      }
      Optional<Extent> extent = extents.extentOf(entry, config.overwriteExtentCache());
      return extent.isPresent() && !extent.get().overlaps(region, zBounds);
    }

    private void openCatalog(CatalogRef catalog, OptionalDouble inherited) {
      Path real = ExtentCacheService.realPath(catalog.path());
      for (CatalogFrame frame : frames) {
        if (frame.realPath.equals(real)) {
          throw new CatalogCycleException(catalog.sourceRef(),
              "catalog " + real + " is already being resolved by an ancestor");
        }
      }
      try {
        BufferedReader reader = Files.newBufferedReader(real, StandardCharsets.UTF_8);
        frames.push(new CatalogFrame(real, reader, inherited));
        log.debug("Entering catalog {} at depth {}", real, frames.size());
      } catch (IOException ex) {
        throw new SourceUnavailableException(catalog.sourceRef(), "cannot open catalog " + real, ex);
      }
    }

    private PointStream openRaster(RasterEntry raster, double weight) {
      try {
        return rasterScan.scan(raster, region, zBounds).map(record -> record.withWeight(weight));
      } catch (IOException ex) {
        throw new SourceUnavailableException(raster.sourceRef(), "cannot scan raster " + raster.path(), ex);
      }
    }

    private PointStream openRemote(RemoteEntry remote, double weight) {
      RemoteFetchPlugin plugin = remotes.find(remote.scheme())
          .orElseThrow(() -> new UnsupportedFormatException(remote.sourceRef(),
              "no fetch plugin registered for scheme '" + remote.scheme() + "'"));
      Region query = region == null ? null : region.buffer(config.remotePaddingPercent(), true);
      try {
        PointStream fetched = plugin.fetch(query, remote.args()).map(record -> record.withWeight(weight));
        return filtered(reprojected(fetched));
      } catch (IOException ex) {
        throw new SourceUnavailableException(remote.sourceRef(), "remote fetch failed: " + ex.getMessage(), ex);
      }
    }

    private PointStream reprojected(PointStream stream) {
      if (!config.reprojects()) {
        return stream;
      }
      int src = config.sourceEpsg().getAsInt();
      int dst = config.targetEpsg().getAsInt();
      return stream.map(record -> {
        double[] xy = transforms.transform(record.x(), record.y(), src, dst);
        return record.withXy(xy[0], xy[1]);
      });
    }

    private PointStream filtered(PointStream stream) {
      if (region == null && zBounds.isUnbounded()) {
        return stream;
      }
      return stream.filter(record ->
          (region == null || region.contains(record.x(), record.y())) && zBounds.accepts(record.z()));
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      if (current != null) {
        current.close();
        current = null;
      }
      while (!frames.isEmpty()) {
        frames.pop().close();
      }
      metrics.observe("catalog.records.emitted", emitted);
      log.debug("Resolution finished after {} records", emitted);
    }
  }
}
