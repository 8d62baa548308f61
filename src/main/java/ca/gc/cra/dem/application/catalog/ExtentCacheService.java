package ca.gc.cra.dem.application.catalog;

import ca.gc.cra.dem.application.port.ExtentCachePort;
import ca.gc.cra.dem.application.port.RasterInfo;
import ca.gc.cra.dem.application.port.RasterIoPort;
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
import ca.gc.cra.dem.domain.extent.Extent;
import ca.gc.cra.dem.domain.extent.ExtentAccumulator;
import ca.gc.cra.dem.domain.grid.GeoTransform;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.grid.SourceWindow;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Lazily computes and persists the extent cache of file entries.
 * <p><strong>Why:</strong> Pruning a catalog entry must not require opening it; the {@code .inf} sidecar is
 * computed once and reused by later runs.</p>
 * <p><strong>Role:</strong> Used by the resolver before it opens an entry and by the catalog {@code inf}
 * command.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use. Sidecar reads and writes for one source are
 * serialized by a per-path lock; the extent itself is computed outside the lock.</p>
 *
 * <p>Caches are only recomputed when {@code overwrite} is requested; a source modified after its sidecar was
 * written keeps its stale extent until then. Within one service instance an overwritten sidecar is not
 * recomputed a second time.</p>
 *
 * <p>A catalog that reaches a remote entry, directly or through sub-catalogs, is open-ended: its cached extent
 * only covers the local files, so it must never be used to prune the catalog.</p>
 *
 * @since 0.1.0
 */
public final class ExtentCacheService {
  private static final Logger log = LoggerFactory.getLogger(ExtentCacheService.class);

  private final ExtentCachePort cache;
  private final RasterIoPort rasterIo;
  private final PointFileReader pointReader;
  private final CatalogLineParser parser;
  private final ConcurrentMap<Path, Object> locks = new ConcurrentHashMap<>();
  private final Set<Path> refreshed = ConcurrentHashMap.newKeySet();
  private final ConcurrentMap<Path, Boolean> openEnded = new ConcurrentHashMap<>();

  /**
   * Creates the service.
   *
   * @param cache sidecar storage
   * @param rasterIo raster header and window reader
   * @param pointReader point file reader used to scan point extents
   * @param parser catalog line parser used to walk sub-catalogs
   */
  public ExtentCacheService(
      ExtentCachePort cache, RasterIoPort rasterIo, PointFileReader pointReader, CatalogLineParser parser) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.rasterIo = Objects.requireNonNull(rasterIo, "rasterIo");
    this.pointReader = Objects.requireNonNull(pointReader, "pointReader");
    this.parser = Objects.requireNonNull(parser, "parser");
  }

  /**
   * Returns the extent of an entry, computing and persisting it when missing.
   *
   * @param entry file entry
   * @param overwrite recompute even when a sidecar exists
   * @return extent, or empty when the entry holds no data
   * @throws SourceUnavailableException when the source is missing or unreadable
   * @throws CatalogCycleException when a sub-catalog references one of its ancestors
   */
  public Optional<Extent> extentOf(FileEntry entry, boolean overwrite) {
    return extentOf(entry, overwrite, new HashSet<>());
  }

  private Optional<Extent> extentOf(FileEntry entry, boolean overwrite, Set<Path> ancestors) {
    Path path = entry.path();
    if (!Files.exists(path)) {
      throw new SourceUnavailableException(path.toString(), "source not found: " + path);
    }
    boolean recompute = overwrite && !refreshed.contains(path);
    if (!recompute) {
      Optional<Extent> cached = readCached(path);
      if (cached.isPresent()) {
        return cached;
      }
    }
    Optional<Extent> computed;
    if (entry instanceof PointEntry points) {
      computed = scanPoints(points);
    } else if (entry instanceof RasterEntry raster) {
      computed = scanRaster(raster);
    } else {
      computed = unionOfChildren((CatalogRef) entry, overwrite, ancestors);
    }
    computed.ifPresent(extent -> store(path, extent));
    if (overwrite) {
      refreshed.add(path);
    }
    return computed;
  }

  /**
   * Tells whether a catalog reaches a remote entry, directly or through nested sub-catalogs.
   *
   * <p>The answer is remembered per catalog for the life of this service.</p>
   *
   * @param catalog catalog entry
   * @return {@code true} when the catalog's coverage is not bounded by its cached extent
   * @throws SourceUnavailableException when the catalog or a nested catalog cannot be read
   * @throws CatalogCycleException when a sub-catalog references one of its ancestors
   */
  public boolean isOpenEnded(CatalogRef catalog) {
    return isOpenEnded(catalog, new HashSet<>());
  }

  private boolean isOpenEnded(CatalogRef catalog, Set<Path> ancestors) {
    Path real = realPath(catalog.path());
    Boolean known = openEnded.get(real);
    if (known != null) {
      return known;
    }
    if (!ancestors.add(real)) {
      throw new CatalogCycleException(catalog.sourceRef(), "catalog " + real + " references itself");
    }
    boolean open = false;
    try (BufferedReader reader = Files.newBufferedReader(real, StandardCharsets.UTF_8)) {
      String line;
      while (!open && (line = reader.readLine()) != null) {
        open = reachesRemote(line, real.getParent(), ancestors);
      }
    } catch (IOException ex) {
      throw new SourceUnavailableException(catalog.sourceRef(), "cannot read catalog " + real, ex);
    } finally {
      ancestors.remove(real);
    }
    openEnded.put(real, open);
    return open;
  }

  private boolean reachesRemote(String line, Path directory, Set<Path> ancestors) {
    try {
      Optional<CatalogEntry> parsed = parser.parse(line, directory);
      if (parsed.isEmpty()) {
        return false;
      }
      if (parsed.get() instanceof RemoteEntry) {
        return true;
      }
      if (parsed.get() instanceof CatalogRef nested && Files.exists(nested.path())) {
        return isOpenEnded(nested, ancestors);
      }
    } catch (CatalogCycleException ex) {
      throw ex;
    } catch (CatalogException ex) {
      log.debug("Child '{}' reaches no remote source: {}", line.strip(), ex.getMessage());
    }
    return false;
  }

  private Optional<Extent> readCached(Path path) {
    synchronized (lockFor(path)) {
      try {
        return cache.read(path);
      } catch (IOException ex) {
        log.warn("Ignoring unreadable extent cache for {}: {}", path, ex.getMessage());
        return Optional.empty();
      }
    }
  }

  private void store(Path path, Extent extent) {
    synchronized (lockFor(path)) {
      try {
        cache.write(path, extent);
      } catch (IOException ex) {
        log.warn("Could not persist extent cache for {}: {}", path, ex.getMessage());
      }
    }
  }

  private Object lockFor(Path path) {
    return locks.computeIfAbsent(path.toAbsolutePath().normalize(), key -> new Object());
  }

  private Optional<Extent> scanPoints(PointEntry entry) {
    ExtentAccumulator accumulator = new ExtentAccumulator();
    try (PointStream stream = pointReader.open(entry.path(), 1d)) {
      while (stream.hasNext()) {
        PointRecord record = stream.next();
        accumulator.add(record.x(), record.y(), record.z());
      }
    }
    log.debug("Scanned {} points for extent of {}", accumulator.count(), entry.path());
    return accumulator.toExtent();
  }

  private Optional<Extent> scanRaster(RasterEntry entry) {
    try {
      RasterInfo info = rasterIo.open(entry.path());
      GeoTransform gt = info.transform();
      double x0 = gt.originX();
      double x1 = gt.originX() + gt.pixelWidth() * info.width();
      double y0 = gt.originY();
      double y1 = gt.originY() + gt.pixelHeight() * info.height();
      Raster data = rasterIo.readWindow(entry.path(), new SourceWindow(0, 0, info.width(), info.height()));
      Optional<double[]> range = data.valueRange();
      if (range.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(Extent.of(Math.min(x0, x1), Math.max(x0, x1), Math.min(y0, y1), Math.max(y0, y1),
          range.get()[0], range.get()[1]));
    } catch (NoSuchFileException ex) {
      throw new SourceUnavailableException(entry.sourceRef(), "raster not found: " + entry.path(), ex);
    } catch (IOException ex) {
      throw new SourceUnavailableException(entry.sourceRef(), "cannot read raster " + entry.path(), ex);
    }
  }

  private Optional<Extent> unionOfChildren(CatalogRef catalog, boolean overwrite, Set<Path> ancestors) {
    Path real = realPath(catalog.path());
    if (!ancestors.add(real)) {
      throw new CatalogCycleException(catalog.sourceRef(), "catalog " + real + " references itself");
    }
    Path directory = real.getParent();
    Extent union = null;
    try (BufferedReader reader = Files.newBufferedReader(real, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        Optional<Extent> child = childExtent(line, directory, overwrite, ancestors);
        if (child.isPresent()) {
          union = union == null ? child.get() : union.union(child.get());
        }
      }
    } catch (IOException ex) {
      throw new SourceUnavailableException(catalog.sourceRef(), "cannot read catalog " + real, ex);
    } finally {
      ancestors.remove(real);
    }
    return Optional.ofNullable(union);
  }

  private Optional<Extent> childExtent(String line, Path directory, boolean overwrite, Set<Path> ancestors) {
    try {
      Optional<CatalogEntry> parsed = parser.parse(line, directory);
      if (parsed.isPresent() && parsed.get() instanceof FileEntry file) {
        return extentOf(file, overwrite, ancestors);
      }
    } catch (CatalogCycleException ex) {
      throw ex;
    } catch (CatalogException ex) {
      log.debug("Child '{}' contributes no extent: {}", line.strip(), ex.getMessage());
    }
    return Optional.empty();
  }

  static Path realPath(Path path) {
    try {
      return path.toRealPath();
    } catch (IOException ex) {
      throw new SourceUnavailableException(path.toString(), "cannot resolve " + path, ex);
    }
  }
}
