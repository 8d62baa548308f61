package ca.gc.cra.dem.application.pipeline;

import ca.gc.cra.dem.application.catalog.CatalogResolver;
import ca.gc.cra.dem.application.catalog.ExtentCacheService;
import ca.gc.cra.dem.config.CatalogConfig;
import ca.gc.cra.dem.domain.catalog.CatalogEntry;
import ca.gc.cra.dem.domain.catalog.CatalogLineParser;
import ca.gc.cra.dem.domain.catalog.CatalogRef;
import ca.gc.cra.dem.domain.catalog.FileEntry;
import ca.gc.cra.dem.domain.catalog.UnsupportedFormatException;
import ca.gc.cra.dem.domain.extent.Extent;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Catalog tool: list the entries of a catalog, build its extent caches, or dump its resolved records.
 *
 * <p>Output lines:</p>
 * <ul>
 *   <li>{@code list}: {@code sourceRef kind weight [metadata,...]} per direct child.</li>
 *   <li>{@code inf}: the root extent as {@code xmin xmax ymin ymax [zmin zmax]}.</li>
 *   <li>{@code dump}: {@code x y z} or {@code x y z w} per record.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class CatalogUseCase {
  private static final Logger log = LoggerFactory.getLogger(CatalogUseCase.class);

  private final CatalogConfig config;
  private final CatalogLineParser parser;
  private final CatalogResolver resolver;
  private final ExtentCacheService extents;
  private final boolean overwriteExtents;

  /**
   * Creates the use case.
   *
   * @param config tool settings
   * @param parser catalog line parser used for the root reference
   * @param resolver catalog resolver
   * @param extents extent cache service
   * @param overwriteExtents whether {@code inf} recomputes existing caches
   */
  public CatalogUseCase(
      CatalogConfig config,
      CatalogLineParser parser,
      CatalogResolver resolver,
      ExtentCacheService extents,
      boolean overwriteExtents) {
    this.config = Objects.requireNonNull(config, "config");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.extents = Objects.requireNonNull(extents, "extents");
    this.overwriteExtents = overwriteExtents;
  }

  /**
   * Runs the configured action.
   *
   * @param out destination of the output lines; flushed, not closed
   * @return number of lines written
   * @throws IOException when writing fails
   */
  public long run(Writer out) throws IOException {
    Objects.requireNonNull(out, "out");
    CatalogEntry root = parser.parse(config.datalist(), null)
        .orElseThrow(() -> new UnsupportedFormatException(config.datalist(), "root reference is blank"));
    long lines = switch (config.action()) {
      case LIST -> list(root, out);
      case INF -> inf(root, out);
      case DUMP -> dump(root, out);
    };
    out.flush();
    log.info("catalog {} wrote {} line(s) for {}", config.action().name().toLowerCase(Locale.ROOT),
        lines, config.datalist());
    return lines;
  }

  private long list(CatalogEntry root, Writer out) throws IOException {
    if (!(root instanceof CatalogRef catalog)) {
      throw new UnsupportedFormatException(root.sourceRef(), "list needs a catalog, not " + root.kind());
    }
    List<CatalogEntry> children = resolver.children(catalog.path());
    for (CatalogEntry child : children) {
      out.write(describe(child));
      out.write(System.lineSeparator());
    }
    return children.size();
  }

  static String describe(CatalogEntry entry) {
    StringBuilder line = new StringBuilder(entry.sourceRef())
        .append(' ').append(entry.kind().name().toLowerCase(Locale.ROOT))
        .append(' ').append(entry.weightFactor());
    if (!entry.metadata().isEmpty()) {
      line.append(' ').append(String.join(",", entry.metadata()));
    }
    return line.toString();
  }

  private long inf(CatalogEntry root, Writer out) throws IOException {
    if (!(root instanceof FileEntry file)) {
      throw new UnsupportedFormatException(root.sourceRef(), "remote entries have no extent");
    }
    Optional<Extent> extent = extents.extentOf(file, overwriteExtents);
    if (extent.isEmpty()) {
      log.warn("{} holds no data", root.sourceRef());
      return 0;
    }
    out.write(extent.get().toSidecarLine());
    out.write(System.lineSeparator());
    return 1;
  }

  private long dump(CatalogEntry root, Writer out) throws IOException {
    long count = 0;
    try (PointStream points = resolver.resolve(root, config.region().orElse(null), config.zBounds(),
        config.weightOverride())) {
      while (points.hasNext()) {
        PointRecord p = points.next();
        out.write(p.x() + " " + p.y() + " " + p.z());
        if (config.writeWeights()) {
          out.write(" " + p.weight());
        }
        out.write(System.lineSeparator());
        count++;
      }
    }
    return count;
  }
}
