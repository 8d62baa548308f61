package ca.gc.cra.dem.domain.catalog;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Parses catalog lines of the form {@code path [formatCode] [weight] [meta1,meta2,...]}.
 *
 * <p>Blank lines and lines starting with {@code #} produce no entry. Relative paths resolve against the
 * directory of the catalog that contains them.</p>
 *
 * @since 0.1.0
 */
public final class CatalogLineParser {
  private final FormatRegistry registry;

  /**
   * Creates a parser.
   *
   * @param registry format lookup tables
   */
  public CatalogLineParser(FormatRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Parses one line.
   *
   * @param line raw catalog line
   * @param baseDirectory directory used to resolve relative paths; may be {@code null} for the working directory
   * @return entry, or empty for blank and comment lines
   * @throws UnsupportedFormatException when the code, extension or scheme is unknown
   * @throws MalformedRecordException when the code or weight column is not numeric or the weight is not positive
   */
  public Optional<CatalogEntry> parse(String line, Path baseDirectory) {
    if (line == null) {
      return Optional.empty();
    }
    String trimmed = line.strip();
    if (trimmed.isEmpty() || trimmed.startsWith("#")) {
      return Optional.empty();
    }
    String[] tokens = trimmed.split("\\s+");
    String ref = tokens[0];

    FormatKind kind;
    Optional<String> impliedScheme = Optional.empty();
    if (tokens.length > 1) {
      int code = parseCode(ref, tokens[1]);
      FormatRegistry.CodeMapping mapping = registry.forCode(code)
          .orElseThrow(() -> new UnsupportedFormatException(ref, "unknown format code " + code));
      kind = mapping.kind();
      impliedScheme = mapping.scheme();
    } else {
      kind = registry.infer(ref)
          .orElseThrow(() -> new UnsupportedFormatException(ref,
              "cannot infer format of '" + ref + "' from its extension or scheme"));
    }

    OptionalDouble weight = tokens.length > 2 ? parseWeight(ref, tokens[2]) : OptionalDouble.empty();
    List<String> metadata = tokens.length > 3
        ? splitMetadata(String.join(" ", Arrays.copyOfRange(tokens, 3, tokens.length)))
        : List.of();

    CatalogEntry entry = switch (kind) {
      case CATALOG -> new CatalogRef(resolve(ref, baseDirectory), weight, metadata);
      case POINTS -> new PointEntry(resolve(ref, baseDirectory), weight, metadata);
      case RASTER -> new RasterEntry(resolve(ref, baseDirectory), weight, metadata);
      case REMOTE -> remote(ref, impliedScheme, weight, metadata);
    };
    return Optional.of(entry);
  }

  private RemoteEntry remote(String ref, Optional<String> impliedScheme, OptionalDouble weight, List<String> metadata) {
    Optional<String> prefix = FormatRegistry.schemeOf(ref);
    String scheme = impliedScheme.orElseGet(() -> prefix
        .orElseThrow(() -> new UnsupportedFormatException(ref, "remote entry has no scheme prefix")));
    Map<String, String> args = new LinkedHashMap<>();
    if (ref.contains("://")) {
      args.put("url", ref);
    } else {
      String body = prefix.filter(scheme::equals).isPresent() ? ref.substring(ref.indexOf(':') + 1) : ref;
      for (String part : body.split(":")) {
        if (part.isBlank()) {
          continue;
        }
        int eq = part.indexOf('=');
        if (eq > 0) {
          args.put(part.substring(0, eq).trim(), part.substring(eq + 1).trim());
        } else if (!part.equals(scheme)) {
          args.put(part.trim(), "");
        }
      }
    }
    return new RemoteEntry(scheme, ref, args, weight, metadata);
  }

  private static Path resolve(String ref, Path baseDirectory) {
    try {
      Path path = Path.of(ref);
      if (!path.isAbsolute() && baseDirectory != null) {
        path = baseDirectory.resolve(path);
      }
      return path.normalize();
    } catch (InvalidPathException ex) {
      throw new MalformedRecordException(ref, -1, "invalid path '" + ref + "': " + ex.getMessage());
    }
  }

  private static int parseCode(String ref, String token) {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException ex) {
      throw new MalformedRecordException(ref, -1, "format code '" + token + "' is not an integer");
    }
  }

  private static OptionalDouble parseWeight(String ref, String token) {
    double value;
    try {
      value = Double.parseDouble(token);
    } catch (NumberFormatException ex) {
      throw new MalformedRecordException(ref, -1, "weight '" + token + "' is not a number");
    }
    if (!(value > 0d) || Double.isInfinite(value)) {
      throw new MalformedRecordException(ref, -1, "weight must be > 0 (was " + token + ")");
    }
    return OptionalDouble.of(value);
  }

  private static List<String> splitMetadata(String raw) {
    List<String> values = new ArrayList<>();
    for (String part : raw.split(",", -1)) {
      values.add(part.trim());
    }
    return values;
  }
}
