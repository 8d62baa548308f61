package ca.gc.cra.dem.domain.catalog;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Lookup tables from legacy numeric codes, file extensions and remote schemes to a
 * {@link FormatKind}.
 * <p><strong>Why:</strong> Catalog files written for older tooling still carry numeric codes such as
 * {@code 168}; new formats are added by registering an extension instead of a magic number.</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@code with*} methods return modified copies.</p>
 *
 * @since 0.1.0
 */
public final class FormatRegistry {
  /** Resolution of a legacy code: a kind, plus the implied remote scheme for module codes. */
  public record CodeMapping(FormatKind kind, Optional<String> scheme) {
    public CodeMapping {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(scheme, "scheme");
    }
  }

  private static final FormatRegistry DEFAULTS = buildDefaults();

  private final Map<Integer, CodeMapping> codes;
  private final Map<String, FormatKind> extensions;
  private final Set<String> remoteSchemes;

  private FormatRegistry(
      Map<Integer, CodeMapping> codes, Map<String, FormatKind> extensions, Set<String> remoteSchemes) {
    this.codes = Map.copyOf(codes);
    this.extensions = Map.copyOf(extensions);
    this.remoteSchemes = Set.copyOf(remoteSchemes);
  }

  /** Returns the built-in registry. */
  public static FormatRegistry defaults() {
    return DEFAULTS;
  }

  private static FormatRegistry buildDefaults() {
    Map<Integer, CodeMapping> codes = new HashMap<>();
    codes.put(-1, new CodeMapping(FormatKind.CATALOG, Optional.empty()));
    codes.put(168, new CodeMapping(FormatKind.POINTS, Optional.empty()));
    codes.put(200, new CodeMapping(FormatKind.RASTER, Optional.empty()));
    codes.put(400, new CodeMapping(FormatKind.REMOTE, Optional.empty()));
    codes.put(401, new CodeMapping(FormatKind.REMOTE, Optional.of("nos")));
    codes.put(402, new CodeMapping(FormatKind.REMOTE, Optional.of("dc")));
    codes.put(403, new CodeMapping(FormatKind.REMOTE, Optional.of("charts")));
    codes.put(404, new CodeMapping(FormatKind.REMOTE, Optional.of("srtm")));
    codes.put(406, new CodeMapping(FormatKind.REMOTE, Optional.of("mb")));
    codes.put(408, new CodeMapping(FormatKind.REMOTE, Optional.of("gmrt")));

    Map<String, FormatKind> extensions = new HashMap<>();
    for (String ext : new String[] {"datalist", "mb-1"}) {
      extensions.put(ext, FormatKind.CATALOG);
    }
    for (String ext : new String[] {"xyz", "csv", "dat", "ascii", "txt"}) {
      extensions.put(ext, FormatKind.POINTS);
    }
    for (String ext : new String[] {"tif", "tiff", "img", "grd", "nc", "vrt", "bag", "asc"}) {
      extensions.put(ext, FormatKind.RASTER);
    }
    Set<String> schemes = new HashSet<>(Set.of("nos", "dc", "gmrt", "srtm", "charts", "mb", "http", "https"));
    return new FormatRegistry(codes, extensions, schemes);
  }

  /**
   * Returns a copy that treats {@code scheme:} references as remote entries.
   *
   * @param scheme plugin scheme
   * @return extended registry
   */
  public FormatRegistry withRemoteScheme(String scheme) {
    Set<String> copy = new HashSet<>(remoteSchemes);
    copy.add(normalize(scheme));
    return new FormatRegistry(codes, extensions, copy);
  }

  /**
   * Looks up a legacy numeric code.
   *
   * @param code code from the second catalog column
   * @return mapping, or empty when unknown
   */
  public Optional<CodeMapping> forCode(int code) {
    return Optional.ofNullable(codes.get(code));
  }

  /**
   * Looks up a file extension.
   *
   * @param extension extension without the dot, any case
   * @return kind, or empty when unknown
   */
  public Optional<FormatKind> forExtension(String extension) {
    if (extension == null || extension.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(extensions.get(normalize(extension)));
  }

  /**
   * Tests whether a scheme is served by a remote plugin.
   *
   * @param scheme candidate scheme
   * @return {@code true} when registered
   */
  public boolean isRemoteScheme(String scheme) {
    return scheme != null && remoteSchemes.contains(normalize(scheme));
  }

  /**
   * Extracts the scheme prefix of a reference such as {@code nos:datatype=xyz} or {@code https://host/f}.
   *
   * @param sourceRef catalog reference
   * @return lowercase scheme when the prefix is a plausible scheme name
   */
  public static Optional<String> schemeOf(String sourceRef) {
    if (sourceRef == null) {
      return Optional.empty();
    }
    int colon = sourceRef.indexOf(':');
    if (colon <= 1) {
      // "C:" drive letters and empty prefixes are paths
      return Optional.empty();
    }
    String prefix = sourceRef.substring(0, colon);
    for (int i = 0; i < prefix.length(); i++) {
      char c = prefix.charAt(i);
      if (!Character.isLetterOrDigit(c) && c != '+' && c != '-' && c != '.') {
        return Optional.empty();
      }
    }
    return Optional.of(prefix.toLowerCase(Locale.ROOT));
  }

  /**
   * Infers the kind of a reference that carries no numeric code.
   *
   * @param sourceRef catalog reference
   * @return kind when the scheme or extension is known
   */
  public Optional<FormatKind> infer(String sourceRef) {
    Optional<String> scheme = schemeOf(sourceRef);
    if (scheme.isPresent() && isRemoteScheme(scheme.get())) {
      return Optional.of(FormatKind.REMOTE);
    }
    return forExtension(extensionOf(sourceRef));
  }

  /**
   * Returns the text after the last dot of the file name part, or an empty string.
   *
   * @param sourceRef path-like reference
   * @return extension without the dot
   */
  public static String extensionOf(String sourceRef) {
    if (sourceRef == null) {
      return "";
    }
    int slash = Math.max(sourceRef.lastIndexOf('/'), sourceRef.lastIndexOf('\\'));
    String name = sourceRef.substring(slash + 1);
    int dot = name.lastIndexOf('.');
    return dot < 0 || dot == name.length() - 1 ? "" : name.substring(dot + 1);
  }

  private static String normalize(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("format key must not be blank");
    }
    String trimmed = value.trim().toLowerCase(Locale.ROOT);
    return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
  }
}
