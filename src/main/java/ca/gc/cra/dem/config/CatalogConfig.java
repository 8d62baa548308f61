package ca.gc.cra.dem.config;

import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.region.ZBounds;
import ca.gc.cra.dem.validation.Strings;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Settings of the catalog tool.
 *
 * @param action what the tool does with the catalog
 * @param datalist root catalog reference
 * @param region optional query region
 * @param zBounds elevation filter
 * @param weights whether catalog weights are applied (root weight {@code 1})
 * @param writeWeights whether dumped records carry a fourth weight column
 * @param output dump destination; empty writes to standard output
 * @since 0.1.0
 */
public record CatalogConfig(
    Action action,
    String datalist,
    Optional<Region> region,
    ZBounds zBounds,
    boolean weights,
    boolean writeWeights,
    Optional<Path> output) {

  /** Catalog tool actions. */
  public enum Action {
    /** Print the entries of the root catalog. */
    LIST,
    /** Build or refresh extent caches and print the root extent. */
    INF,
    /** Print every resolved record. */
    DUMP;

    public static Action parse(String value) {
      if (value == null || value.isBlank()) {
        return LIST;
      }
      try {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("unknown catalog action '" + value.trim() + "' (expected list, inf or dump)", ex);
      }
    }
  }

  public CatalogConfig {
    action = Objects.requireNonNullElse(action, Action.LIST);
    datalist = Strings.requireNonBlank("datalist", datalist);
    region = Objects.requireNonNullElse(region, Optional.empty());
    region.ifPresent(r -> r.requireValid("region"));
    zBounds = Objects.requireNonNullElse(zBounds, ZBounds.none());
    output = Objects.requireNonNullElse(output, Optional.empty());
  }

  public OptionalDouble weightOverride() {
    return weights ? OptionalDouble.of(1d) : OptionalDouble.empty();
  }

  /**
   * Reads {@code action}, {@code datalist}, {@code region}, {@code lower}, {@code upper}, {@code weights},
   * {@code dumpWeights} and {@code out}.
   *
   * @param options flattened configuration
   * @return catalog tool configuration
   */
  public static CatalogConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    OptionalDouble lower = ConfigValues.optionalDouble("lower", options.get("lower"));
    OptionalDouble upper = ConfigValues.optionalDouble("upper", options.get("upper"));
    return new CatalogConfig(
        Action.parse(options.get("action")),
        options.get("datalist"),
        ConfigValues.optionalRegion(options.get("region")),
        ZBounds.of(lower.isPresent() ? lower.getAsDouble() : null, upper.isPresent() ? upper.getAsDouble() : null),
        ConfigValues.parseBoolean(options.get("weights"), false),
        ConfigValues.parseBoolean(options.get("dumpWeights"), false),
        ConfigValues.optionalPath("out", options.get("out")));
  }
}
