package ca.gc.cra.dem.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and required keys.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when a required key is missing
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    // A CLI region replaces the YAML area together with its elevation bounds.
    if (cliCopy.containsKey("region") && !cliCopy.containsKey("lower")) {
      merged.remove("lower");
    }
    if (cliCopy.containsKey("region") && !cliCopy.containsKey("upper")) {
      merged.remove("upper");
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    List<String> required = switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "grid", "spatial" -> List.of("datalist", "region", "inc");
      case "catalog" -> List.of("datalist");
      case "uncertainty" -> List.of("dem", "mask");
      default -> List.of();
    };
    for (String key : required) {
      if (trim(effective.get(key)).isEmpty()) {
        throw new IllegalArgumentException(key + " is required for " + mode);
      }
    }
    boolean src = !trim(effective.get("srcEpsg")).isEmpty();
    boolean dst = !trim(effective.get("dstEpsg")).isEmpty();
    if (src != dst) {
      throw new IllegalArgumentException("srcEpsg and dstEpsg must be given together");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
