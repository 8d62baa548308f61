package ca.gc.cra.dem.config;

import ca.gc.cra.dem.domain.grid.CellSizes;
import ca.gc.cra.dem.domain.region.Region;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Parsing helpers shared by the {@code fromMap} factories.
 */
final class ConfigValues {
  private ConfigValues() {
    // Utility
  }

  static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  static String firstNonBlank(Map<String, String> options, String... keys) {
    for (String key : keys) {
      String value = options.get(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException("expected a boolean but got '" + value + "'");
    };
  }

  static int parseInt(String key, String value, int defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + value + "')", ex);
    }
  }

  static long parseLong(String key, String value, long defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + value + "')", ex);
    }
  }

  static double parseDouble(String key, String value, double defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was '" + value + "')", ex);
    }
  }

  static OptionalDouble optionalDouble(String key, String value) {
    if (value == null || value.isBlank()) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(parseDouble(key, value, 0d));
  }

  static OptionalInt optionalInt(String key, String value) {
    if (value == null || value.isBlank()) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(parseInt(key, value, 0));
  }

  static Path parsePath(String key, String value) {
    try {
      return Path.of(value.trim()).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + value, ex);
    }
  }

  static Optional<Path> optionalPath(String key, String value) {
    return optionalString(value).map(v -> parsePath(key, v));
  }

  static Optional<Region> optionalRegion(String value) {
    return optionalString(value).map(Region::parse);
  }

  static double parseCellSize(String key, String value, double defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return CellSizes.parse(value);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(key + ": " + ex.getMessage(), ex);
    }
  }
}
