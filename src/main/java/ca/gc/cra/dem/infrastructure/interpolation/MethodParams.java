package ca.gc.cra.dem.infrastructure.interpolation;

import ca.gc.cra.dem.application.port.ExternalToolFailureException;
import java.util.Map;

/** Typed reads of interpolation method parameters. */
final class MethodParams {
  private final String engine;
  private final Map<String, String> params;

  MethodParams(String engine, Map<String, String> params) {
    this.engine = engine;
    this.params = params == null ? Map.of() : params;
  }

  String text(String key, String defaultValue) {
    String value = params.get(key);
    return value == null || value.isBlank() ? defaultValue : value.trim();
  }

  double number(String key, double defaultValue) throws ExternalToolFailureException {
    String value = text(key, null);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException ex) {
      throw new ExternalToolFailureException(engine + " parameter " + key + " is not a number: '" + value + "'", ex);
    }
  }

  int integer(String key, int defaultValue) throws ExternalToolFailureException {
    String value = text(key, null);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      throw new ExternalToolFailureException(engine + " parameter " + key + " is not an integer: '" + value + "'", ex);
    }
  }

  @Override
  public String toString() {
    return params.toString();
  }
}
