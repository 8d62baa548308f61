package ca.gc.cra.dem.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a map.
 * <p>Leading dashes on a key are dropped, so {@code --inc=1s} and {@code inc=1s} are the same setting.
 * Values keep everything after the first {@code '='}, which lets regions and parameters carry their own
 * separators. Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Converts arguments into a mutable, insertion-ordered map; a repeated key keeps its last value.
   *
   * @param args raw arguments; {@code null} returns an empty map
   * @return mutable map
   * @throws IllegalArgumentException when an argument is not {@code key=value}, the key holds characters
   *     outside {@code [A-Za-z0-9._-]}, or the value holds control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = stripDashes(arg.substring(0, idx).trim());
      String value = arg.substring(idx + 1).trim();
      if (key.isEmpty() || !KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + arg.substring(0, idx));
      }
      if (containsControl(value)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      map.put(key, value);
    }
    return map;
  }

  private static String stripDashes(String key) {
    int start = 0;
    while (start < key.length() && key.charAt(start) == '-') {
      start++;
    }
    return key.substring(start);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
