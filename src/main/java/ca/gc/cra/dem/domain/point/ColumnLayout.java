package ca.gc.cra.dem.domain.point;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Column positions and header handling for delimited point files.
 *
 * @param xIndex zero-based x column
 * @param yIndex zero-based y column
 * @param zIndex zero-based z column
 * @param skipLines number of header lines to skip
 * @param delimiter forced delimiter; empty means detect from {@link #DETECTION_ORDER}
 * @since 0.1.0
 */
public record ColumnLayout(int xIndex, int yIndex, int zIndex, int skipLines, Optional<String> delimiter) {
  /** Delimiters tried in order against the first data line. */
  public static final List<String> DETECTION_ORDER = List.of(",", " ", "\t", "/", ":");

  public ColumnLayout {
    Objects.requireNonNull(delimiter, "delimiter");
    if (xIndex < 0 || yIndex < 0 || zIndex < 0) {
      throw new IllegalArgumentException("column indices must be >= 0");
    }
    if (xIndex == yIndex || xIndex == zIndex || yIndex == zIndex) {
      throw new IllegalArgumentException("x, y and z columns must differ");
    }
    if (skipLines < 0) {
      throw new IllegalArgumentException("skipLines must be >= 0");
    }
    delimiter.ifPresent(d -> {
      if (d.isEmpty()) {
        throw new IllegalArgumentException("delimiter must not be empty");
      }
    });
  }

  /** Returns the x/y/z layout with no header and delimiter probing. */
  public static ColumnLayout defaults() {
    return new ColumnLayout(0, 1, 2, 0, Optional.empty());
  }

  /** Highest column index the layout reads. */
  public int maxIndex() {
    return Math.max(xIndex, Math.max(yIndex, zIndex));
  }
}
