package ca.gc.cra.dem.application.catalog;

import ca.gc.cra.dem.application.port.MetricsPort;
import ca.gc.cra.dem.domain.catalog.MalformedRecordException;
import ca.gc.cra.dem.domain.catalog.SourceUnavailableException;
import ca.gc.cra.dem.domain.point.ColumnLayout;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Streams records out of delimited text point files.
 * <p><strong>Why:</strong> Point files come from many tools; the delimiter is detected from the first data
 * line instead of being configured per file.</p>
 * <p><strong>Thread-safety:</strong> The reader is stateless and shareable; each returned stream is
 * single-threaded.</p>
 * <p><strong>Observability:</strong> Unparsable lines are logged at DEBUG and counted as
 * {@code catalog.records.malformed}.</p>
 *
 * @since 0.1.0
 */
public final class PointFileReader {
  private static final Logger log = LoggerFactory.getLogger(PointFileReader.class);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final ColumnLayout layout;
  private final MetricsPort metrics;

  /**
   * Creates a reader.
   *
   * @param layout column layout applied to every file
   * @param metrics metrics sink for malformed lines
   */
  public PointFileReader(ColumnLayout layout, MetricsPort metrics) {
    this.layout = Objects.requireNonNull(layout, "layout");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Opens a point file.
   *
   * @param path point file
   * @param weight weight attached to every record
   * @return lazy stream; the file stays open until the stream is exhausted or closed
   * @throws SourceUnavailableException when the file is missing or unreadable
   */
  public PointStream open(Path path, double weight) {
    Objects.requireNonNull(path, "path");
    BufferedReader reader;
    try {
      reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8));
    } catch (NoSuchFileException ex) {
      throw new SourceUnavailableException(path.toString(), "point file not found: " + path, ex);
    } catch (IOException ex) {
      throw new SourceUnavailableException(path.toString(), "cannot open point file " + path, ex);
    }
    return new DelimitedPointStream(path, reader, weight);
  }

  /**
   * Parses one line with an already chosen delimiter.
   *
   * @param line text line
   * @param delimiter delimiter
   * @param weight weight to attach
   * @param source file name for diagnostics
   * @param lineNumber one-based line number for diagnostics
   * @return parsed record
   * @throws MalformedRecordException when a column is missing or not numeric
   */
  PointRecord parseLine(String line, String delimiter, double weight, String source, long lineNumber) {
    String[] fields = split(line, delimiter);
    if (fields.length <= layout.maxIndex()) {
      throw new MalformedRecordException(source, lineNumber,
          "expected at least " + (layout.maxIndex() + 1) + " fields but found " + fields.length);
    }
    try {
      double x = Double.parseDouble(fields[layout.xIndex()]);
      double y = Double.parseDouble(fields[layout.yIndex()]);
      double z = Double.parseDouble(fields[layout.zIndex()]);
      if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
        throw new MalformedRecordException(source, lineNumber, "non-finite coordinate");
      }
      return new PointRecord(x, y, z, weight);
    } catch (NumberFormatException ex) {
      throw new MalformedRecordException(source, lineNumber, "non-numeric field: " + ex.getMessage());
    }
  }

  /**
   * Picks the first delimiter of {@link ColumnLayout#DETECTION_ORDER} that splits {@code line} into more than
   * one field.
   *
   * @param line first data line
   * @return delimiter, or {@code null} when none applies
   */
  static String detectDelimiter(String line) {
    for (String candidate : ColumnLayout.DETECTION_ORDER) {
      if (split(line, candidate).length > 1) {
        return candidate;
      }
    }
    return null;
  }

  static String[] split(String line, String delimiter) {
    String trimmed = line.strip();
    if (" ".equals(delimiter) || "\t".equals(delimiter)) {
      return trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);
    }
    String[] parts = trimmed.split(Pattern.quote(delimiter), -1);
    for (int i = 0; i < parts.length; i++) {
      parts[i] = parts[i].strip();
    }
    return parts;
  }

  private final class DelimitedPointStream implements PointStream {
    private final Path path;
    private final BufferedReader reader;
    private final double weight;
    private String delimiter;
    private long lineNumber;
    private PointRecord pending;
    private boolean exhausted;
    private boolean closed;

    DelimitedPointStream(Path path, BufferedReader reader, double weight) {
      this.path = path;
      this.reader = reader;
      this.weight = weight;
      this.delimiter = layout.delimiter().orElse(null);
    }

    @Override
    public boolean hasNext() {
      if (pending != null) {
        return true;
      }
      if (exhausted || closed) {
        return false;
      }
      try {
        String line;
        while ((line = reader.readLine()) != null) {
          lineNumber++;
          if (lineNumber <= layout.skipLines() || line.isBlank() || line.startsWith("#")) {
            continue;
          }
          if (delimiter == null) {
            delimiter = detectDelimiter(line);
          }
          try {
            if (delimiter == null) {
              throw new MalformedRecordException(path.toString(), lineNumber, "no known delimiter");
            }
            pending = parseLine(line, delimiter, weight, path.toString(), lineNumber);
            return true;
          } catch (MalformedRecordException ex) {
            metrics.increment("catalog.records.malformed");
            if (log.isDebugEnabled()) {
              log.debug("Skipping line {} of {}: {} ({})", lineNumber, path, ex.getMessage(),
                  Logs.sanitize(line, 120));
            }
          }
        }
      } catch (IOException ex) {
        close();
        throw new SourceUnavailableException(path.toString(),
            "read failed at line " + lineNumber + " of " + path, ex);
      }
      exhausted = true;
      close();
      return false;
    }

    @Override
    public PointRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      PointRecord out = pending;
      pending = null;
      return out;
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      try {
        reader.close();
      } catch (IOException ex) {
        log.warn("Failed to close point file {}", path, ex);
      }
    }
  }
}
