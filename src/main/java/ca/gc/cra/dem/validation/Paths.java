package ca.gc.cra.dem.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for catalog inputs and grid outputs.
 * <p><strong>Why:</strong> A grid run can take a long time; failing on an unreadable root catalog or an
 * unwritable output directory before resolution starts keeps failures cheap.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by filesystem semantics.</p>
 *
 * @since 0.1.0
 * @see Strings
 * @see Numbers
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that a file exists and is readable.
   *
   * @param name logical parameter name used in diagnostics
   * @param path candidate file such as a root catalog
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is missing, a directory, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    ensureClean(path);
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " does not exist or is not a file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates a writable directory, optionally creating it when missing.
   *
   * @param path candidate output directory; must not be {@code null}
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @return canonical directory path when it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is not a writable directory or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    ensureClean(path);
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          return normalized;
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static void ensureClean(Path path) {
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
  }
}
