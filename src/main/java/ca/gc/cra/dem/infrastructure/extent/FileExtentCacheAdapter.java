package ca.gc.cra.dem.infrastructure.extent;

import ca.gc.cra.dem.application.port.ExtentCachePort;
import ca.gc.cra.dem.domain.extent.Extent;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores extents in {@code <source>.inf} sidecars next to each source.
 *
 * <p>Writes go to a temporary sibling first and are moved into place atomically, so a reader never sees a
 * partial line.</p>
 *
 * @since 0.1.0
 */
public final class FileExtentCacheAdapter implements ExtentCachePort {
  /** Sidecar suffix appended to the source file name. */
  public static final String SUFFIX = ".inf";

  @Override
  public Optional<Extent> read(Path source) throws IOException {
    Path sidecar = sidecarOf(source);
    if (!Files.isRegularFile(sidecar)) {
      return Optional.empty();
    }
    List<String> lines = Files.readAllLines(sidecar, StandardCharsets.UTF_8);
    for (String line : lines) {
      if (!line.isBlank()) {
        try {
          return Optional.of(Extent.parseSidecar(line));
        } catch (IllegalArgumentException ex) {
          throw new IOException("corrupt extent sidecar " + sidecar + ": " + ex.getMessage(), ex);
        }
      }
    }
    return Optional.empty();
  }

  @Override
  public void write(Path source, Extent extent) throws IOException {
    Objects.requireNonNull(extent, "extent");
    Path sidecar = sidecarOf(source);
    Path temp = Files.createTempFile(sidecar.toAbsolutePath().getParent(), sidecar.getFileName().toString(), ".tmp");
    try {
      Files.writeString(temp, extent.toSidecarLine() + System.lineSeparator(), StandardCharsets.UTF_8);
      Files.move(temp, sidecar, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  /** Sidecar path of {@code source}. */
  public static Path sidecarOf(Path source) {
    Objects.requireNonNull(source, "source");
    return source.resolveSibling(source.getFileName() + SUFFIX);
  }
}
