package ca.gc.cra.dem.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void validateWritableDirReturnsCanonicalPathWhenDirectoryExists() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));

    assertEquals(dir.toRealPath(), Paths.validateWritableDir(dir, false));
  }

  @Test
  void validateWritableDirCreatesWhenRequested() {
    Path validated = Paths.validateWritableDir(tempDir.resolve("missing/child"), true);

    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void validateWritableDirAllowsFutureCreationDuringDryRun() {
    Path dir = tempDir.resolve("future/child");

    Path validated = Paths.validateWritableDir(dir, false);

    assertEquals(dir.toAbsolutePath().normalize(), validated);
    assertFalse(Files.exists(dir));
  }

  @Test
  void validateWritableDirRejectsRegularFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("dem.asc"), "x");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, true));
  }

  @Test
  void requireReadableFileRejectsMissingAndDirectories() throws IOException {
    Path file = Files.writeString(tempDir.resolve("dem.asc"), "x");

    assertEquals(file.toAbsolutePath().normalize(), Paths.requireReadableFile("dem", file));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("dem", tempDir.resolve("no.asc")));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("dem", tempDir));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("dem", null));
  }
}
