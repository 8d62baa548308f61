package ca.gc.cra.dem.infrastructure.extent;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dem.domain.extent.Extent;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileExtentCacheAdapterTest {
  @TempDir Path dir;

  private final FileExtentCacheAdapter cache = new FileExtentCacheAdapter();

  @Test
  void sidecarSitsNextToTheSource() {
    assertEquals(dir.resolve("survey.xyz.inf"), FileExtentCacheAdapter.sidecarOf(dir.resolve("survey.xyz")));
  }

  @Test
  void missingSidecarReadsEmpty() throws Exception {
    assertTrue(cache.read(dir.resolve("survey.xyz")).isEmpty());
  }

  @Test
  void writtenExtentReadsBack() throws Exception {
    Path source = dir.resolve("survey.xyz");
    Extent extent = Extent.of(-70.5, -70, 40, 41.25, -12, 3.5);

    cache.write(source, extent);
    cache.write(source, extent);

    assertEquals(extent, cache.read(source).orElseThrow());
    try (Stream<Path> files = Files.list(dir)) {
      assertEquals(1, files.count());
    }
  }

  @Test
  void blankLinesAreSkippedAndGarbageIsReported() throws Exception {
    Path padded = dir.resolve("padded.xyz");
    Files.writeString(FileExtentCacheAdapter.sidecarOf(padded), "\n\n0 1 2 3\n");
    Path broken = dir.resolve("broken.xyz");
    Files.writeString(FileExtentCacheAdapter.sidecarOf(broken), "not an extent\n");

    assertEquals(Extent.of(0, 1, 2, 3), cache.read(padded).orElseThrow());
    assertThrows(IOException.class, () -> cache.read(broken));
  }
}
