package ca.gc.cra.dem.domain.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CatalogLineParserTest {
  private final CatalogLineParser parser = new CatalogLineParser(FormatRegistry.defaults());
  private final Path base = Path.of("/data/survey");

  @Test
  void blankAndCommentLinesAreSkipped() {
    assertTrue(parser.parse("", base).isEmpty());
    assertTrue(parser.parse("   ", base).isEmpty());
    assertTrue(parser.parse("# heading", base).isEmpty());
    assertTrue(parser.parse(null, base).isEmpty());
  }

  @Test
  void explicitCodeWeightAndMetadata() {
    CatalogEntry entry = parser.parse("soundings.dat 168 2.5 NOAA, 2019 ,hydro", base).orElseThrow();

    PointEntry points = assertInstanceOf(PointEntry.class, entry);
    assertEquals(Path.of("/data/survey/soundings.dat"), points.path());
    assertEquals(2.5, points.weightFactor(), 1e-12);
    assertEquals(List.of("NOAA", "2019", "hydro"), points.metadata());
  }

  @Test
  void formatIsInferredFromExtension() {
    assertInstanceOf(CatalogRef.class, parser.parse("sub/more.datalist", base).orElseThrow());
    assertInstanceOf(RasterEntry.class, parser.parse("dem.TIF", base).orElseThrow());
    CatalogEntry xyz = parser.parse("/abs/a.xyz", base).orElseThrow();
    assertEquals(Path.of("/abs/a.xyz"), ((PointEntry) xyz).path());
    assertEquals(1d, xyz.weightFactor(), 1e-12);
  }

  @Test
  void remoteEntriesCarrySchemeAndArguments() {
    RemoteEntry byPrefix = assertInstanceOf(RemoteEntry.class,
        parser.parse("gmrt:layer=topo:fmt=xyz", base).orElseThrow());
    assertEquals("gmrt", byPrefix.scheme());
    assertEquals(Map.of("layer", "topo", "fmt", "xyz"), byPrefix.args());

    RemoteEntry byCode = assertInstanceOf(RemoteEntry.class, parser.parse("srtm 404 0.5", base).orElseThrow());
    assertEquals("srtm", byCode.scheme());
    assertEquals(0.5, byCode.weightFactor(), 1e-12);

    RemoteEntry url = assertInstanceOf(RemoteEntry.class,
        parser.parse("https://tiles.example.org/{z}/{x}/{y}.xyz", base).orElseThrow());
    assertEquals("https", url.scheme());
    assertEquals("https://tiles.example.org/{z}/{x}/{y}.xyz", url.args().get("url"));
  }

  @Test
  void malformedLinesRaiseTypedErrors() {
    assertThrows(UnsupportedFormatException.class, () -> parser.parse("notes.docx", base));
    assertThrows(UnsupportedFormatException.class, () -> parser.parse("a.xyz 999", base));
    assertThrows(MalformedRecordException.class, () -> parser.parse("a.xyz 168 heavy", base));
    assertThrows(MalformedRecordException.class, () -> parser.parse("a.xyz 168 0", base));
    assertThrows(MalformedRecordException.class, () -> parser.parse("a.xyz one", base));
  }

  @Test
  void metadataIsBoundedToEightValues() {
    CatalogEntry entry = parser.parse("a.xyz 168 1 a,b,c,d,e,f,g,h,i,j", base).orElseThrow();

    assertEquals(CatalogEntry.MAX_METADATA, entry.metadata().size());
    assertEquals("h", entry.metadata().get(7));
  }
}
