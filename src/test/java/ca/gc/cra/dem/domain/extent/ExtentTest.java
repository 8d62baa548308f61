package ca.gc.cra.dem.domain.extent;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.region.ZBounds;
import org.junit.jupiter.api.Test;

class ExtentTest {

  @Test
  void parsesSixValueSidecar() {
    Extent extent = Extent.parseSidecar("0 1 2 3 -4 5\n");

    assertEquals(Extent.of(0, 1, 2, 3, -4, 5), extent);
    assertTrue(extent.hasZRange());
  }

  @Test
  void fifthValueWithoutSixthIsIgnored() {
    Extent extent = Extent.parseSidecar("0 1 2 3 9");

    assertFalse(extent.hasZRange());
    assertEquals(Extent.of(0, 1, 2, 3), extent);
  }

  @Test
  void rejectsShortOrNonNumericSidecars() {
    assertThrows(IllegalArgumentException.class, () -> Extent.parseSidecar("0 1 2"));
    assertThrows(IllegalArgumentException.class, () -> Extent.parseSidecar("0 1 two 3"));
    assertThrows(IllegalArgumentException.class, () -> Extent.parseSidecar(null));
  }

  @Test
  void sidecarLineReparses() {
    Extent extent = Extent.of(-70.5, -70, 40, 41.25, -12, 3.5);

    assertEquals("-70.5 -70 40 41.25 -12 3.5", extent.toSidecarLine());
    assertEquals(extent, Extent.parseSidecar(extent.toSidecarLine()));
  }

  @Test
  void unionKeepsZOnlyWhenBothSidesHaveIt() {
    Extent a = Extent.of(0, 1, 0, 1, -5, 0);
    Extent b = Extent.of(2, 3, -1, 0.5, -2, 4);

    assertEquals(Extent.of(0, 3, -1, 1, -5, 4), a.union(b));
    assertFalse(a.union(Extent.of(2, 3, 0, 1)).hasZRange());
  }

  @Test
  void overlapIsInclusiveAndHonoursElevation() {
    Extent extent = Extent.of(0, 1, 0, 1, -10, -5);

    assertTrue(extent.overlaps(Region.of(1, 2, 1, 2), ZBounds.none()));
    assertFalse(extent.overlaps(Region.of(1.01, 2, 0, 1), ZBounds.none()));
    assertTrue(extent.overlaps(null, ZBounds.of(-6d, null)));
    assertFalse(extent.overlaps(null, ZBounds.of(0d, null)));
    assertTrue(Extent.of(0, 1, 0, 1).overlaps(Region.of(0, 1, 0, 1), ZBounds.of(0d, null)));
  }

  @Test
  void rejectsInvertedBounds() {
    assertThrows(IllegalArgumentException.class, () -> Extent.of(1, 0, 0, 1));
  }
}
