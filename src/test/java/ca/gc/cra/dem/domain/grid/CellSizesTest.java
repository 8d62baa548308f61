package ca.gc.cra.dem.domain.grid;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class CellSizesTest {

  @Test
  void arcSecondsAndMinutesConvertToDegrees() {
    assertEquals(1d / 3600d, CellSizes.parse("1s"), 1e-15);
    assertEquals(1d / 3600d, CellSizes.parse("1c"), 1e-15);
    assertEquals(0.25d / 60d, CellSizes.parse("0.25m"), 1e-15);
    assertEquals(0.0001d, CellSizes.parse("0.0001"), 1e-15);
  }

  @Test
  void nonPositiveOrGarbageIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> CellSizes.parse("0"));
    assertThrows(IllegalArgumentException.class, () -> CellSizes.parse("-1s"));
    assertThrows(IllegalArgumentException.class, () -> CellSizes.parse("abc"));
    assertThrows(IllegalArgumentException.class, () -> CellSizes.parse(""));
  }
}
