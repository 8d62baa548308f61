package ca.gc.cra.dem.domain.extent;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ExtentAccumulatorTest {

  @Test
  void emptyAccumulatorHasNoExtent() {
    assertTrue(new ExtentAccumulator().toExtent().isEmpty());
  }

  @Test
  void tracksMinimumAndMaximum() {
    ExtentAccumulator accumulator = new ExtentAccumulator();
    accumulator.add(1, 5, -3);
    accumulator.add(-2, 7, 4);
    accumulator.add(0, 6, 0);

    assertEquals(3, accumulator.count());
    assertEquals(Extent.of(-2, 1, 5, 7, -3, 4), accumulator.toExtent().orElseThrow());
  }
}
