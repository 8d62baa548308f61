package ca.gc.cra.dem.application.uncertainty;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dem.domain.uncertainty.ErrorAxis;
import ca.gc.cra.dem.domain.uncertainty.ErrorModel;
import ca.gc.cra.dem.domain.uncertainty.ErrorSample;
import ca.gc.cra.dem.domain.uncertainty.FitInput;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PowerLawFitterTest {
  private final PowerLawFitter fitter = new PowerLawFitter();

  @Test
  void recoversKnownCoefficients() {
    ErrorModel truth = new ErrorModel(1d, 0.5d, 1.5d);
    double[] x = new double[20];
    double[] y = new double[20];
    for (int i = 0; i < x.length; i++) {
      x[i] = i + 1;
      y[i] = truth.evaluate(x[i]);
    }

    ErrorModel fitted = fitter.fit(x, y, ErrorModel.INITIAL_GUESS);

    for (int i = 0; i < x.length; i++) {
      assertEquals(y[i], fitted.evaluate(x[i]), 1e-2 * Math.max(1d, y[i]));
    }
    assertEquals(1d, fitted.p0(), 1e-3);
    assertEquals(0.5d, fitted.p1(), 1e-3);
    assertEquals(1.5d, Math.abs(fitted.p2()), 1e-3);
  }

  @Test
  void binnedInputUsesAtMostTenBinsWithOriginPrepended() {
    List<ErrorSample> samples = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      samples.add(new ErrorSample(i % 2 == 0 ? 1 : -1, i, 0));
    }

    double[][] xy = PowerLawFitter.binnedStd(samples, ErrorAxis.DISTANCE);

    assertEquals(PowerLawFitter.MAX_BINS + 1, xy[0].length);
    assertEquals(0d, xy[0][0]);
    assertEquals(0d, xy[1][0]);
    assertEquals(1d, xy[1][1], 1e-12);
  }

  @Test
  void binCountShrinksUntilEveryBinHasTwoSamples() {
    List<ErrorSample> samples = List.of(
        new ErrorSample(1, 0, 0), new ErrorSample(2, 0.1, 0), new ErrorSample(3, 10, 0));

    double[][] xy = PowerLawFitter.binnedStd(samples, ErrorAxis.DISTANCE);

    assertEquals(2, xy[0].length);
    assertNull(PowerLawFitter.binnedStd(List.of(new ErrorSample(1, 1, 1)), ErrorAxis.DISTANCE));
  }

  @Test
  void rawInputUsesAbsoluteErrors() {
    double[][] xy = PowerLawFitter.raw(List.of(new ErrorSample(-3, 1, 7)), ErrorAxis.SLOPE);

    assertEquals(7d, xy[0][0]);
    assertEquals(3d, xy[1][0]);
  }

  @Test
  void tooFewSamplesYieldNoModel() {
    assertTrue(fitter.fit(List.of(), ErrorAxis.DISTANCE, FitInput.BINNED_STD).isEmpty());
    assertTrue(fitter.fit(List.of(new ErrorSample(1, 1, 1)), ErrorAxis.SLOPE, FitInput.RAW).isEmpty());
  }
}
