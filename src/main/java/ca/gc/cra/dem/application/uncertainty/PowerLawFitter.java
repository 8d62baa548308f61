package ca.gc.cra.dem.application.uncertainty;

import ca.gc.cra.dem.domain.uncertainty.ErrorAxis;
import ca.gc.cra.dem.domain.uncertainty.ErrorModel;
import ca.gc.cra.dem.domain.uncertainty.ErrorSample;
import ca.gc.cra.dem.domain.uncertainty.FitInput;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits {@code error = p0 + p1 * |x|^|p2|} to error samples with Levenberg-Marquardt.
 *
 * <p>With {@link FitInput#BINNED_STD} the explanatory values are histogrammed into at most ten equal-width
 * bins, reducing the bin count until every bin holds at least two samples; the fit then runs over the bin
 * centres against the per-bin standard deviation of the error, with {@code (0, 0)} prepended. With
 * {@link FitInput#RAW} every sample contributes {@code (x, |error|)}.</p>
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class PowerLawFitter {
  private static final Logger log = LoggerFactory.getLogger(PowerLawFitter.class);
  static final int MAX_BINS = 10;
  private static final int MAX_ITERATIONS = 200;
  private static final double TOLERANCE = 1e-12;

  /**
   * Fits the model against one axis of the samples.
   *
   * @param samples error samples
   * @param axis explanatory variable
   * @param input sample reduction
   * @return fitted model, or empty when the samples cannot support a fit
   */
  public Optional<ErrorModel> fit(List<ErrorSample> samples, ErrorAxis axis, FitInput input) {
    Objects.requireNonNull(samples, "samples");
    Objects.requireNonNull(axis, "axis");
    double[][] xy = Objects.requireNonNull(input, "input") == FitInput.RAW
        ? raw(samples, axis)
        : binnedStd(samples, axis);
    if (xy == null || xy[0].length < 2) {
      log.warn("Not enough {} error samples to fit a model ({} usable)", axis.suffix(),
          xy == null ? 0 : xy[0].length);
      return Optional.empty();
    }
    return Optional.of(fit(xy[0], xy[1], ErrorModel.INITIAL_GUESS));
  }

  /**
   * Least-squares fit from an explicit starting point.
   *
   * @param x explanatory values
   * @param y observed values
   * @param guess starting coefficients
   * @return fitted model
   */
  public ErrorModel fit(double[] x, double[] y, ErrorModel guess) {
    if (x.length != y.length) {
      throw new IllegalArgumentException("x and y must have the same length");
    }
    int n = x.length;
    double[] p = guess.toArray();
    double sse = sse(x, y, p);
    double lambda = 1e-3;
    DMatrixRMaj jacobian = new DMatrixRMaj(n, 3);
    DMatrixRMaj residual = new DMatrixRMaj(n, 1);
    DMatrixRMaj normal = new DMatrixRMaj(3, 3);
    DMatrixRMaj gradient = new DMatrixRMaj(3, 1);
    DMatrixRMaj damped = new DMatrixRMaj(3, 3);
    DMatrixRMaj step = new DMatrixRMaj(3, 1);
    for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
      for (int i = 0; i < n; i++) {
        double ax = Math.abs(x[i]);
        double power = Math.pow(ax, Math.abs(p[2]));
        residual.set(i, 0, y[i] - (p[0] + p[1] * power));
        jacobian.set(i, 0, 1d);
        jacobian.set(i, 1, power);
        jacobian.set(i, 2, ax > 0d ? p[1] * power * Math.log(ax) * Math.signum(p[2]) : 0d);
      }
      CommonOps_DDRM.multTransA(jacobian, jacobian, normal);
      CommonOps_DDRM.multTransA(jacobian, residual, gradient);
      boolean improved = false;
      while (lambda < 1e12) {
        damped.setTo(normal);
        for (int d = 0; d < 3; d++) {
          damped.add(d, d, lambda * Math.max(normal.get(d, d), 1e-12));
        }
        if (!CommonOps_DDRM.solve(damped, gradient, step)) {
          lambda *= 10d;
          continue;
        }
        double[] candidate = {p[0] + step.get(0), p[1] + step.get(1), p[2] + step.get(2)};
        double candidateSse = sse(x, y, candidate);
        if (Double.isFinite(candidateSse) && candidateSse <= sse) {
          double gain = sse - candidateSse;
          p = candidate;
          sse = candidateSse;
          lambda = Math.max(lambda / 10d, 1e-12);
          improved = gain > TOLERANCE * Math.max(1d, sse);
          break;
        }
        lambda *= 10d;
      }
      if (!improved) {
        break;
      }
    }
    log.debug("Fitted error model {} {} {} with residual {}", p[0], p[1], p[2], sse);
    return new ErrorModel(p[0], p[1], p[2]);
  }

  static double[][] raw(List<ErrorSample> samples, ErrorAxis axis) {
    double[] x = new double[samples.size()];
    double[] y = new double[samples.size()];
    for (int i = 0; i < samples.size(); i++) {
      x[i] = samples.get(i).value(axis);
      y[i] = Math.abs(samples.get(i).error());
    }
    return new double[][] {x, y};
  }

  /** Returns {@code {binCentres, binStd}} with the origin prepended, or {@code null} when no binning works. */
  static double[][] binnedStd(List<ErrorSample> samples, ErrorAxis axis) {
    if (samples.size() < 2) {
      return null;
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (ErrorSample sample : samples) {
      min = Math.min(min, sample.value(axis));
      max = Math.max(max, sample.value(axis));
    }
    for (int bins = MAX_BINS; bins >= 1; bins--) {
      long[] count = new long[bins];
      double[] sum = new double[bins];
      double[] sumSquares = new double[bins];
      for (ErrorSample sample : samples) {
        int bin = binOf(sample.value(axis), min, max, bins);
        count[bin]++;
        sum[bin] += sample.error();
        sumSquares[bin] += sample.error() * sample.error();
      }
      if (!allAtLeastTwo(count)) {
        continue;
      }
      double width = (max - min) / bins;
      double[] x = new double[bins + 1];
      double[] y = new double[bins + 1];
      for (int b = 0; b < bins; b++) {
        double mean = sum[b] / count[b];
        x[b + 1] = min + (b + .5d) * width;
        y[b + 1] = Math.sqrt(Math.max(0d, sumSquares[b] / count[b] - mean * mean));
      }
      return new double[][] {x, y};
    }
    return null;
  }

  private static int binOf(double value, double min, double max, int bins) {
    if (max <= min) {
      return 0;
    }
    int bin = (int) ((value - min) / (max - min) * bins);
    return Math.min(bins - 1, Math.max(0, bin));
  }

  private static boolean allAtLeastTwo(long[] counts) {
    for (long c : counts) {
      if (c < 2) {
        return false;
      }
    }
    return true;
  }

  private static double sse(double[] x, double[] y, double[] p) {
    double total = 0d;
    for (int i = 0; i < x.length; i++) {
      double r = y[i] - (p[0] + p[1] * Math.pow(Math.abs(x[i]), Math.abs(p[2])));
      total += r * r;
    }
    return total;
  }
}
