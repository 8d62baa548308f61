package ca.gc.cra.dem.application.uncertainty;

import ca.gc.cra.dem.application.grid.GridBinner;
import ca.gc.cra.dem.application.port.ExternalToolFailureException;
import ca.gc.cra.dem.application.port.InterpolationEngine;
import ca.gc.cra.dem.application.port.MetricsPort;
import ca.gc.cra.dem.application.port.RasterProxyService;
import ca.gc.cra.dem.config.UncertaintyConfig;
import ca.gc.cra.dem.domain.grid.BinningMode;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.grid.SourceWindow;
import ca.gc.cra.dem.domain.grid.Statistics;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.uncertainty.CombineRule;
import ca.gc.cra.dem.domain.uncertainty.ErrorAxis;
import ca.gc.cra.dem.domain.uncertainty.ErrorModel;
import ca.gc.cra.dem.domain.uncertainty.ErrorSample;
import ca.gc.cra.dem.domain.uncertainty.RegionAnalysis;
import ca.gc.cra.dem.domain.uncertainty.TileProfile;
import ca.gc.cra.dem.domain.uncertainty.Zone;
import ca.gc.cra.dem.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Estimates interpolation uncertainty of a DEM by split-sample simulation.
 * <p><strong>Why:</strong> Interpolated cells far from measurements or on steep ground are less reliable;
 * withholding known cells, re-interpolating and comparing gives an empirical error model for both effects.</p>
 * <p><strong>Role:</strong> Application service run by the grid pipeline after the DEM and its mask exist.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Analyze the region, tile it and pick declustered training tiles per elevation zone.</li>
 *   <li>Run split-sample trials through the interpolation engine and proximity/slope service.</li>
 *   <li>Fit power-law error models against distance and slope and apply them to the whole region.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One estimation at a time per instance; trials fan out over a private
 * worker pool when more than one worker is configured.</p>
 * <p><strong>Observability:</strong> Times every {@link UncertaintyPhase} and counts
 * {@code uncertainty.trials.completed} and {@code uncertainty.trials.failed}.</p>
 *
 * @since 0.1.0
 */
public final class UncertaintyEstimator {
  private static final Logger log = LoggerFactory.getLogger(UncertaintyEstimator.class);
  private static final double MIN_PROXIMITY_PERCENTILE = 2d;

  private final UncertaintyConfig config;
  private final InterpolationEngine engine;
  private final RasterProxyService proxy;
  private final GridBinner binner;
  private final MetricsPort metrics;
  private final PowerLawFitter fitter = new PowerLawFitter();
  private final TileClassifier classifier = new TileClassifier();

  /**
   * Creates an estimator.
   *
   * @param config estimator settings
   * @param engine interpolation engine used for trial surfaces
   * @param proxy proximity and slope service
   * @param binner binner used for trial masks
   * @param metrics metrics sink
   */
  public UncertaintyEstimator(
      UncertaintyConfig config,
      InterpolationEngine engine,
      RasterProxyService proxy,
      GridBinner binner,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.proxy = Objects.requireNonNull(proxy, "proxy");
    this.binner = Objects.requireNonNull(binner, "binner");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Runs the estimation.
   *
   * @param dem interpolated surface of the region
   * @param mask presence mask of measured data on the same grid
   * @param methodParams interpolation parameters forwarded to trial runs
   * @return result, or empty when the trials produced too few error samples to fit
   * @throws ExternalToolFailureException when the region-wide proximity or slope cannot be computed
   * @throws InterruptedException when interrupted while waiting for trial workers
   */
  public Optional<UncertaintyResult> estimate(Raster dem, Raster mask, Map<String, String> methodParams)
      throws ExternalToolFailureException, InterruptedException {
    Objects.requireNonNull(dem, "dem");
    Objects.requireNonNull(mask, "mask");
    if (!dem.spec().equals(mask.spec())) {
      throw new IllegalArgumentException("DEM and mask must share one grid");
    }
    Map<String, String> params = methodParams == null ? Map.of() : Map.copyOf(methodParams);
    GridSpec grid = dem.spec();
    Random random = new Random(config.seed());

    long start = System.nanoTime();
    Raster proximity = proxy.proximity(mask);
    Raster slope = proxy.slope(dem);
    RegionAnalysis analysis = analyze(mask, proximity);
    start = phaseDone(UncertaintyPhase.ANALYZE, start);
    log.info("Region {}: {} of {} cells hold data ({}%), target distance {} cells",
        grid.region(), analysis.dataCells(), analysis.cellCount(),
        String.format("%.3f", analysis.densityPercent()), analysis.proximityTarget());

    int tileCells = Math.max(1, (int) (analysis.proximityTarget() * config.chunkLevel()));
    List<Region> tiles = grid.region().tile(grid.cellSize(), tileCells);
    start = phaseDone(UncertaintyPhase.TILE, start);
    log.info("Split region into {} tiles of {} cells", tiles.size(), tileCells);

    List<TileProfile> profiles = classifier.classify(tiles, dem, mask);
    double target = TileClassifier.samplingTarget(profiles);
    start = phaseDone(UncertaintyPhase.CLASSIFY, start);
    log.info("{} tiles hold data; sampling density target {}%", profiles.size(), target);

    Map<Zone, List<TileProfile>> training = new TrainingTileSelector(random).select(profiles);
    start = phaseDone(UncertaintyPhase.SELECT_TRAINING, start);

    List<Trial> trials = new ArrayList<>();
    for (int sim = 0; sim < config.simulations(); sim++) {
      for (List<TileProfile> zoneTiles : training.values()) {
        List<TileProfile> head = zoneTiles.subList(0, Math.min(config.maxTilesPerZone(), zoneTiles.size()));
        for (TileProfile tile : head) {
          long seed = random.nextLong();
          trials.add(() -> runTrial(dem, mask, tile, target, seed, params));
        }
      }
    }
    TrialTally tally = runTrials(trials);
    start = phaseDone(UncertaintyPhase.SIMULATE, start);
    log.info("Split-sample trials finished: {} completed, {} failed, {} raw error samples",
        tally.completed, tally.failed, tally.samples.size());

    List<ErrorSample> kept = new ArrayList<>();
    for (ErrorSample sample : tally.samples) {
      if (sample.distance() < analysis.proximityTarget()) {
        kept.add(sample);
      }
    }
    start = phaseDone(UncertaintyPhase.AGGREGATE, start);

    Optional<ErrorModel> distanceModel = fitter.fit(kept, ErrorAxis.DISTANCE, config.fitInput());
    Optional<ErrorModel> slopeModel = fitter.fit(kept, ErrorAxis.SLOPE, config.fitInput());
    start = phaseDone(UncertaintyPhase.FIT, start);
    if (distanceModel.isEmpty() || slopeModel.isEmpty()) {
      log.warn("Uncertainty estimation gathered {} usable error samples; no model fitted", kept.size());
      return Optional.empty();
    }
    log.info("Distance error model {}; slope error model {}", distanceModel.get(), slopeModel.get());

    Raster distanceUnc = apply(distanceModel.get(), proximity);
    Raster slopeUnc = apply(slopeModel.get(), slope);
    Optional<Raster> combined = config.combineRule() == CombineRule.NONE
        ? Optional.empty()
        : Optional.of(combine(config.combineRule(), distanceUnc, slopeUnc));
    phaseDone(UncertaintyPhase.APPLY, start);

    return Optional.of(new UncertaintyResult(analysis, tiles.size(), profiles.size(), target,
        tally.completed, tally.failed, kept, distanceModel.get(), slopeModel.get(), distanceUnc, slopeUnc,
        combined));
  }

  RegionAnalysis analyze(Raster mask, Raster proximity) {
    int cells = mask.spec().cellCount();
    int dataCells = TileClassifier.dataCells(mask);
    double[] distances = proximity.validValues();
    double p90 = proximityPercentile(distances, 90d);
    double p95 = proximityPercentile(distances, 95d);
    double pTarget = proximityPercentile(distances, config.percentile());
    return new RegionAnalysis(cells, dataCells, 100d * dataCells / cells, p90, p95, pTarget);
  }

  private static double proximityPercentile(double[] distances, double percent) {
    if (distances.length == 0) {
      return MIN_PROXIMITY_PERCENTILE;
    }
    return Math.max(MIN_PROXIMITY_PERCENTILE,
        Statistics.percentile(distances, percent));
  }

  private TrialTally runTrials(List<Trial> trials) throws InterruptedException {
    TrialTally tally = new TrialTally();
    if (config.workers() == 1) {
      for (Trial trial : trials) {
        tally.record(callTrial(trial));
      }
      return tally;
    }
    ExecutorService pool = ExecutorFactories.newWorkerPool(config.workers(), "unc-trial", null);
    try {
      List<Future<List<ErrorSample>>> futures = new ArrayList<>(trials.size());
      for (Trial trial : trials) {
        futures.add(pool.submit(() -> callTrial(trial)));
      }
      for (Future<List<ErrorSample>> future : futures) {
        try {
          tally.record(future.get());
        } catch (ExecutionException ex) {
          throw new IllegalStateException("uncertainty trial crashed", ex.getCause());
        }
      }
    } finally {
      ExecutorFactories.shutdownAndAwait(pool, Duration.ofSeconds(30));
    }
    return tally;
  }

  private static List<ErrorSample> callTrial(Trial trial) {
    try {
      return trial.run();
    } catch (ExternalToolFailureException ex) {
      log.warn("Skipping uncertainty trial: {}", ex.getMessage());
      return null;
    }
  }

  /**
   * Runs one split-sample trial over a tile.
   *
   * @return error samples of the withheld points, or {@code null} when the tile holds no data
   */
  List<ErrorSample> runTrial(Raster dem, Raster mask, TileProfile tile, double samplingTarget, long seed,
      Map<String, String> params) throws ExternalToolFailureException {
    GridSpec grid = dem.spec();
    Region tileRegion = tile.region();
    Region buffered = tileRegion.buffer(config.tileBufferCells() * grid.cellSize(), false);
    SourceWindow window = grid.windowOf(buffered);
    List<PointRecord> inner = new ArrayList<>();
    List<PointRecord> outer = new ArrayList<>();
    for (int row = window.yOffset(); row < window.yOffset() + window.ySize(); row++) {
      for (int col = window.xOffset(); col < window.xOffset() + window.xSize(); col++) {
        double flag = mask.get(col, row);
        double z = dem.get(col, row);
        if (mask.isNoData(flag) || flag == 0d || dem.isNoData(z)) {
          continue;
        }
        PointRecord point = PointRecord.of(grid.centerX(col), grid.centerY(row), z);
        (tileRegion.contains(point.x(), point.y()) ? inner : outer).add(point);
      }
    }
    if (inner.isEmpty()) {
      log.debug("No measured cells inside tile {}", tileRegion);
      return null;
    }
    Collections.shuffle(inner, new Random(seed));
    int sampleCount = tile.densityPercent() < samplingTarget
        ? 1
        : (int) (tile.cellCount() * (samplingTarget / 100d)) + 1;
    sampleCount = Math.min(sampleCount, inner.size());
    List<PointRecord> retained = new ArrayList<>(outer);
    retained.addAll(inner.subList(0, sampleCount));
    List<PointRecord> withheld = inner.subList(sampleCount, inner.size());

    GridSpec trialGrid = GridSpec.of(tileRegion, grid.cellSize(), grid.nodataValue());
    Raster trialDem;
    try (PointStream input = PointStream.of(retained)) {
      trialDem = engine.interpolate(trialGrid, input, params);
    }
    Raster trialMask;
    try (PointStream input = PointStream.of(retained)) {
      trialMask = binner.bin(input, trialGrid, BinningMode.PRESENCE);
    }
    Raster trialProximity = proxy.proximity(trialMask);
    Raster trialSlope = proxy.slope(trialDem);

    List<ErrorSample> samples = new ArrayList<>(withheld.size());
    for (PointRecord point : withheld) {
      OptionalDouble predicted = trialDem.sample(point.x(), point.y());
      OptionalDouble distance = trialProximity.sample(point.x(), point.y());
      OptionalDouble steepness = trialSlope.sample(point.x(), point.y());
      if (predicted.isPresent() && distance.isPresent() && steepness.isPresent()) {
        samples.add(new ErrorSample(point.z() - predicted.getAsDouble(), distance.getAsDouble(),
            steepness.getAsDouble()));
      }
    }
    log.debug("Trial over {} kept {} of {} cells and produced {} samples", tileRegion, retained.size(),
        retained.size() + withheld.size(), samples.size());
    return samples;
  }

  static Raster apply(ErrorModel model, Raster explanatory) {
    Raster out = Raster.empty(explanatory.spec());
    for (int i = 0; i < explanatory.spec().cellCount(); i++) {
      double x = explanatory.getAt(i);
      if (!explanatory.isNoData(x)) {
        out.setAt(i, model.evaluate(x));
      }
    }
    return out;
  }

  static Raster combine(CombineRule rule, Raster distance, Raster slope) {
    Raster out = Raster.empty(distance.spec());
    for (int i = 0; i < distance.spec().cellCount(); i++) {
      double d = distance.getAt(i);
      double s = slope.getAt(i);
      if (!distance.isNoData(d) && !slope.isNoData(s)) {
        out.setAt(i, rule.combine(d, s));
      }
    }
    return out;
  }

  private long phaseDone(UncertaintyPhase phase, long startNanos) {
    long now = System.nanoTime();
    metrics.observe(phase.metricKey(), now - startNanos);
    log.debug("Uncertainty phase {} took {} ms", phase, (now - startNanos) / 1_000_000L);
    return now;
  }

  @FunctionalInterface
  private interface Trial {
    List<ErrorSample> run() throws ExternalToolFailureException;
  }

  private final class TrialTally {
    private final List<ErrorSample> samples = new ArrayList<>();
    private int completed;
    private int failed;

    void record(List<ErrorSample> outcome) {
      if (outcome == null) {
        failed++;
        metrics.increment("uncertainty.trials.failed");
        return;
      }
      completed++;
      metrics.increment("uncertainty.trials.completed");
      samples.addAll(outcome);
    }
  }
}
