package ca.gc.cra.dem.application.uncertainty;

import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.uncertainty.ErrorModel;
import ca.gc.cra.dem.domain.uncertainty.ErrorSample;
import ca.gc.cra.dem.domain.uncertainty.RegionAnalysis;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an uncertainty estimation.
 *
 * @param analysis whole-region statistics
 * @param tileCount tiles the region was split into
 * @param classifiedTiles tiles holding DEM data
 * @param samplingTarget density percent used to size trial samples
 * @param trialsCompleted trials that produced samples
 * @param trialsFailed trials skipped because of a collaborator failure or missing data
 * @param samples error samples kept for fitting
 * @param distanceModel error model against distance to data
 * @param slopeModel error model against slope
 * @param distanceUncertainty distance model applied to the region's proximity raster
 * @param slopeUncertainty slope model applied to the region's slope raster
 * @param combined combined layer when a combine rule is configured
 * @since 0.1.0
 */
public record UncertaintyResult(
    RegionAnalysis analysis,
    int tileCount,
    int classifiedTiles,
    double samplingTarget,
    int trialsCompleted,
    int trialsFailed,
    List<ErrorSample> samples,
    ErrorModel distanceModel,
    ErrorModel slopeModel,
    Raster distanceUncertainty,
    Raster slopeUncertainty,
    Optional<Raster> combined) {

  public UncertaintyResult {
    Objects.requireNonNull(analysis, "analysis");
    samples = List.copyOf(samples);
    Objects.requireNonNull(distanceModel, "distanceModel");
    Objects.requireNonNull(slopeModel, "slopeModel");
    Objects.requireNonNull(distanceUncertainty, "distanceUncertainty");
    Objects.requireNonNull(slopeUncertainty, "slopeUncertainty");
    combined = Objects.requireNonNullElse(combined, Optional.empty());
  }
}
