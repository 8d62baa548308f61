package ca.gc.cra.dem.domain.uncertainty;

/**
 * Whole-region statistics gathered before tiling.
 *
 * @param cellCount cells in the region
 * @param dataCells cells holding measured data
 * @param densityPercent {@code 100 * dataCells / cellCount}
 * @param proximity90 90th percentile of distance to data, in cells
 * @param proximity95 95th percentile of distance to data, in cells
 * @param proximityTarget configured percentile of distance to data, in cells
 * @since 0.1.0
 */
public record RegionAnalysis(
    int cellCount,
    int dataCells,
    double densityPercent,
    double proximity90,
    double proximity95,
    double proximityTarget) {
}
