package ca.gc.cra.dem.application.uncertainty;

import java.util.Locale;

/**
 * Phases of one uncertainty estimation, in execution order.
 *
 * @since 0.1.0
 */
public enum UncertaintyPhase {
  ANALYZE,
  TILE,
  CLASSIFY,
  SELECT_TRAINING,
  SIMULATE,
  AGGREGATE,
  FIT,
  APPLY;

  /** Histogram key receiving the phase duration in nanoseconds. */
  public String metricKey() {
    return "uncertainty.phase." + name().toLowerCase(Locale.ROOT) + ".nanos";
  }
}
