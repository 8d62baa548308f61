/**
 * OpenTelemetry implementation of {@link ca.gc.cra.dem.application.port.MetricsPort}.
 * <p><strong>Metrics:</strong> Counters and histograms are created lazily per metric key.</p>
 */
package ca.gc.cra.dem.infrastructure.metrics;
