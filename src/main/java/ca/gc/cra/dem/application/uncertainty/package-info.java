/**
 * Split-sample interpolation uncertainty: tiling, training selection, trials and power-law fitting.
 * <p><strong>Concurrency:</strong> Trials may run on a worker pool; every trial owns its random source.</p>
 */
package ca.gc.cra.dem.application.uncertainty;
