/**
 * Command-line entry points of {@code dem}: argument parsing, configuration merge and dispatch to the use
 * cases built by {@link ca.gc.cra.dem.config.CompositionRoot}.
 * <p><strong>Role:</strong> Adapter layer on the driving side; every command returns an {@link
 * ca.gc.cra.dem.api.ExitCode} instead of exiting so it can be tested in-process.</p>
 */
package ca.gc.cra.dem.api;
