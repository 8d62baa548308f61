/**
 * Executor factories for uncertainty trial and spatial metadata worker pools.
 * <p><strong>Concurrency:</strong> Factory methods are thread-safe and return caller-owned executors.</p>
 * <p><strong>Performance:</strong> Worker threads are named per pool for thread dumps.</p>
 */
package ca.gc.cra.dem.infrastructure.exec;
