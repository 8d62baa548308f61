/**
 * Configuration records and composition root wiring for the {@code dem} commands.
 * <p><strong>Role:</strong> Bootstrap layer turning flattened defaults, YAML and CLI settings into immutable
 * run configurations and use case graphs.</p>
 * <p><strong>Concurrency:</strong> Configuration records are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Output names and paths go through {@code ca.gc.cra.dem.validation}.</p>
 */
package ca.gc.cra.dem.config;
