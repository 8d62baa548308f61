/**
 * Recursive catalog resolution into one filtered, weighted point stream.
 */
package ca.gc.cra.dem.application.catalog;
