/**
 * Catalog entry model: datalist line parsing, data formats and weight propagation.
 */
package ca.gc.cra.dem.domain.catalog;
