/**
 * JSON conversion between text and plain map/list object graphs.
 */
package ca.gc.cra.continuum.application.json;
