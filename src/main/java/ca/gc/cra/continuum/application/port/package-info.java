/**
 * Ports through which the audit pipeline reaches the Decision Engine, the remote event store, the license backend,
 * the clock and the metrics exporter.
 */
package ca.gc.cra.continuum.application.port;
