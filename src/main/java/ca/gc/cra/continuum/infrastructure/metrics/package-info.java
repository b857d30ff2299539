/**
 * OpenTelemetry export for audit service metrics.
 */
package ca.gc.cra.continuum.infrastructure.metrics;
