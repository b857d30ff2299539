/**
 * In-process analysis metrics: bounded latency window, cumulative counters and snapshots.
 */
package ca.gc.cra.continuum.application.metrics;
