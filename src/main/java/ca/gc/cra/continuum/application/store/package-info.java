/**
 * Best-effort remote persistence of audit events.
 */
package ca.gc.cra.continuum.application.store;
