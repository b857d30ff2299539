/**
 * Executor construction helpers.
 */
package ca.gc.cra.continuum.infrastructure.exec;
