/**
 * Logging helpers: content-free text descriptions and runtime verbosity control.
 */
package ca.gc.cra.continuum.logging;
