/**
 * Command-line entry points and the caller-facing governance API.
 */
package ca.gc.cra.continuum.api;
