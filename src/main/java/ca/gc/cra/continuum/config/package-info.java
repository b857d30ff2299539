/**
 * Configuration loading (defaults, YAML, environment, CLI) and adapter wiring.
 */
package ca.gc.cra.continuum.config;
