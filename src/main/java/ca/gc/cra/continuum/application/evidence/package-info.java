/**
 * Evidence record assembly and schema validation.
 */
package ca.gc.cra.continuum.application.evidence;
