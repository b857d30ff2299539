/**
 * Validation helpers shared by configuration and CLI parsing.
 */
package ca.gc.cra.continuum.validation;
