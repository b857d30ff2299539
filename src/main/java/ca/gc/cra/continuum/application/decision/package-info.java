/**
 * Decision state normalization.
 */
package ca.gc.cra.continuum.application.decision;
