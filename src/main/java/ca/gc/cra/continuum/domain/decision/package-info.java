/**
 * Decision vocabulary and the Decision Engine verdict as seen by the audit pipeline.
 */
package ca.gc.cra.continuum.domain.decision;
