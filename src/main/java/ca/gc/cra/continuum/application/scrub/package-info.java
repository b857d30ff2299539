/**
 * Content scrubbing: the rule table and the recursive sanitizer that enforces it.
 */
package ca.gc.cra.continuum.application.scrub;
