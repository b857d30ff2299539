/**
 * Request-level use cases: analysis and feedback.
 */
package ca.gc.cra.continuum.application.pipeline;
