/**
 * Application layer: scrubbing, evidence, decisions, license enforcement, metrics, event writing and the
 * use cases that tie them together.
 */
package ca.gc.cra.continuum.application;
