/**
 * Decision Engine client and verdict mapping.
 */
package ca.gc.cra.continuum.infrastructure.engine;
