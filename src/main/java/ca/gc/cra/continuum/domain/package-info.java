/**
 * Domain layer of the continuum audit pipeline. Pure values and functions with no I/O.
 */
package ca.gc.cra.continuum.domain;
