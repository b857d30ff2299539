/**
 * Content-free evidence types: fingerprints, evidence records and the events written to the remote store.
 *
 * <p>No type in this package ever holds raw request or response text beyond the lifetime of a call.</p>
 */
package ca.gc.cra.continuum.domain.evidence;
