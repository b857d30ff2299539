/**
 * License backends: configuration-declared grants and an HTTP licensing service.
 */
package ca.gc.cra.continuum.infrastructure.license;
