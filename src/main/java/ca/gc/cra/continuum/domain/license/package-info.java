/**
 * License entitlement values exchanged between the validator, the watchdog and request admission.
 */
package ca.gc.cra.continuum.domain.license;
