/**
 * License validation, the shared status slot, the periodic watchdog and per-request admission.
 */
package ca.gc.cra.continuum.application.license;
