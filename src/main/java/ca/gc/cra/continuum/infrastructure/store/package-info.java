/**
 * Event store adapters: GitHub contents API, Kafka topic and local directory.
 */
package ca.gc.cra.continuum.infrastructure.store;
