/**
 * Infrastructure adapters behind the application ports: digests, candidate sources, report persistence, metrics,
 * clocks and executors.
 */
package ca.gc.cra.hashmatch.infrastructure;
