/**
 * JCA-backed digest adapters.
 */
package ca.gc.cra.hashmatch.infrastructure.digest;
