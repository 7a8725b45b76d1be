/**
 * Digest algorithm identifiers, parameters, and the normalized comparison target.
 */
package ca.gc.cra.hashmatch.domain.digest;
