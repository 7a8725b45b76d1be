/**
 * File-backed candidate sources.
 */
package ca.gc.cra.hashmatch.infrastructure.source;
