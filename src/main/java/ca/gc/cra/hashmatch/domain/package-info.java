/**
 * Core domain model for the HASHMATCH chunk → dispatch → digest → collect pipeline.
 * <p><strong>Role:</strong> Value types without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across worker threads.</p>
 * <p><strong>Security:</strong> Candidates and matches may be secrets; keep them out of INFO logs except for
 * confirmed matches.</p>
 */
package ca.gc.cra.hashmatch.domain;
