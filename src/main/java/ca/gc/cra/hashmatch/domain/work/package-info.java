/**
 * Work units exchanged between the chunker, the task channel, and digest workers.
 * <p><strong>Concurrency:</strong> Records are immutable; safe to hand across threads.</p>
 */
package ca.gc.cra.hashmatch.domain.work;
