/**
 * Report persistence adapters.
 * <p><strong>Role:</strong> Implements {@link ca.gc.cra.hashmatch.application.port.ReportWriterPort} on the local
 * filesystem using Jackson's streaming generator.</p>
 */
package ca.gc.cra.hashmatch.infrastructure.persistence;
