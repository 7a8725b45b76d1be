/**
 * Command-line entry points.
 * <p><strong>Role:</strong> Parses arguments, resolves configuration, maps failures to {@link
 * ca.gc.cra.hashmatch.api.ExitCode}s and prints operator-facing output through {@link
 * ca.gc.cra.hashmatch.api.CliPrinter}.</p>
 */
package ca.gc.cra.hashmatch.api;
