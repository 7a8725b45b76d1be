/**
 * Configuration loading, merging and validation plus the composition root.
 * <p><strong>Precedence:</strong> CLI arguments override YAML, which overrides {@link
 * ca.gc.cra.hashmatch.config.DefaultsForMode}.</p>
 * <p><strong>Thread-safety:</strong> Configuration records are immutable.</p>
 */
package ca.gc.cra.hashmatch.config;
