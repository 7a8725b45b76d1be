/**
 * Input validation helpers for configuration values, numbers and filesystem paths.
 * <p><strong>Role:</strong> Shared by the config and CLI layers; every helper throws
 * {@link java.lang.IllegalArgumentException} with the offending key in the message.</p>
 */
package ca.gc.cra.hashmatch.validation;
