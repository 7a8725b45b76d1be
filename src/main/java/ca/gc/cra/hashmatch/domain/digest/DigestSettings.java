package ca.gc.cra.hashmatch.domain.digest;

import java.util.Objects;

/**
 * Algorithm choice plus the key-derivation parameters it may need.
 *
 * @param algorithm digest algorithm
 * @param pbkdf2Iterations PBKDF2 iteration count; ignored by unsalted algorithms
 * @param pbkdf2SaltLength PBKDF2 salt length in bytes; ignored by unsalted algorithms
 * @since 0.1.0
 */
public record DigestSettings(HashAlgorithm algorithm, int pbkdf2Iterations, int pbkdf2SaltLength) {
  /** Default PBKDF2 iteration count. */
  public static final int DEFAULT_PBKDF2_ITERATIONS = 100_000;
  /** Default PBKDF2 salt length in bytes. */
  public static final int DEFAULT_PBKDF2_SALT_LENGTH = 32;

  /**
   * Validates parameters.
   *
   * @throws IllegalArgumentException if iteration count or salt length is not positive
   */
  public DigestSettings {
    Objects.requireNonNull(algorithm, "algorithm");
    if (pbkdf2Iterations < 1) {
      throw new IllegalArgumentException("pbkdf2Iterations must be >= 1 (was " + pbkdf2Iterations + ")");
    }
    if (pbkdf2SaltLength < 1) {
      throw new IllegalArgumentException("pbkdf2SaltLength must be >= 1 (was " + pbkdf2SaltLength + ")");
    }
  }

  /**
   * Builds settings for {@code algorithm} with default PBKDF2 parameters.
   *
   * @param algorithm digest algorithm
   * @return settings
   */
  public static DigestSettings of(HashAlgorithm algorithm) {
    return new DigestSettings(algorithm, DEFAULT_PBKDF2_ITERATIONS, DEFAULT_PBKDF2_SALT_LENGTH);
  }
}
