package ca.gc.cra.hashmatch.domain.digest;

import java.util.Locale;

/**
 * <strong>What:</strong> Digest algorithms accepted by the matching pipeline.
 * <p><strong>Role:</strong> Configuration enum; its name is written verbatim into match reports.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum HashAlgorithm {
  /** SHA-256 over the UTF-8 bytes of the candidate. */
  SHA256("SHA-256", false),
  /** SHA-384 over the UTF-8 bytes of the candidate. */
  SHA384("SHA-384", false),
  /** SHA-512 over the UTF-8 bytes of the candidate. */
  SHA512("SHA-512", false),
  /** PBKDF2 with HMAC-SHA256; salted and iterated. */
  PBKDF2("PBKDF2WithHmacSHA256", true);

  private final String jcaName;
  private final boolean salted;

  HashAlgorithm(String jcaName, boolean salted) {
    this.jcaName = jcaName;
    this.salted = salted;
  }

  /**
   * Returns the JCA algorithm name used to obtain the provider implementation.
   *
   * @return JCA name such as {@code SHA-256}
   */
  public String jcaName() {
    return jcaName;
  }

  /**
   * Indicates whether the algorithm needs salt and iteration parameters.
   *
   * @return {@code true} for key-derivation algorithms
   */
  public boolean salted() {
    return salted;
  }

  /**
   * Parses an algorithm identifier, tolerating case and a dash after {@code SHA}.
   *
   * @param value identifier such as {@code SHA256}, {@code sha-512}, or {@code pbkdf2}
   * @return parsed algorithm
   * @throws IllegalArgumentException if the value is blank or names an unsupported algorithm
   */
  public static HashAlgorithm fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("algorithm must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "");
    try {
      return HashAlgorithm.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "Invalid hash algorithm: " + value + " (expected SHA256, SHA384, SHA512, or PBKDF2)", ex);
    }
  }
}
