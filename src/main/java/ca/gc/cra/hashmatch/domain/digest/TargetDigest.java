package ca.gc.cra.hashmatch.domain.digest;

import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Normalized digest that candidates are compared against.
 * <p><strong>Why:</strong> Comparison is case-insensitive; normalizing once keeps the hot loop to a single
 * string comparison.</p>
 * <p><strong>Format:</strong> lower-case hex for SHA-2 algorithms; {@code <saltHex>$<keyHex>} for PBKDF2 so the
 * salt travels with the target.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class TargetDigest {
  /** Separator between salt and derived key in PBKDF2 digests. */
  public static final char SALT_SEPARATOR = '$';

  private static final HexFormat HEX = HexFormat.of();

  private final HashAlgorithm algorithm;
  private final String normalized;
  private final byte[] salt;

  private TargetDigest(HashAlgorithm algorithm, String normalized, byte[] salt) {
    this.algorithm = algorithm;
    this.normalized = normalized;
    this.salt = salt;
  }

  /**
   * Parses and validates a target digest for the given settings.
   *
   * @param raw target as supplied by the operator; surrounding whitespace and case are ignored
   * @param settings algorithm and parameters the target was produced with
   * @return normalized target
   * @throws IllegalArgumentException if the target is blank, not hex, has the wrong length, or (PBKDF2) lacks a
   *     salt of {@code settings.pbkdf2SaltLength()} bytes
   */
  public static TargetDigest parse(String raw, DigestSettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("target digest must not be blank");
    }
    String value = raw.trim().toLowerCase(Locale.ROOT);
    HashAlgorithm algorithm = settings.algorithm();
    if (!algorithm.salted()) {
      requireHex("target", value, expectedHexLength(algorithm));
      return new TargetDigest(algorithm, value, null);
    }
    int idx = value.indexOf(SALT_SEPARATOR);
    if (idx <= 0 || idx == value.length() - 1) {
      throw new IllegalArgumentException("PBKDF2 target must be formatted as <saltHex>$<keyHex>");
    }
    String saltHex = value.substring(0, idx);
    String keyHex = value.substring(idx + 1);
    requireHex("target salt", saltHex, settings.pbkdf2SaltLength() * 2);
    requireHex("target key", keyHex, 64);
    return new TargetDigest(algorithm, value, HEX.parseHex(saltHex));
  }

  /**
   * Compares a computed digest with this target, ignoring case.
   *
   * @param computed digest produced by a digest port; {@code null} never matches
   * @return {@code true} when the digests are equal
   */
  public boolean matches(String computed) {
    return computed != null && normalized.equalsIgnoreCase(computed);
  }

  /**
   * Returns the algorithm this target was produced with.
   *
   * @return algorithm
   */
  public HashAlgorithm algorithm() {
    return algorithm;
  }

  /**
   * Returns the normalized digest text.
   *
   * @return lower-case digest
   */
  public String value() {
    return normalized;
  }

  /**
   * Returns a copy of the PBKDF2 salt carried by the target.
   *
   * @return salt bytes, or an empty array for unsalted algorithms
   */
  public byte[] salt() {
    return salt == null ? new byte[0] : salt.clone();
  }

  private static int expectedHexLength(HashAlgorithm algorithm) {
    return switch (algorithm) {
      case SHA256 -> 64;
      case SHA384 -> 96;
      case SHA512 -> 128;
      case PBKDF2 -> throw new IllegalArgumentException("PBKDF2 has no fixed unsalted length");
    };
  }

  private static void requireHex(String name, String value, int expectedLength) {
    if (value.length() != expectedLength) {
      throw new IllegalArgumentException(
          name + " must be " + expectedLength + " hex characters (was " + value.length() + ")");
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.digit(value.charAt(i), 16) < 0) {
        throw new IllegalArgumentException(name + " must contain only hexadecimal characters");
      }
    }
  }

  @Override
  public String toString() {
    return algorithm + ":" + normalized;
  }
}
