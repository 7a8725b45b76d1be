package ca.gc.cra.hashmatch.config;

import ca.gc.cra.hashmatch.domain.digest.DigestSettings;
import ca.gc.cra.hashmatch.domain.digest.HashAlgorithm;
import ca.gc.cra.hashmatch.validation.Numbers;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated settings for the {@code digest} command, which prints the target digest of a single value.
 *
 * @param value plaintext to digest
 * @param digest algorithm and PBKDF2 parameters
 * @param salt explicit PBKDF2 salt; empty means a random salt is generated
 * @since 0.1.0
 */
public record DigestConfig(String value, DigestSettings digest, Optional<byte[]> salt) {

  public DigestConfig {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(digest, "digest");
    Objects.requireNonNull(salt, "salt");
    salt = salt.map(byte[]::clone);
    if (salt.isPresent()) {
      if (!digest.algorithm().salted()) {
        throw new IllegalArgumentException("salt is only valid with algorithm PBKDF2");
      }
      if (salt.get().length != digest.pbkdf2SaltLength()) {
        throw new IllegalArgumentException(
            "salt must be " + digest.pbkdf2SaltLength() + " bytes (was " + salt.get().length + ")");
      }
    }
  }

  /**
   * Builds a configuration from a merged key/value map.
   *
   * @param args merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing or invalid
   */
  public static DigestConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    String value = args.get("value");
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("value must be provided");
    }
    DigestSettings digest = new DigestSettings(
        HashAlgorithm.fromString(args.getOrDefault("algorithm", "SHA256")),
        Numbers.parseIntInRange("pbkdf2Iterations",
            args.getOrDefault("pbkdf2Iterations", Integer.toString(DigestSettings.DEFAULT_PBKDF2_ITERATIONS)),
            1, Integer.MAX_VALUE),
        Numbers.parseIntInRange("pbkdf2SaltLength",
            args.getOrDefault("pbkdf2SaltLength", Integer.toString(DigestSettings.DEFAULT_PBKDF2_SALT_LENGTH)),
            1, 1_024));
    String rawSalt = args.getOrDefault("salt", "").trim();
    Optional<byte[]> salt = Optional.empty();
    if (!rawSalt.isEmpty()) {
      try {
        salt = Optional.of(HexFormat.of().parseHex(rawSalt));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("salt must be hexadecimal", ex);
      }
    }
    return new DigestConfig(value, digest, salt);
  }
}
