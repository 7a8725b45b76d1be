package ca.gc.cra.hashmatch.infrastructure.digest;

import ca.gc.cra.hashmatch.application.port.DigestPort;
import ca.gc.cra.hashmatch.domain.digest.DigestSettings;
import ca.gc.cra.hashmatch.domain.digest.HashAlgorithm;
import ca.gc.cra.hashmatch.domain.digest.TargetDigest;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

/**
 * <strong>What:</strong> {@link DigestPort} backed by the JCA providers of the running JVM.
 * <p><strong>Formats:</strong> SHA-2 digests are lower-case hex of the UTF-8 bytes. PBKDF2 output is
 * {@code <saltHex>$<keyHex>} with a 256-bit key derived by {@code PBKDF2WithHmacSHA256}.</p>
 * <p><strong>Thread-safety:</strong> not thread-safe; create one instance per worker through {@link #factory}.</p>
 *
 * @since 0.1.0
 */
public final class JcaDigestAdapter implements DigestPort {
  static final int PBKDF2_KEY_BITS = 256;

  private static final HexFormat HEX = HexFormat.of();
  private static final SecureRandom RANDOM = new SecureRandom();

  private final DigestSettings settings;
  private final MessageDigest messageDigest;
  private final SecretKeyFactory keyFactory;
  private final byte[] salt;
  private final String saltHex;

  /**
   * Creates an adapter for {@code settings}.
   *
   * @param settings algorithm and PBKDF2 parameters
   * @param salt PBKDF2 salt; ignored for unsalted algorithms
   * @throws IllegalArgumentException if the JVM lacks the algorithm or the salt length does not match
   */
  public JcaDigestAdapter(DigestSettings settings, byte[] salt) {
    this.settings = Objects.requireNonNull(settings, "settings");
    HashAlgorithm algorithm = settings.algorithm();
    try {
      if (algorithm.salted()) {
        Objects.requireNonNull(salt, "salt");
        if (salt.length != settings.pbkdf2SaltLength()) {
          throw new IllegalArgumentException(
              "salt must be " + settings.pbkdf2SaltLength() + " bytes (was " + salt.length + ")");
        }
        this.salt = salt.clone();
        this.saltHex = HEX.formatHex(this.salt);
        this.keyFactory = SecretKeyFactory.getInstance(algorithm.jcaName());
        this.messageDigest = null;
      } else {
        this.salt = null;
        this.saltHex = null;
        this.keyFactory = null;
        this.messageDigest = MessageDigest.getInstance(algorithm.jcaName());
      }
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalArgumentException("Digest algorithm not available: " + algorithm.jcaName(), ex);
    }
  }

  /**
   * Returns a factory producing one adapter per worker, salted from {@code target} when PBKDF2 is selected.
   *
   * @param settings algorithm and PBKDF2 parameters
   * @param target parsed target digest
   * @return per-worker factory
   */
  public static DigestPort.Factory factory(DigestSettings settings, TargetDigest target) {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(target, "target");
    if (settings.algorithm() != target.algorithm()) {
      throw new IllegalArgumentException(
          "target was parsed for " + target.algorithm() + " but settings select " + settings.algorithm());
    }
    byte[] salt = target.salt();
    return () -> new JcaDigestAdapter(settings, salt);
  }

  /**
   * Generates a random salt of {@code length} bytes.
   *
   * @param length salt length in bytes
   * @return fresh salt
   */
  public static byte[] randomSalt(int length) {
    if (length < 1) {
      throw new IllegalArgumentException("salt length must be >= 1");
    }
    byte[] salt = new byte[length];
    RANDOM.nextBytes(salt);
    return salt;
  }

  @Override
  public String digest(String candidate) throws GeneralSecurityException {
    Objects.requireNonNull(candidate, "candidate");
    if (messageDigest != null) {
      messageDigest.reset();
      return HEX.formatHex(messageDigest.digest(candidate.getBytes(StandardCharsets.UTF_8)));
    }
    PBEKeySpec spec = new PBEKeySpec(candidate.toCharArray(), salt, settings.pbkdf2Iterations(), PBKDF2_KEY_BITS);
    try {
      byte[] key = keyFactory.generateSecret(spec).getEncoded();
      return saltHex + TargetDigest.SALT_SEPARATOR + HEX.formatHex(key);
    } finally {
      spec.clearPassword();
    }
  }

  /**
   * Returns the configured algorithm.
   *
   * @return algorithm
   */
  public HashAlgorithm algorithm() {
    return settings.algorithm();
  }
}
