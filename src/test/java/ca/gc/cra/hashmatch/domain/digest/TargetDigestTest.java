package ca.gc.cra.hashmatch.domain.digest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TargetDigestTest {
  private static final String BOB_SHA256 =
      "81b637d8fcd2c6da6359e6963113a1170de795e4b725b84d1e0b4cfd9ec58ce9";

  @Test
  void normalizesCaseAndWhitespace() {
    TargetDigest target =
        TargetDigest.parse("  " + BOB_SHA256.toUpperCase() + "\n", DigestSettings.of(HashAlgorithm.SHA256));

    assertEquals(BOB_SHA256, target.value());
    assertEquals(HashAlgorithm.SHA256, target.algorithm());
    assertTrue(target.matches(BOB_SHA256));
    assertTrue(target.matches(BOB_SHA256.toUpperCase()));
    assertFalse(target.matches(null));
    assertEquals(0, target.salt().length);
  }

  @Test
  void rejectsWrongLengthOrNonHex() {
    DigestSettings sha256 = DigestSettings.of(HashAlgorithm.SHA256);
    assertThrows(IllegalArgumentException.class, () -> TargetDigest.parse("abc", sha256));
    assertThrows(IllegalArgumentException.class,
        () -> TargetDigest.parse(BOB_SHA256.substring(1) + "z", sha256));
    assertThrows(IllegalArgumentException.class, () -> TargetDigest.parse("", sha256));
    assertThrows(IllegalArgumentException.class,
        () -> TargetDigest.parse(BOB_SHA256, DigestSettings.of(HashAlgorithm.SHA512)));
  }

  @Test
  void pbkdf2TargetCarriesSalt() {
    DigestSettings settings = new DigestSettings(HashAlgorithm.PBKDF2, 1000, 4);
    String raw = "0A0B0C0D$" + BOB_SHA256;

    TargetDigest target = TargetDigest.parse(raw, settings);

    assertEquals("0a0b0c0d$" + BOB_SHA256, target.value());
    assertArrayEquals(new byte[] {0x0a, 0x0b, 0x0c, 0x0d}, target.salt());
  }

  @Test
  void pbkdf2TargetWithoutSaltIsRejected() {
    DigestSettings settings = new DigestSettings(HashAlgorithm.PBKDF2, 1000, 4);
    assertThrows(IllegalArgumentException.class, () -> TargetDigest.parse(BOB_SHA256, settings));
    assertThrows(IllegalArgumentException.class, () -> TargetDigest.parse("0a0b$" + BOB_SHA256, settings));
    assertThrows(IllegalArgumentException.class, () -> TargetDigest.parse("0a0b0c0d$", settings));
  }
}
