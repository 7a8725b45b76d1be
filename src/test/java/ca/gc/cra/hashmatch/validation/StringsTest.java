package ca.gc.cra.hashmatch.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {
  @Test
  void requireNonBlankTrims() {
    assertEquals("abc", Strings.requireNonBlank("target", "  abc "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("target", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("target", "ab\u0007c"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("target", null));
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndRange() {
    assertEquals("team=cra", Strings.requirePrintableAscii("attrs", "team=cra", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "team=cra", 4));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "équipe", 16));
  }

  @Test
  void trimToEmptyHandlesNull() {
    assertEquals("", Strings.trimToEmpty(null));
    assertEquals("x", Strings.trimToEmpty(" x "));
  }
}
