package ca.gc.cra.netmap.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireIdentifierAcceptsHostNames() {
    assertEquals("web-01.example", Strings.requireIdentifier("source", " web-01.example ", 64));
  }

  @Test
  void requireIdentifierRejectsEmbeddedWhitespace() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireIdentifier("source", "web 01", 64));
    assertEquals("source must not contain whitespace", ex.getMessage());
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("iface", "v☃l", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("iface", "abc", 2));
  }

  @Test
  void isBlankTreatsNullAsBlank() {
    assertTrue(Strings.isBlank(null));
    assertTrue(Strings.isBlank("  "));
    assertFalse(Strings.isBlank("x"));
  }
}
