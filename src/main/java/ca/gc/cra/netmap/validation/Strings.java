package ca.gc.cra.netmap.validation;

import java.util.Objects;

/**
 * String validation helpers shared by configuration parsing and the normalizer.
 *
 * <p>All helpers throw {@link IllegalArgumentException} with a message prefixed by the supplied
 * field name so CLI users see which option was rejected.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Trims {@code value} and rejects it when blank or when it carries control characters.
   *
   * @param name label used in error messages
   * @param value candidate string
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates an opaque identifier such as a source host id or interface name: non-blank,
   * printable ASCII, no whitespace, bounded length.
   *
   * @param name label used in error messages
   * @param value candidate identifier
   * @param maxLength maximum accepted length
   * @return trimmed identifier
   */
  public static String requireIdentifier(String name, String value, int maxLength) {
    String sanitized = requirePrintableAscii(name, value, maxLength);
    for (int i = 0; i < sanitized.length(); i++) {
      if (Character.isWhitespace(sanitized.charAt(i))) {
        throw new IllegalArgumentException(message(name, "must not contain whitespace"));
      }
    }
    return sanitized;
  }

  /**
   * Validates that the value is non-blank printable ASCII no longer than {@code maxLength}.
   *
   * @param name label used in error messages
   * @param value candidate string
   * @param maxLength maximum accepted length
   * @return trimmed value
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Returns {@code true} when the value is {@code null} or only whitespace.
   *
   * @param value candidate string
   * @return whether the value carries no content
   */
  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
