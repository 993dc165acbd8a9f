package ca.gc.cra.netmap.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Bounds raw dump text before it reaches operator logs.
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  /** Byte budget for a raw dump line quoted in a log message. */
  public static final int MAX_LINE_BYTES = 160;
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to {@code maxBytes} UTF-8 bytes, noting the original length.
   *
   * @param value string to truncate; {@code null} becomes {@code "<null>"}
   * @param maxBytes bytes to keep; must be positive
   * @return {@code value} when it fits, otherwise its prefix plus {@code "... (truncated, X of Y)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      // IGNORE actions make this unreachable in practice; keep a readable prefix anyway.
      String prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return prefix + "... (truncated)";
    }
  }

  /**
   * Truncates a dump line to {@link #MAX_LINE_BYTES}.
   *
   * @param line raw line
   * @return loggable line
   */
  public static String line(String line) {
    return truncate(line, MAX_LINE_BYTES);
  }
}
