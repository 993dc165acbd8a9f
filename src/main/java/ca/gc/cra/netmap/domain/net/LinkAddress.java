package ca.gc.cra.netmap.domain.net;

import java.util.Locale;
import java.util.Objects;

/**
 * 48-bit link-layer (MAC) address in canonical form: twelve lowercase hex digits, no separators.
 *
 * @param value canonical hex digits
 * @since 0.1.0
 */
public record LinkAddress(String value) implements Comparable<LinkAddress> {
  private static final int HEX_DIGITS = 12;

  public LinkAddress {
    Objects.requireNonNull(value, "value");
    if (value.length() != HEX_DIGITS || !isLowerHex(value)) {
      throw new IllegalArgumentException("link address must be 12 lowercase hex digits: " + value);
    }
  }

  /**
   * Parses colon ({@code 00:16:3e:5e:6c:06}), hyphen ({@code fe-ff-ff-ff-ff-ff}), Cisco dotted
   * ({@code 0016.3e5e.6c06}) or bare forms, case-insensitively.
   *
   * @param text link address literal
   * @return canonical link address
   * @throws IllegalArgumentException when the literal is not a 48-bit address
   */
  public static LinkAddress parse(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim().toLowerCase(Locale.ROOT);
    String digits;
    if (trimmed.indexOf(':') >= 0 || trimmed.indexOf('-') >= 0) {
      String[] parts = trimmed.split("[:-]", -1);
      if (parts.length != 6) {
        throw new IllegalArgumentException("invalid link address: " + text);
      }
      StringBuilder sb = new StringBuilder(HEX_DIGITS);
      for (String part : parts) {
        if (part.isEmpty() || part.length() > 2) {
          throw new IllegalArgumentException("invalid link address: " + text);
        }
        // Some BSD dumps drop the leading zero of an octet.
        if (part.length() == 1) {
          sb.append('0');
        }
        sb.append(part);
      }
      digits = sb.toString();
    } else if (trimmed.indexOf('.') >= 0) {
      String[] parts = trimmed.split("\\.", -1);
      if (parts.length != 3 || parts[0].length() != 4 || parts[1].length() != 4 || parts[2].length() != 4) {
        throw new IllegalArgumentException("invalid link address: " + text);
      }
      digits = parts[0] + parts[1] + parts[2];
    } else {
      digits = trimmed;
    }
    if (digits.length() != HEX_DIGITS || !isLowerHex(digits)) {
      throw new IllegalArgumentException("invalid link address: " + text);
    }
    return new LinkAddress(digits);
  }

  /**
   * Returns whether this is {@code ff:ff:ff:ff:ff:ff}.
   *
   * @return broadcast flag
   */
  public boolean isBroadcast() {
    return value.equals("ffffffffffff");
  }

  /**
   * Returns whether the group bit of the first octet is set (multicast or broadcast).
   *
   * @return group address flag
   */
  public boolean isGroup() {
    return (Integer.parseInt(value.substring(0, 2), 16) & 0x01) != 0;
  }

  /**
   * Returns the colon-separated display form.
   *
   * @return e.g. {@code 00:16:3e:5e:6c:06}
   */
  public String display() {
    StringBuilder sb = new StringBuilder(17);
    for (int i = 0; i < HEX_DIGITS; i += 2) {
      if (i > 0) {
        sb.append(':');
      }
      sb.append(value, i, i + 2);
    }
    return sb.toString();
  }

  @Override
  public int compareTo(LinkAddress other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }

  private static boolean isLowerHex(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
        return false;
      }
    }
    return true;
  }
}
