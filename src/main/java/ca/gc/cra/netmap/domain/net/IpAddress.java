package ca.gc.cra.netmap.domain.net;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical IPv4 or IPv6 address held as network-order bytes.
 *
 * <p><strong>What:</strong> Immutable value type produced by the normalizer from dump literals.</p>
 * <p><strong>Why:</strong> Dumps spell the same address differently ({@code ::ffff:10.0.0.1},
 * {@code 2001:DB8::1}, {@code 2001:db8:0:0::1}); identity decisions need one comparable form.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class IpAddress implements Comparable<IpAddress> {
  private final byte[] octets;
  private final String text;

  private IpAddress(byte[] octets) {
    this.octets = octets;
    this.text = octets.length == 4 ? formatV4(octets) : formatV6(octets);
  }

  /**
   * Parses an IPv4 dotted quad or an IPv6 literal. IPv4-mapped IPv6 literals collapse to IPv4.
   *
   * @param literal textual address; zone ids ({@code %eth0}) are rejected
   * @return canonical address
   * @throws IllegalArgumentException when the literal is not a valid address
   */
  public static IpAddress parse(String literal) {
    Objects.requireNonNull(literal, "literal");
    String trimmed = literal.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("address must not be blank");
    }
    if (trimmed.indexOf(':') >= 0) {
      return parseV6(trimmed);
    }
    return new IpAddress(parseV4(trimmed));
  }

  /**
   * Parses {@code literal} when it is an address, for identifiers that may be either an address
   * or an interface name.
   *
   * @param literal candidate text, may be {@code null}
   * @return address, or empty when the text is not one
   */
  public static Optional<IpAddress> tryParse(String literal) {
    if (literal == null || literal.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(parse(literal));
    } catch (IllegalArgumentException notAnAddress) {
      return Optional.empty();
    }
  }

  /**
   * Builds an address from raw bytes.
   *
   * @param bytes 4 or 16 network-order bytes
   * @return canonical address
   */
  public static IpAddress ofBytes(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    if (bytes.length != 4 && bytes.length != 16) {
      throw new IllegalArgumentException("address must be 4 or 16 bytes (was " + bytes.length + ")");
    }
    return new IpAddress(bytes.clone());
  }

  /**
   * Returns a defensive copy of the address bytes.
   *
   * @return network-order bytes
   */
  public byte[] bytes() {
    return octets.clone();
  }

  /**
   * Returns the address width in bits (32 or 128).
   *
   * @return bit length
   */
  public int bitLength() {
    return octets.length * 8;
  }

  public boolean isIpv4() {
    return octets.length == 4;
  }

  /**
   * Returns whether every bit is zero ({@code 0.0.0.0} or {@code ::}).
   *
   * @return {@code true} for the unspecified address
   */
  public boolean isUnspecified() {
    for (byte b : octets) {
      if (b != 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns whether this is the IPv4 limited broadcast address.
   *
   * @return {@code true} for {@code 255.255.255.255}
   */
  public boolean isLimitedBroadcast() {
    if (!isIpv4()) {
      return false;
    }
    for (byte b : octets) {
      if (b != (byte) 0xFF) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns whether this is a multicast group address (224.0.0.0/4 or ff00::/8).
   *
   * @return {@code true} for multicast
   */
  public boolean isMulticast() {
    int first = octets[0] & 0xFF;
    return isIpv4() ? (first & 0xF0) == 0xE0 : first == 0xFF;
  }

  int bit(int index) {
    int b = octets[index / 8] & 0xFF;
    return (b >> (7 - (index % 8))) & 1;
  }

  @Override
  public int compareTo(IpAddress other) {
    int byLength = Integer.compare(octets.length, other.octets.length);
    if (byLength != 0) {
      return byLength;
    }
    return Arrays.compareUnsigned(octets, other.octets);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof IpAddress other && Arrays.equals(octets, other.octets);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(octets);
  }

  /**
   * Returns the canonical text form: dotted quad, or RFC 5952 compressed lowercase IPv6.
   */
  @Override
  public String toString() {
    return text;
  }

  private static byte[] parseV4(String literal) {
    String[] parts = literal.split("\\.", -1);
    if (parts.length != 4) {
      throw new IllegalArgumentException("invalid IPv4 address: " + literal);
    }
    byte[] out = new byte[4];
    for (int i = 0; i < 4; i++) {
      String part = parts[i];
      if (part.isEmpty() || part.length() > 3) {
        throw new IllegalArgumentException("invalid IPv4 address: " + literal);
      }
      for (int j = 0; j < part.length(); j++) {
        char c = part.charAt(j);
        if (c < '0' || c > '9') {
          throw new IllegalArgumentException("invalid IPv4 address: " + literal);
        }
      }
      if (part.length() > 1 && part.charAt(0) == '0') {
        throw new IllegalArgumentException("ambiguous leading zero in IPv4 address: " + literal);
      }
      int value = Integer.parseInt(part);
      if (value > 255) {
        throw new IllegalArgumentException("IPv4 octet out of range: " + literal);
      }
      out[i] = (byte) value;
    }
    return out;
  }

  private static IpAddress parseV6(String literal) {
    for (int i = 0; i < literal.length(); i++) {
      char c = literal.charAt(i);
      boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
      if (!hex && c != ':' && c != '.') {
        throw new IllegalArgumentException("invalid IPv6 address: " + literal);
      }
    }
    try {
      // Only colon-bearing literals reach here, so no name lookup happens.
      // IPv4-mapped literals come back as 4-byte addresses.
      InetAddress parsed = InetAddress.getByName(literal);
      return new IpAddress(parsed.getAddress());
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 address: " + literal, ex);
    }
  }

  private static String formatV4(byte[] octets) {
    return (octets[0] & 0xFF) + "." + (octets[1] & 0xFF) + "." + (octets[2] & 0xFF) + "." + (octets[3] & 0xFF);
  }

  private static String formatV6(byte[] octets) {
    int[] groups = new int[8];
    for (int i = 0; i < 8; i++) {
      groups[i] = ((octets[2 * i] & 0xFF) << 8) | (octets[2 * i + 1] & 0xFF);
    }
    int bestStart = -1;
    int bestLength = 0;
    int runStart = -1;
    for (int i = 0; i <= 8; i++) {
      if (i < 8 && groups[i] == 0) {
        if (runStart < 0) {
          runStart = i;
        }
      } else if (runStart >= 0) {
        int length = i - runStart;
        if (length > bestLength) {
          bestStart = runStart;
          bestLength = length;
        }
        runStart = -1;
      }
    }
    if (bestLength < 2) {
      bestStart = -1;
    }
    StringBuilder sb = new StringBuilder(39);
    for (int i = 0; i < 8; i++) {
      if (i == bestStart) {
        sb.append("::");
        i += bestLength - 1;
        continue;
      }
      if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') {
        sb.append(':');
      }
      sb.append(Integer.toHexString(groups[i]));
    }
    return sb.toString();
  }
}
