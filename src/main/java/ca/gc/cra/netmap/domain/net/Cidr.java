package ca.gc.cra.netmap.domain.net;

import java.util.Objects;

/**
 * Network address plus prefix length with all host bits clear.
 *
 * @param network network address; host bits are zero
 * @param prefixLength prefix length in {@code [0, network.bitLength()]}
 * @since 0.1.0
 */
public record Cidr(IpAddress network, int prefixLength) implements Comparable<Cidr> {
  public Cidr {
    Objects.requireNonNull(network, "network");
    if (prefixLength < 0 || prefixLength > network.bitLength()) {
      throw new IllegalArgumentException(
          "prefix length " + prefixLength + " out of range for " + network);
    }
    for (int i = prefixLength; i < network.bitLength(); i++) {
      if (network.bit(i) != 0) {
        throw new IllegalArgumentException("host bits set in " + network + "/" + prefixLength);
      }
    }
  }

  /**
   * Parses {@code address/prefix}. A bare address is treated as a host route (/32 or /128).
   *
   * @param text CIDR literal
   * @return canonical CIDR
   * @throws IllegalArgumentException for malformed input or host bits set
   */
  public static Cidr parse(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim();
    int slash = trimmed.indexOf('/');
    if (slash < 0) {
      IpAddress host = IpAddress.parse(trimmed);
      return new Cidr(host, host.bitLength());
    }
    IpAddress network = IpAddress.parse(trimmed.substring(0, slash));
    String prefix = trimmed.substring(slash + 1);
    if (prefix.isEmpty() || prefix.length() > 3 || !prefix.chars().allMatch(c -> c >= '0' && c <= '9')) {
      throw new IllegalArgumentException("invalid prefix length in " + trimmed);
    }
    return new Cidr(network, Integer.parseInt(prefix));
  }

  /**
   * Builds a CIDR from a destination and a dotted netmask, as printed by {@code route -n} and
   * {@code route print}.
   *
   * @param destination network address
   * @param netmask contiguous mask of the same family
   * @return canonical CIDR
   * @throws IllegalArgumentException for non-contiguous masks, family mismatch, or host bits set
   */
  public static Cidr fromNetmask(IpAddress destination, IpAddress netmask) {
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(netmask, "netmask");
    if (destination.bitLength() != netmask.bitLength()) {
      throw new IllegalArgumentException("netmask family does not match " + destination);
    }
    int prefix = 0;
    boolean zeroSeen = false;
    for (int i = 0; i < netmask.bitLength(); i++) {
      if (netmask.bit(i) == 1) {
        if (zeroSeen) {
          throw new IllegalArgumentException("non-contiguous netmask " + netmask);
        }
        prefix++;
      } else {
        zeroSeen = true;
      }
    }
    return new Cidr(destination, prefix);
  }

  /**
   * Returns whether {@code address} falls inside this network.
   *
   * @param address candidate address
   * @return {@code true} when the prefix bits match
   */
  public boolean contains(IpAddress address) {
    if (address.bitLength() != network.bitLength()) {
      return false;
    }
    for (int i = 0; i < prefixLength; i++) {
      if (address.bit(i) != network.bit(i)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int compareTo(Cidr other) {
    int byNetwork = network.compareTo(other.network);
    return byNetwork != 0 ? byNetwork : Integer.compare(prefixLength, other.prefixLength);
  }

  @Override
  public String toString() {
    return network + "/" + prefixLength;
  }
}
