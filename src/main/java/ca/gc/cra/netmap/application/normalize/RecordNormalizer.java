package ca.gc.cra.netmap.application.normalize;

import ca.gc.cra.netmap.domain.net.Cidr;
import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.net.LinkAddress;
import ca.gc.cra.netmap.domain.observation.ArpEntry;
import ca.gc.cra.netmap.domain.observation.HostAlias;
import ca.gc.cra.netmap.domain.observation.ObservationRecord;
import ca.gc.cra.netmap.domain.observation.RawObservation;
import ca.gc.cra.netmap.domain.observation.RecordKind;
import ca.gc.cra.netmap.domain.observation.RouteEntry;
import ca.gc.cra.netmap.domain.observation.TraceHop;
import ca.gc.cra.netmap.validation.Strings;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns parser output into closed {@link ObservationRecord} variants.
 *
 * <p><strong>What:</strong> Canonicalizes addresses, CIDR blocks, link addresses and interface
 * identifiers, and rejects anything that does not fit a known record kind.</p>
 * <p><strong>Why:</strong> Dumps from different operating systems spell the same facts
 * differently; identity resolution downstream compares canonical values only.</p>
 * <p><strong>Role:</strong> Stateless application service; performs no identity merging.</p>
 * <p><strong>Thread-safety:</strong> Immutable and safe to share across ingestion workers.</p>
 *
 * @since 0.1.0
 */
public final class RecordNormalizer {
  static final int MAX_IDENTIFIER_LENGTH = 128;
  private static final Set<String> ON_LINK_GATEWAYS = Set.of("", "*", "on-link", "0.0.0.0", "::");
  private static final Set<String> DEFAULT_DESTINATIONS = Set.of("default", "0.0.0.0");

  /**
   * Normalizes one raw record.
   *
   * @param sourceHostId vantage host the batch was collected on
   * @param raw parser output
   * @return normalized record
   * @throws NormalizationException when the record is malformed
   */
  public ObservationRecord normalize(String sourceHostId, RawObservation raw) throws NormalizationException {
    Objects.requireNonNull(raw, "raw");
    String source = identifier(raw, "sourceHostId", sourceHostId);
    Instant observedAt = raw.observedAt();
    if (observedAt == null) {
      throw reject(raw, "missing observedAt");
    }
    RecordKind kind = RecordKind.fromLabel(raw.kind())
        .orElseThrow(() -> reject(raw, "unknown record kind '" + raw.kind() + "'"));
    return switch (kind) {
      case ARP -> arp(source, observedAt, raw);
      case ROUTE -> route(source, observedAt, raw);
      case ALIAS -> alias(source, observedAt, raw);
      case HOP -> hop(source, observedAt, raw);
    };
  }

  private ArpEntry arp(String source, Instant observedAt, RawObservation raw) throws NormalizationException {
    String local = localIdentifier(raw, RawObservation.LOCAL_INTERFACE);
    IpAddress neighbor = address(raw, RawObservation.NEIGHBOR_IP, required(raw, RawObservation.NEIGHBOR_IP));
    if (neighbor.isUnspecified() || neighbor.isMulticast() || neighbor.isLimitedBroadcast()) {
      throw reject(raw, "neighborIp " + neighbor + " is not a unicast address");
    }
    LinkAddress link = linkAddress(raw, RawObservation.NEIGHBOR_LINK_ADDRESS);
    if (link.isGroup()) {
      throw reject(raw, "neighborLinkAddress " + link.display() + " is not a unicast link address");
    }
    return ArpEntry.create(source, observedAt, local, neighbor, link);
  }

  private RouteEntry route(String source, Instant observedAt, RawObservation raw) throws NormalizationException {
    Cidr destination = destination(raw);
    Optional<IpAddress> gateway = gateway(raw);
    if (gateway.isPresent() && gateway.get().bitLength() != destination.network().bitLength()) {
      throw reject(raw, "gateway " + gateway.get() + " does not match the family of " + destination);
    }
    String out = localIdentifier(raw, RawObservation.INTERFACE);
    int metric = metric(raw);
    return RouteEntry.create(source, observedAt, destination, gateway, out, metric);
  }

  private HostAlias alias(String source, Instant observedAt, RawObservation raw) throws NormalizationException {
    String host = identifier(raw, RawObservation.HOST, required(raw, RawObservation.HOST));
    LinkAddress link = linkAddress(raw, RawObservation.LINK_ADDRESS);
    if (link.isGroup()) {
      throw reject(raw, "linkAddress " + link.display() + " is not a unicast link address");
    }
    return HostAlias.create(source, observedAt, host, link);
  }

  private TraceHop hop(String source, Instant observedAt, RawObservation raw) throws NormalizationException {
    IpAddress target = unicast(raw, RawObservation.TARGET, required(raw, RawObservation.TARGET));
    IpAddress address = unicast(raw, RawObservation.ADDRESS, required(raw, RawObservation.ADDRESS));
    if (address.bitLength() != target.bitLength()) {
      throw reject(raw, "hop " + address + " does not match the family of target " + target);
    }
    int hop = hopNumber(raw);
    Optional<IpAddress> previous = Optional.empty();
    String previousValue = raw.field(RawObservation.PREVIOUS_HOP);
    if (!Strings.isBlank(previousValue)) {
      if (hop == TraceHop.MIN_HOP) {
        throw reject(raw, "the first hop has no previous hop");
      }
      IpAddress previousHop = unicast(raw, RawObservation.PREVIOUS_HOP, previousValue);
      if (previousHop.equals(address)) {
        throw reject(raw, "hop " + hop + " repeats the previous hop " + address);
      }
      if (previousHop.bitLength() != address.bitLength()) {
        throw reject(raw, "previousHop " + previousHop + " does not match the family of " + address);
      }
      previous = Optional.of(previousHop);
    }
    return TraceHop.create(source, observedAt, target, hop, previous, address);
  }

  private int hopNumber(RawObservation raw) throws NormalizationException {
    String value = required(raw, RawObservation.HOP).trim();
    int hop;
    try {
      hop = Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      throw reject(raw, "hop is not an integer: '" + value + "'", ex);
    }
    if (hop < TraceHop.MIN_HOP || hop > TraceHop.MAX_HOP) {
      throw reject(raw, "hop must be between " + TraceHop.MIN_HOP + " and " + TraceHop.MAX_HOP + " (was " + hop + ")");
    }
    return hop;
  }

  private IpAddress unicast(RawObservation raw, String field, String value) throws NormalizationException {
    IpAddress address = address(raw, field, value.trim());
    if (address.isUnspecified() || address.isMulticast() || address.isLimitedBroadcast()) {
      throw reject(raw, field + " " + address + " is not a unicast address");
    }
    return address;
  }

  private Cidr destination(RawObservation raw) throws NormalizationException {
    String value = required(raw, RawObservation.DESTINATION).trim();
    String netmask = raw.field(RawObservation.NETMASK);
    try {
      if (value.indexOf('/') >= 0) {
        return Cidr.parse(value);
      }
      boolean wildcard = DEFAULT_DESTINATIONS.contains(value.toLowerCase(Locale.ROOT));
      IpAddress network = wildcard && value.equalsIgnoreCase("default")
          ? IpAddress.parse("0.0.0.0") : IpAddress.parse(value);
      if (netmask != null && !netmask.isBlank()) {
        return Cidr.fromNetmask(network, IpAddress.parse(netmask));
      }
      return wildcard ? new Cidr(network, 0) : new Cidr(network, network.bitLength());
    } catch (IllegalArgumentException ex) {
      throw reject(raw, "invalid destination '" + value + "': " + ex.getMessage(), ex);
    }
  }

  private Optional<IpAddress> gateway(RawObservation raw) throws NormalizationException {
    String value = raw.field(RawObservation.GATEWAY);
    if (value == null || ON_LINK_GATEWAYS.contains(value.trim().toLowerCase(Locale.ROOT))) {
      return Optional.empty();
    }
    IpAddress gateway = address(raw, RawObservation.GATEWAY, value);
    if (gateway.isUnspecified()) {
      return Optional.empty();
    }
    if (gateway.isMulticast() || gateway.isLimitedBroadcast()) {
      throw reject(raw, "gateway " + gateway + " is not a unicast address");
    }
    return Optional.of(gateway);
  }

  private int metric(RawObservation raw) throws NormalizationException {
    String value = raw.field(RawObservation.METRIC);
    if (value == null || value.isBlank()) {
      return 0;
    }
    try {
      int metric = Integer.parseInt(value.trim());
      if (metric < 0) {
        throw reject(raw, "metric must be >= 0 (was " + metric + ")");
      }
      return metric;
    } catch (NumberFormatException ex) {
      throw reject(raw, "metric is not an integer: '" + value + "'", ex);
    }
  }

  private String localIdentifier(RawObservation raw, String field) throws NormalizationException {
    String value = required(raw, field).trim();
    try {
      return IpAddress.parse(value).toString();
    } catch (IllegalArgumentException notAnAddress) {
      return identifier(raw, field, value);
    }
  }

  private IpAddress address(RawObservation raw, String field, String value) throws NormalizationException {
    try {
      return IpAddress.parse(value);
    } catch (IllegalArgumentException ex) {
      throw reject(raw, "invalid " + field + " '" + value + "'", ex);
    }
  }

  private LinkAddress linkAddress(RawObservation raw, String field) throws NormalizationException {
    String value = required(raw, field);
    try {
      return LinkAddress.parse(value);
    } catch (IllegalArgumentException ex) {
      throw reject(raw, "invalid " + field + " '" + value + "'", ex);
    }
  }

  private String identifier(RawObservation raw, String field, String value) throws NormalizationException {
    if (Strings.isBlank(value)) {
      throw reject(raw, "missing " + field);
    }
    try {
      return Strings.requireIdentifier(field, value, MAX_IDENTIFIER_LENGTH);
    } catch (IllegalArgumentException ex) {
      throw reject(raw, ex.getMessage(), ex);
    }
  }

  private static String required(RawObservation raw, String field) throws NormalizationException {
    String value = raw.field(field);
    if (Strings.isBlank(value)) {
      throw reject(raw, "missing " + field);
    }
    return value;
  }

  private static NormalizationException reject(RawObservation raw, String reason) {
    return new NormalizationException(new NormalizationError(raw.origin(), raw.kind(), reason));
  }

  private static NormalizationException reject(RawObservation raw, String reason, Throwable cause) {
    return new NormalizationException(new NormalizationError(raw.origin(), raw.kind(), reason), cause);
  }
}
