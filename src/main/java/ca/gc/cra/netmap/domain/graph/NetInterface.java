package ca.gc.cra.netmap.domain.graph;

import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.net.LinkAddress;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;

/**
 * One network attachment point of a host.
 *
 * <p>Every attribute value carries a {@link Claim}. The owning host id is assigned by the identity
 * resolver at commit time; deltas staged by the fusion engine leave it empty.</p>
 *
 * @param id canonical interface id (see {@link EntityIds})
 * @param origin how the interface became known
 * @param hostId owning canonical host
 * @param sourceHostId reporting source host for {@link InterfaceOrigin#REPORTED} interfaces
 * @param linkAddresses observed link addresses; at most one
 * @param addresses observed IP addresses
 * @param names host-reported interface names
 * @param conflicts IP conflict annotations keyed by contested address
 * @param seen overall provenance and first/last seen
 */
public record NetInterface(
    String id,
    InterfaceOrigin origin,
    Optional<String> hostId,
    Optional<String> sourceHostId,
    SortedMap<LinkAddress, Claim> linkAddresses,
    SortedMap<IpAddress, Claim> addresses,
    SortedMap<String, Claim> names,
    SortedMap<IpAddress, IpConflict> conflicts,
    Claim seen) implements Mergeable<NetInterface> {

  public NetInterface {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(origin, "origin");
    hostId = hostId == null ? Optional.empty() : hostId;
    sourceHostId = sourceHostId == null ? Optional.empty() : sourceHostId;
    linkAddresses = Merges.sortedCopy(linkAddresses);
    addresses = Merges.sortedCopy(addresses);
    names = Merges.sortedCopy(names);
    conflicts = Merges.sortedCopy(conflicts);
    Objects.requireNonNull(seen, "seen");
    if (linkAddresses.size() > 1) {
      throw new IllegalArgumentException("interface " + id + " holds more than one link address");
    }
  }

  @Override
  public NetInterface mergeWith(NetInterface other) {
    if (!id.equals(other.id)) {
      throw new IllegalArgumentException("cannot merge interface " + other.id + " into " + id);
    }
    return new NetInterface(
        id,
        origin,
        Merges.either(hostId, other.hostId),
        Merges.either(sourceHostId, other.sourceHostId),
        Merges.union(linkAddresses, other.linkAddresses, Claim::merge),
        Merges.union(addresses, other.addresses, Claim::merge),
        Merges.union(names, other.names, Claim::merge),
        Merges.union(conflicts, other.conflicts, IpConflict::merge),
        seen.merge(other.seen));
  }

  /**
   * Returns a copy owned by {@code newHostId}.
   *
   * @param newHostId canonical host id
   * @return re-parented interface
   */
  public NetInterface withHostId(String newHostId) {
    return new NetInterface(
        id, origin, Optional.of(newHostId), sourceHostId, linkAddresses, addresses, names, conflicts, seen);
  }

  /**
   * Returns the link address when this interface was learned from one.
   *
   * @return link address, if any
   */
  public Optional<LinkAddress> linkAddress() {
    return linkAddresses.isEmpty() ? Optional.empty() : Optional.of(linkAddresses.firstKey());
  }

  /**
   * Builds this interface's ownership claim for {@code address}, if it has held it.
   *
   * @param address IP address
   * @return claim for the current-owner view
   */
  public Optional<OwnerClaim> ownerClaim(IpAddress address) {
    Claim claim = addresses.get(address);
    return claim == null ? Optional.empty() : Optional.of(new OwnerClaim(id, claim.lastSeen()));
  }

  /** Orders interfaces by their current claim on {@code address}, best last. */
  static Comparator<NetInterface> byOwnership(IpAddress address) {
    return Comparator.comparing(
        (NetInterface iface) -> iface.ownerClaim(address).orElseThrow(),
        OwnerClaim.precedence());
  }
}
