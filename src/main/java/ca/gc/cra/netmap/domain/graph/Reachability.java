package ca.gc.cra.netmap.domain.graph;

import ca.gc.cra.netmap.domain.net.Cidr;
import ca.gc.cra.netmap.domain.net.IpAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * Placeholder node: "{@code destination} is reachable via {@code gateway}".
 *
 * <p>One node exists per {@code (destination, gateway)} pair named by any route, whether or not
 * the gateway is known yet, so the persisted graph does not depend on which record arrived first.
 * Default views hide {@link ReachabilityStatus#RESOLVED} nodes because the route edges already
 * point at the gateway's host.</p>
 *
 * @param id canonical node id
 * @param destination destination network
 * @param gateway next hop, empty for on-link networks
 * @param resolvedBy current owner of the gateway address, if any
 * @param seen provenance of the routes naming this node
 */
public record Reachability(
    String id,
    Cidr destination,
    Optional<IpAddress> gateway,
    Optional<OwnerClaim> resolvedBy,
    Claim seen) implements Mergeable<Reachability> {

  public Reachability {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(destination, "destination");
    gateway = gateway == null ? Optional.empty() : gateway;
    resolvedBy = resolvedBy == null ? Optional.empty() : resolvedBy;
    Objects.requireNonNull(seen, "seen");
  }

  public ReachabilityStatus status() {
    if (gateway.isEmpty()) {
      return ReachabilityStatus.DIRECT;
    }
    return resolvedBy.isPresent() ? ReachabilityStatus.RESOLVED : ReachabilityStatus.UNRESOLVED;
  }

  public Reachability withResolvedBy(OwnerClaim claim) {
    return new Reachability(id, destination, gateway, Optional.of(claim.max(resolvedBy.orElse(null))), seen);
  }

  @Override
  public Reachability mergeWith(Reachability other) {
    if (!id.equals(other.id)) {
      throw new IllegalArgumentException("cannot merge reachability " + other.id + " into " + id);
    }
    Optional<OwnerClaim> owner = resolvedBy.isEmpty() ? other.resolvedBy
        : Optional.of(resolvedBy.get().max(other.resolvedBy.orElse(null)));
    return new Reachability(id, destination, Merges.either(gateway, other.gateway), owner, seen.merge(other.seen));
  }
}
