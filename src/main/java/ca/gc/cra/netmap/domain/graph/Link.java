package ca.gc.cra.netmap.domain.graph;

import ca.gc.cra.netmap.domain.net.Cidr;
import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.observation.ObservationId;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Edge of the topology graph.
 *
 * <p>{@link LinkKind#ADJACENCY} edges join two interfaces and store them in sorted order.
 * {@link LinkKind#ROUTE} edges start at the reporting interface; {@code endpointB} names the
 * reachability node for {@code (destination, gateway)} and {@link #target()} follows
 * {@code gatewayOwner} once an interface is known to hold the gateway address.</p>
 *
 * <p>{@code confidence} and {@code status} are derived from the support set by the link assessor;
 * merging keeps this side's values until the next assessment.</p>
 *
 * @param id canonical link id
 * @param kind edge variant
 * @param endpointA first endpoint (route source)
 * @param endpointB second endpoint (route reachability node)
 * @param destination route destination network
 * @param gateway route next hop
 * @param metric lowest route metric observed
 * @param gatewayOwner current-owner claim for the gateway address
 * @param support supporting observations
 * @param sources source hosts that supplied support
 * @param firstSeen earliest support time
 * @param lastSeen latest support time
 * @param confidence score in {@code [0, 1)} on this kind's own scale
 * @param status lifecycle status as of the last assessment
 */
public record Link(
    String id,
    LinkKind kind,
    String endpointA,
    String endpointB,
    Optional<Cidr> destination,
    Optional<IpAddress> gateway,
    Optional<Integer> metric,
    Optional<OwnerClaim> gatewayOwner,
    SortedSet<ObservationId> support,
    SortedSet<String> sources,
    Instant firstSeen,
    Instant lastSeen,
    double confidence,
    LinkStatus status) implements Mergeable<Link> {

  public Link {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(endpointA, "endpointA");
    Objects.requireNonNull(endpointB, "endpointB");
    destination = destination == null ? Optional.empty() : destination;
    gateway = gateway == null ? Optional.empty() : gateway;
    metric = metric == null ? Optional.empty() : metric;
    gatewayOwner = gatewayOwner == null ? Optional.empty() : gatewayOwner;
    support = Merges.sortedSet(support);
    sources = Merges.sortedSet(sources);
    Objects.requireNonNull(firstSeen, "firstSeen");
    Objects.requireNonNull(lastSeen, "lastSeen");
    Objects.requireNonNull(status, "status");
    if (kind == LinkKind.ADJACENCY && endpointA.compareTo(endpointB) > 0) {
      throw new IllegalArgumentException("adjacency endpoints must be sorted: " + id);
    }
    if (kind == LinkKind.ROUTE && destination.isEmpty()) {
      throw new IllegalArgumentException("route link " + id + " requires a destination");
    }
  }

  @Override
  public Link mergeWith(Link other) {
    if (!id.equals(other.id)) {
      throw new IllegalArgumentException("cannot merge link " + other.id + " into " + id);
    }
    Optional<Integer> lowestMetric = metric.isEmpty() ? other.metric
        : other.metric.isEmpty() ? metric
        : Optional.of(Math.min(metric.get(), other.metric.get()));
    Optional<OwnerClaim> owner = gatewayOwner.isEmpty() ? other.gatewayOwner
        : Optional.of(gatewayOwner.get().max(other.gatewayOwner.orElse(null)));
    return new Link(
        id,
        kind,
        endpointA,
        endpointB,
        Merges.either(destination, other.destination),
        Merges.either(gateway, other.gateway),
        lowestMetric,
        owner,
        Merges.union(support, other.support),
        Merges.union(sources, other.sources),
        firstSeen.isBefore(other.firstSeen) ? firstSeen : other.firstSeen,
        lastSeen.isAfter(other.lastSeen) ? lastSeen : other.lastSeen,
        confidence,
        status);
  }

  /**
   * Returns the node this edge ends at: the other interface for adjacencies, the gateway owner
   * interface or the reachability node for routes.
   *
   * @return target node id
   */
  public String target() {
    if (kind == LinkKind.ROUTE) {
      return gatewayOwner.map(OwnerClaim::interfaceId).orElse(endpointB);
    }
    return endpointB;
  }

  /**
   * Returns a copy whose gateway owner is the winner of the current claim and {@code claim}.
   *
   * @param claim ownership claim for the gateway address
   * @return updated link
   */
  public Link withGatewayOwner(OwnerClaim claim) {
    OwnerClaim winner = claim.max(gatewayOwner.orElse(null));
    return new Link(id, kind, endpointA, endpointB, destination, gateway, metric, Optional.of(winner),
        support, sources, firstSeen, lastSeen, confidence, status);
  }

  /**
   * Returns a copy carrying freshly assessed confidence and status.
   *
   * @param newConfidence assessed confidence
   * @param newStatus assessed status
   * @return reassessed link
   */
  public Link assessed(double newConfidence, LinkStatus newStatus) {
    return new Link(id, kind, endpointA, endpointB, destination, gateway, metric, gatewayOwner,
        support, sources, firstSeen, lastSeen, newConfidence, newStatus);
  }
}
