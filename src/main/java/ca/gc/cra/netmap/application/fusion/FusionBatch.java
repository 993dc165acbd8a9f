package ca.gc.cra.netmap.application.fusion;

import ca.gc.cra.netmap.application.identity.IdentitySession;
import ca.gc.cra.netmap.application.port.ClockPort;
import ca.gc.cra.netmap.application.port.MetricsPort;
import ca.gc.cra.netmap.application.port.StoreTransaction;
import ca.gc.cra.netmap.domain.graph.Claim;
import ca.gc.cra.netmap.domain.graph.EntityIds;
import ca.gc.cra.netmap.domain.graph.HostMerge;
import ca.gc.cra.netmap.domain.graph.InterfaceOrigin;
import ca.gc.cra.netmap.domain.graph.IpConflict;
import ca.gc.cra.netmap.domain.graph.Link;
import ca.gc.cra.netmap.domain.graph.LinkKind;
import ca.gc.cra.netmap.domain.graph.LinkStatus;
import ca.gc.cra.netmap.domain.graph.NetInterface;
import ca.gc.cra.netmap.domain.graph.OwnerClaim;
import ca.gc.cra.netmap.domain.graph.Reachability;
import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.net.LinkAddress;
import ca.gc.cra.netmap.domain.observation.ArpEntry;
import ca.gc.cra.netmap.domain.observation.HostAlias;
import ca.gc.cra.netmap.domain.observation.ObservationId;
import ca.gc.cra.netmap.domain.observation.ObservationRecord;
import ca.gc.cra.netmap.domain.observation.RecordKind;
import ca.gc.cra.netmap.domain.observation.RouteEntry;
import ca.gc.cra.netmap.domain.observation.TraceHop;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records fused into one store transaction.
 *
 * <p>Created by {@link TopologyFusionEngine#begin}. Links touched by the batch are reassessed by a
 * commit action so their status reflects support merged from concurrent batches too.</p>
 *
 * <p>Not thread-safe.</p>
 */
public final class FusionBatch {
  private static final Logger log = LoggerFactory.getLogger(FusionBatch.class);

  private final StoreTransaction tx;
  private final IdentitySession identity;
  private final MetricsPort metrics;
  private final SortedSet<String> touchedLinks = new TreeSet<>();
  private final List<ConflictReport> conflicts = new ArrayList<>();
  private int fused;

  FusionBatch(
      StoreTransaction tx,
      IdentitySession identity,
      LinkAssessor assessor,
      ClockPort clock,
      MetricsPort metrics) {
    this.tx = tx;
    this.identity = identity;
    this.metrics = metrics;
    tx.onCommit(view -> {
      Instant now = clock.now();
      for (String id : touchedLinks) {
        view.link(id).ifPresent(link -> view.putLink(assessor.assess(link, now)));
      }
    });
  }

  /**
   * Fuses one record unless the store already holds it.
   *
   * @param record normalized record
   * @return {@code false} when the record was a duplicate and nothing changed
   */
  public boolean apply(ObservationRecord record) {
    if (tx.containsObservation(record.id())) {
      log.debug("Skipping duplicate observation {}", record.id());
      return false;
    }
    tx.recordObservation(record);
    if (record instanceof ArpEntry arp) {
      fuseArp(arp);
    } else if (record instanceof RouteEntry route) {
      fuseRoute(route);
    } else if (record instanceof HostAlias alias) {
      fuseAlias(alias);
    } else if (record instanceof TraceHop hop) {
      fuseHop(hop);
    }
    fused++;
    return true;
  }

  public List<ConflictReport> conflicts() {
    return Collections.unmodifiableList(conflicts);
  }

  /** Identity evidence of this batch; its applied merges are known after commit. */
  public IdentitySession identity() {
    return identity;
  }

  public int fusedCount() {
    return fused;
  }

  private void fuseArp(ArpEntry arp) {
    Claim claim = Claim.of(arp.id(), arp.observedAt());
    String local = reportedInterface(arp.sourceHostId(), arp.localInterface(), claim);
    String neighbor = linkInterface(arp.neighborLinkAddress(), Optional.of(arp.neighborIp()), claim);
    claimAddress(neighbor, arp.neighborIp());
    detectConflict(arp.neighborIp(), arp.id());

    String first = local.compareTo(neighbor) <= 0 ? local : neighbor;
    String second = first.equals(local) ? neighbor : local;
    Link adjacency = new Link(
        EntityIds.adjacency(local, neighbor),
        LinkKind.ADJACENCY,
        first,
        second,
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        only(arp.id()),
        only(arp.sourceHostId()),
        arp.observedAt(),
        arp.observedAt(),
        0.0,
        LinkStatus.PROPOSED);
    tx.upsertLink(adjacency);
    touchedLinks.add(adjacency.id());
  }

  private void fuseRoute(RouteEntry route) {
    Claim claim = Claim.of(route.id(), route.observedAt());
    String from = reportedInterface(route.sourceHostId(), route.outgoingInterface(), claim);
    Optional<OwnerClaim> owner = route.gateway().flatMap(this::currentOwner);

    String nodeId = EntityIds.reachability(route.destination(), route.gateway());
    tx.upsertReachability(new Reachability(nodeId, route.destination(), route.gateway(), owner, claim));

    Link edge = new Link(
        EntityIds.route(from, route.destination(), route.gateway()),
        LinkKind.ROUTE,
        from,
        nodeId,
        Optional.of(route.destination()),
        route.gateway(),
        Optional.of(route.metric()),
        owner,
        only(route.id()),
        only(route.sourceHostId()),
        route.observedAt(),
        route.observedAt(),
        0.0,
        LinkStatus.PROPOSED);
    tx.upsertLink(edge);
    touchedLinks.add(edge.id());
  }

  /**
   * A hop is a path edge towards the target's host prefix: from the source host for the first hop,
   * otherwise from the node of the previous hop. Hops after a silent TTL only record their node.
   */
  private void fuseHop(TraceHop hop) {
    Claim claim = Claim.of(hop.id(), hop.observedAt());
    Optional<IpAddress> gateway = Optional.of(hop.address());
    String nodeId = EntityIds.reachability(hop.destination(), gateway);
    Optional<OwnerClaim> owner = currentOwner(hop.address());
    tx.upsertReachability(new Reachability(nodeId, hop.destination(), gateway, owner, claim));

    Optional<String> from = Optional.empty();
    if (hop.firstHop()) {
      from = Optional.of(reportedInterface(hop.sourceHostId(), TraceHop.TRACE_INTERFACE, claim));
    } else if (hop.previousHop().isPresent()) {
      IpAddress previous = hop.previousHop().get();
      String previousId = EntityIds.reachability(hop.destination(), hop.previousHop());
      tx.upsertReachability(new Reachability(
          previousId, hop.destination(), hop.previousHop(), currentOwner(previous), claim));
      from = Optional.of(previousId);
    }
    if (from.isEmpty()) {
      log.debug("Hop {} towards {} follows a silent hop; no path edge", hop.hop(), hop.target());
      return;
    }
    Link edge = new Link(
        EntityIds.route(from.get(), hop.destination(), gateway),
        LinkKind.ROUTE,
        from.get(),
        nodeId,
        Optional.of(hop.destination()),
        gateway,
        Optional.of(hop.hop()),
        owner,
        only(hop.id()),
        only(hop.sourceHostId()),
        hop.observedAt(),
        hop.observedAt(),
        0.0,
        LinkStatus.PROPOSED);
    tx.upsertLink(edge);
    touchedLinks.add(edge.id());
  }

  private void fuseAlias(HostAlias alias) {
    Claim claim = Claim.of(alias.id(), alias.observedAt());
    linkInterface(alias.linkAddress(), Optional.empty(), claim);
    String hostSeed = EntityIds.reportedHostSeed(alias.hostId());
    identity.label(hostSeed, alias.hostId(), claim);
    identity.union(new HostMerge(hostSeed, EntityIds.linkHostSeed(alias.linkAddress()), RecordKind.ALIAS, alias.id()));
  }

  private String reportedInterface(String sourceHostId, String localIdentifier, Claim claim) {
    String id = EntityIds.reportedInterface(sourceHostId, localIdentifier);
    Optional<IpAddress> address = IpAddress.tryParse(localIdentifier);
    tx.upsertInterface(new NetInterface(
        id,
        InterfaceOrigin.REPORTED,
        Optional.empty(),
        Optional.of(sourceHostId),
        null,
        address.map(a -> entry(a, claim)).orElse(null),
        address.isPresent() ? null : entry(localIdentifier, claim),
        null,
        claim));
    String seed = EntityIds.reportedHostSeed(sourceHostId);
    identity.attach(id, seed, claim);
    identity.label(seed, sourceHostId, claim);
    address.ifPresent(a -> claimAddress(id, a));
    return id;
  }

  private String linkInterface(LinkAddress linkAddress, Optional<IpAddress> address, Claim claim) {
    String id = EntityIds.linkInterface(linkAddress);
    tx.upsertInterface(new NetInterface(
        id,
        InterfaceOrigin.LINK_ADDRESS,
        Optional.empty(),
        Optional.empty(),
        entry(linkAddress, claim),
        address.map(a -> entry(a, claim)).orElse(null),
        null,
        null,
        claim));
    identity.attach(id, EntityIds.linkHostSeed(linkAddress), claim);
    return id;
  }

  /** Folds the interface's claim on {@code address} into every route and node using it as gateway. */
  private void claimAddress(String interfaceId, IpAddress address) {
    OwnerClaim claim = tx.networkInterface(interfaceId)
        .flatMap(iface -> iface.ownerClaim(address))
        .orElseThrow(() -> new IllegalStateException(interfaceId + " does not hold " + address));
    for (Link route : tx.routesVia(address)) {
      Link rewired = route.withGatewayOwner(claim);
      if (!rewired.equals(route)) {
        tx.upsertLink(rewired);
      }
    }
    for (Reachability node : tx.reachabilityVia(address)) {
      Reachability resolved = node.withResolvedBy(claim);
      if (!resolved.equals(node)) {
        tx.upsertReachability(resolved);
      }
    }
  }

  private Optional<OwnerClaim> currentOwner(IpAddress address) {
    return tx.interfacesHolding(address).stream()
        .map(iface -> iface.ownerClaim(address))
        .flatMap(Optional::stream)
        .max(OwnerClaim.precedence());
  }

  /**
   * Annotates every link-address interface holding {@code address} when there is more than one.
   * The annotation lists all holders and every observation binding the address to them.
   */
  private void detectConflict(IpAddress address, ObservationId observation) {
    List<NetInterface> holders = tx.interfacesHolding(address).stream()
        .filter(iface -> iface.origin() == InterfaceOrigin.LINK_ADDRESS)
        .toList();
    if (holders.size() < 2) {
      return;
    }
    TreeSet<String> ids = new TreeSet<>();
    TreeSet<ObservationId> evidence = new TreeSet<>();
    for (NetInterface holder : holders) {
      ids.add(holder.id());
      evidence.addAll(holder.addresses().get(address).observations());
    }
    IpConflict conflict = new IpConflict(address, ids, evidence);
    for (NetInterface holder : holders) {
      tx.upsertInterface(new NetInterface(
          holder.id(),
          holder.origin(),
          Optional.empty(),
          Optional.empty(),
          null,
          null,
          null,
          entry(address, conflict),
          holder.seen()));
    }
    conflicts.add(new ConflictReport(address, List.copyOf(ids), observation));
    metrics.increment("fusion.conflicts.raised");
    log.warn("IP {} is held by {} link addresses: {}", address, ids.size(), ids);
  }

  private static <K extends Comparable<? super K>, V> SortedMap<K, V> entry(K key, V value) {
    SortedMap<K, V> map = new TreeMap<>();
    map.put(key, value);
    return map;
  }

  private static <T extends Comparable<? super T>> SortedSet<T> only(T value) {
    SortedSet<T> set = new TreeSet<>();
    set.add(value);
    return set;
  }
}
