package ca.gc.cra.netmap.application.pipeline;

import ca.gc.cra.netmap.application.fusion.LinkAssessor;
import ca.gc.cra.netmap.application.port.ClockPort;
import ca.gc.cra.netmap.application.port.GraphStorePort;
import ca.gc.cra.netmap.domain.graph.GraphFilter;
import ca.gc.cra.netmap.domain.graph.GraphSnapshot;
import ca.gc.cra.netmap.domain.graph.GraphState;
import ca.gc.cra.netmap.domain.graph.Host;
import ca.gc.cra.netmap.domain.graph.Link;
import ca.gc.cra.netmap.domain.graph.LinkView;
import ca.gc.cra.netmap.domain.graph.NetInterface;
import ca.gc.cra.netmap.domain.graph.OwnerClaim;
import ca.gc.cra.netmap.domain.graph.Reachability;
import ca.gc.cra.netmap.domain.graph.ReachabilityStatus;
import ca.gc.cra.netmap.domain.net.IpAddress;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read side of the topology graph.
 *
 * <p>Every query reads the store's last published state and never blocks on ingestion. Link status
 * is re-evaluated against the clock on each query, so a link past the staleness window reads as
 * stale even before the sweeper has persisted the demotion.</p>
 *
 * @since 0.1.0
 */
public final class GraphQueryUseCase {
  private final GraphStorePort store;
  private final LinkAssessor assessor;
  private final ClockPort clock;

  public GraphQueryUseCase(GraphStorePort store, LinkAssessor assessor, ClockPort clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.assessor = Objects.requireNonNull(assessor, "assessor");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the active hosts, all interfaces, the links passing {@code filter} and the reachability
   * nodes not yet resolved to an interface.
   *
   * @param filter staleness and confidence filter
   * @return consistent snapshot
   */
  public GraphSnapshot getGraph(GraphFilter filter) {
    Objects.requireNonNull(filter, "filter");
    GraphState state = store.snapshot();
    Instant now = clock.now();

    List<Host> hosts = state.hosts().values().stream().filter(Host::isActive).toList();
    List<LinkView> links = new ArrayList<>();
    for (Link stored : state.links().values()) {
      Link link = assessor.assess(stored, now);
      if (filter.accepts(link)) {
        links.add(view(state, link));
      }
    }
    List<Reachability> reachability = state.reachability().values().stream()
        .filter(node -> node.status() != ReachabilityStatus.RESOLVED)
        .toList();
    return new GraphSnapshot(now, hosts, List.copyOf(state.interfaces().values()), links, reachability);
  }

  /**
   * Looks a host up by any id it has ever had.
   *
   * @param id canonical or merged host id
   * @return the active host the id resolves to; empty when unknown
   */
  public Optional<Host> getHost(String id) {
    Objects.requireNonNull(id, "id");
    return Optional.ofNullable(store.snapshot().resolveHost(id));
  }

  /**
   * Returns the interface currently holding {@code address}: the holder seen with it most
   * recently, ties going to the smaller interface id.
   *
   * @param address IP address
   * @return current owner, if any interface has held the address
   */
  public Optional<NetInterface> currentOwner(IpAddress address) {
    Objects.requireNonNull(address, "address");
    GraphState state = store.snapshot();
    return state.interfaces().values().stream()
        .map(iface -> iface.ownerClaim(address))
        .flatMap(Optional::stream)
        .max(OwnerClaim.precedence())
        .map(claim -> state.interfaces().get(claim.interfaceId()));
  }

  private static LinkView view(GraphState state, Link link) {
    String target = link.target();
    String fromHost = hostOf(state, sourceInterface(state, link.endpointA())).orElse(link.endpointA());
    return new LinkView(link, fromHost, target, hostOf(state, target));
  }

  /** Hop edges may start at a hop node; once resolved it stands for its gateway owner. */
  private static String sourceInterface(GraphState state, String endpoint) {
    Reachability node = state.reachability().get(endpoint);
    if (node == null) {
      return endpoint;
    }
    return node.resolvedBy().map(OwnerClaim::interfaceId).orElse(endpoint);
  }

  private static Optional<String> hostOf(GraphState state, String interfaceId) {
    NetInterface iface = state.interfaces().get(interfaceId);
    if (iface == null) {
      return Optional.empty();
    }
    return iface.hostId().map(state::resolveHost).map(Host::id);
  }
}
