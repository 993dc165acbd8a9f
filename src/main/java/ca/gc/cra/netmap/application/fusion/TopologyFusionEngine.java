package ca.gc.cra.netmap.application.fusion;

import ca.gc.cra.netmap.application.identity.IdentityResolver;
import ca.gc.cra.netmap.application.port.ClockPort;
import ca.gc.cra.netmap.application.port.MetricsPort;
import ca.gc.cra.netmap.application.port.StoreTransaction;
import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.observation.ArpEntry;
import ca.gc.cra.netmap.domain.observation.HostAlias;
import ca.gc.cra.netmap.domain.observation.ObservationRecord;
import ca.gc.cra.netmap.domain.observation.RouteEntry;
import ca.gc.cra.netmap.domain.observation.TraceHop;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns normalized observations into graph mutations.
 *
 * <p><strong>What:</strong> For every record the engine resolves the interfaces it names, upserts
 * adjacency and route edges with the record as support, maintains reachability nodes for route
 * destinations and traceroute hops, and pushes IP ownership claims to routes that use the address
 * as a gateway. Hop edges are route edges chained through the hop nodes.</p>
 * <p><strong>Why:</strong> Every mutation is a commutative, idempotent merge (set union, min/max,
 * max-claim ownership), so any partition of the records applied in any order converges to the
 * same graph.</p>
 * <p><strong>Role:</strong> Application service called by the ingestion use case inside a store
 * transaction. Identity evidence is handed to {@link IdentityResolver}; edge scoring to
 * {@link LinkAssessor}, both at commit time.</p>
 * <p><strong>Thread-safety:</strong> The engine is stateless and shared; each
 * {@link FusionBatch} belongs to one transaction.</p>
 * <p><strong>Observability:</strong> Increments {@code fusion.conflicts.raised}.</p>
 *
 * @since 0.1.0
 */
public final class TopologyFusionEngine {
  private final IdentityResolver resolver;
  private final LinkAssessor assessor;
  private final ClockPort clock;
  private final MetricsPort metrics;

  public TopologyFusionEngine(
      IdentityResolver resolver, LinkAssessor assessor, ClockPort clock, MetricsPort metrics) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.assessor = Objects.requireNonNull(assessor, "assessor");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Starts fusing records into {@code tx}.
   *
   * @param tx open store transaction
   * @return batch accepting records for this transaction
   */
  public FusionBatch begin(StoreTransaction tx) {
    Objects.requireNonNull(tx, "tx");
    return new FusionBatch(tx, resolver.open(tx), assessor, clock, metrics);
  }

  /**
   * Returns the raw identifiers fusing {@code record} reads or writes. Batches sharing any key
   * serialize; disjoint batches run in parallel.
   *
   * @param record normalized record
   * @return lock keys such as {@code src:web-01}, {@code mac:0011223344aa}, {@code ip:10.0.0.1}
   */
  public static Set<String> lockKeys(ObservationRecord record) {
    Set<String> keys = new TreeSet<>();
    if (record instanceof ArpEntry arp) {
      keys.add(sourceKey(arp.sourceHostId()));
      keys.add(linkKey(arp));
      keys.add(ipKey(arp.neighborIp()));
      IpAddress.tryParse(arp.localInterface()).ifPresent(local -> keys.add(ipKey(local)));
    } else if (record instanceof RouteEntry route) {
      keys.add(sourceKey(route.sourceHostId()));
      route.gateway().ifPresent(gateway -> keys.add(ipKey(gateway)));
      IpAddress.tryParse(route.outgoingInterface()).ifPresent(local -> keys.add(ipKey(local)));
    } else if (record instanceof HostAlias alias) {
      keys.add(sourceKey(alias.hostId()));
      keys.add("mac:" + alias.linkAddress().value());
    } else if (record instanceof TraceHop hop) {
      keys.add(sourceKey(hop.sourceHostId()));
      keys.add(ipKey(hop.address()));
      hop.previousHop().ifPresent(previous -> keys.add(ipKey(previous)));
    }
    return keys;
  }

  private static String sourceKey(String sourceHostId) {
    return "src:" + sourceHostId;
  }

  private static String linkKey(ArpEntry arp) {
    return "mac:" + arp.neighborLinkAddress().value();
  }

  private static String ipKey(IpAddress address) {
    return "ip:" + address;
  }
}
