package ca.gc.cra.netmap.application.port;

import ca.gc.cra.netmap.domain.graph.Host;
import ca.gc.cra.netmap.domain.graph.Link;
import ca.gc.cra.netmap.domain.graph.NetInterface;
import ca.gc.cra.netmap.domain.graph.Reachability;
import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.observation.ObservationId;
import ca.gc.cra.netmap.domain.observation.ObservationRecord;
import java.util.List;
import java.util.Optional;

/**
 * Staged view of the graph store for one batch.
 *
 * <p><strong>Reads</strong> return committed state with this transaction's staged deltas merged
 * in. <strong>Upserts</strong> stage a delta that the store merges, via
 * {@link ca.gc.cra.netmap.domain.graph.Mergeable#mergeWith(Object)}, into whatever is current at
 * commit time. Nothing is visible to other readers before commit.</p>
 *
 * <p>Reads are only stable for identifiers covered by the transaction's lock keys.</p>
 *
 * @since 0.1.0
 */
public interface StoreTransaction {
  Optional<Host> host(String id);

  Optional<NetInterface> networkInterface(String id);

  Optional<Link> link(String id);

  Optional<Reachability> reachability(String id);

  boolean containsObservation(ObservationId id);

  /**
   * Returns every interface that has ever held {@code address}.
   *
   * @param address IP address
   * @return holders, sorted by id
   */
  List<NetInterface> interfacesHolding(IpAddress address);

  /**
   * Returns every route link whose gateway is {@code gateway}.
   *
   * @param gateway next-hop address
   * @return links, sorted by id
   */
  List<Link> routesVia(IpAddress gateway);

  /**
   * Returns every reachability node whose gateway is {@code gateway}.
   *
   * @param gateway next-hop address
   * @return nodes, sorted by id
   */
  List<Reachability> reachabilityVia(IpAddress gateway);

  void recordObservation(ObservationRecord record);

  void upsertInterface(NetInterface delta);

  void upsertLink(Link delta);

  void upsertReachability(Reachability delta);

  /**
   * Registers an action that runs under the store's commit lock, after staged deltas are merged
   * and before the new state is published. Actions run in registration order.
   *
   * @param action commit action
   */
  void onCommit(CommitAction action);

  /** Marks the transaction so the store discards it instead of committing. */
  void rollbackOnly();
}
