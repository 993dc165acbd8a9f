package ca.gc.cra.netmap.infrastructure.store;

import ca.gc.cra.netmap.application.port.CommitAction;
import ca.gc.cra.netmap.application.port.StoreTransaction;
import ca.gc.cra.netmap.domain.graph.GraphState;
import ca.gc.cra.netmap.domain.graph.Host;
import ca.gc.cra.netmap.domain.graph.Link;
import ca.gc.cra.netmap.domain.graph.LinkKind;
import ca.gc.cra.netmap.domain.graph.Mergeable;
import ca.gc.cra.netmap.domain.graph.NetInterface;
import ca.gc.cra.netmap.domain.graph.Reachability;
import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.observation.ObservationId;
import ca.gc.cra.netmap.domain.observation.ObservationRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Transaction that stages merge deltas over a fixed published state.
 */
final class StagedTransaction implements StoreTransaction {
  private final GraphState base;
  private final GraphIndex index;
  private final Map<String, NetInterface> interfaces = new TreeMap<>();
  private final Map<String, Link> links = new TreeMap<>();
  private final Map<String, Reachability> reachability = new TreeMap<>();
  private final Map<ObservationId, ObservationRecord> observations = new LinkedHashMap<>();
  private final List<CommitAction> actions = new ArrayList<>();
  private boolean rollbackOnly;

  StagedTransaction(GraphState base, GraphIndex index) {
    this.base = base;
    this.index = index;
  }

  @Override
  public Optional<Host> host(String id) {
    return Optional.ofNullable(base.hosts().get(id));
  }

  @Override
  public Optional<NetInterface> networkInterface(String id) {
    return merged(base.interfaces().get(id), interfaces.get(id));
  }

  @Override
  public Optional<Link> link(String id) {
    return merged(base.links().get(id), links.get(id));
  }

  @Override
  public Optional<Reachability> reachability(String id) {
    return merged(base.reachability().get(id), reachability.get(id));
  }

  @Override
  public boolean containsObservation(ObservationId id) {
    return observations.containsKey(id) || base.observations().containsKey(id);
  }

  @Override
  public List<NetInterface> interfacesHolding(IpAddress address) {
    Set<String> ids = new TreeSet<>(index.holders(address));
    interfaces.values().stream()
        .filter(iface -> iface.addresses().containsKey(address))
        .forEach(iface -> ids.add(iface.id()));
    return resolve(ids, this::networkInterface);
  }

  @Override
  public List<Link> routesVia(IpAddress gateway) {
    Set<String> ids = new TreeSet<>(index.routesVia(gateway));
    links.values().stream()
        .filter(link -> link.kind() == LinkKind.ROUTE && link.gateway().equals(Optional.of(gateway)))
        .forEach(link -> ids.add(link.id()));
    return resolve(ids, this::link);
  }

  @Override
  public List<Reachability> reachabilityVia(IpAddress gateway) {
    Set<String> ids = new TreeSet<>(index.reachabilityVia(gateway));
    reachability.values().stream()
        .filter(node -> node.gateway().equals(Optional.of(gateway)))
        .forEach(node -> ids.add(node.id()));
    return resolve(ids, this::reachability);
  }

  @Override
  public void recordObservation(ObservationRecord record) {
    observations.putIfAbsent(record.id(), record);
  }

  @Override
  public void upsertInterface(NetInterface delta) {
    interfaces.merge(delta.id(), delta, NetInterface::mergeWith);
  }

  @Override
  public void upsertLink(Link delta) {
    links.merge(delta.id(), delta, Link::mergeWith);
  }

  @Override
  public void upsertReachability(Reachability delta) {
    reachability.merge(delta.id(), delta, Reachability::mergeWith);
  }

  @Override
  public void onCommit(CommitAction action) {
    actions.add(action);
  }

  @Override
  public void rollbackOnly() {
    rollbackOnly = true;
  }

  boolean isRollbackOnly() {
    return rollbackOnly;
  }

  /** Replays staged deltas into {@code working}, then runs the commit actions against it. */
  void commitInto(WorkingState working) {
    observations.values().forEach(working::addObservation);
    interfaces.values().forEach(working::mergeInterface);
    links.values().forEach(working::mergeLink);
    reachability.values().forEach(working::mergeReachability);
    for (CommitAction action : actions) {
      action.apply(working);
    }
  }

  private static <T extends Mergeable<T>> Optional<T> merged(T committed, T staged) {
    if (committed == null) {
      return Optional.ofNullable(staged);
    }
    return Optional.of(staged == null ? committed : committed.mergeWith(staged));
  }

  private static <T> List<T> resolve(Set<String> ids, Function<String, Optional<T>> lookup) {
    if (ids.isEmpty()) {
      return Collections.emptyList();
    }
    List<T> out = new ArrayList<>(ids.size());
    for (String id : ids) {
      lookup.apply(id).ifPresent(out::add);
    }
    return out;
  }
}
