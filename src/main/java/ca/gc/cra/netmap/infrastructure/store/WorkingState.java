package ca.gc.cra.netmap.infrastructure.store;

import ca.gc.cra.netmap.application.port.CommitView;
import ca.gc.cra.netmap.domain.graph.EntityCollection;
import ca.gc.cra.netmap.domain.graph.EntityRef;
import ca.gc.cra.netmap.domain.graph.GraphState;
import ca.gc.cra.netmap.domain.graph.Host;
import ca.gc.cra.netmap.domain.graph.Link;
import ca.gc.cra.netmap.domain.graph.Mergeable;
import ca.gc.cra.netmap.domain.graph.NetInterface;
import ca.gc.cra.netmap.domain.graph.Reachability;
import ca.gc.cra.netmap.domain.observation.ObservationId;
import ca.gc.cra.netmap.domain.observation.ObservationRecord;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Mutable copy of the latest state, built under the commit lock.
 */
final class WorkingState implements CommitView {
  private final GraphState base;
  private final TreeMap<String, Host> hosts;
  private final TreeMap<String, NetInterface> interfaces;
  private final TreeMap<String, Link> links;
  private final TreeMap<String, Reachability> reachability;
  private final TreeMap<ObservationId, ObservationRecord> observations;
  private final List<Runnable> afterPublish = new ArrayList<>();
  private boolean changed;

  WorkingState(GraphState base) {
    this.base = base;
    this.hosts = new TreeMap<>(base.hosts());
    this.interfaces = new TreeMap<>(base.interfaces());
    this.links = new TreeMap<>(base.links());
    this.reachability = new TreeMap<>(base.reachability());
    this.observations = new TreeMap<>(base.observations());
  }

  void addObservation(ObservationRecord record) {
    if (observations.putIfAbsent(record.id(), record) == null) {
      changed = true;
    }
  }

  void mergeInterface(NetInterface delta) {
    merge(interfaces, delta);
  }

  void mergeLink(Link delta) {
    merge(links, delta);
  }

  void mergeReachability(Reachability delta) {
    merge(reachability, delta);
  }

  @Override
  public Optional<Host> host(String id) {
    return Optional.ofNullable(hosts.get(id));
  }

  @Override
  public void putHost(Host host) {
    put(hosts, host.id(), host);
  }

  @Override
  public Optional<NetInterface> networkInterface(String id) {
    return Optional.ofNullable(interfaces.get(id));
  }

  @Override
  public void putInterface(NetInterface iface) {
    put(interfaces, iface.id(), iface);
  }

  @Override
  public Optional<Link> link(String id) {
    return Optional.ofNullable(links.get(id));
  }

  @Override
  public void putLink(Link link) {
    put(links, link.id(), link);
  }

  @Override
  public Collection<Link> links() {
    return Collections.unmodifiableCollection(links.values());
  }

  @Override
  public void afterPublish(Runnable action) {
    afterPublish.add(Objects.requireNonNull(action, "action"));
  }

  boolean changed() {
    return changed;
  }

  List<Runnable> afterPublishActions() {
    return afterPublish;
  }

  GraphState freeze() {
    return new GraphState(hosts, interfaces, links, reachability, observations);
  }

  /** Entities present now that were absent from the base state, in collection then id order. */
  List<EntityRef> created() {
    List<EntityRef> created = new ArrayList<>();
    collect(created, EntityCollection.HOSTS, hosts, base.hosts());
    collect(created, EntityCollection.INTERFACES, interfaces, base.interfaces());
    collect(created, EntityCollection.LINKS, links, base.links());
    collect(created, EntityCollection.REACHABILITY, reachability, base.reachability());
    return created;
  }

  private <T extends Mergeable<T>> void merge(Map<String, T> target, T delta) {
    T current = target.get(delta.id());
    put(target, delta.id(), current == null ? delta : current.mergeWith(delta));
  }

  private <T> void put(Map<String, T> target, String id, T value) {
    T previous = target.put(id, value);
    if (!value.equals(previous)) {
      changed = true;
    }
  }

  private static void collect(
      List<EntityRef> out, EntityCollection collection, Map<String, ?> now, Map<String, ?> before) {
    for (String id : now.keySet()) {
      if (!before.containsKey(id)) {
        out.add(new EntityRef(collection, id));
      }
    }
  }
}
