package ca.gc.cra.netmap.domain.graph;

import ca.gc.cra.netmap.domain.observation.ObservationId;
import ca.gc.cra.netmap.domain.observation.ObservationRecord;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable image of every persisted collection at one commit.
 *
 * <p>Collections are keyed by entity id and sorted, so two states are {@code equals} exactly when
 * they hold the same entities regardless of insertion history.</p>
 *
 * @param hosts hosts by id, including merged tombstones
 * @param interfaces interfaces by id
 * @param links links by id
 * @param reachability reachability nodes by id
 * @param observations accepted observations by id
 * @since 0.1.0
 */
public record GraphState(
    Map<String, Host> hosts,
    Map<String, NetInterface> interfaces,
    Map<String, Link> links,
    Map<String, Reachability> reachability,
    Map<ObservationId, ObservationRecord> observations) {

  private static final GraphState EMPTY = new GraphState(null, null, null, null, null);

  public GraphState {
    hosts = freeze(hosts);
    interfaces = freeze(interfaces);
    links = freeze(links);
    reachability = freeze(reachability);
    observations = freeze(observations);
  }

  public static GraphState empty() {
    return EMPTY;
  }

  /**
   * Follows {@code mergedInto} redirects until an active host is reached.
   *
   * @param hostId any host id ever assigned
   * @return active host, or {@code null} when unknown
   */
  public Host resolveHost(String hostId) {
    Host current = hosts.get(hostId);
    int hops = 0;
    while (current != null && !current.isActive()) {
      current = hosts.get(current.mergedInto().orElseThrow());
      if (++hops > hosts.size()) {
        throw new IllegalStateException("merge redirect cycle at host " + hostId);
      }
    }
    return current;
  }

  public int entityCount() {
    return hosts.size() + interfaces.size() + links.size() + reachability.size();
  }

  private static <K extends Comparable<? super K>, V> Map<K, V> freeze(Map<K, V> source) {
    if (source == null || source.isEmpty()) {
      return Collections.emptySortedMap();
    }
    return Collections.unmodifiableSortedMap(new TreeMap<>(source));
  }
}
