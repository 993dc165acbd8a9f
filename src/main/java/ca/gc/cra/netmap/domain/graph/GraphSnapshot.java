package ca.gc.cra.netmap.domain.graph;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Filtered, consistent view of the graph at {@code takenAt}.
 *
 * @param takenAt evaluation instant used for staleness
 * @param hosts active hosts
 * @param interfaces every interface
 * @param links links passing the filter
 * @param reachability unresolved and direct reachability nodes
 */
public record GraphSnapshot(
    Instant takenAt,
    List<Host> hosts,
    List<NetInterface> interfaces,
    List<LinkView> links,
    List<Reachability> reachability) {

  public GraphSnapshot {
    Objects.requireNonNull(takenAt, "takenAt");
    hosts = List.copyOf(hosts);
    interfaces = List.copyOf(interfaces);
    links = List.copyOf(links);
    reachability = List.copyOf(reachability);
  }

  public Optional<LinkView> link(String id) {
    return links.stream().filter(view -> view.link().id().equals(id)).findFirst();
  }

  public Optional<Host> host(String id) {
    return hosts.stream().filter(host -> host.id().equals(id)).findFirst();
  }
}
