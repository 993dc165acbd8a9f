package ca.gc.cra.netmap.infrastructure.store;

import ca.gc.cra.netmap.domain.graph.GraphState;
import ca.gc.cra.netmap.domain.graph.Link;
import ca.gc.cra.netmap.domain.graph.LinkKind;
import ca.gc.cra.netmap.domain.graph.NetInterface;
import ca.gc.cra.netmap.domain.graph.Reachability;
import ca.gc.cra.netmap.domain.net.IpAddress;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Secondary indexes over one published state: address holders and gateway users.
 */
final class GraphIndex {
  private final Map<IpAddress, SortedSet<String>> holders;
  private final Map<IpAddress, SortedSet<String>> routesByGateway;
  private final Map<IpAddress, SortedSet<String>> reachabilityByGateway;

  private GraphIndex(
      Map<IpAddress, SortedSet<String>> holders,
      Map<IpAddress, SortedSet<String>> routesByGateway,
      Map<IpAddress, SortedSet<String>> reachabilityByGateway) {
    this.holders = holders;
    this.routesByGateway = routesByGateway;
    this.reachabilityByGateway = reachabilityByGateway;
  }

  static GraphIndex of(GraphState state) {
    Map<IpAddress, SortedSet<String>> holders = new HashMap<>();
    Map<IpAddress, SortedSet<String>> routes = new HashMap<>();
    Map<IpAddress, SortedSet<String>> nodes = new HashMap<>();
    for (NetInterface iface : state.interfaces().values()) {
      for (IpAddress address : iface.addresses().keySet()) {
        holders.computeIfAbsent(address, k -> new TreeSet<>()).add(iface.id());
      }
    }
    for (Link link : state.links().values()) {
      if (link.kind() == LinkKind.ROUTE) {
        link.gateway().ifPresent(gw -> routes.computeIfAbsent(gw, k -> new TreeSet<>()).add(link.id()));
      }
    }
    for (Reachability node : state.reachability().values()) {
      node.gateway().ifPresent(gw -> nodes.computeIfAbsent(gw, k -> new TreeSet<>()).add(node.id()));
    }
    return new GraphIndex(holders, routes, nodes);
  }

  SortedSet<String> holders(IpAddress address) {
    return holders.getOrDefault(address, Collections.emptySortedSet());
  }

  SortedSet<String> routesVia(IpAddress gateway) {
    return routesByGateway.getOrDefault(gateway, Collections.emptySortedSet());
  }

  SortedSet<String> reachabilityVia(IpAddress gateway) {
    return reachabilityByGateway.getOrDefault(gateway, Collections.emptySortedSet());
  }
}
