package ca.gc.cra.netmap.domain.graph;

import ca.gc.cra.netmap.domain.net.Cidr;
import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.net.LinkAddress;
import java.util.Optional;

/**
 * Deterministic id scheme for graph entities.
 *
 * <p>Ids are derived from raw identifiers only, never from arrival order, so two stores fed the
 * same observations in different orders agree on every key.</p>
 */
public final class EntityIds {
  private static final String HOST_SOURCE_PREFIX = "host/src/";
  private static final String HOST_LINK_PREFIX = "host/mac/";

  private EntityIds() {}

  public static String reportedHostSeed(String sourceHostId) {
    return HOST_SOURCE_PREFIX + sourceHostId;
  }

  public static String linkHostSeed(LinkAddress linkAddress) {
    return HOST_LINK_PREFIX + linkAddress.value();
  }

  public static boolean isReportedHostSeed(String seedId) {
    return seedId.startsWith(HOST_SOURCE_PREFIX);
  }

  public static String linkInterface(LinkAddress linkAddress) {
    return "if/mac/" + linkAddress.value();
  }

  public static String reportedInterface(String sourceHostId, String localIdentifier) {
    return "if/src/" + sourceHostId + "/" + localIdentifier;
  }

  /**
   * Undirected adjacency id; endpoint order does not matter.
   *
   * @param interfaceA one endpoint
   * @param interfaceB other endpoint
   * @return link id
   */
  public static String adjacency(String interfaceA, String interfaceB) {
    boolean ordered = interfaceA.compareTo(interfaceB) <= 0;
    return "adj/" + (ordered ? interfaceA : interfaceB) + "|" + (ordered ? interfaceB : interfaceA);
  }

  public static String route(String fromInterface, Cidr destination, Optional<IpAddress> gateway) {
    return "route/" + fromInterface + "|" + destination + "|" + gateway.map(IpAddress::toString).orElse("on-link");
  }

  public static String reachability(Cidr destination, Optional<IpAddress> gateway) {
    return "net/" + destination + gateway.map(gw -> "/via/" + gw).orElse("/direct");
  }
}
