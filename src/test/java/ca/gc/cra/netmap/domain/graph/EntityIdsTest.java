package ca.gc.cra.netmap.domain.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netmap.domain.net.Cidr;
import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.net.LinkAddress;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EntityIdsTest {

  @Test
  void adjacencyIdIgnoresEndpointOrder() {
    assertEquals(EntityIds.adjacency("if/b", "if/a"), EntityIds.adjacency("if/a", "if/b"));
    assertEquals("adj/if/a|if/b", EntityIds.adjacency("if/b", "if/a"));
  }

  @Test
  void seedKindsAreDistinguishable() {
    LinkAddress link = LinkAddress.parse("00:16:3e:00:00:07");
    assertTrue(EntityIds.isReportedHostSeed(EntityIds.reportedHostSeed("web-01")));
    assertFalse(EntityIds.isReportedHostSeed(EntityIds.linkHostSeed(link)));
    assertEquals("if/mac/00163e000007", EntityIds.linkInterface(link));
  }

  @Test
  void routeAndReachabilityIdsNameGateway() {
    Cidr any = Cidr.parse("0.0.0.0/0");
    Optional<IpAddress> gw = Optional.of(IpAddress.parse("10.0.0.1"));
    assertEquals("route/if/src/web-01/eth0|0.0.0.0/0|10.0.0.1",
        EntityIds.route("if/src/web-01/eth0", any, gw));
    assertEquals("net/10.0.0.0/24/direct", EntityIds.reachability(Cidr.parse("10.0.0.0/24"), Optional.empty()));
    assertEquals("net/0.0.0.0/0/via/10.0.0.1", EntityIds.reachability(any, gw));
  }

  @Test
  void ownerClaimPrefersLatestThenSmallerId() {
    Instant at = Instant.parse("2024-05-01T12:00:00Z");
    OwnerClaim older = new OwnerClaim("if/a", at);
    OwnerClaim newer = new OwnerClaim("if/z", at.plusSeconds(1));
    assertEquals(newer, older.max(newer));
    assertEquals(newer, newer.max(older));
    OwnerClaim tieA = new OwnerClaim("if/a", at);
    OwnerClaim tieB = new OwnerClaim("if/b", at);
    assertEquals(tieA, tieB.max(tieA));
    assertEquals(tieA, tieA.max(tieB));
  }

  @Test
  void filterHidesStaleByDefault() {
    Instant at = Instant.parse("2024-05-01T12:00:00Z");
    Link stale = new Link("adj/if/a|if/b", LinkKind.ADJACENCY, "if/a", "if/b", null, null, null, null,
        null, null, at, at, 0.75, LinkStatus.STALE);
    assertFalse(GraphFilter.defaults().accepts(stale));
    assertTrue(new GraphFilter(true, 0.5).accepts(stale));
    assertFalse(new GraphFilter(true, 0.8).accepts(stale));
  }
}
