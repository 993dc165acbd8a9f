package ca.gc.cra.netmap.application.pipeline;

import static ca.gc.cra.netmap.application.pipeline.RawRecords.alias;
import static ca.gc.cra.netmap.application.pipeline.RawRecords.arp;
import static ca.gc.cra.netmap.application.pipeline.RawRecords.hop;
import static ca.gc.cra.netmap.application.pipeline.RawRecords.route;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netmap.application.fusion.LinkAssessor;
import ca.gc.cra.netmap.application.fusion.TopologyFusionEngine;
import ca.gc.cra.netmap.application.identity.IdentityResolver;
import ca.gc.cra.netmap.application.normalize.RecordNormalizer;
import ca.gc.cra.netmap.application.port.MetricsPort;
import ca.gc.cra.netmap.config.FusionConfig;
import ca.gc.cra.netmap.config.StoreConfig;
import ca.gc.cra.netmap.domain.graph.GraphFilter;
import ca.gc.cra.netmap.domain.graph.GraphSnapshot;
import ca.gc.cra.netmap.domain.graph.LinkStatus;
import ca.gc.cra.netmap.domain.graph.LinkView;
import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.infrastructure.store.InMemoryGraphStore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GraphQueryUseCaseTest {
  private final AtomicReference<Instant> now = new AtomicReference<>(RawRecords.T0.plusSeconds(60));
  private InMemoryGraphStore store;
  private IngestUseCase ingest;
  private GraphQueryUseCase query;

  @BeforeEach
  void setUp() throws Exception {
    store = new InMemoryGraphStore();
    IdentityResolver resolver = new IdentityResolver();
    LinkAssessor assessor = new LinkAssessor(FusionConfig.defaults());
    TopologyFusionEngine engine = new TopologyFusionEngine(resolver, assessor, now::get, MetricsPort.NO_OP);
    StoreConfig config = new StoreConfig(
        Optional.empty(), false, Duration.ofSeconds(5), 3, Duration.ofMillis(1), Duration.ofMillis(4), 1);
    ingest = new IngestUseCase(store, resolver, engine, new RecordNormalizer(), config, MetricsPort.NO_OP);
    query = new GraphQueryUseCase(store, assessor, now::get);

    ingest.ingest("web-01", List.of(
        arp("eth0", "10.0.0.1", "00:16:3e:00:00:01"),
        route("0.0.0.0/0", "10.0.0.1", "eth0"),
        route("172.16.0.0/16", "10.0.0.254", "eth0")), IngestOptions.defaults());
    ingest.ingest("operator", List.of(alias("gw-01", "00:16:3e:00:00:01")), IngestOptions.defaults());
  }

  @AfterEach
  void tearDown() {
    ingest.close();
  }

  @Test
  void graphLiftsEndpointsToHosts() {
    GraphSnapshot snapshot = query.getGraph(GraphFilter.defaults());

    LinkView route = snapshot.link("route/if/src/web-01/eth0|0.0.0.0/0|10.0.0.1").orElseThrow();
    assertEquals("host/src/web-01", route.fromHostId());
    assertEquals("if/mac/00163e000001", route.toNodeId());
    assertEquals(Optional.of("host/src/gw-01"), route.toHostId());
    assertTrue(snapshot.host("host/mac/00163e000001").isEmpty());
    assertTrue(snapshot.host("host/src/gw-01").isPresent());
  }

  @Test
  void hopEdgeStartsAtHostOwningPreviousHop() throws Exception {
    ingest.ingest("web-01", List.of(
        hop("8.8.8.8", 1, null, "10.0.0.1"),
        hop("8.8.8.8", 2, "10.0.0.1", "192.168.1.1")), IngestOptions.defaults());

    GraphSnapshot snapshot = query.getGraph(GraphFilter.defaults());

    LinkView firstHop = snapshot.link("route/if/src/web-01/traceroute|8.8.8.8/32|10.0.0.1").orElseThrow();
    assertEquals("host/src/web-01", firstHop.fromHostId());
    assertEquals(Optional.of("host/src/gw-01"), firstHop.toHostId());
    LinkView secondHop = snapshot.link("route/net/8.8.8.8/32/via/10.0.0.1|8.8.8.8/32|192.168.1.1").orElseThrow();
    assertEquals("host/src/gw-01", secondHop.fromHostId());
    assertEquals("net/8.8.8.8/32/via/192.168.1.1", secondHop.toNodeId());
  }

  @Test
  void unresolvedGatewaysStayAsReachabilityNodes() {
    GraphSnapshot snapshot = query.getGraph(GraphFilter.defaults());

    List<String> nodes = snapshot.reachability().stream().map(node -> node.id()).toList();
    assertEquals(List.of("net/172.16.0.0/16/via/10.0.0.254"), nodes);
    LinkView pending = snapshot.link("route/if/src/web-01/eth0|172.16.0.0/16|10.0.0.254").orElseThrow();
    assertEquals("net/172.16.0.0/16/via/10.0.0.254", pending.toNodeId());
    assertTrue(pending.toHostId().isEmpty());
  }

  @Test
  void staleLinksAreHiddenUnlessRequested() {
    now.set(RawRecords.T0.plus(Duration.ofHours(30)));

    assertTrue(query.getGraph(GraphFilter.defaults()).links().isEmpty());
    GraphSnapshot all = query.getGraph(new GraphFilter(true, 0.0));
    assertEquals(3, all.links().size());
    assertTrue(all.links().stream().allMatch(view -> view.link().status() == LinkStatus.STALE));
  }

  @Test
  void minConfidenceFiltersPerLink() {
    GraphSnapshot strong = query.getGraph(new GraphFilter(false, 0.4));
    assertEquals(1, strong.links().size());
    assertEquals("adj/if/mac/00163e000001|if/src/web-01/eth0", strong.links().get(0).link().id());
  }

  @Test
  void getHostFollowsMergedIds() {
    assertEquals("host/src/gw-01", query.getHost("host/mac/00163e000001").orElseThrow().id());
    assertTrue(query.getHost("host/src/nobody").isEmpty());
  }

  @Test
  void currentOwnerPrefersLatestSighting() throws Exception {
    ingest.ingest("db-01", List.of(arp(RawRecords.T0.plusSeconds(30), "eth0", "10.0.0.1", "00:16:3e:00:00:02")),
        IngestOptions.defaults());

    assertEquals("if/mac/00163e000002", query.currentOwner(IpAddress.parse("10.0.0.1")).orElseThrow().id());
    assertTrue(query.currentOwner(IpAddress.parse("10.9.9.9")).isEmpty());
  }
}
