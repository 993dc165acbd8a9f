package ca.gc.cra.netmap.infrastructure.store;

import ca.gc.cra.netmap.application.fusion.LinkAssessor;
import ca.gc.cra.netmap.application.fusion.TopologyFusionEngine;
import ca.gc.cra.netmap.application.identity.IdentityResolver;
import ca.gc.cra.netmap.application.normalize.RecordNormalizer;
import ca.gc.cra.netmap.application.pipeline.IngestOptions;
import ca.gc.cra.netmap.application.pipeline.IngestUseCase;
import ca.gc.cra.netmap.application.port.GraphStorePort;
import ca.gc.cra.netmap.application.port.MetricsPort;
import ca.gc.cra.netmap.config.FusionConfig;
import ca.gc.cra.netmap.config.StoreConfig;
import ca.gc.cra.netmap.domain.observation.RawObservation;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Populates a store with a small topology covering every entity kind. */
final class StoreFixtures {
  static final Instant AT = Instant.parse("2024-05-01T12:00:00Z");

  private StoreFixtures() {}

  static void populate(GraphStorePort store) throws InterruptedException {
    IdentityResolver resolver = new IdentityResolver();
    resolver.rebuild(store.snapshot());
    StoreConfig config = new StoreConfig(
        Optional.empty(), false, Duration.ofSeconds(5), 1, Duration.ofMillis(1), Duration.ofMillis(1), 1);
    TopologyFusionEngine engine = new TopologyFusionEngine(
        resolver, new LinkAssessor(FusionConfig.defaults()), () -> AT.plusSeconds(60), MetricsPort.NO_OP);
    try (IngestUseCase ingest = new IngestUseCase(
        store, resolver, engine, new RecordNormalizer(), config, MetricsPort.NO_OP)) {
      ingest.ingest("web-01", List.of(
          raw("arp", Map.of(RawObservation.LOCAL_INTERFACE, "eth0", RawObservation.NEIGHBOR_IP, "10.0.0.1",
              RawObservation.NEIGHBOR_LINK_ADDRESS, "00:16:3e:00:00:01")),
          raw("route", Map.of(RawObservation.DESTINATION, "0.0.0.0/0", RawObservation.GATEWAY, "10.0.0.1",
              RawObservation.INTERFACE, "eth0", RawObservation.METRIC, "100")),
          raw("route", Map.of(RawObservation.DESTINATION, "2001:db8::/32", RawObservation.GATEWAY, "2001:db8::1",
              RawObservation.INTERFACE, "eth0")),
          raw("hop", Map.of(RawObservation.TARGET, "8.8.8.8", RawObservation.HOP, "1",
              RawObservation.ADDRESS, "10.0.0.1")),
          raw("hop", Map.of(RawObservation.TARGET, "8.8.8.8", RawObservation.HOP, "2",
              RawObservation.PREVIOUS_HOP, "10.0.0.1", RawObservation.ADDRESS, "192.168.1.1"))),
          IngestOptions.defaults());
      ingest.ingest("app-01", List.of(
          raw("arp", Map.of(RawObservation.LOCAL_INTERFACE, "10.0.0.30", RawObservation.NEIGHBOR_IP, "10.0.0.1",
              RawObservation.NEIGHBOR_LINK_ADDRESS, "00:16:3e:00:00:02"))), IngestOptions.defaults());
      ingest.ingest("operator", List.of(
          raw("alias", Map.of(RawObservation.HOST, "gw-01", RawObservation.LINK_ADDRESS, "00:16:3e:00:00:01"))),
          IngestOptions.defaults());
    }
  }

  private static RawObservation raw(String kind, Map<String, String> fields) {
    return new RawObservation(kind, AT, fields, "fixture");
  }
}
