package ca.gc.cra.netmap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netmap.application.pipeline.IngestOptions;
import ca.gc.cra.netmap.application.port.MetricsPort;
import ca.gc.cra.netmap.domain.graph.EntityIds;
import ca.gc.cra.netmap.domain.graph.GraphFilter;
import ca.gc.cra.netmap.domain.observation.RawObservation;
import ca.gc.cra.netmap.infrastructure.store.InMemoryGraphStore;
import ca.gc.cra.netmap.infrastructure.store.JsonFileGraphStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  private static final Instant AT = Instant.parse("2024-05-01T12:00:00Z");

  @TempDir Path tempDir;

  @Test
  void memoryStoreIsSelectedWithoutPath() throws Exception {
    try (CompositionRoot root = CompositionRoot.open(
        StoreConfig.fromMap(Map.of("store", "memory")), FusionConfig.defaults(), MetricsPort.NO_OP)) {
      assertTrue(root.store() instanceof InMemoryGraphStore);
      assertSame(root.ingestUseCase(), root.ingestUseCase());
    }
  }

  @Test
  void reopenedFileStoreRebuildsIdentityClusters() throws Exception {
    StoreConfig config = StoreConfig.fromMap(Map.of("store", tempDir.resolve("graph.json").toString()));
    try (CompositionRoot root = CompositionRoot.open(config, FusionConfig.defaults(), MetricsPort.NO_OP)) {
      assertTrue(root.store() instanceof JsonFileGraphStore);
      root.ingestUseCase().ingest("web-01", List.of(new RawObservation("arp", AT, Map.of(
          RawObservation.LOCAL_INTERFACE, "eth0",
          RawObservation.NEIGHBOR_IP, "10.0.0.1",
          RawObservation.NEIGHBOR_LINK_ADDRESS, "00:16:3e:00:00:01"), "test:1")), IngestOptions.defaults());
    }
    assertTrue(Files.exists(tempDir.resolve("graph.json")));

    try (CompositionRoot reopened = CompositionRoot.open(config, FusionConfig.defaults(), MetricsPort.NO_OP)) {
      String seed = EntityIds.reportedHostSeed("web-01");
      assertEquals(Optional.of(seed), reopened.resolver().canonical(seed));
      assertEquals(1, reopened.graphQueryUseCase().getGraph(new GraphFilter(true, 0.0)).links().size());
    }
  }

  @Test
  void sweepsCanBeScheduledAndCancelled() throws Exception {
    try (CompositionRoot root = CompositionRoot.open(
        StoreConfig.fromMap(Map.of("store", "memory")), FusionConfig.defaults(), MetricsPort.NO_OP)) {
      ScheduledFuture<?> sweeps = root.startStalenessSweeps();
      assertTrue(sweeps.cancel(false));
    }
  }
}
