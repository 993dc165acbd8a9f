package ca.gc.cra.netmap.infrastructure.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netmap.application.port.CommitResult;
import ca.gc.cra.netmap.application.port.StoreCorruptionException;
import ca.gc.cra.netmap.domain.graph.GraphState;
import ca.gc.cra.netmap.domain.observation.ArpEntry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileGraphStoreTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(2);

  @TempDir
  Path dir;

  @Test
  void missingFileStartsEmpty() throws Exception {
    JsonFileGraphStore store = JsonFileGraphStore.open(dir.resolve("nested/graph.json"), true);

    assertEquals(GraphState.empty(), store.snapshot());
    assertFalse(Files.exists(store.file()));
  }

  @Test
  void committedStateSurvivesReopen() throws Exception {
    Path file = dir.resolve("graph.json");
    JsonFileGraphStore store = JsonFileGraphStore.open(file, false);
    StoreFixtures.populate(store);
    GraphState written = store.snapshot();

    JsonFileGraphStore reopened = JsonFileGraphStore.open(file, false);

    assertEquals(written, reopened.snapshot());
    assertFalse(Files.exists(dir.resolve("graph.json.tmp")));
    assertFalse(Files.exists(dir.resolve("graph.json.bak")));
  }

  @Test
  void backupHoldsPreviousState() throws Exception {
    Path file = dir.resolve("graph.json");
    JsonFileGraphStore store = JsonFileGraphStore.open(file, true);
    ArpEntry first = InMemoryGraphStoreTest.arp("00:16:3e:00:00:01");
    store.execute(Set.of("a"), TIMEOUT, tx -> {
      tx.recordObservation(first);
      return null;
    });
    GraphState afterFirst = store.snapshot();
    ArpEntry second = InMemoryGraphStoreTest.arp("00:16:3e:00:00:02");
    store.execute(Set.of("a"), TIMEOUT, tx -> {
      tx.recordObservation(second);
      return null;
    });

    Path bak = dir.resolve("graph.json.bak");
    assertTrue(Files.exists(bak));
    assertEquals(afterFirst, JsonFileGraphStore.open(bak, false).snapshot());
    assertEquals(2, JsonFileGraphStore.open(file, false).snapshot().observations().size());
  }

  @Test
  void rolledBackWorkLeavesFileUntouched() throws Exception {
    Path file = dir.resolve("graph.json");
    JsonFileGraphStore store = JsonFileGraphStore.open(file, false);

    CommitResult<Void> result = store.execute(Set.of("a"), TIMEOUT, tx -> {
      tx.recordObservation(InMemoryGraphStoreTest.arp("00:16:3e:00:00:01"));
      tx.rollbackOnly();
      return null;
    });

    assertFalse(result.committed());
    assertFalse(Files.exists(file));
  }

  @Test
  void corruptFileFailsToOpen() throws Exception {
    Path file = dir.resolve("graph.json");
    Files.write(file, "{\"format\":".getBytes(StandardCharsets.UTF_8));

    assertThrows(StoreCorruptionException.class, () -> JsonFileGraphStore.open(file, true));
  }
}
