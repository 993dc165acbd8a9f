package ca.gc.cra.netmap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class StoreConfigTest {

  @Test
  void defaultsPointAtHomeDirectory() {
    StoreConfig defaults = StoreConfig.defaults();
    assertTrue(defaults.path().orElseThrow().endsWith(Path.of(".netmap", "graph.json")));
    assertTrue(defaults.backup());
    assertFalse(defaults.inMemory());
  }

  @Test
  void memoryKeywordAndIgnoreStoreSelectInMemory() {
    assertTrue(StoreConfig.fromMap(Map.of("store", "MEMORY")).inMemory());
    assertTrue(StoreConfig.fromMap(Map.of("store", "/tmp/graph.json", "ignoreStore", "true")).inMemory());
  }

  @Test
  void parsesShorthandDurations() {
    StoreConfig config = StoreConfig.fromMap(Map.of(
        "store", "/tmp/graph.json",
        "transactionTimeout", "750ms",
        "backoffInitial", "50ms",
        "backoffMax", "2s",
        "maxAttempts", "7",
        "workers", "2",
        "storeBackup", "off"));

    assertEquals(Optional.of(Path.of("/tmp/graph.json").toAbsolutePath()), config.path());
    assertEquals(Duration.ofMillis(750), config.transactionTimeout());
    assertEquals(Duration.ofSeconds(2), config.backoffMax());
    assertEquals(7, config.maxAttempts());
    assertFalse(config.backup());
  }

  @Test
  void backoffMaxBelowInitialIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> StoreConfig.fromMap(Map.of("backoffInitial", "2s", "backoffMax", "1s")));
  }

  @Test
  void malformedValuesNameTheKey() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> StoreConfig.fromMap(Map.of("maxAttempts", "many")));
    assertEquals("maxAttempts must be an integer (was 'many')", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> StoreConfig.fromMap(Map.of("workers", "0")));
    assertThrows(IllegalArgumentException.class, () -> StoreConfig.fromMap(Map.of("storeBackup", "maybe")));
  }
}
