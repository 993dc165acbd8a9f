package ca.gc.cra.netmap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netmap.domain.graph.GraphFilter;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class QueryConfigTest {

  @Test
  void defaultsExcludeStaleLinks() {
    QueryConfig config = QueryConfig.fromMap(Map.of("store", "memory"));
    assertEquals(new GraphFilter(false, 0.0), config.filter());
    assertEquals(Optional.empty(), config.hostId());
    assertEquals(Optional.empty(), config.out());
  }

  @Test
  void readsFilterHostAndOutput() {
    QueryConfig config = QueryConfig.fromMap(Map.of(
        "includeStale", "yes", "minConfidence", "0.5", "id", " web-01 ", "out", "graph.json"));

    assertEquals(new GraphFilter(true, 0.5), config.filter());
    assertEquals(Optional.of("web-01"), config.hostId());
    assertTrue(config.out().orElseThrow().isAbsolute());
  }
}
