package ca.gc.cra.netmap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("netmap.yaml");
    Files.writeString(yaml, """
        common:
          store: /var/lib/netmap/graph.json
          maxAttempts: 3
        ingest:
          maxAttempts: 8
        graph:
          includeStale: true
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "ingest").orElseThrow();

    assertEquals("/var/lib/netmap/graph.json", map.get("store"));
    assertEquals("8", map.get("maxAttempts"));
    assertFalse(map.containsKey("includeStale"));
  }

  @Test
  void groupingSectionsAreDroppedAndListsJoined() throws IOException {
    Path yaml = tempDir.resolve("grouped.yaml");
    Files.writeString(yaml, """
        common:
          fusion:
            stalenessWindow: 12h
            trustedSources: [10.0.0.5, jump-01]
          labels:
            site: ott
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "graph").orElseThrow();

    assertEquals("12h", map.get("stalenessWindow"));
    assertEquals("10.0.0.5,jump-01", map.get("trustedSources"));
    assertEquals("ott", map.get("labels.site"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "ingest").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");
    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "host").orElseThrow());
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "common: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "ingest"));
  }

  @Test
  void nonMappingSectionIsRejected() throws IOException {
    Path yaml = tempDir.resolve("scalar.yaml");
    Files.writeString(yaml, "ingest: fast\n");
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "ingest"));
    assertEquals("ingest section must be a mapping", ex.getMessage());
  }
}
