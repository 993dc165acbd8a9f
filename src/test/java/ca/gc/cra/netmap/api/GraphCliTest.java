package ca.gc.cra.netmap.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GraphCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private Path store;

  @BeforeEach
  void setUp() throws IOException {
    store = tempDir.resolve("graph.json");
    Path dump = tempDir.resolve("linux-arp.txt");
    try (InputStream in = GraphCliTest.class.getResourceAsStream("/dumps/linux-arp.txt")) {
      Files.copy(in, dump);
    }
    CliPrinter.setWriterForTesting(new PrintWriter(new StringWriter()));
    assertEquals(ExitCode.SUCCESS, IngestCli.run(new String[] {dump.toString(), "--source=web-01", "store=" + store}));
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsSnapshotAsJson() {
    ExitCode code = GraphCli.run(new String[] {"store=" + store});

    assertEquals(ExitCode.SUCCESS, code);
    String json = buffer.toString();
    assertTrue(json.contains("\"takenAt\""));
    assertTrue(json.contains("\"fromHostId\""));
    assertTrue(json.contains("host/src/web-01"));
    assertTrue(json.contains("adj/"));
  }

  @Test
  void writesSnapshotToOutFile() throws IOException {
    Path out = tempDir.resolve("exports/graph-view.json");

    ExitCode code = GraphCli.run(new String[] {"store=" + store, "out=" + out});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.readString(out).contains("\"links\""));
    assertEquals("", buffer.toString());
  }

  @Test
  void confidenceFloorFiltersLinks() {
    ExitCode code = GraphCli.run(new String[] {"store=" + store, "minConfidence=0.99"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("\"links\" : [ ]"));
  }

  @Test
  void positionalArgumentsAreRejected() {
    assertEquals(ExitCode.INVALID_ARGS, GraphCli.run(new String[] {"everything", "store=" + store}));
    assertTrue(buffer.toString().contains("usage: graph"));
  }

  @Test
  void outOfRangeConfidenceIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, GraphCli.run(new String[] {"store=" + store, "minConfidence=2"}));
  }

  @Test
  void corruptStoreIsReported() throws IOException {
    Files.writeString(store, "{\"format\":\"netmap-graph\",\"version\":9}");
    assertEquals(ExitCode.STORE_CORRUPTION, GraphCli.run(new String[] {"store=" + store}));
  }
}
