package ca.gc.cra.netmap.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: netmap <ingest|graph|host>"));
  }

  @Test
  void helpWithoutCommandListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("ingest   Merge an ARP, route or alias dump"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void dispatchesToSubcommandWithoutTheCommandToken() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"GRAPH", "--help"}));
    assertTrue(buffer.toString().contains("NETMAP graph"));
  }

  @Test
  void dispatchedGraphRunsAgainstMemoryStore() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"graph", "store=memory"}));
    assertTrue(buffer.toString().contains("\"hosts\" : [ ]"));
  }
}
