package ca.gc.cra.netmap.infrastructure.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import org.junit.jupiter.api.Test;

class WindowsRouteParserTest {
  private final WindowsRouteParser parser = new WindowsRouteParser();

  @Test
  void readsOnlyTheActiveRouteTable() throws Exception {
    ParsedDump dump = parser.parse(Dumps.input("windows-route.txt", "win-01"));

    assertEquals(2, dump.records().size());
    RawObservation onLink = dump.records().get(1);
    assertEquals("10.0.0.0", onLink.field(RawObservation.DESTINATION));
    assertEquals("On-link", onLink.field(RawObservation.GATEWAY));
    assertEquals("10.0.0.20", onLink.field(RawObservation.INTERFACE));
    assertEquals("281", onLink.field(RawObservation.METRIC));
    assertEquals(dump.records().size() + dump.skippedLines(), Dumps.lines("windows-route.txt").size());
  }

  @Test
  void requiresSource() {
    assertThrows(DumpParseException.class, () -> parser.parse(Dumps.input("windows-route.txt", null)));
  }
}
