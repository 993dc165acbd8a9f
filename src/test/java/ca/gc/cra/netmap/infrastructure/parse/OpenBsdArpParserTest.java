package ca.gc.cra.netmap.infrastructure.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import org.junit.jupiter.api.Test;

class OpenBsdArpParserTest {
  private final OpenBsdArpParser parser = new OpenBsdArpParser();

  @Test
  void acceptsShortOctetsAndTrailingColumns() throws Exception {
    ParsedDump dump = parser.parse(Dumps.input("openbsd-arp.txt", "fw-01"));

    assertEquals(2, dump.records().size());
    assertEquals(1, dump.skippedLines());
    RawObservation permanent = dump.records().get(1);
    assertEquals("em0", permanent.field(RawObservation.LOCAL_INTERFACE));
    assertEquals("10.0.0.5", permanent.field(RawObservation.NEIGHBOR_IP));
    assertEquals("0:16:3e:0:0:5", permanent.field(RawObservation.NEIGHBOR_LINK_ADDRESS));
  }

  @Test
  void requiresSource() {
    assertThrows(DumpParseException.class, () -> parser.parse(Dumps.input("openbsd-arp.txt", null)));
  }
}
