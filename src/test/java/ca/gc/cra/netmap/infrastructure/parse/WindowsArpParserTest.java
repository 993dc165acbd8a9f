package ca.gc.cra.netmap.infrastructure.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class WindowsArpParserTest {
  private final WindowsArpParser parser = new WindowsArpParser();

  @Test
  void entriesTakeTheirSectionAddressAsLocalInterface() throws Exception {
    ParsedDump dump = parser.parse(Dumps.input("windows-arp.txt", null));

    assertEquals("10.0.0.20", dump.sourceHostId());
    assertEquals(3, dump.records().size());
    assertEquals(3, dump.skippedLines());
    RawObservation last = dump.records().get(2);
    assertEquals("192.168.56.1", last.field(RawObservation.LOCAL_INTERFACE));
    assertEquals("192.168.56.101", last.field(RawObservation.NEIGHBOR_IP));
    assertEquals("08-00-27-aa-bb-cc", last.field(RawObservation.NEIGHBOR_LINK_ADDRESS));
  }

  @Test
  void suppliedSourceMayNameAnySection() throws Exception {
    ParsedDump dump = parser.parse(Dumps.input("windows-arp.txt", "192.168.56.1"));
    assertEquals("192.168.56.1", dump.sourceHostId());
  }

  @Test
  void rejectsSourceNotInTheDump() {
    DumpParseException ex = assertThrows(DumpParseException.class,
        () -> parser.parse(Dumps.input("windows-arp.txt", "10.9.9.9")));
    assertTrue(ex.getMessage().contains("10.0.0.20, 192.168.56.1"));
  }

  @Test
  void rejectsDumpWithoutSections() {
    DumpInput input = new DumpInput("bare.txt", List.of("  10.0.0.1  00-16-3e-00-00-01  dynamic"),
        Dumps.AT, Optional.empty());
    assertThrows(DumpParseException.class, () -> parser.parse(input));
  }
}
