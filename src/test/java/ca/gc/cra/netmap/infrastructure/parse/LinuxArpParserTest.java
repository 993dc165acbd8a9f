package ca.gc.cra.netmap.infrastructure.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import org.junit.jupiter.api.Test;

class LinuxArpParserTest {
  private final LinuxArpParser parser = new LinuxArpParser();

  @Test
  void parsesCompleteEntriesAndSkipsTheRest() throws Exception {
    ParsedDump dump = parser.parse(Dumps.input("linux-arp.txt", "web-01"));

    assertEquals(DumpFormat.LINUX_ARP, dump.format());
    assertEquals("web-01", dump.sourceHostId());
    assertEquals(2, dump.records().size());
    assertEquals(2, dump.skippedLines());

    RawObservation first = dump.records().get(0);
    assertEquals("arp", first.kind());
    assertEquals("eth0", first.field(RawObservation.LOCAL_INTERFACE));
    assertEquals("10.0.0.1", first.field(RawObservation.NEIGHBOR_IP));
    assertEquals("00:16:3e:00:00:01", first.field(RawObservation.NEIGHBOR_LINK_ADDRESS));
    assertEquals("linux-arp.txt:2", first.origin());
    assertEquals(Dumps.AT, first.observedAt());
  }

  @Test
  void requiresSource() {
    DumpParseException ex = assertThrows(DumpParseException.class,
        () -> parser.parse(Dumps.input("linux-arp.txt", null)));
    assertTrue(ex.getMessage().contains("--source"));
  }
}
