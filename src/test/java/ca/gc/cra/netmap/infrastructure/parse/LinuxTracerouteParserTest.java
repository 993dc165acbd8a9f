package ca.gc.cra.netmap.infrastructure.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LinuxTracerouteParserTest {
  private final LinuxTracerouteParser parser = new LinuxTracerouteParser();

  @Test
  void respondingHopsChainToTheirPredecessor() throws Exception {
    ParsedDump dump = parser.parse(Dumps.input("linux-traceroute.txt", "web-01"));

    assertEquals("web-01", dump.sourceHostId());
    assertEquals(5, dump.records().size());
    assertEquals(2, dump.skippedLines());

    RawObservation first = dump.records().get(0);
    assertEquals("hop", first.kind());
    assertEquals("8.8.8.8", first.field(RawObservation.TARGET));
    assertEquals("1", first.field(RawObservation.HOP));
    assertEquals("10.0.0.1", first.field(RawObservation.ADDRESS));
    assertNull(first.field(RawObservation.PREVIOUS_HOP));
    assertEquals("linux-traceroute.txt:2", first.origin());

    assertEquals("10.0.0.1", dump.records().get(1).field(RawObservation.PREVIOUS_HOP));
    assertEquals("192.168.1.1", dump.records().get(1).field(RawObservation.ADDRESS));
  }

  @Test
  void hopAfterSilentHopHasNoPredecessor() throws Exception {
    List<RawObservation> records = parser.parse(Dumps.input("linux-traceroute.txt", "web-01")).records();

    RawObservation afterGap = records.get(2);
    assertEquals("4", afterGap.field(RawObservation.HOP));
    assertEquals("203.0.113.9", afterGap.field(RawObservation.ADDRESS));
    assertNull(afterGap.field(RawObservation.PREVIOUS_HOP));

    assertEquals("203.0.113.9", records.get(3).field(RawObservation.PREVIOUS_HOP));
    assertEquals("203.0.113.17", records.get(3).field(RawObservation.ADDRESS));
    assertEquals("8.8.8.8", records.get(4).field(RawObservation.ADDRESS));
  }

  @Test
  void repeatedReplyIsSkipped() throws Exception {
    DumpInput input = new DumpInput("loop.txt", List.of(
        "traceroute to 10.9.0.1 (10.9.0.1), 30 hops max, 60 byte packets",
        " 1  10.0.0.1  0.4 ms  0.3 ms  0.3 ms",
        " 2  10.0.0.1  0.5 ms  0.4 ms  0.4 ms",
        " 3  10.9.0.1  0.9 ms  * *"), Dumps.AT, Optional.of("web-01"));

    ParsedDump dump = parser.parse(input);

    assertEquals(2, dump.records().size());
    assertEquals("10.0.0.1", dump.records().get(1).field(RawObservation.PREVIOUS_HOP));
    assertEquals("3", dump.records().get(1).field(RawObservation.HOP));
  }

  @Test
  void sourceIsRequired() {
    DumpParseException ex = assertThrows(DumpParseException.class,
        () -> parser.parse(Dumps.input("linux-traceroute.txt", null)));
    assertTrue(ex.getMessage().contains("--source"));
  }

  @Test
  void dumpWithoutHeaderIsRefused() {
    DumpInput input = new DumpInput("hops.txt", List.of(" 1  10.0.0.1  0.4 ms"), Dumps.AT, Optional.of("web-01"));
    DumpParseException ex = assertThrows(DumpParseException.class, () -> parser.parse(input));
    assertTrue(ex.getMessage().contains("no 'traceroute to' header"));
  }
}
