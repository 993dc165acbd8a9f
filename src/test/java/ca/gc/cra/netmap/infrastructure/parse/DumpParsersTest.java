package ca.gc.cra.netmap.infrastructure.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DumpParsersTest {
  private final DumpParsers parsers = DumpParsers.defaults();

  @TempDir
  Path dir;

  @Test
  void readDetectsFormatAndStampsObservedAt() throws Exception {
    ParsedDump dump = parsers.read(Dumps.path("linux-arp.txt"), Optional.empty(), Optional.empty(),
        Optional.of("web-01"), Optional.of(Dumps.AT));

    assertEquals(DumpFormat.LINUX_ARP, dump.format());
    assertEquals(Dumps.AT, dump.records().get(0).observedAt());
  }

  @Test
  void observedAtDefaultsToModificationTime() throws Exception {
    Path copy = dir.resolve("aliases.txt");
    Files.copy(Dumps.path("aliases.txt"), copy);
    Instant modified = Instant.parse("2024-04-30T08:00:00Z");
    Files.setLastModifiedTime(copy, FileTime.from(modified));

    ParsedDump dump = parsers.read(copy, Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

    assertEquals(modified, dump.records().get(0).observedAt());
  }

  @Test
  void explicitTypeAndOsSkipDetection() throws Exception {
    assertEquals(DumpFormat.WINDOWS_ROUTE,
        parsers.resolveFormat(Dumps.lines("linux-arp.txt"), Optional.of(DumpType.ROUTE), Optional.of(DumpOs.WINDOWS)));
  }

  @Test
  void contradictingTypeIsRefused() {
    DumpParseException ex = assertThrows(DumpParseException.class,
        () -> parsers.resolveFormat(Dumps.lines("linux-route.txt"), Optional.of(DumpType.ARP), Optional.empty()));
    assertTrue(ex.getMessage().startsWith("--type=arp"));
  }

  @Test
  void contradictingOsIsRefused() {
    assertThrows(DumpParseException.class,
        () -> parsers.resolveFormat(Dumps.lines("linux-arp.txt"), Optional.empty(), Optional.of(DumpOs.WINDOWS)));
  }

  @Test
  void tracerouteIsDetectedAndParsed() throws Exception {
    ParsedDump dump = parsers.read(Dumps.path("linux-traceroute.txt"), Optional.empty(), Optional.empty(),
        Optional.of("web-01"), Optional.of(Dumps.AT));

    assertEquals(DumpFormat.LINUX_TRACEROUTE, dump.format());
    assertEquals(5, dump.records().size());
  }

  @Test
  void formatWithoutParserIsRefused() {
    DumpParseException ex = assertThrows(DumpParseException.class,
        () -> parsers.parser(new DumpFormat(DumpType.TRACEROUTE, DumpOs.WINDOWS)));
    assertEquals("no parser for traceroute/windows dumps", ex.getMessage());
  }

  @Test
  void undetectableDumpAsksForHints() throws Exception {
    Path unknown = dir.resolve("unknown.txt");
    Files.writeString(unknown, "hello\n");
    DumpParseException ex = assertThrows(DumpParseException.class, () -> parsers.read(
        unknown, Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty()));
    assertTrue(ex.getMessage().contains("--type and --os"));
  }
}
