package ca.gc.cra.netmap.domain.observation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netmap.domain.net.Cidr;
import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.net.LinkAddress;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ObservationIdTest {
  private static final Instant AT = Instant.parse("2024-05-01T12:00:00Z");

  @Test
  void equalRecordsShareFingerprint() {
    ArpEntry first = ArpEntry.create("web-01", AT, "eth0",
        IpAddress.parse("10.0.0.1"), LinkAddress.parse("00:16:3e:00:00:01"));
    ArpEntry second = ArpEntry.create("web-01", AT, "eth0",
        IpAddress.parse("10.0.0.1"), LinkAddress.parse("00-16-3E-00-00-01"));
    assertEquals(first.id(), second.id());
    assertEquals(first, second);
  }

  @Test
  void fingerprintIsThirtyTwoHexCharacters() {
    ObservationId id = ObservationId.fingerprint("arp|x");
    assertEquals(32, id.value().length());
    assertTrue(id.value().matches("[0-9a-f]{32}"));
  }

  @Test
  void timestampIsPartOfIdentity() {
    RouteEntry early = RouteEntry.create("web-01", AT, Cidr.parse("0.0.0.0/0"),
        Optional.of(IpAddress.parse("10.0.0.1")), "eth0", 100);
    RouteEntry late = RouteEntry.create("web-01", AT.plusSeconds(1), Cidr.parse("0.0.0.0/0"),
        Optional.of(IpAddress.parse("10.0.0.1")), "eth0", 100);
    assertNotEquals(early.id(), late.id());
  }

  @Test
  void kindsDoNotCollide() {
    LinkAddress link = LinkAddress.parse("00:16:3e:00:00:07");
    HostAlias alias = HostAlias.create("operator", AT, "web-01", link);
    assertEquals(RecordKind.ALIAS, alias.kind());
    assertTrue(alias.canonicalForm().startsWith("alias|operator|"));
  }

  @Test
  void recordKindLabelsAreCaseInsensitive() {
    assertEquals(Optional.of(RecordKind.ROUTE), RecordKind.fromLabel(" Route "));
    assertTrue(RecordKind.fromLabel("traceroute").isEmpty());
  }
}
