package ca.gc.cra.netmap.domain.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CidrTest {

  @Test
  void parsesPrefixForm() {
    Cidr cidr = Cidr.parse("10.0.0.0/24");
    assertEquals(24, cidr.prefixLength());
    assertEquals("10.0.0.0/24", cidr.toString());
  }

  @Test
  void bareAddressIsHostRoute() {
    assertEquals(32, Cidr.parse("10.0.0.1").prefixLength());
    assertEquals(128, Cidr.parse("2001:db8::1").prefixLength());
  }

  @Test
  void rejectsHostBits() {
    assertThrows(IllegalArgumentException.class, () -> Cidr.parse("10.0.0.1/24"));
  }

  @Test
  void rejectsBadPrefix() {
    assertThrows(IllegalArgumentException.class, () -> Cidr.parse("10.0.0.0/33"));
    assertThrows(IllegalArgumentException.class, () -> Cidr.parse("10.0.0.0/"));
  }

  @Test
  void fromNetmaskCountsContiguousBits() {
    Cidr cidr = Cidr.fromNetmask(IpAddress.parse("172.16.0.0"), IpAddress.parse("255.255.0.0"));
    assertEquals(Cidr.parse("172.16.0.0/16"), cidr);
    assertEquals(Cidr.parse("0.0.0.0/0"),
        Cidr.fromNetmask(IpAddress.parse("0.0.0.0"), IpAddress.parse("0.0.0.0")));
  }

  @Test
  void fromNetmaskRejectsNonContiguousMask() {
    assertThrows(IllegalArgumentException.class,
        () -> Cidr.fromNetmask(IpAddress.parse("10.0.0.0"), IpAddress.parse("255.0.255.0")));
  }

  @Test
  void containsChecksPrefixOnly() {
    Cidr cidr = Cidr.parse("10.0.0.0/24");
    assertTrue(cidr.contains(IpAddress.parse("10.0.0.77")));
    assertFalse(cidr.contains(IpAddress.parse("10.0.1.1")));
    assertFalse(cidr.contains(IpAddress.parse("::1")));
  }
}
