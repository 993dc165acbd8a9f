package ca.gc.cra.netmap.domain.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class IpAddressTest {

  @Test
  void ipv6SpellingsCollapseToOneForm() {
    IpAddress a = IpAddress.parse("2001:DB8::1");
    IpAddress b = IpAddress.parse("2001:db8:0:0:0:0:0:1");
    assertEquals(a, b);
    assertEquals("2001:db8::1", a.toString());
  }

  @Test
  void mappedIpv6BecomesIpv4() {
    IpAddress mapped = IpAddress.parse("::ffff:10.0.0.1");
    assertTrue(mapped.isIpv4());
    assertEquals(IpAddress.parse("10.0.0.1"), mapped);
  }

  @Test
  void singleZeroRunIsNotCompressed() {
    assertEquals("2001:db8:0:1:1:1:1:1", IpAddress.parse("2001:db8::1:1:1:1:1").toString());
  }

  @ParameterizedTest
  @ValueSource(strings = {"010.0.0.1", "10.0.0", "10.0.0.256", "10.0.0.1%eth0", "fe80::1%eth0", "host.example", ""})
  void rejectsMalformed(String literal) {
    assertThrows(IllegalArgumentException.class, () -> IpAddress.parse(literal));
  }

  @Test
  void tryParseReturnsEmptyForInterfaceNames() {
    assertTrue(IpAddress.tryParse("eth0").isEmpty());
    assertTrue(IpAddress.tryParse("10.0.0.20").isPresent());
  }

  @Test
  void classifiesSpecialAddresses() {
    assertTrue(IpAddress.parse("0.0.0.0").isUnspecified());
    assertTrue(IpAddress.parse("::").isUnspecified());
    assertTrue(IpAddress.parse("255.255.255.255").isLimitedBroadcast());
    assertTrue(IpAddress.parse("224.0.0.251").isMulticast());
    assertTrue(IpAddress.parse("ff02::1").isMulticast());
    assertFalse(IpAddress.parse("10.0.0.1").isMulticast());
  }

  @Test
  void ordersIpv4BeforeIpv6() {
    assertTrue(IpAddress.parse("255.0.0.1").compareTo(IpAddress.parse("::1")) < 0);
    assertTrue(IpAddress.parse("10.0.0.2").compareTo(IpAddress.parse("10.0.0.10")) < 0);
  }
}
