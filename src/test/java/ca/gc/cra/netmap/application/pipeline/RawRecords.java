package ca.gc.cra.netmap.application.pipeline;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builders for parser-shaped records used across pipeline tests. */
final class RawRecords {
  static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

  private RawRecords() {}

  static RawObservation arp(String local, String ip, String mac) {
    return arp(T0, local, ip, mac);
  }

  static RawObservation arp(Instant at, String local, String ip, String mac) {
    return new RawObservation("arp", at, Map.of(
        RawObservation.LOCAL_INTERFACE, local,
        RawObservation.NEIGHBOR_IP, ip,
        RawObservation.NEIGHBOR_LINK_ADDRESS, mac), "test:arp");
  }

  static RawObservation route(String destination, String gateway, String iface) {
    return new RawObservation("route", T0, Map.of(
        RawObservation.DESTINATION, destination,
        RawObservation.GATEWAY, gateway,
        RawObservation.INTERFACE, iface,
        RawObservation.METRIC, "100"), "test:route");
  }

  static RawObservation hop(String target, int hop, String previous, String address) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put(RawObservation.TARGET, target);
    fields.put(RawObservation.HOP, Integer.toString(hop));
    if (previous != null) {
      fields.put(RawObservation.PREVIOUS_HOP, previous);
    }
    fields.put(RawObservation.ADDRESS, address);
    return new RawObservation("hop", T0, fields, "test:hop");
  }

  static RawObservation alias(String host, String mac) {
    return new RawObservation("alias", T0, Map.of(
        RawObservation.HOST, host,
        RawObservation.LINK_ADDRESS, mac), "test:alias");
  }
}
