package ca.gc.cra.netmap.domain.observation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Loosely-typed parser output awaiting normalization.
 *
 * @param kind record kind label ({@code arp}, {@code route}, {@code alias}, {@code hop})
 * @param observedAt capture time
 * @param fields raw field values keyed by field name
 * @param origin where the record came from, typically {@code file:line}
 */
public record RawObservation(String kind, Instant observedAt, Map<String, String> fields, String origin) {
  public static final String LOCAL_INTERFACE = "localInterface";
  public static final String NEIGHBOR_IP = "neighborIp";
  public static final String NEIGHBOR_LINK_ADDRESS = "neighborLinkAddress";
  public static final String DESTINATION = "destination";
  public static final String NETMASK = "netmask";
  public static final String GATEWAY = "gateway";
  public static final String INTERFACE = "interface";
  public static final String METRIC = "metric";
  public static final String HOST = "host";
  public static final String LINK_ADDRESS = "linkAddress";
  public static final String TARGET = "target";
  public static final String HOP = "hop";
  public static final String PREVIOUS_HOP = "previousHop";
  public static final String ADDRESS = "address";

  public RawObservation {
    fields = fields == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    origin = origin == null ? "unknown" : origin;
  }

  /**
   * Returns a field value or {@code null} when absent.
   *
   * @param name field name
   * @return raw value
   */
  public String field(String name) {
    return fields.get(Objects.requireNonNull(name, "name"));
  }
}
