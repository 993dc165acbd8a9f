package ca.gc.cra.netmap.domain.observation;

import ca.gc.cra.netmap.domain.net.Cidr;
import ca.gc.cra.netmap.domain.net.IpAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One routing-table entry of the source host.
 *
 * @param id fingerprint id
 * @param sourceHostId vantage host
 * @param observedAt capture time
 * @param destination destination network
 * @param gateway next hop, empty for on-link routes
 * @param outgoingInterface local interface identifier the route leaves through
 * @param metric route metric, zero or greater
 */
public record RouteEntry(
    ObservationId id,
    String sourceHostId,
    Instant observedAt,
    Cidr destination,
    Optional<IpAddress> gateway,
    String outgoingInterface,
    int metric) implements ObservationRecord {

  public RouteEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourceHostId, "sourceHostId");
    Objects.requireNonNull(observedAt, "observedAt");
    Objects.requireNonNull(destination, "destination");
    gateway = gateway == null ? Optional.empty() : gateway;
    Objects.requireNonNull(outgoingInterface, "outgoingInterface");
    if (metric < 0) {
      throw new IllegalArgumentException("metric must be >= 0");
    }
  }

  /**
   * Creates an entry and derives its fingerprint id.
   *
   * @param sourceHostId vantage host
   * @param observedAt capture time
   * @param destination destination network
   * @param gateway next hop, empty for on-link
   * @param outgoingInterface local interface identifier
   * @param metric route metric
   * @return new entry
   */
  public static RouteEntry create(
      String sourceHostId,
      Instant observedAt,
      Cidr destination,
      Optional<IpAddress> gateway,
      String outgoingInterface,
      int metric) {
    Optional<IpAddress> gw = gateway == null ? Optional.empty() : gateway;
    String canonical = canonical(sourceHostId, observedAt, destination, gw, outgoingInterface, metric);
    return new RouteEntry(
        ObservationId.fingerprint(canonical),
        sourceHostId,
        observedAt,
        destination,
        gw,
        outgoingInterface,
        metric);
  }

  @Override
  public RecordKind kind() {
    return RecordKind.ROUTE;
  }

  @Override
  public String canonicalForm() {
    return canonical(sourceHostId, observedAt, destination, gateway, outgoingInterface, metric);
  }

  private static String canonical(
      String source, Instant at, Cidr destination, Optional<IpAddress> gateway, String out, int metric) {
    return "route|" + source + "|" + at + "|" + destination + "|"
        + gateway.map(IpAddress::toString).orElse("-") + "|" + out + "|" + metric;
  }
}
