package ca.gc.cra.netmap.domain.observation;

import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.net.LinkAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * One neighbor-cache entry: {@code neighborIp} was resolved to {@code neighborLinkAddress} on the
 * source host's {@code localInterface}.
 *
 * @param id fingerprint id
 * @param sourceHostId vantage host
 * @param observedAt capture time
 * @param localInterface local interface identifier (name such as {@code eth0} or the local IP)
 * @param neighborIp neighbor address
 * @param neighborLinkAddress neighbor link address
 */
public record ArpEntry(
    ObservationId id,
    String sourceHostId,
    Instant observedAt,
    String localInterface,
    IpAddress neighborIp,
    LinkAddress neighborLinkAddress) implements ObservationRecord {

  public ArpEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourceHostId, "sourceHostId");
    Objects.requireNonNull(observedAt, "observedAt");
    Objects.requireNonNull(localInterface, "localInterface");
    Objects.requireNonNull(neighborIp, "neighborIp");
    Objects.requireNonNull(neighborLinkAddress, "neighborLinkAddress");
  }

  /**
   * Creates an entry and derives its fingerprint id.
   *
   * @param sourceHostId vantage host
   * @param observedAt capture time
   * @param localInterface local interface identifier
   * @param neighborIp neighbor address
   * @param neighborLinkAddress neighbor link address
   * @return new entry
   */
  public static ArpEntry create(
      String sourceHostId,
      Instant observedAt,
      String localInterface,
      IpAddress neighborIp,
      LinkAddress neighborLinkAddress) {
    String canonical = canonical(sourceHostId, observedAt, localInterface, neighborIp, neighborLinkAddress);
    return new ArpEntry(
        ObservationId.fingerprint(canonical),
        sourceHostId,
        observedAt,
        localInterface,
        neighborIp,
        neighborLinkAddress);
  }

  @Override
  public RecordKind kind() {
    return RecordKind.ARP;
  }

  @Override
  public String canonicalForm() {
    return canonical(sourceHostId, observedAt, localInterface, neighborIp, neighborLinkAddress);
  }

  private static String canonical(
      String source, Instant at, String local, IpAddress ip, LinkAddress link) {
    return "arp|" + source + "|" + at + "|" + local + "|" + ip + "|" + link;
  }
}
