package ca.gc.cra.netmap.domain.observation;

import ca.gc.cra.netmap.domain.net.LinkAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * Operator assertion that {@code linkAddress} is an interface of the host known as
 * {@code hostId}.
 *
 * @param id fingerprint id
 * @param sourceHostId who supplied the alias
 * @param observedAt when the alias was supplied
 * @param hostId source host id the link address belongs to
 * @param linkAddress aliased link address
 */
public record HostAlias(
    ObservationId id,
    String sourceHostId,
    Instant observedAt,
    String hostId,
    LinkAddress linkAddress) implements ObservationRecord {

  public HostAlias {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourceHostId, "sourceHostId");
    Objects.requireNonNull(observedAt, "observedAt");
    Objects.requireNonNull(hostId, "hostId");
    Objects.requireNonNull(linkAddress, "linkAddress");
  }

  public static HostAlias create(String sourceHostId, Instant observedAt, String hostId, LinkAddress linkAddress) {
    String canonical = canonical(sourceHostId, observedAt, hostId, linkAddress);
    return new HostAlias(ObservationId.fingerprint(canonical), sourceHostId, observedAt, hostId, linkAddress);
  }

  @Override
  public RecordKind kind() {
    return RecordKind.ALIAS;
  }

  @Override
  public String canonicalForm() {
    return canonical(sourceHostId, observedAt, hostId, linkAddress);
  }

  private static String canonical(String source, Instant at, String hostId, LinkAddress link) {
    return "alias|" + source + "|" + at + "|" + hostId + "|" + link;
  }
}
