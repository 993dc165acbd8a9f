package ca.gc.cra.netmap.domain.observation;

import ca.gc.cra.netmap.domain.net.Cidr;
import ca.gc.cra.netmap.domain.net.IpAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One responding hop of a traceroute run from the source host towards {@code target}.
 *
 * <p>{@code previousHop} is the address that answered at {@code hop - 1}. It is empty for the
 * first hop, whose predecessor is the source host itself, and for hops following a silent one,
 * which carry no path edge.</p>
 *
 * @param id fingerprint id
 * @param sourceHostId vantage host traceroute ran on
 * @param observedAt capture time
 * @param target traced address
 * @param hop TTL the reply was received for, {@value #MIN_HOP} to {@value #MAX_HOP}
 * @param previousHop address that replied at the preceding TTL, if any
 * @param address address that replied at this TTL
 */
public record TraceHop(
    ObservationId id,
    String sourceHostId,
    Instant observedAt,
    IpAddress target,
    int hop,
    Optional<IpAddress> previousHop,
    IpAddress address) implements ObservationRecord {
  public static final int MIN_HOP = 1;
  public static final int MAX_HOP = 255;
  /** Local identifier of the source host interface that first-hop edges start from. */
  public static final String TRACE_INTERFACE = "traceroute";

  public TraceHop {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourceHostId, "sourceHostId");
    Objects.requireNonNull(observedAt, "observedAt");
    Objects.requireNonNull(target, "target");
    previousHop = previousHop == null ? Optional.empty() : previousHop;
    Objects.requireNonNull(address, "address");
    if (hop < MIN_HOP || hop > MAX_HOP) {
      throw new IllegalArgumentException("hop must be between " + MIN_HOP + " and " + MAX_HOP + " (was " + hop + ")");
    }
    if (previousHop.isPresent() && hop == MIN_HOP) {
      throw new IllegalArgumentException("the first hop has no previous hop");
    }
  }

  public static TraceHop create(
      String sourceHostId,
      Instant observedAt,
      IpAddress target,
      int hop,
      Optional<IpAddress> previousHop,
      IpAddress address) {
    Optional<IpAddress> previous = previousHop == null ? Optional.empty() : previousHop;
    String canonical = canonical(sourceHostId, observedAt, target, hop, previous, address);
    return new TraceHop(
        ObservationId.fingerprint(canonical), sourceHostId, observedAt, target, hop, previous, address);
  }

  /** Host prefix of the target; hop edges and nodes are keyed by it. */
  public Cidr destination() {
    return new Cidr(target, target.bitLength());
  }

  /** True when this hop directly follows the source host. */
  public boolean firstHop() {
    return hop == MIN_HOP;
  }

  @Override
  public RecordKind kind() {
    return RecordKind.HOP;
  }

  @Override
  public String canonicalForm() {
    return canonical(sourceHostId, observedAt, target, hop, previousHop, address);
  }

  private static String canonical(
      String source, Instant at, IpAddress target, int hop, Optional<IpAddress> previous, IpAddress address) {
    return "hop|" + source + "|" + at + "|" + target + "|" + hop + "|"
        + previous.map(IpAddress::toString).orElse("-") + "|" + address;
  }
}
