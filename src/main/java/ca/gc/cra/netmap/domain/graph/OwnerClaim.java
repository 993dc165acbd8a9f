package ca.gc.cra.netmap.domain.graph;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Candidate owner of an IP address: an interface and the last time it was seen holding it.
 *
 * <p>The current owner is the maximum claim: latest {@code lastSeen}, ties going to the smaller
 * interface id. Taking the maximum is order-independent, so routes and reachability nodes can
 * fold claims in as they arrive.</p>
 *
 * @param interfaceId claiming interface
 * @param lastSeen last observation of the binding
 */
public record OwnerClaim(String interfaceId, Instant lastSeen) {
  private static final Comparator<OwnerClaim> PRECEDENCE = Comparator
      .comparing(OwnerClaim::lastSeen)
      .thenComparing(OwnerClaim::interfaceId, Comparator.reverseOrder());

  public OwnerClaim {
    Objects.requireNonNull(interfaceId, "interfaceId");
    Objects.requireNonNull(lastSeen, "lastSeen");
  }

  /**
   * Returns whichever claim wins.
   *
   * @param other competing claim, may be {@code null}
   * @return winning claim
   */
  public OwnerClaim max(OwnerClaim other) {
    if (other == null) {
      return this;
    }
    return PRECEDENCE.compare(this, other) >= 0 ? this : other;
  }

  public static Comparator<OwnerClaim> precedence() {
    return PRECEDENCE;
  }
}
