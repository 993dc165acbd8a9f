package ca.gc.cra.netmap.domain.graph;

import ca.gc.cra.netmap.domain.observation.ObservationId;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Provenance attached to one attribute value: the observations that produced it and the time
 * span they cover.
 *
 * <p>{@link #merge(Claim)} is commutative, associative and idempotent; the graph's convergence
 * under any ingestion order rests on that.</p>
 *
 * @param firstSeen earliest supporting observation time
 * @param lastSeen latest supporting observation time
 * @param observations supporting observation ids
 * @since 0.1.0
 */
public record Claim(Instant firstSeen, Instant lastSeen, SortedSet<ObservationId> observations) {
  public Claim {
    Objects.requireNonNull(firstSeen, "firstSeen");
    Objects.requireNonNull(lastSeen, "lastSeen");
    if (lastSeen.isBefore(firstSeen)) {
      throw new IllegalArgumentException("lastSeen precedes firstSeen");
    }
    observations = Merges.sortedSet(observations);
  }

  /**
   * Claim backed by a single observation.
   *
   * @param observation observation id
   * @param at observation time
   * @return new claim
   */
  public static Claim of(ObservationId observation, Instant at) {
    return new Claim(at, at, new TreeSet<>(Collections.singleton(observation)));
  }

  /**
   * Combines two claims for the same value.
   *
   * @param other claim to fold in
   * @return claim covering both
   */
  public Claim merge(Claim other) {
    if (other == null || other.equals(this)) {
      return this;
    }
    TreeSet<ObservationId> union = new TreeSet<>(observations);
    union.addAll(other.observations);
    Instant first = firstSeen.isBefore(other.firstSeen) ? firstSeen : other.firstSeen;
    Instant last = lastSeen.isAfter(other.lastSeen) ? lastSeen : other.lastSeen;
    return new Claim(first, last, union);
  }
}
