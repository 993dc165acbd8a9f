package ca.gc.cra.netmap.domain.graph;

import ca.gc.cra.netmap.domain.observation.ObservationId;
import ca.gc.cra.netmap.domain.observation.RecordKind;
import java.util.Comparator;
import java.util.Objects;

/**
 * Provenance entry for a host union.
 *
 * @param seedA lexicographically smaller seed of the joined pair
 * @param seedB larger seed of the joined pair
 * @param evidenceKind kind of record that justified the union
 * @param observation justifying observation
 */
public record HostMerge(String seedA, String seedB, RecordKind evidenceKind, ObservationId observation)
    implements Comparable<HostMerge> {
  private static final Comparator<HostMerge> ORDER = Comparator
      .comparing(HostMerge::seedA)
      .thenComparing(HostMerge::seedB)
      .thenComparing(HostMerge::evidenceKind)
      .thenComparing(HostMerge::observation);

  public HostMerge {
    Objects.requireNonNull(seedA, "seedA");
    Objects.requireNonNull(seedB, "seedB");
    Objects.requireNonNull(evidenceKind, "evidenceKind");
    Objects.requireNonNull(observation, "observation");
    if (seedA.compareTo(seedB) > 0) {
      String swap = seedA;
      seedA = seedB;
      seedB = swap;
    }
  }

  @Override
  public int compareTo(HostMerge other) {
    return ORDER.compare(this, other);
  }
}
