package ca.gc.cra.netmap.domain.graph;

import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.observation.ObservationId;
import java.util.Objects;
import java.util.SortedSet;

/**
 * Annotation recorded when one IP address is evidenced on more than one link address.
 *
 * <p>The interfaces involved stay distinct; the annotation only explains the contradiction.</p>
 *
 * @param address contested address
 * @param interfaceIds interfaces that have held the address
 * @param observations observations binding the address to those interfaces
 */
public record IpConflict(IpAddress address, SortedSet<String> interfaceIds, SortedSet<ObservationId> observations) {
  public IpConflict {
    Objects.requireNonNull(address, "address");
    interfaceIds = Merges.sortedSet(interfaceIds);
    observations = Merges.sortedSet(observations);
  }

  /**
   * Unions two annotations for the same address.
   *
   * @param other annotation to fold in
   * @return combined annotation
   */
  public IpConflict merge(IpConflict other) {
    if (!address.equals(other.address)) {
      throw new IllegalArgumentException("cannot merge conflicts for different addresses");
    }
    return new IpConflict(
        address,
        Merges.union(interfaceIds, other.interfaceIds),
        Merges.union(observations, other.observations));
  }
}
