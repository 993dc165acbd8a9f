package ca.gc.cra.netmap.domain.graph;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Canonical entity for one real machine.
 *
 * <p><strong>What:</strong> The union of every seed the identity resolver has clustered together.
 * A seed is the host implied by one source host id or one link address.</p>
 * <p><strong>Lifecycle:</strong> Absorbed hosts are kept with status {@link HostStatus#MERGED} and
 * an empty body; {@link #mergedInto()} names the survivor so old ids keep resolving.</p>
 *
 * @param id canonical host id
 * @param status lifecycle status
 * @param mergedInto survivor id when merged
 * @param memberSeeds seeds clustered into this host
 * @param interfaceIds owned interfaces
 * @param labels display names with provenance
 * @param seen first/last seen with provenance; empty for merged hosts
 * @param merges union provenance
 * @since 0.1.0
 */
public record Host(
    String id,
    HostStatus status,
    Optional<String> mergedInto,
    SortedSet<String> memberSeeds,
    SortedSet<String> interfaceIds,
    SortedMap<String, Claim> labels,
    Optional<Claim> seen,
    SortedSet<HostMerge> merges) implements Mergeable<Host> {

  public Host {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(status, "status");
    mergedInto = mergedInto == null ? Optional.empty() : mergedInto;
    memberSeeds = Merges.sortedSet(memberSeeds);
    interfaceIds = Merges.sortedSet(interfaceIds);
    labels = Merges.sortedCopy(labels);
    seen = seen == null ? Optional.empty() : seen;
    merges = Merges.sortedSet(merges);
    if (status == HostStatus.MERGED && mergedInto.isEmpty()) {
      throw new IllegalArgumentException("merged host " + id + " must name its survivor");
    }
  }

  /**
   * Fresh active host for a single seed.
   *
   * @param seedId seed id, which becomes the host id
   * @return empty active host
   */
  public static Host seed(String seedId) {
    return new Host(
        seedId, HostStatus.ACTIVE, Optional.empty(), new TreeSet<>(Set.of(seedId)),
        null, null, Optional.empty(), null);
  }

  /**
   * Tombstone left behind when this host is absorbed.
   *
   * @param survivorId surviving canonical id
   * @return merged host record
   */
  public Host absorbedInto(String survivorId) {
    return new Host(id, HostStatus.MERGED, Optional.of(survivorId), null, null, null, Optional.empty(), null);
  }

  /**
   * Returns this host renamed to {@code newId}, keeping its body. Used when a merge elects a
   * survivor id different from either side's current id.
   *
   * @param newId canonical id
   * @return renamed host
   */
  public Host withId(String newId) {
    return new Host(newId, status, mergedInto, memberSeeds, interfaceIds, labels, seen, merges);
  }

  @Override
  public Host mergeWith(Host other) {
    if (!id.equals(other.id)) {
      throw new IllegalArgumentException("cannot merge host " + other.id + " into " + id);
    }
    return absorb(other);
  }

  /**
   * Folds the body of {@code other} (possibly a different host) into this one, keeping this id.
   *
   * @param other host whose seeds, interfaces, labels and provenance are taken over
   * @return combined host
   */
  public Host absorb(Host other) {
    HostStatus mergedStatus = status == HostStatus.ACTIVE || other.status == HostStatus.ACTIVE
        ? HostStatus.ACTIVE : HostStatus.MERGED;
    return new Host(
        id,
        mergedStatus,
        mergedStatus == HostStatus.ACTIVE ? Optional.empty() : Merges.either(mergedInto, other.mergedInto),
        Merges.union(memberSeeds, other.memberSeeds),
        Merges.union(interfaceIds, other.interfaceIds),
        Merges.union(labels, other.labels, Claim::merge),
        Merges.mergeClaims(seen, other.seen),
        Merges.union(merges, other.merges));
  }

  /**
   * Returns this host owning {@code interfaceId}, with {@code claim} folded into its provenance.
   *
   * @param interfaceId interface to attach
   * @param claim attaching observation
   * @return updated host
   */
  public Host withInterface(String interfaceId, Claim claim) {
    TreeSet<String> ids = new TreeSet<>(interfaceIds);
    ids.add(interfaceId);
    return new Host(id, status, mergedInto, memberSeeds, ids, labels, Merges.mergeClaims(seen, Optional.of(claim)), merges);
  }

  public Host withLabel(String label, Claim claim) {
    TreeMap<String, Claim> next = new TreeMap<>(labels);
    next.merge(label, claim, Claim::merge);
    return new Host(id, status, mergedInto, memberSeeds, interfaceIds, next, seen, merges);
  }

  public Host withMerge(HostMerge merge) {
    TreeSet<HostMerge> next = new TreeSet<>(merges);
    next.add(merge);
    return new Host(id, status, mergedInto, memberSeeds, interfaceIds, labels, seen, next);
  }

  public boolean isActive() {
    return status == HostStatus.ACTIVE;
  }
}
