package ca.gc.cra.netmap.domain.graph;

/**
 * Entity that can absorb another version of itself.
 *
 * <p>Implementations must make {@link #mergeWith(Object)} commutative and idempotent over the
 * fields that observations contribute. The graph store replays staged deltas through this method
 * at commit time, against whatever state is current then.</p>
 *
 * @param <T> entity type
 * @since 0.1.0
 */
public interface Mergeable<T> {
  /** Stable entity id used as the store key. */
  String id();

  /**
   * Folds {@code other} into this entity.
   *
   * @param other version with the same id
   * @return merged entity
   */
  T mergeWith(T other);
}
