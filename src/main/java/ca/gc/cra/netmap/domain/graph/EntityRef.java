package ca.gc.cra.netmap.domain.graph;

import java.util.Comparator;
import java.util.Objects;

/**
 * Reference to a stored entity.
 *
 * @param collection owning collection
 * @param id entity id
 */
public record EntityRef(EntityCollection collection, String id) implements Comparable<EntityRef> {
  private static final Comparator<EntityRef> ORDER = Comparator
      .comparing(EntityRef::collection)
      .thenComparing(EntityRef::id);

  public EntityRef {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(id, "id");
  }

  @Override
  public int compareTo(EntityRef other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return collection.label() + ":" + id;
  }
}
