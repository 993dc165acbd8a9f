package ca.gc.cra.netmap.domain.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BinaryOperator;

/** Commutative merge helpers for entity attribute collections. */
final class Merges {
  private Merges() {}

  static <T extends Comparable<? super T>> SortedSet<T> union(Collection<T> left, Collection<T> right) {
    TreeSet<T> out = new TreeSet<>(left);
    out.addAll(right);
    return Collections.unmodifiableSortedSet(out);
  }

  static <K extends Comparable<? super K>, V> SortedMap<K, V> union(
      Map<K, V> left, Map<K, V> right, BinaryOperator<V> combiner) {
    TreeMap<K, V> out = new TreeMap<>(left);
    right.forEach((key, value) -> out.merge(key, value, combiner));
    return Collections.unmodifiableSortedMap(out);
  }

  static <T extends Comparable<? super T>> SortedSet<T> sortedSet(Collection<T> values) {
    if (values == null || values.isEmpty()) {
      return Collections.emptySortedSet();
    }
    return Collections.unmodifiableSortedSet(new TreeSet<>(values));
  }

  static <K extends Comparable<? super K>, V> SortedMap<K, V> sortedCopy(Map<K, V> values) {
    if (values == null || values.isEmpty()) {
      return Collections.emptySortedMap();
    }
    return Collections.unmodifiableSortedMap(new TreeMap<>(values));
  }

  static <T> Optional<T> either(Optional<T> preferred, Optional<T> fallback) {
    return preferred.isPresent() ? preferred : fallback;
  }

  static Optional<Claim> mergeClaims(Optional<Claim> left, Optional<Claim> right) {
    if (left.isEmpty()) {
      return right;
    }
    if (right.isEmpty()) {
      return left;
    }
    return Optional.of(left.get().merge(right.get()));
  }
}
