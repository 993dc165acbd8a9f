package ca.gc.cra.netmap.infrastructure.store;

import ca.gc.cra.netmap.application.port.StoreTransactionException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed pool of lock stripes. Each raw identifier maps to one stripe; stripes are acquired in
 * ascending index order so two transactions can never wait on each other in a cycle.
 *
 * <p>The pool never grows. Identifiers sharing a stripe serialize even when unrelated.</p>
 */
final class KeyedLocks {
  static final int DEFAULT_STRIPES = 256;

  private final ReentrantLock[] stripes;

  KeyedLocks() {
    this(DEFAULT_STRIPES);
  }

  KeyedLocks(int stripeCount) {
    if (stripeCount < 1) {
      throw new IllegalArgumentException("stripeCount must be >= 1");
    }
    this.stripes = new ReentrantLock[stripeCount];
    for (int i = 0; i < stripeCount; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  /**
   * Locks the stripes of every key or none.
   *
   * @param keys identifiers to lock
   * @param deadlineNanos {@link System#nanoTime()} deadline for the whole acquisition
   * @return held locks in acquisition order
   * @throws StoreTransactionException when a stripe cannot be locked before the deadline
   * @throws InterruptedException when interrupted while waiting
   */
  List<ReentrantLock> acquire(Collection<String> keys, long deadlineNanos)
      throws StoreTransactionException, InterruptedException {
    SortedMap<Integer, SortedSet<String>> byStripe = new TreeMap<>();
    for (String key : keys) {
      byStripe.computeIfAbsent(stripe(key), i -> new TreeSet<>()).add(key);
    }
    List<ReentrantLock> held = new ArrayList<>();
    boolean acquired = false;
    try {
      for (Map.Entry<Integer, SortedSet<String>> entry : byStripe.entrySet()) {
        ReentrantLock lock = stripes[entry.getKey()];
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        if (!lock.tryLock(remaining, TimeUnit.NANOSECONDS)) {
          throw new StoreTransactionException("timed out waiting for lock on " + String.join(", ", entry.getValue()));
        }
        held.add(lock);
      }
      acquired = true;
      return held;
    } finally {
      if (!acquired) {
        release(held);
      }
    }
  }

  static void release(List<ReentrantLock> held) {
    for (int i = held.size() - 1; i >= 0; i--) {
      held.get(i).unlock();
    }
  }

  int stripe(String key) {
    int h = key.hashCode();
    return Math.floorMod(h ^ (h >>> 16), stripes.length);
  }

  int size() {
    return stripes.length;
  }
}
