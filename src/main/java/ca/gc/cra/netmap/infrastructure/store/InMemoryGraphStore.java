package ca.gc.cra.netmap.infrastructure.store;

import ca.gc.cra.netmap.application.port.CommitResult;
import ca.gc.cra.netmap.application.port.GraphStorePort;
import ca.gc.cra.netmap.application.port.StoreTransactionException;
import ca.gc.cra.netmap.application.port.TransactionWork;
import ca.gc.cra.netmap.domain.graph.EntityRef;
import ca.gc.cra.netmap.domain.graph.GraphState;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link GraphStorePort} holding the graph as an immutable
 * {@link GraphState} published through a volatile field.
 * <p><strong>Locking:</strong> Transactions lock their raw identifiers in sorted order, stage merge
 * deltas against the state published when they started, and commit under a single commit lock:
 * deltas are replayed through {@code mergeWith} onto the latest state, commit actions run, the
 * optional {@link PublishListener} persists the result, and the new state is published.</p>
 * <p><strong>Atomicity:</strong> Any failure before publication (lock or commit timeout,
 * interruption, listener {@link IOException}, exception from the work) discards the attempt.
 * The commit lock wait is the last interruptible point.</p>
 * <p><strong>Reads:</strong> {@link #snapshot()} never blocks.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryGraphStore implements GraphStorePort {
  private static final Logger log = LoggerFactory.getLogger(InMemoryGraphStore.class);

  private final KeyedLocks locks = new KeyedLocks();
  private final ReentrantLock commitLock = new ReentrantLock();
  private final PublishListener listener;
  private volatile Published published;

  public InMemoryGraphStore() {
    this(GraphState.empty(), PublishListener.NONE);
  }

  /**
   * Creates a store seeded with {@code initial}.
   *
   * @param initial state to start from
   * @param listener called with every state about to be published
   */
  public InMemoryGraphStore(GraphState initial, PublishListener listener) {
    Objects.requireNonNull(initial, "initial");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.published = new Published(initial, GraphIndex.of(initial));
  }

  @Override
  public <T> CommitResult<T> execute(Set<String> lockKeys, Duration timeout, TransactionWork<T> work)
      throws StoreTransactionException, InterruptedException {
    Objects.requireNonNull(lockKeys, "lockKeys");
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(work, "work");
    long deadline = System.nanoTime() + timeout.toNanos();
    List<ReentrantLock> held = locks.acquire(lockKeys, deadline);
    try {
      Published start = published;
      StagedTransaction tx = new StagedTransaction(start.state(), start.index());
      T value = work.apply(tx);
      if (Thread.interrupted()) {
        throw new InterruptedException("interrupted before commit");
      }
      return commit(tx, value, deadline);
    } finally {
      KeyedLocks.release(held);
    }
  }

  private <T> CommitResult<T> commit(StagedTransaction tx, T value, long deadline)
      throws StoreTransactionException, InterruptedException {
    long remaining = Math.max(0L, deadline - System.nanoTime());
    if (!commitLock.tryLock(remaining, TimeUnit.NANOSECONDS)) {
      throw new StoreTransactionException("timed out waiting for the commit lock");
    }
    try {
      WorkingState working = new WorkingState(published.state());
      tx.commitInto(working);
      boolean publish = !tx.isRollbackOnly();
      if (!working.changed()) {
        return new CommitResult<>(value, List.of(), publish);
      }
      List<EntityRef> created = working.created();
      if (!publish) {
        log.debug("Rolled back transaction that would have created {} entities", created.size());
        return new CommitResult<>(value, created, false);
      }
      GraphState next = working.freeze();
      try {
        listener.beforePublish(next);
      } catch (IOException ex) {
        throw new StoreTransactionException("failed to persist graph state: " + ex.getMessage(), ex);
      }
      published = new Published(next, GraphIndex.of(next));
      working.afterPublishActions().forEach(Runnable::run);
      return new CommitResult<>(value, created, true);
    } finally {
      commitLock.unlock();
    }
  }

  @Override
  public GraphState snapshot() {
    return published.state();
  }

  @Override
  public void recreate(Duration timeout) throws StoreTransactionException, InterruptedException {
    if (!commitLock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
      throw new StoreTransactionException("timed out waiting to recreate the store");
    }
    try {
      GraphState empty = GraphState.empty();
      try {
        listener.beforePublish(empty);
      } catch (IOException ex) {
        throw new StoreTransactionException("failed to persist recreated store: " + ex.getMessage(), ex);
      }
      published = new Published(empty, GraphIndex.of(empty));
      log.info("Graph store recreated");
    } finally {
      commitLock.unlock();
    }
  }

  /** Hook that persists a state before it becomes visible. */
  @FunctionalInterface
  public interface PublishListener {
    PublishListener NONE = state -> {};

    /**
     * Persists {@code next}; throwing aborts the commit.
     *
     * @param next state about to be published
     * @throws IOException when the state cannot be persisted
     */
    void beforePublish(GraphState next) throws IOException;
  }

  private record Published(GraphState state, GraphIndex index) {}
}
