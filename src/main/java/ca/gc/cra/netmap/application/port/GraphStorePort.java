package ca.gc.cra.netmap.application.port;

import ca.gc.cra.netmap.domain.graph.GraphState;
import java.time.Duration;
import java.util.Set;

/**
 * Transactional keyed storage for the topology graph.
 *
 * <p><strong>What:</strong> Holds the hosts, interfaces, links, reachability and observations
 * collections and applies batches atomically.</p>
 * <p><strong>Locking:</strong> {@link #execute} locks the given keys (raw identifiers such as
 * {@code ip:10.0.0.1}) before running the work, so batches that share an identifier serialize and
 * disjoint batches proceed in parallel. Lock acquisition and commit are bounded by
 * {@code timeout}.</p>
 * <p><strong>Atomicity:</strong> A batch is either fully published or leaves no trace. Interrupting
 * the calling thread before commit aborts the attempt.</p>
 *
 * @since 0.1.0
 */
public interface GraphStorePort extends AutoCloseable {
  /**
   * Runs {@code work} in a transaction and commits its staged writes.
   *
   * @param lockKeys identifiers the work reads or writes
   * @param timeout bound on lock acquisition and commit
   * @param work unit of work
   * @param <T> result type
   * @return work result plus created entities
   * @throws StoreTransactionException on timeout or a transient write failure
   * @throws InterruptedException when interrupted before commit
   */
  <T> CommitResult<T> execute(Set<String> lockKeys, Duration timeout, TransactionWork<T> work)
      throws StoreTransactionException, InterruptedException;

  /**
   * Returns the last published state. Never blocks on writers.
   *
   * @return immutable state
   */
  GraphState snapshot();

  /**
   * Drops every collection. Intended for development and tests.
   *
   * @param timeout bound on waiting for in-flight commits
   * @throws StoreTransactionException when the store cannot be cleared in time
   * @throws InterruptedException when interrupted while waiting
   */
  void recreate(Duration timeout) throws StoreTransactionException, InterruptedException;

  @Override
  default void close() {}
}
