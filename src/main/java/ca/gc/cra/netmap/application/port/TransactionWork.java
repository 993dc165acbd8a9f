package ca.gc.cra.netmap.application.port;

/**
 * Unit of work executed inside a store transaction.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionWork<T> {
  /**
   * Reads and stages writes through {@code tx}. Throwing discards everything staged.
   *
   * @param tx open transaction
   * @return work result
   * @throws StoreTransactionException to abort the attempt as a transient failure
   */
  T apply(StoreTransaction tx) throws StoreTransactionException;
}
