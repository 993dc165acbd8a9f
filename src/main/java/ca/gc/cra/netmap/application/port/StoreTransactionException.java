package ca.gc.cra.netmap.application.port;

/**
 * Transient store failure: a lock or commit timeout, or a failed write of the backing file.
 * Callers retry the whole batch; nothing from the failed attempt is visible.
 *
 * @since 0.1.0
 */
public final class StoreTransactionException extends GraphStoreException {
  public StoreTransactionException(String message) {
    super(message);
  }

  public StoreTransactionException(String message, Throwable cause) {
    super(message, cause);
  }
}
