package ca.gc.cra.netmap.application.port;

/**
 * Fatal store failure: persisted data cannot be read back or violates the schema. Ingestion halts
 * and the operator must intervene.
 *
 * @since 0.1.0
 */
public final class StoreCorruptionException extends GraphStoreException {
  public StoreCorruptionException(String message) {
    super(message);
  }

  public StoreCorruptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
