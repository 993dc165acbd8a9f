package ca.gc.cra.netmap.application.port;

/**
 * Base type for graph store failures.
 *
 * @since 0.1.0
 */
public abstract class GraphStoreException extends Exception {
  protected GraphStoreException(String message) {
    super(message);
  }

  protected GraphStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
