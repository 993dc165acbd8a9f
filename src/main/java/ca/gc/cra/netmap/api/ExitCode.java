package ca.gc.cra.netmap.api;

/**
 * <strong>What:</strong> Process exit codes of the {@code netmap} command.
 * <p><strong>Why:</strong> Scripts driving batch ingestion need to tell a bad dump from a busy or
 * damaged store.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including batches with rejected records. */
  SUCCESS(0),
  /** Command-line arguments or the dump itself were unusable. */
  INVALID_ARGS(2),
  /** IO failure while reading a dump or writing output. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** The batch failed after exhausting its store retries; nothing was stored. */
  STORE_FAILURE(6),
  /** The store file is corrupt and needs operator attention. */
  STORE_CORRUPTION(7),
  /** The requested entity does not exist. */
  NOT_FOUND(8),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
