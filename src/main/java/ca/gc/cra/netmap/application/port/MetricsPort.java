package ca.gc.cra.netmap.application.port;

/**
 * Counter and histogram sink for ingestion and fusion telemetry.
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the counter named {@code key} by one.
   *
   * @param key metric key, e.g. {@code ingest.records.accepted}
   */
  void increment(String key);

  /**
   * Adds {@code delta} to the counter named {@code key}.
   *
   * @param key metric key
   * @param delta non-negative amount
   */
  default void add(String key, long delta) {
    for (long i = 0; i < delta; i++) {
      increment(key);
    }
  }

  /**
   * Records one histogram observation.
   *
   * @param key metric key, e.g. {@code ingest.batch.latencyNanos}
   * @param value observed value
   */
  void observe(String key, long value);

  /** Metrics sink that drops everything. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void add(String key, long delta) {}

    @Override public void observe(String key, long value) {}
  };
}
