package ca.gc.cra.netmap.infrastructure.metrics;

import ca.gc.cra.netmap.application.port.MetricsPort;

/**
 * Metrics adapter that discards everything; selected when the exporter is {@code none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void add(String key, long delta) {}

  @Override
  public void observe(String key, long value) {}
}
