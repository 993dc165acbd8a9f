package ca.gc.cra.netmap.infrastructure.metrics;

import ca.gc.cra.netmap.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards netmap counters and histograms to OpenTelemetry.
 *
 * <p>Each metric key becomes an instrument named after the sanitized key and tagged with the
 * original key in {@code netmap.metric.key}. Instruments are created on first use and cached.</p>
 *
 * <p>Thread-safe.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("netmap.metric.key");
  private static final String FALLBACK_METRIC_NAME = "netmap.metric";

  private final OpenTelemetryBootstrap.Provider provider;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Provider provider) {
    this.provider = Objects.requireNonNull(provider, "provider");
    this.meter = provider.meter();
  }

  /**
   * Returns the metrics sink selected by {@code settings}: an exporting adapter for OTLP, a no-op
   * sink otherwise or when the exporter cannot be started.
   *
   * @param settings exporter settings
   * @return metrics sink
   */
  public static MetricsPort create(TelemetrySettings settings) {
    if (settings.exporter() == TelemetrySettings.ExporterMode.NONE) {
      log.debug("OpenTelemetry metrics exporter disabled");
      return new NoOpMetricsAdapter();
    }
    try {
      return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.start(settings));
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return new NoOpMetricsAdapter();
    }
  }

  @Override
  public void increment(String key) {
    add(key, 1);
  }

  @Override
  public void add(String key, long delta) {
    if (delta <= 0) {
      return;
    }
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::counter);
    counter.instrument().add(delta, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::histogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  void forceFlush() {
    provider.forceFlush();
  }

  @Override
  public void close() {
    provider.close();
  }

  private Counter counter(String key) {
    LongCounter counter = meter.counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("netmap counter for " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram histogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setDescription("netmap observation for " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  /** Lowercases {@code key} and replaces characters OpenTelemetry rejects in instrument names. */
  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
