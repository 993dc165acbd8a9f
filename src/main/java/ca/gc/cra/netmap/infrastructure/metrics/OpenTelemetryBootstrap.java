package ca.gc.cra.netmap.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for netmap metrics.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.netmap";
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {}

  /**
   * Starts an OTLP-exporting provider.
   *
   * @param settings exporter settings; must select {@link TelemetrySettings.ExporterMode#OTLP}
   * @return provider handle
   */
  static Provider start(TelemetrySettings settings) {
    Objects.requireNonNull(settings, "settings");
    OtlpGrpcMetricExporter exporter =
        OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
    MetricReader reader = PeriodicMetricReader.builder(exporter)
        .setInterval(settings.exportInterval())
        .build();
    log.info("OpenTelemetry metrics exporting to {} every {}s",
        settings.endpoint(), settings.exportInterval().toSeconds());
    return build(reader, parseResourceAttributes(settings.resourceAttributes()));
  }

  static Provider forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static Provider build(MetricReader reader, Attributes extra) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault()
        .merge(Resource.create(Attributes.builder()
            .put(SERVICE_NAME, "netmap")
            .put(SERVICE_NAMESPACE, "ca.gc.cra")
            .put(SERVICE_VERSION, version)
            .build()))
        .merge(extra.isEmpty() ? Resource.empty() : Resource.create(extra));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return new Provider(provider, meter);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      int idx = trimmed.indexOf('=');
      if (idx <= 0 || idx == trimmed.length() - 1) {
        if (!trimmed.isEmpty()) {
          log.warn("Ignoring malformed resource attribute entry: {}", trimmed);
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(trimmed.substring(0, idx).trim()), trimmed.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "0.0.0-dev" : version;
  }

  /** Running meter provider and its meter. */
  static final class Provider implements AutoCloseable {
    private final SdkMeterProvider provider;
    private final Meter meter;

    private Provider(SdkMeterProvider provider, Meter meter) {
      this.provider = provider;
      this.meter = meter;
    }

    Meter meter() {
      return meter;
    }

    void forceFlush() {
      CompletableResultCode result = provider.forceFlush();
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      CompletableResultCode shutdown = provider.shutdown();
      shutdown.join(5, TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
      }
    }
  }
}
