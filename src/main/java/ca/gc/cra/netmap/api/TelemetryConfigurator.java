package ca.gc.cra.netmap.api;

import ca.gc.cra.netmap.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.netmap.validation.Strings;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link TelemetrySettings} from the merged CLI settings. Missing values fall back to the
 * standard {@code OTEL_*} environment variables; with neither, metrics stay disabled.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static TelemetrySettings configureMetrics(Map<String, String> settings) {
    String exporter = settings.get("metricsExporter");
    String endpoint = settings.get("otelEndpoint");
    String resourceAttributes = settings.get("otelResourceAttributes");
    if (resourceAttributes != null && !resourceAttributes.isBlank()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes.trim(), MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    TelemetrySettings resolved = TelemetrySettings.resolve(exporter, endpoint, resourceAttributes);
    log.debug("Metrics exporter: {} ({})", resolved.exporter(), resolved.endpoint());
    return resolved;
  }
}
