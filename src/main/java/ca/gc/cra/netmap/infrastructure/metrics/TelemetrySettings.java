package ca.gc.cra.netmap.infrastructure.metrics;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Exporter settings for the OpenTelemetry bootstrap.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes extra resource attributes as {@code k=v,k2=v2}
 * @param exportInterval periodic export interval
 */
public record TelemetrySettings(
    ExporterMode exporter, String endpoint, String resourceAttributes, Duration exportInterval) {
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
    exportInterval = exportInterval == null ? Duration.ofSeconds(30) : exportInterval;
    if (exporter == ExporterMode.OTLP) {
      validateEndpoint(endpoint);
    }
  }

  /** Metrics disabled; the CLI default. */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(ExporterMode.NONE, null, null, null);
  }

  /**
   * Resolves settings from explicit values, falling back to the standard {@code OTEL_*}
   * environment variables.
   *
   * @param exporter {@code otlp} or {@code none}; {@code null} to consult the environment
   * @param endpoint endpoint override, may be {@code null}
   * @param resourceAttributes attribute override, may be {@code null}
   * @return settings
   */
  public static TelemetrySettings resolve(String exporter, String endpoint, String resourceAttributes) {
    return new TelemetrySettings(
        ExporterMode.from(firstNonBlank(exporter, System.getenv("OTEL_METRICS_EXPORTER"))),
        firstNonBlank(endpoint, System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT")),
        firstNonBlank(resourceAttributes, System.getenv("OTEL_RESOURCE_ATTRIBUTES")),
        null);
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    return second;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  /** Where metrics go. */
  public enum ExporterMode {
    OTLP,
    NONE;

    /**
     * Parses an exporter name; blank means {@link #NONE}.
     *
     * @param raw {@code otlp} or {@code none}
     * @return mode
     * @throws IllegalArgumentException for any other value
     */
    public static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was '" + raw + "')");
      };
    }
  }
}
