package ca.gc.cra.netmap.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class TelemetrySettingsTest {
  @Test
  void disabledUsesDefaults() {
    TelemetrySettings settings = TelemetrySettings.disabled();
    assertEquals(TelemetrySettings.ExporterMode.NONE, settings.exporter());
    assertEquals(TelemetrySettings.DEFAULT_ENDPOINT, settings.endpoint());
    assertEquals(Duration.ofSeconds(30), settings.exportInterval());
  }

  @Test
  void explicitValuesWinOverEnvironment() {
    TelemetrySettings settings = TelemetrySettings.resolve("OTLP", "https://collector:4317", "env=test");
    assertEquals(TelemetrySettings.ExporterMode.OTLP, settings.exporter());
    assertEquals("https://collector:4317", settings.endpoint());
    assertEquals("env=test", settings.resourceAttributes());
  }

  @Test
  void otlpRequiresHttpEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> new TelemetrySettings(TelemetrySettings.ExporterMode.OTLP, "ftp://collector", null, null));
  }

  @Test
  void unknownExporterIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> TelemetrySettings.ExporterMode.from("prometheus"));
    assertEquals("metricsExporter must be 'otlp' or 'none' (was 'prometheus')", ex.getMessage());
  }
}
