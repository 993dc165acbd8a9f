package ca.gc.cra.netmap.api;

import ca.gc.cra.netmap.application.port.MetricsPort;
import ca.gc.cra.netmap.application.port.StoreCorruptionException;
import ca.gc.cra.netmap.config.CompositionRoot;
import ca.gc.cra.netmap.config.ConfigMerger;
import ca.gc.cra.netmap.config.DefaultsForMode;
import ca.gc.cra.netmap.config.FusionConfig;
import ca.gc.cra.netmap.config.StoreConfig;
import ca.gc.cra.netmap.config.YamlConfigLoader;
import ca.gc.cra.netmap.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.netmap.infrastructure.metrics.TelemetrySettings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/** Shared steps of the commands: YAML lookup and the defaults/YAML/CLI merge. */
final class ConfigCliUtils {
  static final Path DEFAULT_CONFIG = Path.of(System.getProperty("user.home", "."), ".netmap", "netmap.yaml");

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Merges the built-in defaults, the YAML file and the CLI settings of {@code mode}.
   *
   * @param mode command name
   * @param cli CLI settings; {@code config} is consumed
   * @param log logger receiving override warnings
   * @return effective settings
   * @throws IOException when an existing config file cannot be read
   * @throws IllegalArgumentException when an explicit config file is missing or any file or value is invalid
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cli, Logger log) throws IOException {
    Map<String, String> args = new LinkedHashMap<>(cli);
    String configPath = extractConfigPath(args);
    Optional<Map<String, String>> yaml;
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    } else {
      yaml = YamlConfigLoader.load(DEFAULT_CONFIG, mode);
      yaml.ifPresent(ignored -> log.debug("Loaded default configuration {}", DEFAULT_CONFIG));
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, args, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  /**
   * Starts metrics and opens the store; the metrics sink is closed again when the store fails.
   *
   * @param store store settings
   * @param fusion fusion settings
   * @param telemetry metrics exporter settings
   * @return wired composition root
   * @throws StoreCorruptionException when the store file cannot be decoded
   * @throws IOException when the store file cannot be read
   */
  static CompositionRoot openRoot(StoreConfig store, FusionConfig fusion, TelemetrySettings telemetry)
      throws StoreCorruptionException, IOException {
    MetricsPort metrics = OpenTelemetryMetricsAdapter.create(telemetry);
    try {
      return CompositionRoot.open(store, fusion, metrics);
    } catch (StoreCorruptionException | IOException | RuntimeException ex) {
      if (metrics instanceof AutoCloseable closeable) {
        closeAfterFailure(closeable, ex);
      }
      throw ex;
    }
  }

  private static void closeAfterFailure(AutoCloseable closeable, Exception primary) {
    try {
      closeable.close();
    } catch (Exception suppressed) {
      primary.addSuppressed(suppressed);
    }
  }
}
