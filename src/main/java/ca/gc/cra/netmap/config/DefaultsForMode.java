package ca.gc.cra.netmap.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default settings for each NETMAP command.
 *
 * <p>The config records remain the source of truth; this map exists so that the merger can tell
 * when YAML replaces a built-in value.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged over the common defaults.
   *
   * @param mode command name ({@code ingest}, {@code graph}, {@code host})
   * @return unmodifiable map of defaults as strings
   * @throws IllegalArgumentException for an unknown command
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "ingest" -> buildIngestDefaults();
      case "graph", "host" -> buildQueryDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    StoreConfig store = StoreConfig.defaults();
    FusionConfig fusion = FusionConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("store", store.path().map(Path::toString).orElse(StoreConfig.MEMORY));
    map.put("storeBackup", Boolean.toString(store.backup()));
    map.put("transactionTimeout", format(store.transactionTimeout()));
    map.put("stalenessWindow", format(fusion.stalenessWindow()));
    map.put("confirmThreshold", Integer.toString(fusion.confirmThreshold()));
    map.put("adjacencyConfidenceStep", Double.toString(fusion.adjacencyConfidenceStep()));
    map.put("routeConfidenceStep", Double.toString(fusion.routeConfidenceStep()));
    map.put("trustedSources", String.join(",", fusion.trustedSources()));
    return Map.copyOf(map);
  }

  private static Map<String, String> buildIngestDefaults() {
    StoreConfig store = StoreConfig.defaults();
    FusionConfig fusion = FusionConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("maxAttempts", Integer.toString(store.maxAttempts()));
    map.put("backoffInitial", format(store.backoffInitial()));
    map.put("backoffMax", format(store.backoffMax()));
    map.put("workers", Integer.toString(store.workers()));
    map.put("sweepInterval", format(fusion.sweepInterval()));
    map.put("force", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildQueryDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("includeStale", "false");
    map.put("minConfidence", "0.0");
    return map;
  }

  private static String format(Duration duration) {
    return duration.toString();
  }
}
