package ca.gc.cra.netmap.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings for one command.
   *
   * @param mode command name
   * @param yaml YAML settings for the command, if a file was loaded
   * @param cli CLI key/value settings (may be empty)
   * @param defaults built-in defaults for the command
   * @param warn receives one message per YAML key that replaces a default and per CLI key that
   *     replaces a YAML key
   * @return immutable merged settings
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> sink = warn == null ? message -> {} : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      String previous = defaultsCopy.get(entry.getKey());
      if (previous != null && !previous.equals(entry.getValue())) {
        sink.accept("YAML overrides default for key: " + entry.getKey());
      }
      merged.put(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key)) {
        sink.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("ingest".equalsIgnoreCase(mode)
        && ConfigValues.parseBoolean(effective.get("force"), false)
        && ConfigValues.parseBoolean(effective.get("dryRun"), false)) {
      throw new IllegalArgumentException("--force cannot be combined with --dry-run");
    }
    if ("host".equalsIgnoreCase(mode) && ConfigValues.firstNonBlank(effective, "id") == null) {
      throw new IllegalArgumentException("host requires id=<hostId>");
    }
  }
}
