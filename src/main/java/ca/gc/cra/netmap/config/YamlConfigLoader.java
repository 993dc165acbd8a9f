package ca.gc.cra.netmap.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads NETMAP settings from a YAML document and flattens the {@code common} section plus one
 * command section into a key/value map.
 *
 * <pre>
 * common:
 *   store: /var/lib/netmap/graph.json
 *   fusion:
 *     trustedSources: [10.0.0.5, jump-01]
 * ingest:
 *   maxAttempts: 8
 * </pre>
 *
 * <p>Nested mappings are flattened with dots; a {@code fusion} or {@code store} level is dropped so
 * that {@code fusion.stalenessWindow} and {@code stalenessWindow} name the same key. Lists of
 * scalars become comma-separated values.</p>
 */
public final class YamlConfigLoader {
  private static final List<String> GROUPING_SECTIONS = List.of("fusion", "store", "telemetry");

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges {@code common} with the {@code mode} section.
   *
   * @param path YAML file
   * @param mode command name ({@code ingest}, {@code graph}, {@code host})
   * @return flat settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      Object commonSection = findSection(root, "common");
      if (commonSection != null) {
        flatten(asMap(commonSection, "common"), "", flattened);
      }
      Object modeSection = findSection(root, normalizedMode);
      if (modeSection != null) {
        flatten(asMap(modeSection, normalizedMode), "", flattened);
      }
      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        String nestedPrefix = prefix.isEmpty() && GROUPING_SECTIONS.contains(key) ? "" : composite;
        flatten(asMap(nested, composite), nestedPrefix, target);
      } else if (value instanceof Iterable<?> items) {
        List<String> parts = new ArrayList<>();
        for (Object item : items) {
          if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
            throw new IllegalArgumentException("YAML list for key " + composite + " must hold scalars");
          }
          parts.add(String.valueOf(item));
        }
        target.put(composite, String.join(",", parts));
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
