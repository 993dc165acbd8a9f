package ca.gc.cra.netmap.config;

import ca.gc.cra.netmap.domain.graph.GraphFilter;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the read-only {@code graph} and {@code host} commands.
 *
 * @param filter snapshot filter
 * @param hostId host to print for the {@code host} command
 * @param out output file; empty prints to stdout
 * @param store store settings
 * @param fusion fusion settings used for lazy staleness evaluation
 */
public record QueryConfig(
    GraphFilter filter,
    Optional<String> hostId,
    Optional<Path> out,
    StoreConfig store,
    FusionConfig fusion) {

  public QueryConfig {
    Objects.requireNonNull(filter, "filter");
    hostId = hostId == null ? Optional.empty() : hostId;
    out = out == null ? Optional.empty() : out;
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(fusion, "fusion");
  }

  public static QueryConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    GraphFilter filter = new GraphFilter(
        ConfigValues.parseBoolean(options.get("includeStale"), false),
        ConfigValues.parseDouble("minConfidence", options.get("minConfidence"), 0.0));
    String out = ConfigValues.firstNonBlank(options, "out");
    return new QueryConfig(
        filter,
        ConfigValues.optionalString(options.get("id")),
        out == null ? Optional.empty() : Optional.of(ConfigValues.parsePath("out", out)),
        StoreConfig.fromMap(options),
        FusionConfig.fromMap(options));
  }
}
