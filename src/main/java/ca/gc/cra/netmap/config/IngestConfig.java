package ca.gc.cra.netmap.config;

import ca.gc.cra.netmap.validation.Strings;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Settings for one {@code ingest} run.
 *
 * @param dumpFile dump to ingest
 * @param dumpType parser type ({@code arp}, {@code route}, {@code traceroute}, {@code alias}); empty to sniff
 * @param dumpOs OS hint ({@code linux}, {@code windows}, {@code openbsd}); empty to sniff
 * @param sourceHostId vantage host id; Windows dumps fall back to the first interface address
 * @param observedAt capture time override; defaults to the dump's modification time
 * @param forceRecreate drop the store before ingesting
 * @param dryRun roll the batch back instead of committing
 * @param store store settings
 * @param fusion fusion settings
 * @since 0.1.0
 */
public record IngestConfig(
    Path dumpFile,
    Optional<String> dumpType,
    Optional<String> dumpOs,
    Optional<String> sourceHostId,
    Optional<Instant> observedAt,
    boolean forceRecreate,
    boolean dryRun,
    StoreConfig store,
    FusionConfig fusion) {

  private static final Set<String> TYPES = Set.of("arp", "route", "traceroute", "alias");
  private static final Set<String> OSES = Set.of("linux", "windows", "openbsd");

  public IngestConfig {
    Objects.requireNonNull(dumpFile, "dumpFile");
    dumpFile = dumpFile.toAbsolutePath().normalize();
    dumpType = checkChoice("type", dumpType, TYPES);
    dumpOs = checkChoice("os", dumpOs, OSES);
    sourceHostId = sourceHostId == null
        ? Optional.empty()
        : sourceHostId.map(value -> Strings.requireIdentifier("source", value, 128));
    observedAt = observedAt == null ? Optional.empty() : observedAt;
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(fusion, "fusion");
  }

  /**
   * Builds a config from flattened options.
   *
   * @param options merged CLI/YAML options; {@code dump} holds the positional dump path
   * @return validated config
   * @throws IllegalArgumentException when the dump path is missing or a value is malformed
   */
  public static IngestConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String dump = ConfigValues.firstNonBlank(options, "dump", "in");
    if (dump == null) {
      throw new IllegalArgumentException("a dump file path is required");
    }
    return new IngestConfig(
        ConfigValues.parsePath("dump", dump),
        ConfigValues.optionalString(options.get("type")),
        ConfigValues.optionalString(options.get("os")),
        ConfigValues.optionalString(ConfigValues.firstNonBlank(options, "source", "ip")),
        parseInstant(options.get("observedAt")),
        ConfigValues.parseBoolean(options.get("force"), false),
        ConfigValues.parseBoolean(options.get("dryRun"), false),
        StoreConfig.fromMap(options),
        FusionConfig.fromMap(options));
  }

  private static Optional<String> checkChoice(String name, Optional<String> value, Set<String> allowed) {
    if (value == null || value.isEmpty()) {
      return Optional.empty();
    }
    String normalized = value.get().trim().toLowerCase(Locale.ROOT);
    if (!allowed.contains(normalized)) {
      throw new IllegalArgumentException(name + " must be one of " + allowed.stream().sorted().toList()
          + " (was '" + value.get() + "')");
    }
    return Optional.of(normalized);
  }

  private static Optional<Instant> parseInstant(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Instant.parse(value.trim()));
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("observedAt must be an ISO-8601 instant (was '" + value + "')", ex);
    }
  }
}
