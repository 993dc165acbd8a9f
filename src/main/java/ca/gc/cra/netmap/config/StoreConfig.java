package ca.gc.cra.netmap.config;

import ca.gc.cra.netmap.validation.Numbers;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Graph store location and batch execution limits.
 *
 * @param path JSON store file; empty selects the in-memory store
 * @param backup whether the previous store file is kept as {@code .bak} on every write
 * @param transactionTimeout bound on lock acquisition and commit per attempt
 * @param maxAttempts attempts per batch before it is reported failed
 * @param backoffInitial delay before the first retry
 * @param backoffMax cap on the exponential retry delay
 * @param workers ingestion worker threads
 * @since 0.1.0
 */
public record StoreConfig(
    Optional<Path> path,
    boolean backup,
    Duration transactionTimeout,
    int maxAttempts,
    Duration backoffInitial,
    Duration backoffMax,
    int workers) {

  static final String MEMORY = "memory";

  public StoreConfig {
    path = path == null ? Optional.empty() : path.map(p -> p.toAbsolutePath().normalize());
    Numbers.requirePositive("transactionTimeout", transactionTimeout);
    Numbers.requireRange("maxAttempts", maxAttempts, 1, 100);
    Numbers.requirePositive("backoffInitial", backoffInitial);
    Numbers.requirePositive("backoffMax", backoffMax);
    if (backoffMax.compareTo(backoffInitial) < 0) {
      throw new IllegalArgumentException("backoffMax must be >= backoffInitial");
    }
    Numbers.requireRange("workers", workers, 1, 64);
  }

  public static StoreConfig defaults() {
    return new StoreConfig(
        Optional.of(ConfigValues.defaultBaseDirectory().resolve("graph.json")),
        true,
        Duration.ofSeconds(5),
        5,
        Duration.ofMillis(100),
        Duration.ofSeconds(5),
        Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors())));
  }

  /**
   * Builds a config from flattened options. {@code store=memory} (or the {@code ignoreStore}
   * flag) selects the in-memory store.
   *
   * @param options merged CLI/YAML options
   * @return validated config
   */
  public static StoreConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    StoreConfig defaults = defaults();
    Optional<Path> path = defaults.path();
    String storeRaw = ConfigValues.firstNonBlank(options, "store", "storePath");
    if (storeRaw != null) {
      path = storeRaw.trim().toLowerCase(Locale.ROOT).equals(MEMORY)
          ? Optional.empty()
          : Optional.of(ConfigValues.parsePath("store", storeRaw));
    }
    if (ConfigValues.parseBoolean(options.get("ignoreStore"), false)) {
      path = Optional.empty();
    }
    return new StoreConfig(
        path,
        ConfigValues.parseBoolean(options.get("storeBackup"), defaults.backup()),
        ConfigValues.parseDuration("transactionTimeout", options.get("transactionTimeout"), defaults.transactionTimeout()),
        ConfigValues.parseInt("maxAttempts", options.get("maxAttempts"), defaults.maxAttempts()),
        ConfigValues.parseDuration("backoffInitial", options.get("backoffInitial"), defaults.backoffInitial()),
        ConfigValues.parseDuration("backoffMax", options.get("backoffMax"), defaults.backoffMax()),
        ConfigValues.parseInt("workers", options.get("workers"), defaults.workers()));
  }

  public boolean inMemory() {
    return path.isEmpty();
  }
}
