package ca.gc.cra.netmap.config;

import ca.gc.cra.netmap.validation.Numbers;
import ca.gc.cra.netmap.validation.Strings;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Scoring and lifecycle parameters of the topology fusion engine.
 *
 * <p>Adjacency and route confidence use separate steps: the two scales are independent and
 * values of different kinds are not meant to be compared.</p>
 *
 * @param stalenessWindow age of the latest support after which a link turns stale
 * @param confirmThreshold distinct supporting observations needed to confirm a link
 * @param adjacencyConfidenceStep per-observation step of the adjacency confidence curve
 * @param routeConfidenceStep per-observation step of the route confidence curve
 * @param trustedSources source host ids whose single observation confirms a link
 * @param sweepInterval period of the background staleness sweep
 * @since 0.1.0
 */
public record FusionConfig(
    Duration stalenessWindow,
    int confirmThreshold,
    double adjacencyConfidenceStep,
    double routeConfidenceStep,
    Set<String> trustedSources,
    Duration sweepInterval) {

  public FusionConfig {
    Numbers.requirePositive("stalenessWindow", stalenessWindow);
    Numbers.requireRange("confirmThreshold", confirmThreshold, 1, 1_000);
    Numbers.requireOpenUnitInterval("adjacencyConfidenceStep", adjacencyConfidenceStep);
    Numbers.requireOpenUnitInterval("routeConfidenceStep", routeConfidenceStep);
    trustedSources = trustedSources == null ? Set.of() : Set.copyOf(trustedSources);
    trustedSources.forEach(source -> Strings.requireIdentifier("trustedSources", source, 128));
    Numbers.requirePositive("sweepInterval", sweepInterval);
  }

  public static FusionConfig defaults() {
    return new FusionConfig(Duration.ofHours(24), 2, 0.5, 0.3, Set.of(), Duration.ofMinutes(5));
  }

  /**
   * Builds a config from flattened options, falling back to {@link #defaults()} per key.
   *
   * @param options merged CLI/YAML options
   * @return validated config
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static FusionConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    FusionConfig defaults = defaults();
    return new FusionConfig(
        ConfigValues.parseDuration("stalenessWindow", options.get("stalenessWindow"), defaults.stalenessWindow()),
        ConfigValues.parseInt("confirmThreshold", options.get("confirmThreshold"), defaults.confirmThreshold()),
        ConfigValues.parseDouble(
            "adjacencyConfidenceStep", options.get("adjacencyConfidenceStep"), defaults.adjacencyConfidenceStep()),
        ConfigValues.parseDouble(
            "routeConfidenceStep", options.get("routeConfidenceStep"), defaults.routeConfidenceStep()),
        ConfigValues.parseList(options.get("trustedSources"), defaults.trustedSources()),
        ConfigValues.parseDuration("sweepInterval", options.get("sweepInterval"), defaults.sweepInterval()));
  }
}
