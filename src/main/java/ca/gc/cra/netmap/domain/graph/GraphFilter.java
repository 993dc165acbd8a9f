package ca.gc.cra.netmap.domain.graph;

import ca.gc.cra.netmap.validation.Numbers;

/**
 * Query filter for graph snapshots.
 *
 * @param includeStale whether stale links are returned
 * @param minConfidence lowest confidence returned, compared against each link's own kind scale
 */
public record GraphFilter(boolean includeStale, double minConfidence) {
  public GraphFilter {
    Numbers.requireUnitInterval("minConfidence", minConfidence);
  }

  /** Default topology view: live links of any confidence. */
  public static GraphFilter defaults() {
    return new GraphFilter(false, 0.0);
  }

  public boolean accepts(Link link) {
    if (!includeStale && link.status() == LinkStatus.STALE) {
      return false;
    }
    return link.confidence() >= minConfidence;
  }
}
