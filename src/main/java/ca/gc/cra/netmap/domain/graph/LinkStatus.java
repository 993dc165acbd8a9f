package ca.gc.cra.netmap.domain.graph;

/**
 * Edge lifecycle: {@code PROPOSED -> CONFIRMED -> STALE -> CONFIRMED}. Edges are never deleted.
 */
public enum LinkStatus {
  PROPOSED,
  CONFIRMED,
  STALE
}
