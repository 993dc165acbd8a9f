package ca.gc.cra.netmap.domain.graph;

/** Resolution state of a reachability node. */
public enum ReachabilityStatus {
  /** On-link network; there is no gateway to resolve. */
  DIRECT,
  /** No known interface holds the gateway address yet. */
  UNRESOLVED,
  /** An interface holds the gateway address; route edges terminate there instead. */
  RESOLVED
}
