package ca.gc.cra.netmap.domain.graph;

/** Lifecycle of a canonical host id. */
public enum HostStatus {
  ACTIVE,
  /** Absorbed by another host; see {@link Host#mergedInto()}. */
  MERGED
}
