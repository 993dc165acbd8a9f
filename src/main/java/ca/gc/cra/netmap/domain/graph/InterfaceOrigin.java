package ca.gc.cra.netmap.domain.graph;

/** How an interface became known. */
public enum InterfaceOrigin {
  /** Seen as an ARP neighbor; keyed by its link address. */
  LINK_ADDRESS,
  /** Reported by a source host as one of its own; keyed by host and local identifier. */
  REPORTED
}
