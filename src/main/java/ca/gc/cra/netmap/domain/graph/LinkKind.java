package ca.gc.cra.netmap.domain.graph;

/** Edge variants. Their confidence values are independent scales and are not compared. */
public enum LinkKind {
  /** L2 neighbor relation from ARP evidence; undirected. */
  ADJACENCY,
  /** L3 relation from routing evidence; directed from the reporting interface. */
  ROUTE
}
