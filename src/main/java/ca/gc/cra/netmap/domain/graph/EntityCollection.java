package ca.gc.cra.netmap.domain.graph;

/** Persisted collections of the graph store. */
public enum EntityCollection {
  HOSTS("hosts"),
  INTERFACES("interfaces"),
  LINKS("links"),
  REACHABILITY("reachability"),
  OBSERVATIONS("observations");

  private final String label;

  EntityCollection(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
