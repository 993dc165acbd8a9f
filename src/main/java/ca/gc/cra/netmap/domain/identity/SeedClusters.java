package ca.gc.cra.netmap.domain.identity;

import ca.gc.cra.netmap.domain.graph.EntityIds;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Arena of host seeds clustered by a {@link DisjointSet}.
 *
 * <p>Each cluster elects a canonical id deterministically: seeds named after a source host win
 * over seeds named after a link address, then the lexicographically smaller id wins. The elected
 * id therefore depends only on cluster membership, not on the order unions happened in.</p>
 *
 * @since 0.1.0
 */
public final class SeedClusters {
  /** Preferred-first ordering used to elect canonical ids. */
  public static final Comparator<String> ELECTION = Comparator
      .comparing((String seed) -> EntityIds.isReportedHostSeed(seed) ? 0 : 1)
      .thenComparing(Comparator.naturalOrder());

  private final DisjointSet forest;
  private final Map<String, Integer> handles;
  private final List<String> seeds;
  private final Map<Integer, String> canonicalByRoot;

  public SeedClusters() {
    this(new DisjointSet(), new HashMap<>(), new ArrayList<>(), new HashMap<>());
  }

  private SeedClusters(
      DisjointSet forest,
      Map<String, Integer> handles,
      List<String> seeds,
      Map<Integer, String> canonicalByRoot) {
    this.forest = forest;
    this.handles = handles;
    this.seeds = seeds;
    this.canonicalByRoot = canonicalByRoot;
  }

  /**
   * Registers {@code seed} as a singleton cluster if it is not known yet.
   *
   * @param seed host seed id
   * @return whether the seed was new
   */
  public boolean add(String seed) {
    Objects.requireNonNull(seed, "seed");
    if (handles.containsKey(seed)) {
      return false;
    }
    int handle = forest.add();
    handles.put(seed, handle);
    seeds.add(seed);
    canonicalByRoot.put(handle, seed);
    return true;
  }

  public boolean contains(String seed) {
    return handles.containsKey(seed);
  }

  /**
   * Returns the canonical host id of the cluster holding {@code seed}.
   *
   * @param seed known seed id
   * @return canonical id
   * @throws IllegalArgumentException if the seed is unknown
   */
  public String canonical(String seed) {
    Integer handle = handles.get(seed);
    if (handle == null) {
      throw new IllegalArgumentException("unknown host seed " + seed);
    }
    return canonicalByRoot.get(forest.find(handle));
  }

  /**
   * Joins the clusters of two known seeds.
   *
   * @param seedA seed id
   * @param seedB seed id
   * @return the outcome when two distinct clusters were joined, empty when already together
   */
  public Optional<Union> union(String seedA, String seedB) {
    String canonicalA = canonical(seedA);
    String canonicalB = canonical(seedB);
    if (canonicalA.equals(canonicalB)) {
      return Optional.empty();
    }
    int rootA = forest.find(handles.get(seedA));
    int rootB = forest.find(handles.get(seedB));
    int root = forest.union(rootA, rootB);
    canonicalByRoot.remove(rootA);
    canonicalByRoot.remove(rootB);
    String survivor = ELECTION.compare(canonicalA, canonicalB) <= 0 ? canonicalA : canonicalB;
    String absorbed = survivor.equals(canonicalA) ? canonicalB : canonicalA;
    canonicalByRoot.put(root, survivor);
    return Optional.of(new Union(survivor, absorbed));
  }

  public int size() {
    return seeds.size();
  }

  /**
   * Returns an independent copy for staged mutation.
   *
   * @return deep copy
   */
  public SeedClusters copy() {
    return new SeedClusters(
        forest.copy(), new HashMap<>(handles), new ArrayList<>(seeds), new HashMap<>(canonicalByRoot));
  }

  /**
   * Result of joining two clusters.
   *
   * @param survivor canonical id of the joined cluster
   * @param absorbed canonical id that stopped being canonical
   */
  public record Union(String survivor, String absorbed) {}
}
