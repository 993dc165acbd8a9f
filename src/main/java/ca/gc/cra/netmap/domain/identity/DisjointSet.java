package ca.gc.cra.netmap.domain.identity;

import java.util.Arrays;

/**
 * Index-based disjoint-set forest with path compression and union by rank.
 *
 * <p><strong>Role:</strong> Backing structure for host clustering. Elements are dense integer
 * handles handed out by {@link #add()}; callers keep their own arena mapping handles to ids.</p>
 * <p><strong>Performance:</strong> {@link #find(int)} and {@link #union(int, int)} run in
 * amortized near-constant time.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. The identity resolver mutates a private copy
 * under the store's commit lock and publishes it afterwards.</p>
 *
 * @since 0.1.0
 */
public final class DisjointSet {
  private static final int INITIAL_CAPACITY = 16;

  private int[] parent;
  private int[] rank;
  private int size;

  public DisjointSet() {
    this(INITIAL_CAPACITY);
  }

  private DisjointSet(int capacity) {
    this.parent = new int[capacity];
    this.rank = new int[capacity];
  }

  /**
   * Adds a singleton element.
   *
   * @return handle of the new element
   */
  public int add() {
    if (size == parent.length) {
      int grown = parent.length * 2;
      parent = Arrays.copyOf(parent, grown);
      rank = Arrays.copyOf(rank, grown);
    }
    parent[size] = size;
    rank[size] = 0;
    return size++;
  }

  /**
   * Returns the root handle of {@code element}'s set, compressing the path walked.
   *
   * @param element element handle
   * @return root handle
   */
  public int find(int element) {
    checkHandle(element);
    int root = element;
    while (parent[root] != root) {
      root = parent[root];
    }
    int cursor = element;
    while (parent[cursor] != root) {
      int next = parent[cursor];
      parent[cursor] = root;
      cursor = next;
    }
    return root;
  }

  /**
   * Joins the sets containing {@code a} and {@code b}.
   *
   * @param a element handle
   * @param b element handle
   * @return root of the joined set
   */
  public int union(int a, int b) {
    int rootA = find(a);
    int rootB = find(b);
    if (rootA == rootB) {
      return rootA;
    }
    if (rank[rootA] < rank[rootB]) {
      parent[rootA] = rootB;
      return rootB;
    }
    if (rank[rootA] > rank[rootB]) {
      parent[rootB] = rootA;
      return rootA;
    }
    parent[rootB] = rootA;
    rank[rootA]++;
    return rootA;
  }

  public boolean connected(int a, int b) {
    return find(a) == find(b);
  }

  public int size() {
    return size;
  }

  /**
   * Returns an independent copy.
   *
   * @return deep copy
   */
  public DisjointSet copy() {
    DisjointSet copy = new DisjointSet(Math.max(parent.length, INITIAL_CAPACITY));
    System.arraycopy(parent, 0, copy.parent, 0, size);
    System.arraycopy(rank, 0, copy.rank, 0, size);
    copy.size = size;
    return copy;
  }

  private void checkHandle(int element) {
    if (element < 0 || element >= size) {
      throw new IndexOutOfBoundsException("unknown element handle " + element);
    }
  }
}
