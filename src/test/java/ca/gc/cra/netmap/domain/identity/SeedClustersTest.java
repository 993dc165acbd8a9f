package ca.gc.cra.netmap.domain.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class SeedClustersTest {
  private static final String WEB = "host/src/web-01";
  private static final String MAC_A = "host/mac/00163e000007";
  private static final String MAC_B = "host/mac/00163e000107";

  @Test
  void reportedSeedWinsElection() {
    SeedClusters clusters = new SeedClusters();
    clusters.add(MAC_A);
    clusters.add(WEB);
    SeedClusters.Union union = clusters.union(MAC_A, WEB).orElseThrow();
    assertEquals(WEB, union.survivor());
    assertEquals(MAC_A, union.absorbed());
    assertEquals(WEB, clusters.canonical(MAC_A));
  }

  @Test
  void smallerIdWinsAmongLinkSeeds() {
    SeedClusters clusters = new SeedClusters();
    clusters.add(MAC_B);
    clusters.add(MAC_A);
    assertEquals(MAC_A, clusters.union(MAC_B, MAC_A).orElseThrow().survivor());
  }

  @Test
  void canonicalIdDoesNotDependOnUnionOrder() {
    for (List<String> order : List.of(List.of(MAC_A, MAC_B, WEB), List.of(WEB, MAC_B, MAC_A))) {
      SeedClusters clusters = new SeedClusters();
      order.forEach(clusters::add);
      clusters.union(order.get(0), order.get(1));
      clusters.union(order.get(1), order.get(2));
      assertEquals(WEB, clusters.canonical(MAC_A));
      assertEquals(WEB, clusters.canonical(MAC_B));
    }
  }

  @Test
  void secondUnionIsNoOp() {
    SeedClusters clusters = new SeedClusters();
    clusters.add(MAC_A);
    clusters.add(MAC_B);
    assertTrue(clusters.union(MAC_A, MAC_B).isPresent());
    assertTrue(clusters.union(MAC_B, MAC_A).isEmpty());
  }

  @Test
  void addIsIdempotent() {
    SeedClusters clusters = new SeedClusters();
    assertTrue(clusters.add(WEB));
    assertFalse(clusters.add(WEB));
    assertEquals(1, clusters.size());
  }

  @Test
  void copyDoesNotLeakUnions() {
    SeedClusters clusters = new SeedClusters();
    clusters.add(MAC_A);
    clusters.add(MAC_B);
    SeedClusters staged = clusters.copy();
    staged.union(MAC_A, MAC_B);
    assertEquals(MAC_B, clusters.canonical(MAC_B));
    assertEquals(MAC_A, staged.canonical(MAC_B));
  }

  @Test
  void unknownSeedIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new SeedClusters().canonical(WEB));
  }
}
