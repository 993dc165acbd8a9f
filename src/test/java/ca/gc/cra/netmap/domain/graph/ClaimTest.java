package ca.gc.cra.netmap.domain.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.netmap.domain.observation.ObservationId;
import java.time.Instant;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class ClaimTest {
  private static final Instant T1 = Instant.parse("2024-05-01T12:00:00Z");
  private static final Instant T2 = T1.plusSeconds(60);
  private static final Instant T3 = T1.plusSeconds(120);

  private final Claim a = Claim.of(new ObservationId("aa"), T2);
  private final Claim b = Claim.of(new ObservationId("bb"), T1);
  private final Claim c = Claim.of(new ObservationId("cc"), T3);

  @Test
  void mergeIsCommutative() {
    assertEquals(a.merge(b), b.merge(a));
  }

  @Test
  void mergeIsAssociative() {
    assertEquals(a.merge(b).merge(c), a.merge(b.merge(c)));
  }

  @Test
  void mergeIsIdempotent() {
    Claim ab = a.merge(b);
    assertEquals(ab, ab.merge(a));
    assertEquals(ab, ab.merge(ab));
  }

  @Test
  void mergeWidensTimeSpan() {
    Claim all = a.merge(c).merge(b);
    assertEquals(T1, all.firstSeen());
    assertEquals(T3, all.lastSeen());
    assertEquals(3, all.observations().size());
  }

  @Test
  void rejectsInvertedSpan() {
    assertThrows(IllegalArgumentException.class, () -> new Claim(T2, T1, new TreeSet<>()));
  }
}
