package ca.gc.cra.netmap.application.fusion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.netmap.config.FusionConfig;
import ca.gc.cra.netmap.domain.graph.Link;
import ca.gc.cra.netmap.domain.graph.LinkKind;
import ca.gc.cra.netmap.domain.graph.LinkStatus;
import ca.gc.cra.netmap.domain.observation.ObservationId;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class LinkAssessorTest {
  private static final Instant NOW = Instant.parse("2024-05-02T12:00:00Z");
  private final LinkAssessor assessor = new LinkAssessor(new FusionConfig(
      Duration.ofHours(24), 2, 0.5, 0.3, Set.of("10.0.0.5"), Duration.ofMinutes(5)));

  @Test
  void confidenceFollowsPerKindCurve() {
    assertEquals(0.0, assessor.confidence(LinkKind.ADJACENCY, 0), 1e-9);
    assertEquals(0.5, assessor.confidence(LinkKind.ADJACENCY, 1), 1e-9);
    assertEquals(0.75, assessor.confidence(LinkKind.ADJACENCY, 2), 1e-9);
    assertEquals(0.3, assessor.confidence(LinkKind.ROUTE, 1), 1e-9);
    assertEquals(0.51, assessor.confidence(LinkKind.ROUTE, 2), 1e-9);
  }

  @Test
  void singleUntrustedObservationIsProposed() {
    assertEquals(LinkStatus.PROPOSED, assessor.status(link(NOW.minusSeconds(60), "web-01", "aa"), NOW));
  }

  @Test
  void thresholdSupportConfirms() {
    assertEquals(LinkStatus.CONFIRMED, assessor.status(link(NOW.minusSeconds(60), "web-01", "aa", "bb"), NOW));
  }

  @Test
  void trustedSourceConfirmsAlone() {
    assertEquals(LinkStatus.CONFIRMED, assessor.status(link(NOW.minusSeconds(60), "10.0.0.5", "aa"), NOW));
  }

  @Test
  void oldSupportIsStaleEvenWhenConfirmed() {
    Link old = link(NOW.minus(Duration.ofHours(25)), "10.0.0.5", "aa", "bb");
    assertEquals(LinkStatus.STALE, assessor.status(old, NOW));
  }

  @Test
  void staleLinkRecoversWithFreshSupport() {
    Link old = link(NOW.minus(Duration.ofHours(25)), "web-01", "aa", "bb").assessed(0.75, LinkStatus.STALE);
    Link refreshed = old.mergeWith(link(NOW.minusSeconds(5), "web-01", "cc"));
    assertEquals(LinkStatus.CONFIRMED, assessor.assess(refreshed, NOW).status());
  }

  @Test
  void assessReturnsSameInstanceWhenUnchanged() {
    Link assessed = assessor.assess(link(NOW.minusSeconds(60), "web-01", "aa"), NOW);
    assertSame(assessed, assessor.assess(assessed, NOW));
  }

  private static Link link(Instant lastSeen, String source, String... observations) {
    TreeSet<ObservationId> support = new TreeSet<>();
    for (String observation : observations) {
      support.add(new ObservationId(observation));
    }
    return new Link("adj/if/a|if/b", LinkKind.ADJACENCY, "if/a", "if/b", null, null, null, null,
        support, new TreeSet<>(Set.of(source)), lastSeen, lastSeen, 0.0, LinkStatus.PROPOSED);
  }
}
