package ca.gc.cra.netmap.application.fusion;

import ca.gc.cra.netmap.config.FusionConfig;
import ca.gc.cra.netmap.domain.graph.Link;
import ca.gc.cra.netmap.domain.graph.LinkKind;
import ca.gc.cra.netmap.domain.graph.LinkStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Derives confidence and lifecycle status of a link from its support.
 *
 * <p>Confidence is {@code 1 - (1 - step)^n} for {@code n} distinct supporting observations, with a
 * separate step per link kind. A link is {@link LinkStatus#CONFIRMED} once it has
 * {@code confirmThreshold} supporting observations or any support from a trusted source, and
 * {@link LinkStatus#STALE} once its latest support is older than the staleness window.</p>
 *
 * <p>Stateless apart from its configuration; safe to share.</p>
 */
public final class LinkAssessor {
  private final FusionConfig config;

  public LinkAssessor(FusionConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Confidence for {@code supportCount} observations of a {@code kind} link.
   *
   * @param kind link kind selecting the confidence track
   * @param supportCount distinct supporting observations
   * @return confidence in {@code [0, 1)}
   */
  public double confidence(LinkKind kind, int supportCount) {
    double step = kind == LinkKind.ADJACENCY
        ? config.adjacencyConfidenceStep()
        : config.routeConfidenceStep();
    return 1.0 - Math.pow(1.0 - step, supportCount);
  }

  public LinkStatus status(Link link, Instant now) {
    if (Duration.between(link.lastSeen(), now).compareTo(config.stalenessWindow()) > 0) {
      return LinkStatus.STALE;
    }
    boolean trusted = link.sources().stream().anyMatch(config.trustedSources()::contains);
    if (trusted || link.support().size() >= config.confirmThreshold()) {
      return LinkStatus.CONFIRMED;
    }
    return LinkStatus.PROPOSED;
  }

  /**
   * Returns {@code link} with confidence and status evaluated at {@code now}.
   *
   * @param link stored link
   * @param now evaluation instant
   * @return reassessed link, or {@code link} itself when nothing changed
   */
  public Link assess(Link link, Instant now) {
    double confidence = confidence(link.kind(), link.support().size());
    LinkStatus status = status(link, now);
    if (confidence == link.confidence() && status == link.status()) {
      return link;
    }
    return link.assessed(confidence, status);
  }
}
