package ca.gc.cra.netmap.domain.graph;

import java.util.Objects;
import java.util.Optional;

/**
 * Link as seen by consumers: the stored edge plus its endpoints lifted to host level.
 *
 * @param link stored link with status re-evaluated at snapshot time
 * @param fromHostId host owning {@code endpointA}
 * @param toNodeId node the edge ends at (interface or reachability id)
 * @param toHostId host owning the target interface; empty when the target is a reachability node
 */
public record LinkView(Link link, String fromHostId, String toNodeId, Optional<String> toHostId) {
  public LinkView {
    Objects.requireNonNull(link, "link");
    Objects.requireNonNull(fromHostId, "fromHostId");
    Objects.requireNonNull(toNodeId, "toNodeId");
    toHostId = toHostId == null ? Optional.empty() : toHostId;
  }
}
