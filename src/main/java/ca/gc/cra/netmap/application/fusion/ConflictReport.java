package ca.gc.cra.netmap.application.fusion;

import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.observation.ObservationId;
import java.util.List;
import java.util.Objects;

/**
 * IP conflict raised while fusing one observation.
 *
 * @param address contested address
 * @param interfaceIds link-address interfaces that have held the address, sorted
 * @param observation observation that raised the conflict
 */
public record ConflictReport(IpAddress address, List<String> interfaceIds, ObservationId observation) {
  public ConflictReport {
    Objects.requireNonNull(address, "address");
    interfaceIds = List.copyOf(interfaceIds);
    Objects.requireNonNull(observation, "observation");
  }
}
