package ca.gc.cra.netmap.application.identity;

import ca.gc.cra.netmap.domain.observation.ObservationId;
import ca.gc.cra.netmap.domain.observation.RecordKind;
import java.util.Objects;

/**
 * Host union applied by a committed batch.
 *
 * @param survivor canonical host id after the union
 * @param absorbed canonical id that was redirected to {@code survivor}
 * @param evidenceKind kind of record that justified the union
 * @param observation justifying observation
 */
public record HostMergeEvent(String survivor, String absorbed, RecordKind evidenceKind, ObservationId observation) {
  public HostMergeEvent {
    Objects.requireNonNull(survivor, "survivor");
    Objects.requireNonNull(absorbed, "absorbed");
    Objects.requireNonNull(evidenceKind, "evidenceKind");
    Objects.requireNonNull(observation, "observation");
  }
}
