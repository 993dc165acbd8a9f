package ca.gc.cra.netmap.application.pipeline;

import ca.gc.cra.netmap.application.fusion.ConflictReport;
import ca.gc.cra.netmap.application.identity.HostMergeEvent;
import ca.gc.cra.netmap.application.normalize.NormalizationError;
import ca.gc.cra.netmap.domain.graph.EntityRef;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Summary of one ingestion batch.
 *
 * <p>For committed and dry-run batches {@code accepted + rejected + duplicates} equals the number
 * of raw records. A {@link BatchStatus#FAILED} batch changed nothing and reports no accepted
 * records.</p>
 *
 * @param batchId unique batch id, also logged as MDC {@code batch.id}
 * @param sourceHostId vantage host of the batch
 * @param status outcome
 * @param accepted records fused into the graph
 * @param rejected records the normalizer refused
 * @param duplicates records repeated within the batch or already stored
 * @param errors normalization errors, one per rejected record
 * @param created entities that did not exist before the batch
 * @param conflicts IP conflicts raised by the batch
 * @param hostMerges host unions applied by the batch
 * @param attempts store attempts made
 * @param failure reason of a failed batch
 * @since 0.1.0
 */
public record MergeReport(
    String batchId,
    String sourceHostId,
    BatchStatus status,
    int accepted,
    int rejected,
    int duplicates,
    List<NormalizationError> errors,
    List<EntityRef> created,
    List<ConflictReport> conflicts,
    List<HostMergeEvent> hostMerges,
    int attempts,
    Optional<String> failure) {

  public MergeReport {
    Objects.requireNonNull(batchId, "batchId");
    Objects.requireNonNull(sourceHostId, "sourceHostId");
    Objects.requireNonNull(status, "status");
    errors = List.copyOf(errors);
    created = List.copyOf(created);
    conflicts = List.copyOf(conflicts);
    hostMerges = List.copyOf(hostMerges);
    failure = failure == null ? Optional.empty() : failure;
  }

  public boolean committed() {
    return status == BatchStatus.COMMITTED;
  }
}
