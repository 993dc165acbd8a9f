package ca.gc.cra.netmap.application.port;

import ca.gc.cra.netmap.domain.graph.EntityRef;
import java.util.List;

/**
 * Outcome of {@link GraphStorePort#execute}.
 *
 * @param value work result
 * @param created entities absent before this transaction
 * @param committed {@code false} when the transaction was rolled back on request
 * @param <T> work result type
 */
public record CommitResult<T>(T value, List<EntityRef> created, boolean committed) {
  public CommitResult {
    created = List.copyOf(created);
  }
}
