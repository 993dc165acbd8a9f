package ca.gc.cra.netmap.application.pipeline;

/**
 * Per-batch ingestion switches. A dry run never touches the store, so it cannot be combined with
 * {@code forceRecreate}.
 *
 * @param forceRecreate drop the store and identity clusters before ingesting
 * @param dryRun normalize and fuse, then roll back instead of committing
 */
public record IngestOptions(boolean forceRecreate, boolean dryRun) {
  public IngestOptions {
    if (forceRecreate && dryRun) {
      throw new IllegalArgumentException("forceRecreate cannot be combined with dryRun");
    }
  }

  public static IngestOptions defaults() {
    return new IngestOptions(false, false);
  }
}
