package ca.gc.cra.netmap.application.pipeline;

/** Outcome of one ingestion batch. */
public enum BatchStatus {
  COMMITTED,
  DRY_RUN,
  FAILED
}
