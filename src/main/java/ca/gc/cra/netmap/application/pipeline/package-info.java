/**
 * <strong>Purpose:</strong> Ingest and query orchestration over the graph store.
 * <p><strong>Pipeline role:</strong> normalize -> resolve -> fuse -> commit, with retry on contention.</p>
 * <p><strong>Concurrency:</strong> Batches may be submitted from many threads; the store serializes commits.</p>
 * <p><strong>Metrics:</strong> Emits {@code ingest.*} counters.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.application.pipeline;
