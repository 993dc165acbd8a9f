/**
 * <strong>Purpose:</strong> Topology fusion: applying identity decisions, link evidence and staleness to the graph.
 * <p><strong>Pipeline role:</strong> Runs inside a store transaction after normalization and identity resolution.</p>
 * <p><strong>Concurrency:</strong> Engine state is per-batch; the sweeper runs on its own scheduler thread.</p>
 * <p><strong>Metrics:</strong> Emits {@code fusion.*} counters.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.application.fusion;
