/**
 * <strong>Purpose:</strong> Graph store adapters: in-memory with keyed locks, and a JSON file store built on it.
 * <p><strong>Concurrency:</strong> Transactions lock their keys, stage work, then publish under one commit lock.</p>
 * <p><strong>Durability:</strong> The file store replaces its file atomically on each commit.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.infrastructure.store;
