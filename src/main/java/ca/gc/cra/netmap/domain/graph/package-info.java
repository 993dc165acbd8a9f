/**
 * <strong>Purpose:</strong> Graph entities (hosts, interfaces, links, reachability) and their provenance claims.
 * <p><strong>Invariants:</strong> Every merge is commutative and idempotent, so replaying observations in any
 * order yields the same graph.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.domain.graph;
