/**
 * <strong>Purpose:</strong> Identity resolution: grouping interfaces and addresses that belong to the same host.
 * <p><strong>Concurrency:</strong> Cluster updates run under the store's commit lock; sessions are
 * confined to one transaction.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.application.identity;
