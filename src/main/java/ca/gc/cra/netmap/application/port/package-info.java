/**
 * <strong>Purpose:</strong> Ports the use cases depend on: graph store, clock and metrics.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Security:</strong> Port boundaries assume validated inputs from configuration modules.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.application.port;
