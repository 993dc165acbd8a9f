/**
 * Thread factories and executors with named, daemon workers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.infrastructure.exec;
