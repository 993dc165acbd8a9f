/**
 * <strong>Purpose:</strong> Use cases that turn raw observations into a fused topology graph.
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.application;
