/**
 * Immutable domain model shared by every layer.
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.domain;
