/**
 * Adapters implementing the application ports.
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.infrastructure;
