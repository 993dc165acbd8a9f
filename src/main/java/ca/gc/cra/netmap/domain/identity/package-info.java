/**
 * Identity clustering primitives.
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.domain.identity;
