/**
 * Value types for addresses, prefixes and link-layer addresses.
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.domain.net;
