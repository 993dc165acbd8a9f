/**
 * Logging helpers: verbosity control and log-safe rendering of untrusted text.
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.logging;
