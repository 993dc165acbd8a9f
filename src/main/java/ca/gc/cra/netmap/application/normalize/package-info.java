/**
 * Validation and canonicalization of raw dump records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.application.normalize;
