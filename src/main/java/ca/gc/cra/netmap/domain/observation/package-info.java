/**
 * Raw and normalized observation records with their content fingerprints.
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.domain.observation;
