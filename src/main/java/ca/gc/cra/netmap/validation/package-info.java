/**
 * <strong>Purpose:</strong> Argument validation helpers shared by configuration and adapters.
 * <p><strong>Security:</strong> Rejects control characters and unwritable paths before use.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.validation;
