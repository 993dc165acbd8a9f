/**
 * <strong>Purpose:</strong> Typed configuration records, YAML loading and the composition root.
 * <p><strong>Precedence:</strong> CLI arguments override YAML, which overrides built-in defaults.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.config;
