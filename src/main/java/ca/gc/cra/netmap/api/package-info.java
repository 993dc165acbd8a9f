/**
 * <strong>Purpose:</strong> Command-line entry points for ingesting dumps and querying the topology graph.
 * <p><strong>Pipeline role:</strong> Outermost adapter; parses arguments, resolves configuration and maps
 * failures to {@link ca.gc.cra.netmap.api.ExitCode} values.</p>
 * <p><strong>Concurrency:</strong> Each command runs on the invoking thread.</p>
 * <p><strong>Security:</strong> File arguments are validated before any read or write.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.api;
