/**
 * <strong>Purpose:</strong> Parsers for ARP tables, routing tables and alias files from several operating systems.
 * <p><strong>Pipeline role:</strong> Turns dump text into raw observations for ingestion.</p>
 * <p><strong>Security:</strong> Lines echoed into logs are truncated.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.infrastructure.parse;
