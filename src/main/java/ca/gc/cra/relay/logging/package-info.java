/**
 * Logging helpers that keep relayed payloads readable and bounded in operator logs.
 * <p><strong>Concurrency:</strong> Stateless utilities; safe for concurrent use.</p>
 */
package ca.gc.cra.relay.logging;
