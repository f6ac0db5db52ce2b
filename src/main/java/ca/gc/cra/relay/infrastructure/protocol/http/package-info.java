/**
 * Incremental HTTP/1.x head parsers for requests and responses.
 * <p><strong>Role:</strong> Adapter layer turning arbitrarily fragmented byte chunks into {@code HttpRequest} and
 * {@code HttpResponse} domain messages.</p>
 * <p><strong>Concurrency:</strong> Parser instances are per message and confined to one connection thread.</p>
 * <p><strong>Performance:</strong> Terminator scans resume where the previous chunk ended; the head is decoded once.</p>
 * <p><strong>Security:</strong> Header blocks are bounded by a configurable byte limit.</p>
 */
package ca.gc.cra.relay.infrastructure.protocol.http;
