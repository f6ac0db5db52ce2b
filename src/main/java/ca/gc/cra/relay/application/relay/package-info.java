/**
 * Streaming relay between a client connection and a proxy target.
 * <p><strong>Role:</strong> Application service that forwards a parsed request, intercepts the response head for
 * rewriting, and then pumps raw bytes in both directions.</p>
 * <p><strong>Concurrency:</strong> The relay loop runs on the connection thread; two reader tasks feed it through a
 * single ordered event queue.</p>
 * <p><strong>Metrics:</strong> Emits {@code relay.bytes.clientToTarget}, {@code relay.bytes.targetToClient}, and
 * {@code relay.exchange.completed}.</p>
 */
package ca.gc.cra.relay.application.relay;
