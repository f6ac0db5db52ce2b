/**
 * Core domain model for RELAY request/response interception.
 * <p><strong>Role:</strong> Domain layer types describing HTTP messages and relayed exchanges without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Message types are mutable and owned by a single connection thread; value records are immutable.</p>
 * <p><strong>Performance:</strong> Messages hold only the header block and the body bytes already received, never a full body.</p>
 * <p><strong>Metrics:</strong> Exchange results feed {@code relay.bytes.*} metrics.</p>
 * <p><strong>Security:</strong> Header values may carry credentials and cookies; log them at DEBUG only.</p>
 */
package ca.gc.cra.relay.domain;
