/**
 * Input validation helpers shared by the CLI, configuration, and adapters.
 * <p><strong>Concurrency:</strong> Stateless utilities; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}s for callers to report.</p>
 */
package ca.gc.cra.relay.validation;
