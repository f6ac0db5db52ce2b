/**
 * Value types describing one relayed request/response exchange.
 */
package ca.gc.cra.relay.domain.relay;
