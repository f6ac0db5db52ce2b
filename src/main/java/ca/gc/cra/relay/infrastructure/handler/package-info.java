/**
 * {@link ca.gc.cra.relay.application.port.RequestHandler} implementations mounted on the prefix router.
 */
package ca.gc.cra.relay.infrastructure.handler;
