package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.http.HttpParseException;
import ca.gc.cra.relay.domain.http.HttpRequest;
import java.io.IOException;

/**
 * Handles a request whose head has already been read from the client.
 * <p>Handlers write their answer to the client connection but never close it; the connection handler does.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RequestHandler {
  /**
   * Serves {@code request}.
   *
   * @param client connection the request arrived on
   * @param request parsed request, including any body bytes received with the head
   * @throws IOException on client or upstream I/O failure
   * @throws HttpParseException when an upstream message cannot be parsed
   */
  void handle(StreamConnection client, HttpRequest request) throws IOException, HttpParseException;
}
