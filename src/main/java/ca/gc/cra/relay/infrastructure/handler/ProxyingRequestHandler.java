package ca.gc.cra.relay.infrastructure.handler;

import ca.gc.cra.relay.application.port.RequestHandler;
import ca.gc.cra.relay.application.port.StreamConnection;
import ca.gc.cra.relay.application.relay.RelayEngine;
import ca.gc.cra.relay.domain.http.HttpParseException;
import ca.gc.cra.relay.domain.http.HttpRequest;
import java.io.IOException;
import java.util.Objects;

/**
 * Relays matching requests to the configured target through a {@link RelayEngine}.
 */
public final class ProxyingRequestHandler implements RequestHandler {
  private final RelayEngine engine;

  public ProxyingRequestHandler(RelayEngine engine) {
    this.engine = Objects.requireNonNull(engine, "engine");
  }

  @Override
  public void handle(StreamConnection client, HttpRequest request) throws IOException, HttpParseException {
    engine.relay(client, request);
  }

  @Override
  public String toString() {
    return "ProxyingRequestHandler{target=" + engine.targetHost() + ':' + engine.targetPort() + '}';
  }
}
