package ca.gc.cra.relay.application.server;

import ca.gc.cra.relay.application.port.RequestHandler;
import ca.gc.cra.relay.application.port.StreamConnection;
import ca.gc.cra.relay.domain.http.HttpParseException;
import ca.gc.cra.relay.domain.http.HttpRequest;
import ca.gc.cra.relay.domain.http.HttpResponse;
import ca.gc.cra.relay.validation.Strings;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Dispatches requests to handlers by URI prefix.
 * <p><strong>Why:</strong> One listener can serve local files under one prefix and relay everything else.</p>
 * <p><strong>Rules:</strong> Routes are tried in registration order and the first prefix the request URI starts
 * with wins. The prefix is not stripped from the URI. Without a match the router answers {@code 404 Not Found}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent routing; registration is expected before serving starts.</p>
 *
 * @since 0.1.0
 */
public final class PrefixRouter implements RequestHandler {
  private static final Logger log = LoggerFactory.getLogger(PrefixRouter.class);

  private final List<Route> routes = new CopyOnWriteArrayList<>();

  /**
   * Adds a route after the existing ones.
   *
   * @param prefix URI prefix, for example {@code /static/}
   * @param handler handler for matching requests
   * @return this router
   */
  public PrefixRouter register(String prefix, RequestHandler handler) {
    String p = Strings.requireNonBlank("prefix", prefix);
    routes.add(new Route(p, Objects.requireNonNull(handler, "handler")));
    log.debug("Registered route {} -> {}", p, handler.getClass().getSimpleName());
    return this;
  }

  /**
   * Finds the handler for {@code uri}.
   *
   * @param uri request URI as received
   * @return the first matching handler, or empty
   */
  public Optional<RequestHandler> resolve(String uri) {
    if (uri == null) {
      return Optional.empty();
    }
    for (Route route : routes) {
      if (uri.startsWith(route.prefix())) {
        return Optional.of(route.handler());
      }
    }
    return Optional.empty();
  }

  /** Returns the registered prefixes in match order. */
  public List<String> prefixes() {
    return routes.stream().map(Route::prefix).toList();
  }

  @Override
  public void handle(StreamConnection client, HttpRequest request) throws IOException, HttpParseException {
    Optional<RequestHandler> handler = resolve(request.uri());
    if (handler.isPresent()) {
      handler.get().handle(client, request);
      return;
    }
    log.info("No handler for {}", request.uri());
    HttpResponse notFound = HttpResponse.create(404, "Not Found", "No handler for " + request.uri() + ".\n");
    OutputStream out = client.output();
    out.write(notFound.toWireBytes());
    out.flush();
  }

  private record Route(String prefix, RequestHandler handler) {}
}
