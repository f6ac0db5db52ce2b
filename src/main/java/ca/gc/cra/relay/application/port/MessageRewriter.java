package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.http.HttpRequest;
import ca.gc.cra.relay.domain.http.HttpResponse;
import java.util.Objects;

/**
 * <strong>What:</strong> Strategy that mutates relayed messages before their heads are forwarded.
 * <p><strong>Why:</strong> Lets callers patch the start-line and headers of a message that is still streaming.</p>
 * <p><strong>Role:</strong> Injected into the relay engine at construction.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@link #rewriteRequest(HttpRequest)} runs once, before the request is written to the target.</li>
 *   <li>{@link #rewriteResponse(HttpResponse)} runs once, when the response head is complete and before any
 *   response byte reaches the client.</li>
 * </ul>
 * <p>Strategies compose explicitly with {@link #andThen(MessageRewriter)}.</p>
 * <p>Heads are serialized as ISO-8859-1: a start-line or header value set here with characters outside Latin-1
 * reaches the peer with each such character replaced by {@code ?}.</p>
 *
 * @since 0.1.0
 */
public interface MessageRewriter {
  /**
   * Mutates the outbound request in place.
   *
   * @param request request about to be sent to the target
   */
  void rewriteRequest(HttpRequest request);

  /**
   * Mutates the inbound response in place.
   *
   * @param response response head plus any body bytes already buffered
   */
  void rewriteResponse(HttpResponse response);

  /**
   * Returns a strategy running this one first and {@code next} second, for both hooks.
   *
   * @param next strategy applied after this one
   * @return composed strategy
   */
  default MessageRewriter andThen(MessageRewriter next) {
    Objects.requireNonNull(next, "next");
    MessageRewriter first = this;
    return new MessageRewriter() {
      @Override
      public void rewriteRequest(HttpRequest request) {
        first.rewriteRequest(request);
        next.rewriteRequest(request);
      }

      @Override
      public void rewriteResponse(HttpResponse response) {
        first.rewriteResponse(response);
        next.rewriteResponse(response);
      }
    };
  }

  /** Strategy that leaves both messages untouched. */
  MessageRewriter IDENTITY = new MessageRewriter() {
    @Override public void rewriteRequest(HttpRequest request) {}

    @Override public void rewriteResponse(HttpResponse response) {}
  };
}
