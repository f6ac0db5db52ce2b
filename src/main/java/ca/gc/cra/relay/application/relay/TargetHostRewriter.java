package ca.gc.cra.relay.application.relay;

import ca.gc.cra.relay.application.port.MessageRewriter;
import ca.gc.cra.relay.domain.http.HttpRequest;
import ca.gc.cra.relay.domain.http.HttpResponse;
import ca.gc.cra.relay.validation.Strings;

/**
 * Default rewrite strategy for the relay.
 * <ul>
 *   <li>Request: {@code Host} is set to the target host, since the client addressed the relay and the target
 *   may reject a foreign host name.</li>
 *   <li>Request and response: {@code Connection: close}, since only the first exchange on a connection is
 *   parsed.</li>
 * </ul>
 * Custom strategies extend it by composition, for example {@code new TargetHostRewriter(host).andThen(custom)}.
 *
 * @since 0.1.0
 */
public final class TargetHostRewriter implements MessageRewriter {
  private final String targetHost;

  public TargetHostRewriter(String targetHost) {
    this.targetHost = Strings.requireNonBlank("targetHost", targetHost);
  }

  public String targetHost() {
    return targetHost;
  }

  @Override
  public void rewriteRequest(HttpRequest request) {
    request.headers().replace("Host", targetHost);
    request.headers().replace("Connection", "close");
  }

  @Override
  public void rewriteResponse(HttpResponse response) {
    response.headers().replace("Connection", "close");
  }
}
