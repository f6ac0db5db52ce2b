package ca.gc.cra.relay.application.relay;

import ca.gc.cra.relay.application.port.MessageRewriter;
import ca.gc.cra.relay.domain.http.HttpRequest;
import ca.gc.cra.relay.domain.http.HttpResponse;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes configured headers from relayed requests and responses. Names are matched exactly.
 *
 * @since 0.1.0
 */
public final class HeaderStripRewriter implements MessageRewriter {
  private static final Logger log = LoggerFactory.getLogger(HeaderStripRewriter.class);

  private final List<String> requestHeaders;
  private final List<String> responseHeaders;

  /**
   * Creates a strategy.
   *
   * @param requestHeaders header names removed from requests
   * @param responseHeaders header names removed from responses
   */
  public HeaderStripRewriter(List<String> requestHeaders, List<String> responseHeaders) {
    this.requestHeaders = List.copyOf(Objects.requireNonNull(requestHeaders, "requestHeaders"));
    this.responseHeaders = List.copyOf(Objects.requireNonNull(responseHeaders, "responseHeaders"));
  }

  public boolean isEmpty() {
    return requestHeaders.isEmpty() && responseHeaders.isEmpty();
  }

  @Override
  public void rewriteRequest(HttpRequest request) {
    for (String name : requestHeaders) {
      int removed = request.headers().remove(name);
      if (removed > 0) {
        log.debug("Stripped {} request header(s) named {}", removed, name);
      }
    }
  }

  @Override
  public void rewriteResponse(HttpResponse response) {
    for (String name : responseHeaders) {
      int removed = response.headers().remove(name);
      if (removed > 0) {
        log.debug("Stripped {} response header(s) named {}", removed, name);
      }
    }
  }
}
