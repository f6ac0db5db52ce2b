package ca.gc.cra.relay.infrastructure.protocol.http;

import ca.gc.cra.relay.domain.http.HeaderCollection;
import ca.gc.cra.relay.domain.http.HttpParseException;
import ca.gc.cra.relay.domain.http.HttpRequest;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Incremental parser for HTTP/1.x requests.
 * <p>Accepts request-lines of the form {@code METHOD SP URI SP PROTOCOL/1.d}. The URI is kept verbatim.</p>
 *
 * @since 0.1.0
 */
public final class HttpRequestParser extends HttpMessageParser<HttpRequest> {
  private static final Pattern REQUEST_LINE =
      Pattern.compile("^(\\w+)\\s+(\\S+)\\s+(\\w+)/(1\\.\\d)$");

  public HttpRequestParser() {
    this(DEFAULT_MAX_HEADER_BYTES);
  }

  public HttpRequestParser(int maxHeaderBytes) {
    super(maxHeaderBytes);
  }

  @Override
  protected HttpRequest createMessage(String startLine, HeaderCollection headers, byte[] bodyPrefix)
      throws HttpParseException {
    Matcher matcher = REQUEST_LINE.matcher(startLine);
    if (!matcher.matches()) {
      throw new HttpParseException("Invalid request line", startLine);
    }
    return new HttpRequest(
        startLine,
        matcher.group(1),
        matcher.group(2),
        matcher.group(3),
        matcher.group(4),
        headers,
        bodyPrefix);
  }
}
