package ca.gc.cra.relay.infrastructure.protocol.http;

import ca.gc.cra.relay.domain.http.HeaderCollection;
import ca.gc.cra.relay.domain.http.HttpParseException;
import ca.gc.cra.relay.domain.http.HttpResponse;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Incremental parser for HTTP/1.x responses.
 * <p>Accepts status-lines of the form {@code PROTOCOL/1.d SP CODE [SP REASON]}.</p>
 *
 * @since 0.1.0
 */
public final class HttpResponseParser extends HttpMessageParser<HttpResponse> {
  private static final Pattern STATUS_LINE =
      Pattern.compile("^(\\w+)/(1\\.\\d)\\s+(\\d{3})(?:\\s+(.*))?$");

  public HttpResponseParser() {
    this(DEFAULT_MAX_HEADER_BYTES);
  }

  public HttpResponseParser(int maxHeaderBytes) {
    super(maxHeaderBytes);
  }

  @Override
  protected HttpResponse createMessage(String startLine, HeaderCollection headers, byte[] bodyPrefix)
      throws HttpParseException {
    Matcher matcher = STATUS_LINE.matcher(startLine);
    if (!matcher.matches()) {
      throw new HttpParseException("Invalid status line", startLine);
    }
    String reason = matcher.group(4) == null ? "" : matcher.group(4).trim();
    return new HttpResponse(
        startLine,
        matcher.group(1),
        matcher.group(2),
        Integer.parseInt(matcher.group(3)),
        reason,
        headers,
        bodyPrefix);
  }
}
