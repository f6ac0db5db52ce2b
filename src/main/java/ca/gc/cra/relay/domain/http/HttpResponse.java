package ca.gc.cra.relay.domain.http;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * HTTP response with status-line fields. Setters regenerate the start-line, mirroring {@link HttpRequest}.
 *
 * @since 0.1.0
 */
public final class HttpResponse extends HttpMessage {
  private String protocol;
  private String version;
  private int statusCode;
  private String reasonPhrase;

  /**
   * Creates a response from an already validated status-line.
   *
   * @param startLine status-line exactly as received
   * @param protocol protocol name, normally {@code HTTP}
   * @param version protocol version
   * @param statusCode three digit status code
   * @param reasonPhrase reason phrase; may be empty
   * @param headers parsed headers
   * @param bodyPrefix body bytes received with the head
   */
  public HttpResponse(
      String startLine,
      String protocol,
      String version,
      int statusCode,
      String reasonPhrase,
      HeaderCollection headers,
      byte[] bodyPrefix) {
    super(startLine, headers, bodyPrefix);
    this.protocol = Objects.requireNonNull(protocol, "protocol");
    this.version = Objects.requireNonNull(version, "version");
    this.statusCode = statusCode;
    this.reasonPhrase = reasonPhrase == null ? "" : reasonPhrase;
  }

  /**
   * Builds a locally generated {@code HTTP/1.1} response that closes the connection.
   *
   * @param statusCode status code
   * @param reasonPhrase reason phrase
   * @param body response body text, encoded as UTF-8; may be empty
   * @return response carrying {@code Connection: close} and, when a body is given, {@code Content-Length}
   */
  public static HttpResponse create(int statusCode, String reasonPhrase, String body) {
    byte[] payload = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
    HeaderCollection headers = new HeaderCollection();
    if (payload.length > 0) {
      headers.add("Content-Length", Integer.toString(payload.length));
    }
    headers.add("Connection", "close");
    String line = "HTTP/1.1 " + statusCode + ' ' + reasonPhrase;
    return new HttpResponse(line, "HTTP", "1.1", statusCode, reasonPhrase, headers, payload);
  }

  public String protocol() {
    return protocol;
  }

  public String version() {
    return version;
  }

  public int statusCode() {
    return statusCode;
  }

  public String reasonPhrase() {
    return reasonPhrase;
  }

  public void setProtocol(String protocol) {
    this.protocol = Objects.requireNonNull(protocol, "protocol");
    updateStatusLine();
  }

  public void setVersion(String version) {
    this.version = Objects.requireNonNull(version, "version");
    updateStatusLine();
  }

  public void setStatusCode(int statusCode) {
    if (statusCode < 100 || statusCode > 999) {
      throw new IllegalArgumentException("statusCode must have three digits: " + statusCode);
    }
    this.statusCode = statusCode;
    updateStatusLine();
  }

  public void setReasonPhrase(String reasonPhrase) {
    this.reasonPhrase = reasonPhrase == null ? "" : reasonPhrase;
    updateStatusLine();
  }

  private void updateStatusLine() {
    String line = protocol + '/' + version + ' ' + statusCode;
    setStartLine(reasonPhrase.isEmpty() ? line : line + ' ' + reasonPhrase);
  }
}
