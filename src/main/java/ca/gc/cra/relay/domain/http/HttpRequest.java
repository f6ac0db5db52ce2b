package ca.gc.cra.relay.domain.http;

import java.util.Objects;

/**
 * HTTP request with request-line fields. Every setter regenerates the start-line from the four parts, so
 * {@link #startLine()} always agrees with the accessors after a mutation.
 *
 * @since 0.1.0
 */
public final class HttpRequest extends HttpMessage {
  private String method;
  private String uri;
  private String protocol;
  private String version;

  /**
   * Creates a request from an already validated request-line.
   *
   * @param startLine request-line exactly as received
   * @param method request method, for example {@code GET}
   * @param uri request target as received; never rewritten by parsing
   * @param protocol protocol name, normally {@code HTTP}
   * @param version protocol version, for example {@code 1.1}
   * @param headers parsed headers
   * @param bodyPrefix body bytes received with the head
   */
  public HttpRequest(
      String startLine,
      String method,
      String uri,
      String protocol,
      String version,
      HeaderCollection headers,
      byte[] bodyPrefix) {
    super(startLine, headers, bodyPrefix);
    this.method = Objects.requireNonNull(method, "method");
    this.uri = Objects.requireNonNull(uri, "uri");
    this.protocol = Objects.requireNonNull(protocol, "protocol");
    this.version = Objects.requireNonNull(version, "version");
  }

  public String method() {
    return method;
  }

  public String uri() {
    return uri;
  }

  public String protocol() {
    return protocol;
  }

  public String version() {
    return version;
  }

  public void setMethod(String method) {
    this.method = Objects.requireNonNull(method, "method");
    updateRequestLine();
  }

  public void setUri(String uri) {
    this.uri = Objects.requireNonNull(uri, "uri");
    updateRequestLine();
  }

  public void setProtocol(String protocol) {
    this.protocol = Objects.requireNonNull(protocol, "protocol");
    updateRequestLine();
  }

  public void setVersion(String version) {
    this.version = Objects.requireNonNull(version, "version");
    updateRequestLine();
  }

  private void updateRequestLine() {
    setStartLine(method + ' ' + uri + ' ' + protocol + '/' + version);
  }
}
