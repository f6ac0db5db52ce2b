package ca.gc.cra.relay.application.server;

import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.RequestHandler;
import ca.gc.cra.relay.application.port.StreamConnection;
import ca.gc.cra.relay.domain.http.HttpParseException;
import ca.gc.cra.relay.domain.http.HttpRequest;
import ca.gc.cra.relay.domain.http.HttpResponse;
import ca.gc.cra.relay.infrastructure.protocol.http.HttpRequestParser;
import ca.gc.cra.relay.logging.Logs;
import ca.gc.cra.relay.validation.Numbers;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Serves one accepted client connection from the first byte to the final close.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read the client in chunks into an {@link HttpRequestParser} until the request head is complete.</li>
 *   <li>Log the request line and hand the request to the configured {@link RequestHandler}.</li>
 *   <li>Answer {@code 400 Bad Request} for an unparsable request head and {@code 502 Bad Gateway} when the handler
 *   reports an unparsable upstream response.</li>
 *   <li>Close the client on every path.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; {@link #handle(StreamConnection)} runs on many worker
 * threads at once.</p>
 * <p><strong>Observability:</strong> MDC key {@code peer} holds the client address while the connection is served.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionHandler {
  private static final Logger log = LoggerFactory.getLogger(ConnectionHandler.class);
  static final String MDC_PEER = "peer";

  private final RequestHandler handler;
  private final MetricsPort metrics;
  private final int readChunkBytes;
  private final int maxHeaderBytes;

  /**
   * Creates a connection handler.
   *
   * @param handler receives every successfully parsed request
   * @param metrics metrics sink
   * @param readChunkBytes bytes requested per client read
   * @param maxHeaderBytes bound on the request head
   */
  public ConnectionHandler(RequestHandler handler, MetricsPort metrics, int readChunkBytes, int maxHeaderBytes) {
    this.handler = Objects.requireNonNull(handler, "handler");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.readChunkBytes = (int) Numbers.requireRange("readChunkBytes", readChunkBytes, 1, Integer.MAX_VALUE);
    this.maxHeaderBytes = (int) Numbers.requireRange("maxHeaderBytes", maxHeaderBytes, 1, Integer.MAX_VALUE);
  }

  /**
   * Serves {@code client} and closes it. Never throws; failures are logged and counted.
   *
   * @param client accepted connection
   */
  public void handle(StreamConnection client) {
    MDC.put(MDC_PEER, client.describe());
    metrics.increment("relay.connection.accepted");
    try {
      serve(client);
    } catch (IOException ex) {
      metrics.increment("relay.connection.failed");
      log.warn("Connection failed: {}", ex.toString());
      log.debug("Connection failure detail", ex);
    } catch (RuntimeException ex) {
      metrics.increment("relay.connection.failed");
      log.error("Unexpected failure while serving connection", ex);
    } finally {
      try {
        client.close();
      } catch (IOException ex) {
        log.debug("Failed to close client: {}", ex.getMessage());
      }
      MDC.remove(MDC_PEER);
    }
  }

  private void serve(StreamConnection client) throws IOException {
    HttpRequest request;
    try {
      request = readRequest(client.input());
    } catch (HttpParseException ex) {
      metrics.increment("relay.request.parseError");
      log.warn("Rejecting unparsable request: {} (line: {})", ex.getMessage(), Logs.truncate(ex.offendingLine(), 256));
      writeQuietly(client, HttpResponse.create(400, "Bad Request", "Bad request: " + ex.getMessage() + "\n"));
      return;
    }
    if (request == null) {
      metrics.increment("relay.request.incomplete");
      log.debug("Client closed before sending a complete request head");
      return;
    }
    log.info("{}", request.startLine());
    try {
      handler.handle(client, request);
    } catch (HttpParseException ex) {
      log.warn("Upstream response rejected: {} (line: {})", ex.getMessage(), Logs.truncate(ex.offendingLine(), 256));
      writeQuietly(client, HttpResponse.create(502, "Bad Gateway", "Bad gateway: " + ex.getMessage() + "\n"));
    }
  }

  /**
   * Reads until the request head is complete.
   *
   * @return the request, or {@code null} if the client closed first
   */
  private HttpRequest readRequest(InputStream in) throws IOException, HttpParseException {
    HttpRequestParser parser = new HttpRequestParser(maxHeaderBytes);
    byte[] buffer = new byte[readChunkBytes];
    long consumed = 0L;
    while (!parser.headersRead()) {
      int n = in.read(buffer);
      if (n <= 0) {
        return null;
      }
      consumed += n;
      parser.feed(buffer, 0, n);
    }
    HttpRequest request = parser.message();
    metrics.observe("protocol.http.bytes", consumed - request.bodyLength());
    return request;
  }

  private static void writeQuietly(StreamConnection client, HttpResponse response) {
    try {
      OutputStream out = client.output();
      out.write(response.toWireBytes());
      out.flush();
    } catch (IOException ex) {
      log.debug("Could not send {} to client: {}", response.statusCode(), ex.getMessage());
    }
  }
}
