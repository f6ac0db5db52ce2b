package ca.gc.cra.relay.application.relay;

import ca.gc.cra.relay.application.port.MessageRewriter;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.StreamConnection;
import ca.gc.cra.relay.application.port.TargetConnector;
import ca.gc.cra.relay.domain.http.HttpParseException;
import ca.gc.cra.relay.domain.http.HttpRequest;
import ca.gc.cra.relay.domain.http.HttpResponse;
import ca.gc.cra.relay.domain.relay.RelayResult;
import ca.gc.cra.relay.domain.relay.RelaySide;
import ca.gc.cra.relay.infrastructure.protocol.http.HttpResponseParser;
import ca.gc.cra.relay.logging.Logs;
import ca.gc.cra.relay.validation.Numbers;
import ca.gc.cra.relay.validation.Strings;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Relays one HTTP exchange between a client and the proxy target.
 * <p><strong>Why:</strong> The response head must be rewritten before the client sees it, while the body streams through
 * without being buffered.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply {@link MessageRewriter#rewriteRequest(HttpRequest)} and send the serialized request to the target.</li>
 *   <li>Multiplex client and target reads; client bytes after the request are forwarded untouched.</li>
 *   <li>Hold target bytes in a response parser until the head is complete, apply
 *   {@link MessageRewriter#rewriteResponse(HttpResponse)}, and forward the canonical serialized form.</li>
 *   <li>Forward every later target chunk untouched until either peer closes.</li>
 *   <li>Close the target connection on every exit path. The client connection belongs to the caller.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; {@link #relay(StreamConnection, HttpRequest)} may run on
 * many connection threads at once.</p>
 *
 * @implNote Response heads are held in memory until their terminator arrives, bounded by {@code maxHeaderBytes}.
 * There is no idle timeout: a peer that neither sends nor closes keeps the exchange open.
 * @since 0.1.0
 */
public final class RelayEngine {
  private static final Logger log = LoggerFactory.getLogger(RelayEngine.class);
  private static final int PREVIEW_BYTES = 512;

  private final TargetConnector connector;
  private final String targetHost;
  private final int targetPort;
  private final MessageRewriter rewriter;
  private final ExecutorService readerPool;
  private final RelayMetrics metrics;
  private final int chunkSize;
  private final int maxHeaderBytes;

  /**
   * Creates an engine bound to one target.
   *
   * @param connector opens target connections
   * @param targetHost target host name
   * @param targetPort target port
   * @param rewriter rewrite strategy applied to every exchange
   * @param readerPool executor running the two reader tasks of each exchange
   * @param metrics metrics sink
   * @param chunkSize maximum bytes per read
   * @param maxHeaderBytes bound on the response head
   */
  public RelayEngine(
      TargetConnector connector,
      String targetHost,
      int targetPort,
      MessageRewriter rewriter,
      ExecutorService readerPool,
      MetricsPort metrics,
      int chunkSize,
      int maxHeaderBytes) {
    this.connector = Objects.requireNonNull(connector, "connector");
    this.targetHost = Strings.requireNonBlank("targetHost", targetHost);
    this.targetPort = (int) Numbers.requireRange("targetPort", targetPort, 1, 65_535);
    this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
    this.readerPool = Objects.requireNonNull(readerPool, "readerPool");
    this.metrics = new RelayMetrics(Objects.requireNonNull(metrics, "metrics"));
    this.chunkSize = (int) Numbers.requireRange("chunkSize", chunkSize, 1, Integer.MAX_VALUE);
    this.maxHeaderBytes = (int) Numbers.requireRange("maxHeaderBytes", maxHeaderBytes, 1, Integer.MAX_VALUE);
  }

  /**
   * Relays {@code request} to the target and streams the exchange until either side closes.
   *
   * @param client client connection; left open. The client reader task stays blocked on its input, consuming any
   *     later client bytes, until the caller closes it, so callers must close the client once this returns
   * @param request request already read from the client; mutated by the rewrite strategy
   * @return byte counters for the exchange
   * @throws IOException when connecting, reading, or writing fails
   * @throws HttpParseException when the target's response head is malformed or too large
   */
  public RelayResult relay(StreamConnection client, HttpRequest request)
      throws IOException, HttpParseException {
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(request, "request");
    rewriter.rewriteRequest(request);

    try (StreamConnection target = connector.connect(targetHost, targetPort);
        ReadinessMultiplexer mux = new ReadinessMultiplexer(readerPool, chunkSize)) {
      OutputStream toTarget = target.output();
      OutputStream toClient = client.output();

      byte[] requestBytes = request.toWireBytes();
      toTarget.write(requestBytes);
      toTarget.flush();
      log.debug(">>> {}", preview(requestBytes));

      long clientToTarget = requestBytes.length;
      long targetToClient = 0L;
      boolean headForwarded = false;
      HttpResponseParser response = new HttpResponseParser(maxHeaderBytes);

      mux.watch(RelaySide.CLIENT, client.input());
      mux.watch(RelaySide.TARGET, target.input());

      RelaySide closedBy;
      while (true) {
        ReadEvent event = mux.next();
        if (event.failed()) {
          throw event.failure();
        }
        if (event.endOfStream()) {
          closedBy = event.side();
          break;
        }
        byte[] data = event.data();
        if (event.side() == RelaySide.CLIENT) {
          toTarget.write(data);
          toTarget.flush();
          clientToTarget += data.length;
          metrics.onForwarded(RelaySide.CLIENT, data.length);
          log.debug(">>> {}", preview(data));
          continue;
        }
        if (!response.headersRead()) {
          response.feed(data);
          if (!response.headersRead()) {
            continue;
          }
          HttpResponse head = response.message();
          rewriter.rewriteResponse(head);
          metrics.onResponseHeadRewritten();
          data = head.toWireBytes();
          headForwarded = true;
        }
        toClient.write(data);
        toClient.flush();
        targetToClient += data.length;
        metrics.onForwarded(RelaySide.TARGET, data.length);
        log.debug("<<< {}", preview(data));
      }

      RelayResult result = new RelayResult(clientToTarget, targetToClient, headForwarded, closedBy);
      log.info(
          "Closing relayed exchange with {}:{} (closed by {}): clientToTarget={} targetToClient={}",
          targetHost,
          targetPort,
          closedBy,
          clientToTarget,
          targetToClient);
      metrics.onCompleted(result);
      return result;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted = new InterruptedIOException("relay interrupted");
      interrupted.initCause(ex);
      throw interrupted;
    }
  }

  public String targetHost() {
    return targetHost;
  }

  public int targetPort() {
    return targetPort;
  }

  private static String preview(byte[] data) {
    if (!log.isDebugEnabled()) {
      return "";
    }
    return Logs.preview(data, 0, data.length, PREVIEW_BYTES);
  }
}
