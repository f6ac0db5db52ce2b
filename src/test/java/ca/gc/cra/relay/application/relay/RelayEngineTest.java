package ca.gc.cra.relay.application.relay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.port.MessageRewriter;
import ca.gc.cra.relay.application.port.StreamConnection;
import ca.gc.cra.relay.application.port.TargetConnector;
import ca.gc.cra.relay.domain.http.HttpParseException;
import ca.gc.cra.relay.domain.http.HttpRequest;
import ca.gc.cra.relay.domain.relay.RelayResult;
import ca.gc.cra.relay.domain.relay.RelaySide;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.relay.infrastructure.net.PlainTargetConnector;
import ca.gc.cra.relay.infrastructure.protocol.http.HttpRequestParser;
import ca.gc.cra.relay.testutil.LoopbackPair;
import ca.gc.cra.relay.testutil.RecordingMetricsPort;
import ca.gc.cra.relay.testutil.ScriptedTarget;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RelayEngineTest {
  private static final String TARGET_HOST = "jira.domain.com";

  private final ExecutorService readers = ExecutorFactories.newConnectionPool("engine-test", true, null);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @AfterEach
  void tearDown() {
    readers.shutdownNow();
  }

  @Test
  void rewritesHostAndConnectionButKeepsUri() throws Exception {
    try (ScriptedTarget target = ScriptedTarget.respondingWith(
            List.of("HTTP/1.1 204 No Content\r\nConnection: keep-alive\r\n\r\n"));
        LoopbackPair client = LoopbackPair.open()) {
      HttpRequest request = parse(
          "GET /secure/Dashboard.jspa?x=1 HTTP/1.1\r\nHost: localhost:8080\r\nConnection: keep-alive\r\n\r\n");

      engine(target, new TargetHostRewriter(TARGET_HOST)).relay(client.serverSide(), request);

      assertEquals(
          "GET /secure/Dashboard.jspa?x=1 HTTP/1.1\r\n"
              + "Host: jira.domain.com\r\n"
              + "Connection: close\r\n\r\n",
          target.receivedText());
    }
  }

  @Test
  void responseHeadSplitAcrossChunksIsRewrittenBeforeTheClientSeesIt() throws Exception {
    try (ScriptedTarget target = ScriptedTarget.respondingWith(List.of(
            "HTTP/1.1 200 OK\r\nSet-Coo",
            "kie: a=1\r\nConnection: keep-alive\r\nContent-Length: 5\r\n\r\nhel",
            "lo"));
        LoopbackPair client = LoopbackPair.open()) {
      HttpRequest request = parse("GET / HTTP/1.1\r\nHost: localhost\r\n\r\n");

      RelayResult result = engine(target, new TargetHostRewriter(TARGET_HOST)).relay(client.serverSide(), request);
      client.serverSide().close();
      String received = client.readPeerUntilClosed();

      assertEquals(
          "HTTP/1.1 200 OK\r\n"
              + "Set-Cookie: a=1\r\n"
              + "Content-Length: 5\r\n"
              + "Connection: close\r\n\r\n"
              + "hello",
          received);
      assertEquals(RelaySide.TARGET, result.closedBy());
      assertTrue(result.responseHeadersForwarded());
      assertEquals(received.length(), result.targetToClientBytes());
      assertEquals(request.toWireBytes().length, result.clientToTargetBytes());
    }
  }

  @Test
  void composedStripRewriterRemovesResponseHeaders() throws Exception {
    try (ScriptedTarget target = ScriptedTarget.respondingWith(List.of(
            "HTTP/1.1 200 OK\r\nSet-Cookie: a=1\r\nSet-Cookie: b=2\r\nContent-Length: 2\r\n\r\nok"));
        LoopbackPair client = LoopbackPair.open()) {
      MessageRewriter rewriter = new TargetHostRewriter(TARGET_HOST)
          .andThen(new HeaderStripRewriter(List.of(), List.of("Set-Cookie")));

      engine(target, rewriter).relay(client.serverSide(), parse("GET / HTTP/1.1\r\n\r\n"));
      client.serverSide().close();
      String received = client.readPeerUntilClosed();

      assertFalse(received.contains("Set-Cookie"), received);
      assertTrue(received.endsWith("\r\n\r\nok"), received);
    }
  }

  @Test
  void singleSetCookieIsStrippedAndEverythingElseForwardedAsIs() throws Exception {
    try (ScriptedTarget target = ScriptedTarget.respondingWith(List.of(
            "HTTP/1.1 200 OK\r\n"
                + "Content-Type: text/plain\r\n"
                + "Set-Cookie: JSESSIONID=abc; Path=/\r\n"
                + "Content-Length: 4\r\n"
                + "Connection: close\r\n\r\n"
                + "BODY"));
        LoopbackPair client = LoopbackPair.open()) {
      MessageRewriter rewriter = new TargetHostRewriter(TARGET_HOST)
          .andThen(new HeaderStripRewriter(List.of(), List.of("Set-Cookie")));

      engine(target, rewriter).relay(client.serverSide(), parse("GET / HTTP/1.1\r\n\r\n"));
      client.serverSide().close();

      assertEquals(
          "HTTP/1.1 200 OK\r\n"
              + "Content-Type: text/plain\r\n"
              + "Content-Length: 4\r\n"
              + "Connection: close\r\n\r\n"
              + "BODY",
          client.readPeerUntilClosed());
    }
  }

  @Test
  void clientReaderIsReleasedOnlyWhenTheCallerClosesTheClient() throws Exception {
    try (ScriptedTarget target = ScriptedTarget.respondingWith(
            List.of("HTTP/1.1 204 No Content\r\n\r\n"));
        LoopbackPair client = LoopbackPair.open()) {
      RelayResult result = engine(target, new TargetHostRewriter(TARGET_HOST))
          .relay(client.serverSide(), parse("GET / HTTP/1.1\r\n\r\n"));
      readers.shutdown();

      assertEquals(RelaySide.TARGET, result.closedBy());
      assertFalse(readers.awaitTermination(200, TimeUnit.MILLISECONDS));

      client.serverSide().close();

      assertTrue(readers.awaitTermination(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void clientBytesAfterTheHeadAreForwardedUntouched() throws Exception {
    try (ScriptedTarget target = ScriptedTarget.respondingWith(
            List.of("HTTP/1.1 201 Created\r\nContent-Length: 0\r\n\r\n"), 6);
        LoopbackPair client = LoopbackPair.open()) {
      HttpRequest request = parse("POST /upload HTTP/1.1\r\nContent-Length: 6\r\n\r\nabc");
      OutputStream peerOut = client.peer().getOutputStream();
      peerOut.write("def".getBytes(StandardCharsets.US_ASCII));
      peerOut.flush();

      RelayResult result = engine(target, new TargetHostRewriter(TARGET_HOST)).relay(client.serverSide(), request);

      assertTrue(target.receivedText().endsWith("\r\n\r\nabcdef"), target.receivedText());
      assertEquals(request.toWireBytes().length + 3L, result.clientToTargetBytes());
      assertEquals(3L, metrics.observedSum("relay.bytes.clientToTarget"));
    }
  }

  @Test
  void clientEndOfStreamEndsTheExchange() throws Exception {
    try (ScriptedTarget target = ScriptedTarget.respondingWith(List.of(), 1_000);
        LoopbackPair client = LoopbackPair.open()) {
      client.peer().shutdownOutput();

      RelayResult result = engine(target, new TargetHostRewriter(TARGET_HOST))
          .relay(client.serverSide(), parse("GET / HTTP/1.1\r\n\r\n"));

      assertEquals(RelaySide.CLIENT, result.closedBy());
      assertFalse(result.responseHeadersForwarded());
      assertEquals(0L, result.targetToClientBytes());
    }
  }

  @Test
  void malformedResponseHeadFailsAndClosesTarget() throws Exception {
    try (ScriptedTarget target = ScriptedTarget.respondingWith(List.of("NOT-HTTP garbage\r\n\r\n"));
        LoopbackPair client = LoopbackPair.open()) {
      AtomicBoolean targetClosed = new AtomicBoolean();
      PlainTargetConnector plain = new PlainTargetConnector(Duration.ofSeconds(5));
      TargetConnector tracking = (host, port) -> new ClosingTracker(
          plain.connect("127.0.0.1", target.port()), targetClosed);
      RelayEngine engine = new RelayEngine(
          tracking, TARGET_HOST, 443, new TargetHostRewriter(TARGET_HOST), readers, metrics, 4096, 65_536);

      assertThrows(HttpParseException.class, () -> engine.relay(client.serverSide(), parse("GET / HTTP/1.1\r\n\r\n")));
      assertTrue(targetClosed.get());
    }
  }

  @Test
  void metricsCoverForwardedBytesAndCompletion() throws Exception {
    try (ScriptedTarget target = ScriptedTarget.respondingWith(
            List.of("HTTP/1.1 200 OK\r\nContent-Length: 3\r\n\r\n", "abc"));
        LoopbackPair client = LoopbackPair.open()) {
      RelayResult result = engine(target, new TargetHostRewriter(TARGET_HOST))
          .relay(client.serverSide(), parse("GET / HTTP/1.1\r\n\r\n"));

      assertEquals(1, metrics.count("relay.exchange.completed"));
      assertEquals(1, metrics.count("relay.response.rewritten"));
      assertEquals(result.targetToClientBytes(), metrics.observedSum("relay.bytes.targetToClient"));
      assertEquals(List.of(result.clientToTargetBytes()), metrics.observed("relay.exchange.clientToTarget"));
    }
  }

  private RelayEngine engine(ScriptedTarget target, MessageRewriter rewriter) {
    PlainTargetConnector plain = new PlainTargetConnector(Duration.ofSeconds(5));
    TargetConnector loopback = (host, port) -> plain.connect("127.0.0.1", target.port());
    return new RelayEngine(loopback, TARGET_HOST, 443, rewriter, readers, metrics, 4096, 65_536);
  }

  private static HttpRequest parse(String text) throws HttpParseException {
    HttpRequestParser parser = new HttpRequestParser();
    parser.feed(text.getBytes(StandardCharsets.ISO_8859_1));
    return parser.message();
  }

  private static final class ClosingTracker implements StreamConnection {
    private final StreamConnection delegate;
    private final AtomicBoolean closed;

    ClosingTracker(StreamConnection delegate, AtomicBoolean closed) {
      this.delegate = delegate;
      this.closed = closed;
    }

    @Override
    public InputStream input() throws IOException {
      return delegate.input();
    }

    @Override
    public OutputStream output() throws IOException {
      return delegate.output();
    }

    @Override
    public String describe() {
      return delegate.describe();
    }

    @Override
    public void close() throws IOException {
      closed.set(true);
      delegate.close();
    }
  }
}
