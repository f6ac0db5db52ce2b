package ca.gc.cra.relay.config;

import ca.gc.cra.relay.application.port.MessageRewriter;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.TargetConnector;
import ca.gc.cra.relay.application.relay.HeaderStripRewriter;
import ca.gc.cra.relay.application.relay.RelayEngine;
import ca.gc.cra.relay.application.relay.TargetHostRewriter;
import ca.gc.cra.relay.application.server.ConnectionHandler;
import ca.gc.cra.relay.application.server.PrefixRouter;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.relay.infrastructure.handler.ProxyingRequestHandler;
import ca.gc.cra.relay.infrastructure.handler.StaticFilesRequestHandler;
import ca.gc.cra.relay.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.relay.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.relay.infrastructure.net.PlainTargetConnector;
import ca.gc.cra.relay.infrastructure.net.RelayServer;
import ca.gc.cra.relay.infrastructure.net.TlsTargetConnector;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that turns a {@link RelayConfig} into a runnable server.
 * <p><strong>Why:</strong> Keeps adapter selection (TLS or plaintext, OTLP or no metrics, static mount or not) in one
 * place so the CLI stays thin and tests can wire the same graph against loopback targets.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the metrics adapter and the target connector.</li>
 *   <li>Compose the rewrite strategy: target host rewriting first, then configured header stripping.</li>
 *   <li>Register routes: the static mount before the proxy prefix.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Use from the bootstrap thread; each factory call builds new instances.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final RelayConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a composition root that selects its metrics adapter from the configuration.
   */
  public CompositionRoot(RelayConfig config) {
    this(config, createMetrics(config));
  }

  /**
   * Creates a composition root with an explicit metrics sink.
   */
  public CompositionRoot(RelayConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public RelayConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /** Returns the connector matching {@link RelayConfig#targetTls()}. */
  public TargetConnector targetConnector() {
    return config.targetTls()
        ? new TlsTargetConnector(config.connectTimeout())
        : new PlainTargetConnector(config.connectTimeout());
  }

  /** Returns target host rewriting followed by header stripping, when any headers are configured. */
  public MessageRewriter rewriter() {
    MessageRewriter rewriter = new TargetHostRewriter(config.targetHost());
    HeaderStripRewriter strip =
        new HeaderStripRewriter(config.requestStripHeaders(), config.responseStripHeaders());
    return strip.isEmpty() ? rewriter : rewriter.andThen(strip);
  }

  /**
   * Builds the relay engine for the configured target.
   *
   * @param readerPool executor running the per-exchange reader tasks
   */
  public RelayEngine relayEngine(ExecutorService readerPool) {
    return new RelayEngine(
        targetConnector(),
        config.targetHost(),
        config.targetPort(),
        rewriter(),
        readerPool,
        metrics,
        config.readChunkBytes(),
        config.maxHeaderBytes());
  }

  /**
   * Builds the router: static mount first when configured, then the proxy prefix.
   *
   * @param readerPool executor running the per-exchange reader tasks
   */
  public PrefixRouter router(ExecutorService readerPool) {
    PrefixRouter router = new PrefixRouter();
    if (config.staticPrefix().isPresent() && config.staticRoot().isPresent()) {
      router.register(config.staticPrefix().get(), new StaticFilesRequestHandler(config.staticRoot().get()));
    }
    router.register(config.proxyPrefix(), new ProxyingRequestHandler(relayEngine(readerPool)));
    return router;
  }

  /**
   * Builds the server with its own worker and reader pools. Stopping the server shuts both down.
   */
  public RelayServer relayServer() {
    ExecutorService readers = ExecutorFactories.newConnectionPool("relay-reader", true,
        (t, ex) -> log.error("Reader thread {} failed", t.getName(), ex));
    ExecutorService workers = ExecutorFactories.newConnectionPool("relay-conn", false,
        (t, ex) -> log.error("Connection thread {} failed", t.getName(), ex));
    ConnectionHandler handler = new ConnectionHandler(
        router(readers), metrics, config.readChunkBytes(), config.maxHeaderBytes());
    InetSocketAddress bind = new InetSocketAddress(config.listenAddress(), config.listenPort());
    return new RelayServer(bind, handler, workers, List.of(readers));
  }

  /**
   * Describes what {@code serve} would do, one line per item, without binding anything.
   */
  public List<String> describePlan() {
    List<String> lines = new ArrayList<>();
    lines.add("listen: " + config.listenAddress() + ":" + config.listenPort());
    lines.add("target: " + (config.targetTls() ? "https://" : "http://")
        + config.targetHost() + ":" + config.targetPort()
        + " (connect timeout " + config.connectTimeout().toMillis() + " ms)");
    if (config.staticPrefix().isPresent() && config.staticRoot().isPresent()) {
      lines.add("route: " + config.staticPrefix().get() + " -> static files in " + config.staticRoot().get());
    }
    lines.add("route: " + config.proxyPrefix() + " -> relay");
    lines.add("maxHeaderBytes: " + config.maxHeaderBytes() + ", readChunkBytes: " + config.readChunkBytes());
    if (!config.requestStripHeaders().isEmpty()) {
      lines.add("strip request headers: " + String.join(", ", config.requestStripHeaders()));
    }
    if (!config.responseStripHeaders().isEmpty()) {
      lines.add("strip response headers: " + String.join(", ", config.responseStripHeaders()));
    }
    lines.add("metrics: " + config.metricsExporter().name().toLowerCase(Locale.ROOT));
    return List.copyOf(lines);
  }

  private static MetricsPort createMetrics(RelayConfig config) {
    if (config.metricsExporter() == MetricsExporter.OTLP) {
      return new OpenTelemetryMetricsAdapter(config.otelEndpoint(), config.otelResourceAttributes());
    }
    return new NoOpMetricsAdapter();
  }
}
