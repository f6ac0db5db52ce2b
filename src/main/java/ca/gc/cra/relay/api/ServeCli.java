package ca.gc.cra.relay.api;

import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.config.CompositionRoot;
import ca.gc.cra.relay.config.RelayConfig;
import ca.gc.cra.relay.infrastructure.net.RelayServer;
import ca.gc.cra.relay.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the relay server from CLI key-value arguments and an optional YAML file.
 *
 * @since 0.1.0
 */
public final class ServeCli {
  private static final Logger log = LoggerFactory.getLogger(ServeCli.class);
  private static final String MODE = "serve";
  private static final Set<String> KNOWN_FLAGS = Set.of("--dry-run");
  private static final String SUMMARY_USAGE =
      "usage: serve targetHost=HOST [targetPort=1-65535] [targetTls=true|false] [listenAddress=ADDR] "
          + "[listenPort=0-65535] [proxyPrefix=/] [staticPrefix=/PREFIX staticRoot=DIR] "
          + "[maxHeaderBytes=1024-1048576] [readChunkBytes=512-1048576] [config=PATH] [--dry-run]";
  private static final String HELP_TEXT = """
      RELAY HTTP rewriting relay

      Usage:
        serve targetHost=HOST [options]

      Required:
        targetHost=HOST              Host every proxied request is sent to (Host header rewritten to it)

      Optional (validated):
        targetPort=1-65535           Target port (default 443)
        targetTls=true|false         Connect to the target over TLS (default true)
        connectTimeoutMillis=0-600000  Target connect timeout, 0 waits forever (default 10000)
        listenAddress=ADDR           Address to listen on (default 0.0.0.0)
        listenPort=0-65535           Port to listen on (default 8080; 0 picks a free port)
        proxyPrefix=/PREFIX          URI prefix relayed to the target (default /)
        staticPrefix=/PREFIX         URI prefix served from staticRoot (requires staticRoot)
        staticRoot=DIR               Directory served under staticPrefix
        maxHeaderBytes=1024-1048576  Largest accepted request/response head (default 65536)
        readChunkBytes=512-1048576   Bytes per socket read (default 16384)
        requestStripHeaders=A,B      Headers removed from relayed requests
        responseStripHeaders=A,B     Headers removed from relayed responses, e.g. Set-Cookie
        metricsExporter=otlp|none    Metrics exporter (default none)
        otelEndpoint=URL             OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V   Comma-separated OTel resource attributes
        config=PATH                  YAML file with 'common' and 'serve' sections; CLI values win
        --dry-run                    Validate inputs and print the plan without listening
        --verbose                    Enable DEBUG logging, including payload previews
        --help                       Show this message
      """;

  private ServeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the serve command and returns once the server stops or the dry run is printed.
   *
   * @param args raw CLI arguments
   * @return exit code signalling success or failure
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for serve");
    }
    List<String> unknown = input.unknownFlags(KNOWN_FLAGS);
    if (!unknown.isEmpty()) {
      log.error("Unknown flag(s): {}", String.join(", ", unknown));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    boolean dryRun = input.hasFlag("--dry-run");

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    RelayConfig config;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(MODE, kv);
      if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose", false)) {
        LoggingConfigurator.enableVerboseLogging();
      }
      TelemetryConfigurator.validate(effective);
      config = RelayConfig.fromMap(effective);
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serve configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    if (dryRun) {
      CompositionRoot planOnly = new CompositionRoot(config, MetricsPort.NO_OP);
      List<String> lines = new ArrayList<>();
      lines.add("Serve dry-run: nothing will be bound.");
      planOnly.describePlan().forEach(line -> lines.add(" " + line));
      lines.add(" Re-run without --dry-run to start relaying.");
      CliPrinter.printLines(lines);
      return ExitCode.SUCCESS;
    }

    CompositionRoot root;
    RelayServer server;
    try {
      root = new CompositionRoot(config);
      server = root.relayServer();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serve configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    Thread shutdownHook = new Thread(() -> stop(server, root), "relay-shutdown");
    try {
      server.start();
      Runtime.getRuntime().addShutdownHook(shutdownHook);
      log.info("Relaying {} to {}:{}", config.proxyPrefix(), config.targetHost(), config.targetPort());
      server.awaitTermination();
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to listen on {}:{}", config.listenAddress(), config.listenPort(), ex);
      stop(server, root);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Serve interrupted; shutting down");
      stop(server, root);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while serving", ex);
      stop(server, root);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void stop(RelayServer server, CompositionRoot root) {
    server.stop();
    if (root.metrics() instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter cleanly", ex);
      }
    }
  }
}
