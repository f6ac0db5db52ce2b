package ca.gc.cra.relay.infrastructure.handler;

import ca.gc.cra.relay.application.port.RequestHandler;
import ca.gc.cra.relay.application.port.StreamConnection;
import ca.gc.cra.relay.domain.http.HeaderCollection;
import ca.gc.cra.relay.domain.http.HttpRequest;
import ca.gc.cra.relay.domain.http.HttpResponse;
import ca.gc.cra.relay.validation.Paths;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Serves files from a base directory.
 * <p><strong>Rules:</strong> The leading {@code /} of the URI is dropped and the rest is resolved under the base
 * directory, prefix included. URIs containing {@code /../}, absolute paths, and anything that is not a readable
 * regular file inside the base answer {@code 404 Not found}. Query strings are not interpreted.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class StaticFilesRequestHandler implements RequestHandler {
  private static final Logger log = LoggerFactory.getLogger(StaticFilesRequestHandler.class);

  private final Path baseDirectory;

  /**
   * Creates a handler.
   *
   * @param baseDirectory existing, readable directory
   * @throws IllegalArgumentException if the directory is unusable
   */
  public StaticFilesRequestHandler(Path baseDirectory) {
    this.baseDirectory = Paths.requireReadableDir("staticRoot", baseDirectory);
  }

  public Path baseDirectory() {
    return baseDirectory;
  }

  @Override
  public void handle(StreamConnection client, HttpRequest request) throws IOException {
    Optional<Path> file = resolve(request.uri());
    OutputStream out = client.output();
    if (file.isEmpty()) {
      log.info("Static file not found for {}", request.uri());
      out.write(HttpResponse.create(404, "Not found", "").toWireBytes());
      out.flush();
      return;
    }
    Path path = file.get();
    long size = Files.size(path);
    HeaderCollection headers = new HeaderCollection();
    headers.add("Content-Length", Long.toString(size));
    headers.add("Connection", "close");
    HttpResponse ok = new HttpResponse("HTTP/1.1 200 OK", "HTTP", "1.1", 200, "OK", headers, null);
    out.write(ok.toWireBytes());
    try (InputStream in = Files.newInputStream(path)) {
      in.transferTo(out);
    }
    out.flush();
    log.debug("Served {} ({} bytes)", path, size);
  }

  /**
   * Maps a request URI to a file under the base directory.
   *
   * @param uri request URI as received
   * @return readable regular file, or empty when the URI is rejected or names nothing servable
   */
  Optional<Path> resolve(String uri) {
    if (uri == null || uri.contains("/../")) {
      return Optional.empty();
    }
    String relative = uri.startsWith("/") ? uri.substring(1) : uri;
    if (relative.isEmpty() || relative.startsWith("/") || relative.startsWith("\\")) {
      return Optional.empty();
    }
    if (relative.length() > 1 && relative.charAt(1) == ':') {
      return Optional.empty();
    }
    return Paths.resolveRegularFile(baseDirectory, relative);
  }
}
