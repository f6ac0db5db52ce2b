package ca.gc.cra.relay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RelayConfigTest {

  @Test
  void defaultsMatchTheDocumentedValues() {
    RelayConfig config = RelayConfig.defaults("jira.domain.com");

    assertEquals("0.0.0.0", config.listenAddress());
    assertEquals(8080, config.listenPort());
    assertEquals(443, config.targetPort());
    assertTrue(config.targetTls());
    assertEquals(Duration.ofSeconds(10), config.connectTimeout());
    assertEquals("/", config.proxyPrefix());
    assertFalse(config.staticPrefix().isPresent());
    assertEquals(65_536, config.maxHeaderBytes());
    assertEquals(16_384, config.readChunkBytes());
    assertEquals(List.of(), config.responseStripHeaders());
  }

  @Test
  void fromMapParsesEveryKey() {
    Map<String, String> options = new HashMap<>();
    options.put("listenAddress", "127.0.0.1");
    options.put("listenPort", "0");
    options.put("targetHost", "jira.domain.com");
    options.put("targetPort", "8443");
    options.put("targetTls", "no");
    options.put("connectTimeoutMillis", "2500");
    options.put("proxyPrefix", "/jira/");
    options.put("staticPrefix", "/assets/");
    options.put("staticRoot", "/srv/assets");
    options.put("maxHeaderBytes", "8192");
    options.put("readChunkBytes", "1024");
    options.put("requestStripHeaders", "Cookie");
    options.put("responseStripHeaders", "Set-Cookie, X-Frame-Options");
    options.put("metricsExporter", "OTLP");

    RelayConfig config = RelayConfig.fromMap(options);

    assertEquals(0, config.listenPort());
    assertEquals(8443, config.targetPort());
    assertFalse(config.targetTls());
    assertEquals(Duration.ofMillis(2500), config.connectTimeout());
    assertEquals("/jira/", config.proxyPrefix());
    assertEquals(Optional.of("/assets/"), config.staticPrefix());
    assertEquals(Optional.of(Path.of("/srv/assets")), config.staticRoot());
    assertEquals(List.of("Cookie"), config.requestStripHeaders());
    assertEquals(List.of("Set-Cookie", "X-Frame-Options"), config.responseStripHeaders());
    assertEquals(MetricsExporter.OTLP, config.metricsExporter());
  }

  @Test
  void rejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class,
        () -> RelayConfig.fromMap(Map.of("targetHost", "t.example", "targetPort", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> RelayConfig.fromMap(Map.of("targetHost", "t.example", "maxHeaderBytes", "100")));
    assertThrows(IllegalArgumentException.class,
        () -> RelayConfig.fromMap(Map.of("targetHost", "t.example", "targetTls", "maybe")));
    assertThrows(IllegalArgumentException.class,
        () -> RelayConfig.fromMap(Map.of("targetHost", "t.example", "metricsExporter", "prometheus")));
    assertThrows(IllegalArgumentException.class,
        () -> RelayConfig.fromMap(Map.of("targetHost", "t.example", "responseStripHeaders", "Bad Header")));
  }

  @Test
  void targetHostIsRequired() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.fromMap(Map.of("targetHost", " ")));

    assertEquals("targetHost is required", ex.getMessage());
  }

  @Test
  void halfConfiguredStaticMountIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> RelayConfig.fromMap(Map.of("targetHost", "t.example", "staticRoot", "/srv/assets")));
  }
}
