package ca.gc.cra.relay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  private static final Map<String, String> DEFAULTS = DefaultsForMode.asFlatMap("serve");

  @Test
  void cliBeatsYamlBeatsDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "serve",
        Optional.of(Map.of("targetHost", "yaml.example", "listenPort", "9090")),
        Map.of("targetHost", "cli.example"),
        DEFAULTS,
        warnings::add);

    assertEquals("cli.example", merged.get("targetHost"));
    assertEquals("9090", merged.get("listenPort"));
    assertEquals("443", merged.get("targetPort"));
    assertEquals(List.of("CLI overrides YAML for key: targetHost"), warnings);
  }

  @Test
  void targetHostIsRequired() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("serve", Optional.empty(), Map.of(), DEFAULTS, null));

    assertTrue(ex.getMessage().contains("targetHost"));
  }

  @Test
  void staticMountNeedsBothKeys() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "serve",
        Optional.empty(),
        Map.of("targetHost", "t.example", "staticPrefix", "/static/"),
        DEFAULTS,
        null));
  }

  @Test
  void staticPrefixMustDifferFromProxyPrefix() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "serve",
        Optional.empty(),
        Map.of("targetHost", "t.example", "staticPrefix", "/", "staticRoot", "/srv/www"),
        DEFAULTS,
        null));
  }

  @Test
  void defaultsAloneProduceAValidConfigOnceTargetIsGiven() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "serve", Optional.empty(), Map.of("targetHost", "t.example"), DEFAULTS, null);

    RelayConfig config = RelayConfig.fromMap(merged);

    assertEquals(8080, config.listenPort());
    assertEquals(MetricsExporter.NONE, config.metricsExporter());
  }

  @Test
  void unknownModeHasNoDefaults() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("proxy"));
  }
}
