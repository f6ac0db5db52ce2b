package ca.gc.cra.relay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir
  Path dir;

  @Test
  void modeSectionOverridesCommonAndListsAreJoined() throws Exception {
    Path file = write("""
        common:
          metricsExporter: otlp
          verbose: true
        serve:
          targetHost: jira.domain.com
          targetPort: 8443
          metricsExporter: none
          responseStripHeaders:
            - Set-Cookie
            - Strict-Transport-Security
        """);

    Map<String, String> values = YamlConfigLoader.load(file, "serve").orElseThrow();

    assertEquals("jira.domain.com", values.get("targetHost"));
    assertEquals("8443", values.get("targetPort"));
    assertEquals("none", values.get("metricsExporter"));
    assertEquals("true", values.get("verbose"));
    assertEquals("Set-Cookie,Strict-Transport-Security", values.get("responseStripHeaders"));
  }

  @Test
  void nestedMappingsFlattenToDottedKeys() throws Exception {
    Path file = write("""
        serve:
          tls:
            enabled: false
        """);

    assertEquals("false", YamlConfigLoader.load(file, "SERVE").orElseThrow().get("tls.enabled"));
  }

  @Test
  void missingFileIsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(dir.resolve("absent.yaml"), "serve").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    assertEquals(Map.of(), YamlConfigLoader.load(write(""), "serve").orElseThrow());
  }

  @Test
  void nonMappingSectionIsRejected() throws Exception {
    Path file = write("serve: just-a-string\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "serve"));
  }

  @Test
  void listsOfMappingsAreRejected() throws Exception {
    Path file = write("""
        serve:
          requestStripHeaders:
            - name: Cookie
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "serve"));
  }

  @Test
  void brokenYamlIsReportedAsIllegalArgument() throws Exception {
    Path file = write("serve: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "serve"));
  }

  private Path write(String yaml) throws Exception {
    Path file = dir.resolve("relay.yaml");
    Files.writeString(file, yaml, StandardCharsets.UTF_8);
    return file;
  }
}
