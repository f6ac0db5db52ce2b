package ca.gc.cra.relay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ServeCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ServeCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunPrintsPlanWithoutBinding() {
    ExitCode code = ServeCli.run(new String[] {
        "targetHost=jira.domain.com", "listenPort=18080", "responseStripHeaders=Set-Cookie", "--dry-run"});

    String out = buffer.toString();
    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(out.startsWith("Serve dry-run: nothing will be bound."), out);
    assertTrue(out.contains(" listen: 0.0.0.0:18080"), out);
    assertTrue(out.contains(" target: https://jira.domain.com:443"), out);
    assertTrue(out.contains(" route: / -> relay"), out);
    assertTrue(out.contains(" strip response headers: Set-Cookie"), out);
    assertTrue(out.contains("Re-run without --dry-run to start relaying."), out);
  }

  @Test
  void yamlConfigFeedsDryRunAndCliOverridesIt() throws Exception {
    Path config = tempDir.resolve("relay.yaml");
    Files.writeString(config, """
        serve:
          targetHost: yaml.example
          targetPort: 8443
          targetTls: false
        """, StandardCharsets.UTF_8);

    ExitCode code = ServeCli.run(new String[] {"config=" + config, "targetPort=9443", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains(" target: http://yaml.example:9443"), buffer.toString());
  }

  @Test
  void missingTargetHostIsAConfigError() {
    ExitCode code = ServeCli.run(new String[] {"--dry-run"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(buffer.toString().contains("usage: serve"));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
        && event.getFormattedMessage().contains("Invalid serve configuration")
        && event.getFormattedMessage().contains("targetHost")));
  }

  @Test
  void outOfRangeValueIsAConfigError() {
    ExitCode code = ServeCli.run(new String[] {"targetHost=t.example", "readChunkBytes=10", "--dry-run"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void unknownFlagIsRejected() {
    ExitCode code = ServeCli.run(new String[] {"targetHost=t.example", "--frobnicate"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: serve"));
  }

  @Test
  void malformedArgumentIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, ServeCli.run(new String[] {"targetHost"}));
  }

  @Test
  void missingConfigFileIsAnIoError() {
    ExitCode code = ServeCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml"), "--dry-run"});

    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void helpPrintsEveryOption() {
    ExitCode code = ServeCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("targetHost=HOST"));
    assertTrue(out.contains("responseStripHeaders"));
    assertFalse(out.contains("usage: serve"));
  }
}
