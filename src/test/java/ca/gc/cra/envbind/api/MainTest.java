package ca.gc.cra.envbind.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.envbind.testutil.SampleConfigs;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class MainTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(Main.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    ExitCode code = Main.run(new String[0]);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: envbind <usage|check|unused> [options]"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().equals("Missing command")));
  }

  @Test
  void unknownCommandPrintsUsage() {
    ExitCode code = Main.run(new String[] {"frobnicate"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: envbind <usage|check|unused> [options]"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().equals("Unknown command: frobnicate")));
  }

  @Test
  void helpWithoutCommandShowsDispatcherHelp() {
    ExitCode code = Main.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().startsWith("envbind command dispatcher"));
  }

  @Test
  void helpAfterCommandIsDelegated() {
    ExitCode code = Main.run(new String[] {"unused", "--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().startsWith("envbind unused"), buffer.toString());
  }

  @Test
  void flagsAreForwardedToTheCommand() throws Exception {
    Path env = Files.writeString(tempDir.resolve("app.env"), "APP_PORT=8080\n");

    ExitCode code = Main.run(new String[] {
        "--no-system-env",
        "CHECK",
        "spec=" + SampleConfigs.ServiceConfig.class.getName(),
        "prefix=app",
        "envFile=" + env});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().startsWith("OK: 19 variables checked"), buffer.toString());
  }
}
