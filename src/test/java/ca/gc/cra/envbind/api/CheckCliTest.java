package ca.gc.cra.envbind.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.envbind.testutil.SampleConfigs;
import ch.qos.logback.classic.Level;
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

class CheckCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(CheckCli.class);
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
  void validEnvironmentReportsVariableCount() throws Exception {
    Path env = Files.writeString(tempDir.resolve("app.env"), "APP_PORT=8080\nAPP_DEBUG=true\n");

    ExitCode code = CheckCli.run(new String[] {
        "spec=" + SampleConfigs.ServiceConfig.class.getName(),
        "prefix=app",
        "envFile=" + env,
        "--no-system-env"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("OK: 19 variables checked for " + SampleConfigs.ServiceConfig.class.getName(),
        buffer.toString().strip());
  }

  @Test
  void missingRequiredKeyIsConfigError() throws Exception {
    Path env = Files.writeString(tempDir.resolve("app.env"), "# nothing set\n");

    ExitCode code = CheckCli.run(new String[] {
        "spec=" + SampleConfigs.RequiredConfig.class.getName(),
        "prefix=app",
        "envFile=" + env,
        "--no-system-env"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertFalse(buffer.toString().contains("OK:"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("required key APP_REQUIREDVAR missing value")));
  }

  @Test
  void conversionFailureIsConfigError() throws Exception {
    Path env = Files.writeString(tempDir.resolve("app.env"), "APP_PORT=eighty\n");

    ExitCode code = CheckCli.run(new String[] {
        "spec=" + SampleConfigs.ServiceConfig.class.getName(),
        "prefix=app",
        "envFile=" + env,
        "--no-system-env"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("APP_PORT")));
  }

  @Test
  void malformedEnvFileIsConfigError() throws Exception {
    Path env = Files.writeString(tempDir.resolve("app.env"), "NOT A PAIR\n");

    ExitCode code = CheckCli.run(new String[] {
        "spec=" + SampleConfigs.ServiceConfig.class.getName(),
        "envFile=" + env,
        "--no-system-env"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().startsWith("Invalid input file")));
  }

  @Test
  void unknownClassIsInvalidArgs() {
    ExitCode code = CheckCli.run(new String[] {"spec=com.example.DoesNotExist", "--no-system-env"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage()
            .contains("Unable to load configuration class com.example.DoesNotExist")));
  }

  @Test
  void missingSpecPrintsUsage() {
    ExitCode code = CheckCli.run(new String[] {"prefix=app"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains(CheckCli.SUMMARY_USAGE));
  }

  @Test
  void helpReturnsSuccess() {
    ExitCode code = CheckCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("envbind check"));
  }
}
