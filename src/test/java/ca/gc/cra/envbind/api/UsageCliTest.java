package ca.gc.cra.envbind.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.envbind.testutil.SampleConfigs;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class UsageCliTest {
  private static final String SERVICE = SampleConfigs.ServiceConfig.class.getName();

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Logger supportLogger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(UsageCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    supportLogger = (Logger) LoggerFactory.getLogger(InspectCliSupport.class);
    supportLogger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      supportLogger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void tablePrintsHeaderAndKeys() {
    ExitCode code = UsageCli.run(new String[] {"spec=" + SERVICE, "prefix=app", "--no-system-env"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.startsWith("This application is configured via the environment."), out);
    assertTrue(out.contains("APP_PORT"), out);
    assertTrue(out.contains("APP_SERVICE_HOST"), out);
  }

  @Test
  void jsonListsEveryVariable() throws Exception {
    ExitCode code = UsageCli.run(new String[] {
        "spec=" + SERVICE, "prefix=app", "format=json", "--no-system-env"});

    assertEquals(ExitCode.SUCCESS, code);
    List<String> keys = new ArrayList<>();
    try (JsonParser parser = new JsonFactory().createParser(buffer.toString())) {
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        if (token == JsonToken.FIELD_NAME && "key".equals(parser.getCurrentName())) {
          parser.nextToken();
          keys.add(parser.getText());
        }
      }
    }
    assertEquals(19, keys.size());
    assertEquals("APP_DEBUG", keys.get(0));
  }

  @Test
  void customTemplatePrintsOneLinePerVariable() {
    ExitCode code = UsageCli.run(new String[] {
        "spec=" + SERVICE, "prefix=app", "format=custom", "template={key}={type}\\n",
        "--no-system-env"});

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = buffer.toString().lines().toList();
    assertEquals(19, lines.size());
    assertEquals("APP_DEBUG=True or False", lines.get(0));
    assertTrue(lines.contains("APP_PORT=Integer"), lines.toString());
    assertTrue(lines.contains("APP_SERVICE_HOST=String"), lines.toString());
  }

  @Test
  void customFormatWithoutTemplatePrintsUsage() {
    ExitCode code = UsageCli.run(new String[] {
        "spec=" + SERVICE, "format=custom", "--no-system-env"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains(UsageCli.SUMMARY_USAGE));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("format=custom requires template")));
  }

  @Test
  void invalidFormatPrintsUsage() {
    ExitCode code = UsageCli.run(new String[] {"spec=" + SERVICE, "format=xml", "--no-system-env"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains(UsageCli.SUMMARY_USAGE));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("format must be one of")));
  }

  @Test
  void invalidTargetIsConfigError() {
    ExitCode code = UsageCli.run(new String[] {
        "spec=" + SampleConfigs.BadSeparatorConfig.class.getName(), "--no-system-env"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void unknownClassIsInvalidArgs() {
    ExitCode code = UsageCli.run(new String[] {"spec=com.example.Missing", "--no-system-env"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }
}
