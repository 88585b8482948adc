package com.openpanel.sdk.integrations;

import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogCapture;
import com.launchdarkly.logging.Logs;
import com.openpanel.sdk.Components;
import com.openpanel.sdk.Tracker;
import com.openpanel.sdk.subsystems.ClientContext;
import com.openpanel.sdk.subsystems.LoggingConfiguration;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;

@SuppressWarnings("javadoc")
public class LoggingConfigurationBuilderTest {
  private static final ClientContext BASIC_CONTEXT = new ClientContext(null, null);

  @Test
  public void defaultBaseLoggerNameIsTrackerClassName() {
    LoggingConfiguration c = Components.logging().build(BASIC_CONTEXT);
    assertEquals(Tracker.class.getName(), c.getBaseLoggerName());
  }

  @Test
  public void canSetBaseLoggerName() {
    LoggingConfiguration c = Components.logging().baseLoggerName("my.app.analytics").build(BASIC_CONTEXT);
    assertEquals("my.app.analytics", c.getBaseLoggerName());
  }

  @Test
  public void canSetLogAdapterAndLevel() {
    LogCapture logSink = Logs.capture();
    LoggingConfiguration c = Components.logging()
        .adapter(logSink)
        .level(LDLogLevel.WARN)
        .build(BASIC_CONTEXT);
    LDLogger logger = LDLogger.withAdapter(c.getLogAdapter(), "");
    logger.debug("message 1");
    logger.info("message 2");
    logger.warn("message 3");
    logger.error("message 4");
    assertThat(logSink.getMessageStrings(), contains("WARN:message 3", "ERROR:message 4"));
  }

  @Test
  public void defaultLevelIsInfo() {
    LogCapture logSink = Logs.capture();
    LoggingConfiguration c = Components.logging(logSink).build(BASIC_CONTEXT);
    LDLogger logger = LDLogger.withAdapter(c.getLogAdapter(), "");
    logger.debug("message 1");
    logger.info("message 2");
    logger.warn("message 3");
    logger.error("message 4");
    assertThat(logSink.getMessageStrings(), contains("INFO:message 2", "WARN:message 3", "ERROR:message 4"));
  }

  @Test
  public void clientContextUsesBaseLoggerName() {
    LogCapture logSink = Logs.capture();
    LoggingConfiguration c = Components.logging(logSink).baseLoggerName("base").build(BASIC_CONTEXT);
    ClientContext context = new ClientContext(null, c);
    context.getBaseLogger().subLogger("Events").info("hello");
    assertEquals("base.Events", logSink.getMessages().get(0).getLoggerName());
  }
}
