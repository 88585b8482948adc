package com.openpanel.sdk.integrations;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.Logs;
import com.openpanel.sdk.Components;
import com.openpanel.sdk.subsystems.ComponentConfigurer;
import com.openpanel.sdk.subsystems.LoggingConfiguration;

/**
 * Contains methods for configuring the SDK's logging behavior.
 * <p>
 * If you want to set non-default values for any of these properties, create a builder with
 * {@link Components#logging()}, change its properties with the methods of this class, and pass it
 * to {@link com.openpanel.sdk.TrackerConfig.Builder#logging(ComponentConfigurer)}:
 * <pre><code>
 *     TrackerConfig config = TrackerConfig.fromEnvironment()
 *         .logging(
 *           Components.logging()
 *             .baseLoggerName("analytics")
 *          )
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#logging()}.
 */
public abstract class LoggingConfigurationBuilder implements ComponentConfigurer<LoggingConfiguration> {
  protected String baseName = null;
  protected LDLogAdapter logAdapter = null;
  protected LDLogLevel minimumLevel = null;
  
  /**
   * Specifies the implementation of logging to use.
   * <p>
   * The <a href="https://github.com/launchdarkly/java-logging"><code>com.launchdarkly.logging</code></a>
   * API defines the {@link LDLogAdapter} interface to specify where log output should be sent.
   * <p>
   * The default logging destination, if no adapter is specified, depends on whether
   * <a href="https://www.slf4j.org/">SLF4J</a> is present in the classpath. If it is, then the SDK uses
   * {@link com.launchdarkly.logging.LDSLF4J#adapter()}, causing output to go to SLF4J; what happens to
   * the output then is determined by the SLF4J configuration. If SLF4J is not present in the classpath,
   * the SDK uses {@link Logs#toConsole()} instead, causing output to go to the {@code System.err} stream.
   * <p>
   * You may use the {@link com.launchdarkly.logging.Logs} factory methods, or a custom implementation,
   * to handle log output differently. For instance, you may specify
   * {@link com.launchdarkly.logging.Logs#toJavaUtilLogging()} to use the <code>java.util.logging</code>
   * framework.
   * 
   * @param logAdapter an {@link LDLogAdapter} for the desired logging implementation
   * @return the builder
   */
  public LoggingConfigurationBuilder adapter(LDLogAdapter logAdapter) {
    this.logAdapter = logAdapter;
    return this;
  }

  /**
   * Specifies a custom base logger name.
   * <p>
   * By default, the SDK uses a base logger name of <code>com.openpanel.sdk.Tracker</code>.
   * Messages will be logged either under this name, or with a suffix to indicate what
   * general area of functionality is involved:
   * <ul>
   * <li> <code>.Events</code>: delivery of events to the collection endpoint, and responses
   * that did not indicate success. </li>
   * </ul>
   * <p>
   * Setting {@link #baseLoggerName(String)} to a non-null value overrides the default. The
   * SDK still adds the same suffixes to the name.
   * 
   * @param name the base logger name
   * @return the builder
   */
  public LoggingConfigurationBuilder baseLoggerName(String name) {
    this.baseName = name;
    return this;
  }
  
  /**
   * Specifies the lowest level of logging to enable.
   * <p>
   * This is only applicable when using an implementation of logging that does not have its own
   * external configuration mechanism, such as {@link Logs#toConsole()}. It adds a log level filter
   * so that log messages at lower levels are suppressed. If not specified, the default minimum level
   * is {@link LDLogLevel#INFO}.
   * <p>
   * When using a logging framework like SLF4J or {@code java.util.logging} that has its own
   * separate mechanism for log filtering, you must use that framework's configuration options for
   * log levels; calling {@link #level(LDLogLevel)} in that case has no effect.  
   * 
   * @param minimumLevel the lowest level of logging to enable
   * @return the builder
   */
  public LoggingConfigurationBuilder level(LDLogLevel minimumLevel) {
    this.minimumLevel = minimumLevel;
    return this;
  }
}
