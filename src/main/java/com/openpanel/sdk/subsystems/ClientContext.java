package com.openpanel.sdk.subsystems;

import com.launchdarkly.logging.LDLogger;

/**
 * Context information provided by the {@link com.openpanel.sdk.Tracker} when creating components.
 * <p>
 * This is passed as a parameter to {@link ComponentConfigurer#build(ClientContext)}. Component
 * factories do not receive the entire {@link com.openpanel.sdk.TrackerConfig} because it contains
 * only factory implementations.
 */
public class ClientContext {
  private final LDLogger baseLogger;
  private final HttpConfiguration http;
  private final LoggingConfiguration logging;

  /**
   * Constructs an instance, specifying all properties.
   *
   * @param http the HTTP configuration
   * @param logging the logging configuration; if null, logging is disabled
   */
  public ClientContext(HttpConfiguration http, LoggingConfiguration logging) {
    this.http = http;
    this.logging = logging;

    this.baseLogger = logging == null ? LDLogger.none() :
      LDLogger.withAdapter(logging.getLogAdapter(), logging.getBaseLoggerName());
  }

  /**
   * The base logger for the tracker. Components should use {@link LDLogger#subLogger(String)}
   * to get a logger for their own area of functionality.
   *
   * @return the base logger
   */
  public LDLogger getBaseLogger() {
    return baseLogger;
  }

  /**
   * The configured networking properties that apply to all components.
   *
   * @return the HTTP configuration
   */
  public HttpConfiguration getHttp() {
    return http;
  }

  /**
   * The configured logging properties that apply to all components.
   *
   * @return the logging configuration
   */
  public LoggingConfiguration getLogging() {
    return logging;
  }
}
