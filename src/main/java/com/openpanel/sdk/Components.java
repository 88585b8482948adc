package com.openpanel.sdk;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.Logs;
import com.openpanel.sdk.ComponentsImpl.HttpConfigurationBuilderImpl;
import com.openpanel.sdk.ComponentsImpl.HttpTransportFactory;
import com.openpanel.sdk.ComponentsImpl.LoggingConfigurationBuilderImpl;
import com.openpanel.sdk.integrations.HttpConfigurationBuilder;
import com.openpanel.sdk.integrations.LoggingConfigurationBuilder;
import com.openpanel.sdk.subsystems.ComponentConfigurer;
import com.openpanel.sdk.subsystems.EventTransport;

/**
 * Provides configurable factories for the standard implementations of SDK components.
 * <p>
 * Some of the configuration options in {@link TrackerConfig.Builder} affect the entire SDK, but others
 * are specific to one area of functionality, such as how the SDK uses HTTP or where its log output
 * goes. Those areas are configured with builders obtained from this class, which are then passed to
 * the corresponding {@link TrackerConfig.Builder} method.
 */
public abstract class Components {
  private Components() {}

  /**
   * Returns a configuration builder for the SDK's networking configuration.
   * <p>
   * Passing this to {@link TrackerConfig.Builder#http(ComponentConfigurer)}
   * applies this configuration to all HTTP requests made by the SDK.
   * <pre><code>
   *     TrackerConfig config = TrackerConfig.fromEnvironment()
   *         .http(
   *              Components.httpConfiguration()
   *                  .connectTimeout(Duration.ofSeconds(3))
   *                  .proxyHostAndPort("my-proxy", 8080)
   *         )
   *         .build();
   * </code></pre>
   * 
   * @return a factory object
   * @see TrackerConfig.Builder#http(ComponentConfigurer)
   */
  public static HttpConfigurationBuilder httpConfiguration() {
    return new HttpConfigurationBuilderImpl();
  }

  /**
   * Returns a configuration builder for the SDK's logging configuration.
   * <p>
   * Passing this to {@link TrackerConfig.Builder#logging(ComponentConfigurer)},
   * after setting any desired properties on the builder, applies this configuration to the SDK.
   * 
   * @return a configuration builder
   * @see TrackerConfig.Builder#logging(ComponentConfigurer)
   */
  public static LoggingConfigurationBuilder logging() {
    return new LoggingConfigurationBuilderImpl();
  }

  /**
   * Returns a configuration builder for the SDK's logging configuration, specifying the
   * implementation of logging to use.
   * <p>
   * This is a shortcut for <code>Components.logging().adapter(logAdapter)</code>.
   * <pre><code>
   *     TrackerConfig config = TrackerConfig.fromEnvironment()
   *         .logging(Components.logging(Logs.basic()))
   *         .build();
   * </code></pre>
   * 
   * @param logAdapter the log adapter
   * @return a configuration builder
   * @see LoggingConfigurationBuilder#adapter(LDLogAdapter)
   */
  public static LoggingConfigurationBuilder logging(LDLogAdapter logAdapter) {
    return logging().adapter(logAdapter);
  }

  /**
   * Returns a configuration builder that turns off SDK logging.
   * <p>
   * It is equivalent to <code>Components.logging(com.launchdarkly.logging.Logs.none())</code>.
   * 
   * @return a configuration builder
   */
  public static LoggingConfigurationBuilder noLogging() {
    return logging().adapter(Logs.none());
  }

  /**
   * Returns the factory for the default HTTP transport, which uses OkHttp with the settings from
   * {@link TrackerConfig.Builder#http(ComponentConfigurer)}.
   * <p>
   * This is the default for {@link TrackerConfig.Builder#transport(ComponentConfigurer)}, so there is
   * normally no need to call it.
   *
   * @return a factory object
   */
  public static ComponentConfigurer<EventTransport> httpTransport() {
    return HttpTransportFactory.INSTANCE;
  }
}
