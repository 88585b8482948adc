package com.openpanel.sdk;

import com.openpanel.sdk.subsystems.ComponentConfigurer;
import com.openpanel.sdk.subsystems.EventTransport;
import com.openpanel.sdk.subsystems.HttpConfiguration;
import com.openpanel.sdk.subsystems.LoggingConfiguration;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * This class exposes advanced configuration options for the {@link Tracker}.
 * <p>
 * Instances are created with a {@link Builder}, usually one pre-filled from the environment:
 * <pre><code>
 *     TrackerConfig config = TrackerConfig.fromEnvironment()
 *         .logging(Components.logging().level(LDLogLevel.DEBUG))
 *         .build();
 *     Tracker tracker = new Tracker(config);
 * </code></pre>
 */
public final class TrackerConfig {
  /**
   * The variable that holds the URL events are posted to.
   */
  public static final String TRACK_URL_VARIABLE = "OPENPANEL_TRACK_URL";

  /**
   * The variable that holds the client ID.
   */
  public static final String CLIENT_ID_VARIABLE = "OPENPANEL_CLIENT_ID";

  /**
   * The variable that holds the client secret.
   */
  public static final String CLIENT_SECRET_VARIABLE = "OPENPANEL_CLIENT_SECRET";

  final URI apiUrl;
  final String clientId;
  final String clientSecret;
  final ComponentConfigurer<HttpConfiguration> http;
  final ComponentConfigurer<LoggingConfiguration> logging;
  final ComponentConfigurer<EventTransport> transport;

  private TrackerConfig(Builder builder, URI apiUrl) {
    this.apiUrl = apiUrl;
    this.clientId = builder.clientId;
    this.clientSecret = builder.clientSecret;
    this.http = builder.http == null ? Components.httpConfiguration() : builder.http;
    this.logging = builder.logging == null ? Components.logging() : builder.logging;
    this.transport = builder.transport == null ? Components.httpTransport() : builder.transport;
  }

  /**
   * Returns a builder pre-filled from environment variables, falling back to a {@code .env} file in
   * the working directory.
   *
   * @return a builder
   * @throws ConfigurationException if the {@code .env} file exists but cannot be read
   * @see ConfigurationSources#defaultSource()
   */
  public static Builder fromEnvironment() throws ConfigurationException {
    return fromSource(ConfigurationSources.defaultSource());
  }

  /**
   * Returns a builder pre-filled from a configuration source. Values the source does not define are
   * left unset, and {@link Builder#build()} reports them.
   *
   * @param source the configuration source
   * @return a builder
   * @throws ConfigurationException if the source cannot be read
   */
  public static Builder fromSource(ConfigurationSource source) throws ConfigurationException {
    return new Builder()
        .apiUrl(source.get(TRACK_URL_VARIABLE))
        .clientId(source.get(CLIENT_ID_VARIABLE))
        .clientSecret(source.get(CLIENT_SECRET_VARIABLE));
  }

  /**
   * Returns the URL events are posted to.
   *
   * @return the endpoint URL
   */
  public URI getApiUrl() {
    return apiUrl;
  }

  /**
   * Returns the client ID.
   *
   * @return the client ID
   */
  public String getClientId() {
    return clientId;
  }

  /**
   * A <a href="http://en.wikipedia.org/wiki/Builder_pattern">builder</a> that helps construct
   * {@link TrackerConfig} objects. Builder calls can be chained, enabling the following pattern:
   * <pre>
   * TrackerConfig config = new TrackerConfig.Builder()
   *      .apiUrl("https://api.openpanel.dev/track")
   *      .clientId("my-client-id")
   *      .clientSecret("my-client-secret")
   *      .build()
   * </pre>
   */
  public static class Builder {
    private String apiUrl;
    private String clientId;
    private String clientSecret;
    private ComponentConfigurer<HttpConfiguration> http = null;
    private ComponentConfigurer<LoggingConfiguration> logging = null;
    private ComponentConfigurer<EventTransport> transport = null;

    /**
     * Creates a builder with no values set.
     */
    public Builder() {
    }

    /**
     * Sets the URL that events are posted to. Device IDs are requested from the {@code device-id}
     * path below it.
     *
     * @param apiUrl an absolute http or https URL
     * @return the builder
     */
    public Builder apiUrl(String apiUrl) {
      this.apiUrl = apiUrl;
      return this;
    }

    /**
     * Sets the client ID.
     *
     * @param clientId the client ID
     * @return the builder
     */
    public Builder clientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    /**
     * Sets the client secret.
     *
     * @param clientSecret the client secret
     * @return the builder
     */
    public Builder clientSecret(String clientSecret) {
      this.clientSecret = clientSecret;
      return this;
    }

    /**
     * Sets the SDK's networking configuration, using a configuration builder. This builder is
     * obtained from {@link Components#httpConfiguration()}, and has methods for setting individual
     * HTTP-related properties.
     *
     * @param http the HTTP configuration builder
     * @return the builder
     * @see Components#httpConfiguration()
     */
    public Builder http(ComponentConfigurer<HttpConfiguration> http) {
      this.http = http;
      return this;
    }

    /**
     * Sets the SDK's logging configuration, using a factory object. This object is normally a
     * configuration builder obtained from {@link Components#logging()}.
     *
     * @param logging the logging configuration builder
     * @return the builder
     * @see Components#logging()
     * @see Components#noLogging()
     */
    public Builder logging(ComponentConfigurer<LoggingConfiguration> logging) {
      this.logging = logging;
      return this;
    }

    /**
     * Sets the component that performs HTTP requests. The default is {@link Components#httpTransport()}.
     *
     * @param transport a factory for the transport
     * @return the builder
     */
    public Builder transport(ComponentConfigurer<EventTransport> transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Builds the configured {@link TrackerConfig} object.
     *
     * @return the {@link TrackerConfig} configured by this builder
     * @throws ConfigurationException if a required value is missing or the URL is invalid
     */
    public TrackerConfig build() throws ConfigurationException {
      requireValue(TRACK_URL_VARIABLE, apiUrl);
      requireValue(CLIENT_ID_VARIABLE, clientId);
      requireValue(CLIENT_SECRET_VARIABLE, clientSecret);
      return new TrackerConfig(this, parseApiUrl(apiUrl));
    }

    private static void requireValue(String name, String value) throws ConfigurationException {
      if (value == null || value.isEmpty()) {
        throw new ConfigurationException(name + " is not set");
      }
    }

    private static URI parseApiUrl(String value) throws ConfigurationException {
      URI uri;
      try {
        uri = new URI(value);
      } catch (URISyntaxException e) {
        throw new ConfigurationException(TRACK_URL_VARIABLE + " is not a valid URL", e);
      }
      String scheme = uri.getScheme();
      if (!uri.isAbsolute() || uri.getHost() == null ||
          !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
        throw new ConfigurationException(TRACK_URL_VARIABLE + " must be an absolute http or https URL");
      }
      return uri;
    }
  }
}
