package com.openpanel.sdk.integrations;

import com.openpanel.sdk.Components;
import com.openpanel.sdk.subsystems.ComponentConfigurer;
import com.openpanel.sdk.subsystems.HttpConfiguration;

import java.time.Duration;

import javax.net.SocketFactory;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.X509TrustManager;

/**
 * Builder for the tracker's network settings. Obtain one from {@link Components#httpConfiguration()}
 * and pass it to {@link com.openpanel.sdk.TrackerConfig.Builder#http(ComponentConfigurer)}:
 * <pre><code>
 *     Tracker tracker = new Tracker(TrackerConfig.fromEnvironment()
 *         .http(Components.httpConfiguration()
 *             .connectTimeout(Duration.ofSeconds(2))
 *             .proxyHostAndPort("proxy.internal", 3128))
 *         .build());
 * </code></pre>
 */
public abstract class HttpConfigurationBuilder implements ComponentConfigurer<HttpConfiguration> {
  /**
   * Connect timeout used when none is set: 10 seconds, matching OkHttp.
   */
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

  /**
   * Socket timeout used when none is set: 10 seconds, matching OkHttp.
   */
  public static final Duration DEFAULT_SOCKET_TIMEOUT = Duration.ofSeconds(10);

  protected Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
  protected Duration socketTimeout = DEFAULT_SOCKET_TIMEOUT;
  protected String proxyHost;
  protected int proxyPort;
  protected SocketFactory socketFactory;
  protected SSLSocketFactory sslSocketFactory;
  protected X509TrustManager trustManager;

  /**
   * Limits how long opening a connection to the endpoint may take.
   *
   * @param connectTimeout the timeout, or null for {@link #DEFAULT_CONNECT_TIMEOUT}
   * @return the builder
   */
  public HttpConfigurationBuilder connectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
    return this;
  }

  /**
   * Limits how long a read or write on an open connection may stall.
   *
   * @param socketTimeout the timeout, or null for {@link #DEFAULT_SOCKET_TIMEOUT}
   * @return the builder
   */
  public HttpConfigurationBuilder socketTimeout(Duration socketTimeout) {
    this.socketTimeout = socketTimeout == null ? DEFAULT_SOCKET_TIMEOUT : socketTimeout;
    return this;
  }

  /**
   * Routes requests through an HTTP proxy.
   *
   * @param host proxy host name
   * @param port proxy port
   * @return the builder
   */
  public HttpConfigurationBuilder proxyHostAndPort(String host, int port) {
    this.proxyHost = host;
    this.proxyPort = port;
    return this;
  }

  /**
   * Supplies the factory for plain (non-TLS) sockets.
   *
   * @param socketFactory the factory
   * @return the builder
   */
  public HttpConfigurationBuilder socketFactory(SocketFactory socketFactory) {
    this.socketFactory = socketFactory;
    return this;
  }

  /**
   * Supplies custom TLS settings, for example to trust a private certificate authority.
   *
   * @param sslSocketFactory factory for TLS sockets
   * @param trustManager the matching certificate verifier
   * @return the builder
   */
  public HttpConfigurationBuilder sslSocketFactory(SSLSocketFactory sslSocketFactory, X509TrustManager trustManager) {
    this.sslSocketFactory = sslSocketFactory;
    this.trustManager = trustManager;
    return this;
  }
}
