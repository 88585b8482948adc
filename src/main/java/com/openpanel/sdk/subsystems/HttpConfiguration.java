package com.openpanel.sdk.subsystems;

import com.openpanel.sdk.integrations.HttpConfigurationBuilder;

import java.net.Proxy;
import java.time.Duration;

import javax.net.SocketFactory;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.X509TrustManager;

/**
 * Network settings for the tracker's HTTP client, as produced by {@link HttpConfigurationBuilder}.
 * <p>
 * This holds plain JDK types only, so a custom {@link EventTransport} can apply the same settings to
 * whatever client it uses.
 */
public final class HttpConfiguration {
  private final Duration connectTimeout;
  private final Duration socketTimeout;
  private final Proxy proxy;
  private final SocketFactory socketFactory;
  private final SSLSocketFactory sslSocketFactory;
  private final X509TrustManager trustManager;

  /**
   * Creates an instance. Null timeouts are replaced with the builder defaults; every other
   * parameter may be null to mean "not customized".
   *
   * @param connectTimeout time allowed to open a connection
   * @param proxy HTTP proxy
   * @param socketFactory factory for plain sockets
   * @param socketTimeout time allowed between reads or writes
   * @param sslSocketFactory factory for TLS sockets
   * @param trustManager certificate verification used together with {@code sslSocketFactory}
   */
  public HttpConfiguration(Duration connectTimeout, Proxy proxy, SocketFactory socketFactory,
      Duration socketTimeout, SSLSocketFactory sslSocketFactory, X509TrustManager trustManager) {
    this.connectTimeout = connectTimeout == null ? HttpConfigurationBuilder.DEFAULT_CONNECT_TIMEOUT : connectTimeout;
    this.socketTimeout = socketTimeout == null ? HttpConfigurationBuilder.DEFAULT_SOCKET_TIMEOUT : socketTimeout;
    this.proxy = proxy;
    this.socketFactory = socketFactory;
    this.sslSocketFactory = sslSocketFactory;
    this.trustManager = trustManager;
  }

  /**
   * @return the connect timeout, never null
   */
  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  /**
   * @return the read/write timeout, never null
   */
  public Duration getSocketTimeout() {
    return socketTimeout;
  }

  /**
   * @return the proxy, or null to connect directly
   */
  public Proxy getProxy() {
    return proxy;
  }

  /**
   * @return the plain socket factory, or null for the client's default
   */
  public SocketFactory getSocketFactory() {
    return socketFactory;
  }

  /**
   * @return the TLS socket factory, or null for the client's default
   */
  public SSLSocketFactory getSslSocketFactory() {
    return sslSocketFactory;
  }

  /**
   * @return the trust manager paired with {@link #getSslSocketFactory()}, or null
   */
  public X509TrustManager getTrustManager() {
    return trustManager;
  }
}
