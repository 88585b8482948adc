package com.openpanel.sdk.internal.http;

import com.openpanel.sdk.subsystems.HttpConfiguration;

import java.net.Proxy;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import javax.net.SocketFactory;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.X509TrustManager;

import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

/**
 * Internal container for HTTP parameters used by SDK components. Includes logic for creating an
 * OkHttp client.
 * <p>
 * This is separate from the public {@link HttpConfiguration} class. That is transformed into this
 * when the SDK is constructing components. The public API does not reference any OkHttp classes,
 * but this internal class does.
 */
public final class HttpProperties {
  private static final int DEFAULT_TIMEOUT = 10000; // same as OkHttp's own default

  private final long connectTimeoutMillis;
  private final Proxy proxy;
  private final SocketFactory socketFactory;
  private final long socketTimeoutMillis;
  private final SSLSocketFactory sslSocketFactory;
  private final X509TrustManager trustManager;

  /**
   * Constructs an instance.
   * 
   * @param connectTimeout connection timeout; null or zero for the default
   * @param proxy optional proxy
   * @param socketFactory optional socket factory
   * @param socketTimeout socket timeout; null or zero for the default
   * @param sslSocketFactory optional SSL socket factory
   * @param trustManager optional SSL trust manager
   */
  public HttpProperties(Duration connectTimeout, Proxy proxy, SocketFactory socketFactory,
      Duration socketTimeout, SSLSocketFactory sslSocketFactory, X509TrustManager trustManager) {
    this.connectTimeoutMillis = millisOrDefault(connectTimeout);
    this.proxy = proxy;
    this.socketFactory = socketFactory;
    this.socketTimeoutMillis = millisOrDefault(socketTimeout);
    this.sslSocketFactory = sslSocketFactory;
    this.trustManager = trustManager;
  }

  /**
   * Returns a minimal set of properties.
   * 
   * @return a default instance
   */
  public static HttpProperties defaults() {
    return new HttpProperties(null, null, null, null, null, null);
  }

  /**
   * Converts the public HTTP configuration into properties.
   *
   * @param config the HTTP configuration
   * @return an instance
   */
  public static HttpProperties fromHttpConfiguration(HttpConfiguration config) {
    return new HttpProperties(
        config.getConnectTimeout(),
        config.getProxy(),
        config.getSocketFactory(),
        config.getSocketTimeout(),
        config.getSslSocketFactory(),
        config.getTrustManager()
        );
  }

  private static long millisOrDefault(Duration d) {
    return d == null || d.toMillis() <= 0 ? DEFAULT_TIMEOUT : d.toMillis();
  }

  /**
   * Applies the configured properties to an OkHttp client builder.
   * 
   * @param builder the client builder
   */
  public void applyToHttpClientBuilder(OkHttpClient.Builder builder) {
    builder.connectionPool(new ConnectionPool(5, 5, TimeUnit.SECONDS));
    builder.connectTimeout(connectTimeoutMillis, TimeUnit.MILLISECONDS);
    builder.readTimeout(socketTimeoutMillis, TimeUnit.MILLISECONDS)
      .writeTimeout(socketTimeoutMillis, TimeUnit.MILLISECONDS);
    builder.retryOnConnectionFailure(false); // every request is attempted at most once

    if (socketFactory != null) {
      builder.socketFactory(socketFactory);
    }

    if (sslSocketFactory != null) {
      builder.sslSocketFactory(sslSocketFactory, trustManager);
    }

    if (proxy != null) {
      builder.proxy(proxy);
    }
  }

  /**
   * Returns an OkHttp client builder initialized with the configured properties.
   * 
   * @return a client builder
   */
  public OkHttpClient.Builder toHttpClientBuilder() {
    OkHttpClient.Builder builder = new OkHttpClient.Builder();
    applyToHttpClientBuilder(builder);
    return builder;
  }

  /**
   * Attempts to completely shut down an OkHttp client.
   * 
   * @param client the client to stop
   */
  public static void shutdownHttpClient(OkHttpClient client) {
    client.dispatcher().cancelAll();
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }
}
