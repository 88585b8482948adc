package com.openpanel.sdk;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.LDSLF4J;
import com.launchdarkly.logging.Logs;
import com.openpanel.sdk.integrations.HttpConfigurationBuilder;
import com.openpanel.sdk.integrations.LoggingConfigurationBuilder;
import com.openpanel.sdk.internal.http.DefaultEventTransport;
import com.openpanel.sdk.internal.http.HttpProperties;
import com.openpanel.sdk.subsystems.ClientContext;
import com.openpanel.sdk.subsystems.ComponentConfigurer;
import com.openpanel.sdk.subsystems.EventTransport;
import com.openpanel.sdk.subsystems.HttpConfiguration;
import com.openpanel.sdk.subsystems.LoggingConfiguration;

import java.net.InetSocketAddress;
import java.net.Proxy;

/**
 * This class contains the package-private implementations of component factories and builders whose
 * public factory methods are in {@link Components}.
 */
abstract class ComponentsImpl {
  private ComponentsImpl() {}

  static final class HttpTransportFactory implements ComponentConfigurer<EventTransport> {
    static final HttpTransportFactory INSTANCE = new HttpTransportFactory();

    @Override
    public EventTransport build(ClientContext context) {
      return new DefaultEventTransport(
          HttpProperties.fromHttpConfiguration(context.getHttp()),
          context.getBaseLogger().subLogger(Loggers.EVENTS_LOGGER_NAME));
    }
  }

  static final class HttpConfigurationBuilderImpl extends HttpConfigurationBuilder {
    @Override
    public HttpConfiguration build(ClientContext clientContext) {
      Proxy proxy = proxyHost == null ? null : new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxyHost, proxyPort));

      return new HttpConfiguration(
          connectTimeout,
          proxy,
          socketFactory,
          socketTimeout,
          sslSocketFactory,
          trustManager
          );
    }
  }

  static final class LoggingConfigurationBuilderImpl extends LoggingConfigurationBuilder {
    @Override
    public LoggingConfiguration build(ClientContext clientContext) {
      LDLogAdapter adapter = logAdapter == null ? getDefaultLogAdapter() : logAdapter;
      LDLogAdapter filteredAdapter = Logs.level(adapter,
          minimumLevel == null ? LDLogLevel.INFO : minimumLevel);
      // If the adapter is for a framework like SLF4J or java.util.logging that has its own external
      // configuration system, then calling Logs.level here has no effect and filteredAdapter will be
      // just the same as adapter.
      String name = baseName == null ? Loggers.BASE_LOGGER_NAME : baseName;
      return new LoggingConfiguration(name, filteredAdapter);
    }

    private static LDLogAdapter getDefaultLogAdapter() {
      // If SLF4J is present in the classpath, use that by default; otherwise use the console.
      try {
        Class.forName("org.slf4j.LoggerFactory");
        return LDSLF4J.adapter();
      } catch (ClassNotFoundException e) {
        return Logs.toConsole();
      }
    }
  }
}
