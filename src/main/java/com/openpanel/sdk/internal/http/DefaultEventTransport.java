package com.openpanel.sdk.internal.http;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.openpanel.sdk.HeaderSet;
import com.openpanel.sdk.RequestException;
import com.openpanel.sdk.TrackerResponse;
import com.openpanel.sdk.subsystems.EventTransport;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Map;

import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * The default {@link EventTransport}, based on OkHttp.
 * <p>
 * Each call makes a single attempt. The response is returned without being read, so the body
 * stream stays open until the caller closes the {@link TrackerResponse}.
 */
public final class DefaultEventTransport implements EventTransport {
  private final OkHttpClient httpClient;
  private final LDLogger logger;

  /**
   * Creates an instance.
   *
   * @param httpProperties the HTTP client settings
   * @param logger the logger for request diagnostics
   */
  public DefaultEventTransport(HttpProperties httpProperties, LDLogger logger) {
    this.httpClient = httpProperties.toHttpClientBuilder().build();
    this.logger = logger;
  }

  @Override
  public void close() throws IOException {
    HttpProperties.shutdownHttpClient(httpClient);
  }

  @Override
  public TrackerResponse post(URI uri, HeaderSet headers, byte[] body) throws RequestException {
    String contentType = headers.get("Content-Type");
    MediaType mediaType = contentType == null ? null : MediaType.parse(contentType);
    Request request = new Request.Builder()
        .url(uri.toASCIIString())
        .headers(toOkHttpHeaders(headers))
        .post(RequestBody.create(body, mediaType))
        .build();
    return execute(request, "posting event");
  }

  @Override
  public TrackerResponse get(URI uri, HeaderSet headers) throws RequestException {
    Request request = new Request.Builder()
        .url(uri.toASCIIString())
        .headers(toOkHttpHeaders(headers))
        .get()
        .build();
    return execute(request, "getting " + uri.getPath());
  }

  private TrackerResponse execute(Request request, String description) throws RequestException {
    long startTime = System.currentTimeMillis();
    Response response;
    try {
      response = httpClient.newCall(request).execute();
    } catch (IOException e) {
      logger.warn("Error {}: {}", description, LogValues.exceptionSummary(e));
      throw new RequestException("Error " + description + " to " + request.url(), e);
    }
    long endTime = System.currentTimeMillis();
    logger.debug("{} took {} ms, response status {}", description, endTime - startTime, response.code());

    if (!response.isSuccessful()) {
      HttpErrors.logHttpError(logger, description, response.code());
    }

    ResponseBody body = response.body();
    InputStream bodyStream = body == null ? new ByteArrayInputStream(new byte[0]) : body.byteStream();
    return new TrackerResponse(response.code(), response.headers().toMultimap(), bodyStream);
  }

  private static Headers toOkHttpHeaders(HeaderSet headers) {
    Headers.Builder builder = new Headers.Builder();
    for (Map.Entry<String, String> kv: headers) {
      builder.add(kv.getKey(), kv.getValue());
    }
    return builder.build();
  }
}
