package com.openpanel.sdk;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteStreams;
import com.google.common.io.Closeables;
import com.openpanel.sdk.internal.http.HttpErrors;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The raw HTTP response to a request made by a {@link Tracker}.
 * <p>
 * The SDK does not interpret the status code; an unsuccessful status is returned here rather than
 * thrown. The body is an open stream, so the response must be closed when the caller is done with
 * it, preferably with try-with-resources:
 * <pre><code>
 *     try (TrackerResponse response = tracker.track("signup")) {
 *       if (!response.isSuccessful()) {
 *         log("tracking failed with status " + response.getStatusCode());
 *       }
 *     }
 * </code></pre>
 */
public final class TrackerResponse implements Closeable {
  private final int statusCode;
  private final ImmutableMap<String, List<String>> headers;
  private final InputStream body;

  /**
   * Creates an instance. This is normally called only by an {@link com.openpanel.sdk.subsystems.EventTransport}.
   *
   * @param statusCode the HTTP status
   * @param headers the response headers; names are matched case-insensitively
   * @param body the response body stream; ownership passes to this object
   */
  public TrackerResponse(int statusCode, Map<String, List<String>> headers, InputStream body) {
    this.statusCode = statusCode;
    this.headers = normalizeHeaders(headers);
    this.body = body;
  }

  private static ImmutableMap<String, List<String>> normalizeHeaders(Map<String, List<String>> headers) {
    if (headers == null) {
      return ImmutableMap.of();
    }
    Map<String, List<String>> merged = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> e: headers.entrySet()) {
      merged.computeIfAbsent(e.getKey().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).addAll(e.getValue());
    }
    ImmutableMap.Builder<String, List<String>> builder = ImmutableMap.builder();
    for (Map.Entry<String, List<String>> e: merged.entrySet()) {
      builder.put(e.getKey(), ImmutableList.copyOf(e.getValue()));
    }
    return builder.build();
  }

  /**
   * Returns the HTTP status code.
   *
   * @return the status code
   */
  public int getStatusCode() {
    return statusCode;
  }

  /**
   * Returns true if the status code is in the 2xx range.
   *
   * @return true for a successful status
   */
  public boolean isSuccessful() {
    return HttpErrors.isSuccessStatus(statusCode);
  }

  /**
   * Returns the first value of a response header.
   *
   * @param name the header name, in any case
   * @return the value, or null if the header was not present
   */
  public String getHeader(String name) {
    List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  /**
   * Returns all response headers, keyed by lowercase name.
   *
   * @return an immutable map
   */
  public Map<String, List<String>> getHeaders() {
    return headers;
  }

  /**
   * Returns the response body stream. It can be read only once.
   *
   * @return the body stream
   */
  public InputStream getBody() {
    return body;
  }

  /**
   * Reads the whole response body as UTF-8 text.
   *
   * @return the body text
   * @throws IOException if the body could not be read
   */
  public String readBodyAsString() throws IOException {
    return new String(ByteStreams.toByteArray(body), StandardCharsets.UTF_8);
  }

  @Override
  public void close() {
    Closeables.closeQuietly(body);
  }

  @Override
  public String toString() {
    return "TrackerResponse(" + statusCode + ")";
  }
}
