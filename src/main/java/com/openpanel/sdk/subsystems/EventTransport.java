package com.openpanel.sdk.subsystems;

import com.openpanel.sdk.HeaderSet;
import com.openpanel.sdk.RequestException;
import com.openpanel.sdk.TrackerResponse;

import java.io.Closeable;
import java.net.URI;

/**
 * Interface for a component that performs the HTTP exchanges on behalf of a
 * {@link com.openpanel.sdk.Tracker}.
 * <p>
 * The SDK's default implementation uses OkHttp and is obtained from
 * {@link com.openpanel.sdk.Components#httpTransport()}. A custom implementation can be supplied with
 * {@link com.openpanel.sdk.TrackerConfig.Builder#transport(ComponentConfigurer)}, for instance to
 * reuse an HTTP client that the application already owns, or as a test fixture.
 * <p>
 * Implementations make exactly one attempt per call and do not interpret the response status.
 */
public interface EventTransport extends Closeable {
  /**
   * Sends a POST request.
   * <p>
   * This method is called synchronously on the caller's thread.
   *
   * @param uri the target URI
   * @param headers the headers to send; the body's content type comes from the {@code Content-Type}
   *   header if present
   * @param body the preformatted JSON data, in UTF-8 encoding
   * @return the response; the caller must close it
   * @throws RequestException if no response was received
   */
  TrackerResponse post(URI uri, HeaderSet headers, byte[] body) throws RequestException;

  /**
   * Sends a GET request.
   *
   * @param uri the target URI
   * @param headers the headers to send
   * @return the response; the caller must close it
   * @throws RequestException if no response was received
   */
  TrackerResponse get(URI uri, HeaderSet headers) throws RequestException;
}
