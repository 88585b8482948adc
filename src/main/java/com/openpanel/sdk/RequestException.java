package com.openpanel.sdk;

/**
 * Indicates a transport-level failure: the connection could not be made, DNS or TLS failed, or the
 * exchange was interrupted before a complete response was read.
 * <p>
 * HTTP error statuses are not reported this way; they are returned to the caller in a
 * {@link TrackerResponse}.
 */
@SuppressWarnings("serial")
public final class RequestException extends TrackerException {
  /**
   * Creates an instance.
   *
   * @param message a description of the request that failed
   * @param cause the underlying exception
   */
  public RequestException(String message, Throwable cause) {
    super(Kind.REQUEST, message, cause);
  }
}
