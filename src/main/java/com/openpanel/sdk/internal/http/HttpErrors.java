package com.openpanel.sdk.internal.http;

import com.launchdarkly.logging.LDLogger;

/**
 * Contains shared helpers related to HTTP response reporting.
 * <p>
 * The SDK does not act on HTTP error statuses; responses are handed back to the caller as they
 * are. These helpers only make the log output readable.
 * <p>
 * This class is for internal use only and should not be documented in the SDK API. It is not
 * supported for any use outside of the SDK, and is subject to change without notice.
 */
public abstract class HttpErrors {
  private HttpErrors() {}

  /**
   * Tests whether a status code represents success.
   *
   * @param statusCode the HTTP status
   * @return true for any 2xx status
   */
  public static boolean isSuccessStatus(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }

  /**
   * Logs a non-success HTTP status at WARN level.
   *
   * @param logger the logger to log to
   * @param errorContext a phrase like "posting track event"
   * @param statusCode the HTTP status
   */
  public static void logHttpError(LDLogger logger, String errorContext, int statusCode) {
    logger.warn("Received unsuccessful response when {}: {}", errorContext, httpErrorDescription(statusCode));
  }

  /**
   * Returns a text description of an HTTP error.
   * 
   * @param statusCode the status code
   * @return the error description
   */
  public static String httpErrorDescription(int statusCode) {
    String detail;
    switch (statusCode) {
    case 401:
    case 403:
      detail = " (invalid client credentials)";
      break;
    case 429:
      detail = " (too many requests)";
      break;
    default:
      detail = "";
    }
    return "HTTP error " + statusCode + detail;
  }
}
