package com.openpanel.sdk.internal.http;

import java.net.URI;

/**
 * Helper methods related to HTTP.
 * <p>
 * This class is for internal use only and should not be documented in the SDK API. It is not
 * supported for any use outside of the SDK, and is subject to change without notice.
 */
public abstract class HttpHelpers {
  private HttpHelpers() {}

  // RFC 7230 "tchar" punctuation; letters and digits are checked separately
  private static final String HEADER_NAME_SYMBOLS = "!#$%&'*+-.^_`|~";

  /**
   * Safely concatenates a path, ensuring that there is exactly one slash between components.
   * 
   * @param baseUri the base URI
   * @param path the path to add
   * @return a new URI
   */
  public static URI concatenateUriPath(URI baseUri, String path) {
    String uriStr = baseUri.toString();
    String addPath = path.startsWith("/") ? path.substring(1) : path;
    return URI.create(uriStr + (uriStr.endsWith("/") ? "" : "/") + addPath);
  }

  /**
   * Tests whether a string contains only characters that are safe to use in an HTTP header value.
   * <p>
   * This is specifically testing whether the string would be considered a valid HTTP header value
   * by the OkHttp client. The actual HTTP spec does not prohibit characters >= 127; OkHttp's
   * check is overly strict, as was pointed out in https://github.com/square/okhttp/issues/2016.
   * But all OkHttp 3.x and 4.x versions so far have continued to enforce that check. Control
   * characters other than a tab are always illegal.
   * <p>
   * The values we're mainly concerned with are the client credentials. If a secret accidentally has
   * (for instance) a newline added to it, we don't want to end up having OkHttp throw an exception
   * mentioning the value, which might get logged (https://github.com/square/okhttp/issues/6738).
   * 
   * @param value a string
   * @return true if valid
   */
  public static boolean isAsciiHeaderValue(String value) {
    for (int i = 0; i < value.length(); i++) {
      char ch = value.charAt(i);
      if ((ch < 0x20 || ch > 0x7e) && ch != '\t') {
        return false;
      }
    }
    return true;
  }

  /**
   * Tests whether a string is a valid HTTP header name: a non-empty token made of ASCII letters,
   * digits, and the punctuation allowed by RFC 7230.
   *
   * @param name a string
   * @return true if valid
   */
  public static boolean isValidHeaderName(String name) {
    if (name.isEmpty()) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      char ch = name.charAt(i);
      boolean alphanumeric = (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9');
      if (!alphanumeric && HEADER_NAME_SYMBOLS.indexOf(ch) < 0) {
        return false;
      }
    }
    return true;
  }
}
