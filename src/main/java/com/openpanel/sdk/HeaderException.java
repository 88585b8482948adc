package com.openpanel.sdk;

/**
 * Indicates that a header name or value is not valid on the wire.
 * <p>
 * The message names the offending header but never includes the rejected value, since header values
 * are often credentials.
 */
@SuppressWarnings("serial")
public final class HeaderException extends TrackerException {
  /**
   * Creates an instance.
   *
   * @param message a description of the problem
   */
  public HeaderException(String message) {
    super(Kind.HEADER, message);
  }
}
