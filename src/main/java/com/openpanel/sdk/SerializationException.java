package com.openpanel.sdk;

/**
 * General exception class for all errors in serializing or deserializing JSON.
 * <p>
 * The SDK uses this class to avoid depending on exception types from the underlying JSON framework
 * that it uses (currently Gson).
 */
@SuppressWarnings("serial")
public final class SerializationException extends TrackerException {
  /**
   * Creates an instance.
   *
   * @param message a description of the problem
   */
  public SerializationException(String message) {
    super(Kind.SERIALIZATION, message);
  }

  /**
   * Creates an instance.
   *
   * @param cause the underlying exception
   */
  public SerializationException(Throwable cause) {
    super(Kind.SERIALIZATION, String.valueOf(cause), cause);
  }
}
