package com.openpanel.sdk;

/**
 * Base class for all errors reported by {@link Tracker} operations.
 * <p>
 * Every subclass reports a distinct {@link Kind}, so callers that do not care about the concrete
 * exception type can branch on {@link #getKind()} instead. None of these errors are retried
 * internally; each one is terminal for the call that produced it.
 */
@SuppressWarnings("serial")
public abstract class TrackerException extends Exception {
  /**
   * The category of a {@link TrackerException}.
   */
  public enum Kind {
    /**
     * A required configuration value was missing or could not be read.
     */
    CONFIGURATION,
    /**
     * A header name or value could not be sent over the wire.
     */
    HEADER,
    /**
     * A payload could not be encoded as JSON, or a response body could not be decoded.
     */
    SERIALIZATION,
    /**
     * The HTTP transport failed before a response was received.
     */
    REQUEST,
    /**
     * The tracker is disabled; no request was made.
     */
    DISABLED,
    /**
     * The caller's filter rejected the event; no request was made.
     */
    FILTERED
  }

  private final Kind kind;

  TrackerException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  TrackerException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * Returns the category of this error.
   *
   * @return the error kind
   */
  public Kind getKind() {
    return kind;
  }
}
