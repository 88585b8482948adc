package com.openpanel.sdk;

/**
 * Indicates that a required configuration value was absent or unreadable.
 */
@SuppressWarnings("serial")
public final class ConfigurationException extends TrackerException {
  /**
   * Creates an instance.
   *
   * @param message a description of the problem
   */
  public ConfigurationException(String message) {
    super(Kind.CONFIGURATION, message);
  }

  /**
   * Creates an instance.
   *
   * @param message a description of the problem
   * @param cause the underlying exception
   */
  public ConfigurationException(String message, Throwable cause) {
    super(Kind.CONFIGURATION, message, cause);
  }
}
