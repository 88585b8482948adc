package com.openpanel.sdk;

/**
 * Static logger names to be shared by implementation code in the main {@code com.openpanel.sdk} package.
 * <p>
 * Most class names in the SDK are implementation details that are not meaningful to users, so both
 * for reading a log at a glance and for defining SLF4J logger name filters, it is preferable to use
 * these stable names rather than class names.
 */
abstract class Loggers {
  private Loggers() {}

  static final String BASE_LOGGER_NAME = Tracker.class.getName();
  static final String EVENTS_LOGGER_NAME = "Events";
}
