package com.openpanel.sdk;

/**
 * Thrown when the {@link EventFilter} passed to {@link Tracker#track(String, java.util.Map, EventFilter)}
 * rejects an event. No request is made.
 */
@SuppressWarnings("serial")
public final class EventFilteredException extends TrackerException {
  private final String eventName;

  EventFilteredException(String eventName) {
    super(Kind.FILTERED, "Event filtered: " + eventName);
    this.eventName = eventName;
  }

  /**
   * Returns the name of the event that was rejected.
   *
   * @return the event name
   */
  public String getEventName() {
    return eventName;
  }
}
