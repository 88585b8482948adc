package com.openpanel.sdk;

/**
 * The kinds of event envelope that the collection endpoint accepts.
 */
public enum EventKind {
  /**
   * A named event with properties. Revenue events are also sent with this kind.
   */
  TRACK("track"),
  /**
   * Attaches profile data to a profile id.
   */
  IDENTIFY("identify"),
  /**
   * Adds a value to a numeric profile property.
   */
  INCREMENT("increment"),
  /**
   * Subtracts a value from a numeric profile property.
   */
  DECREMENT("decrement");

  private final String tag;

  EventKind(String tag) {
    this.tag = tag;
  }

  /**
   * Returns the value used for the envelope's {@code type} property.
   *
   * @return the lowercase wire tag
   */
  public String getTag() {
    return tag;
  }

  @Override
  public String toString() {
    return tag;
  }
}
