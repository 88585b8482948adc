package com.openpanel.sdk;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Base class for the event envelopes built by {@link Tracker}. Properties have already been merged
 * with the tracker's global properties by the time an event is created.
 */
abstract class Event {
  private final EventKind kind;

  Event(EventKind kind) {
    this.kind = kind;
  }

  EventKind getKind() {
    return kind;
  }

  /**
   * A named event, including revenue events.
   */
  static final class Track extends Event {
    private final String name;
    private final String profileId;
    private final Long amount;
    private final ImmutableMap<String, String> properties;

    Track(String name, String profileId, Long amount, Map<String, String> properties) {
      super(EventKind.TRACK);
      this.name = name;
      this.profileId = profileId;
      this.amount = amount;
      this.properties = ImmutableMap.copyOf(properties);
    }

    String getName() {
      return name;
    }

    String getProfileId() {
      return profileId;
    }

    Long getAmount() {
      return amount;
    }

    Map<String, String> getProperties() {
      return properties;
    }
  }

  static final class Identify extends Event {
    private final IdentifyUser user;

    Identify(IdentifyUser user) {
      super(EventKind.IDENTIFY);
      this.user = user;
    }

    IdentifyUser getUser() {
      return user;
    }
  }

  /**
   * An increment or decrement of a numeric profile property.
   */
  static final class PropertyDelta extends Event {
    private final String profileId;
    private final String property;
    private final long value;

    PropertyDelta(EventKind kind, String profileId, String property, long value) {
      super(kind);
      this.profileId = profileId;
      this.property = property;
      this.value = value;
    }

    String getProfileId() {
      return profileId;
    }

    String getProperty() {
      return property;
    }

    long getValue() {
      return value;
    }
  }
}
