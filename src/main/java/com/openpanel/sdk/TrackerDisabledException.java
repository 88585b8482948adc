package com.openpanel.sdk;

/**
 * Thrown when a network operation is attempted on a {@link Tracker} that was created with
 * {@link Tracker#disable()}. No request is made.
 */
@SuppressWarnings("serial")
public final class TrackerDisabledException extends TrackerException {
  TrackerDisabledException() {
    super(Kind.DISABLED, "Tracker is disabled");
  }
}
