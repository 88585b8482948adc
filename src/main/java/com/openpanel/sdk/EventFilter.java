package com.openpanel.sdk;

import java.util.Map;

/**
 * A caller-supplied veto for track events.
 * <p>
 * The filter sees the event's properties after global properties have been merged in. If it returns
 * {@code true}, the event is not sent and the track call fails with {@link EventFilteredException}.
 * <pre><code>
 *     EventFilter internalUsers = properties -&gt; "internal".equals(properties.get("plan"));
 *     tracker.track("checkout", properties, internalUsers);
 * </code></pre>
 */
@FunctionalInterface
public interface EventFilter {
  /**
   * Decides whether an event should be dropped.
   *
   * @param properties the merged event properties; read-only
   * @return true to drop the event
   */
  boolean rejects(Map<String, String> properties);
}
