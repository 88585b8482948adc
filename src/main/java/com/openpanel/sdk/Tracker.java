package com.openpanel.sdk;

import com.google.common.collect.ImmutableMap;
import com.launchdarkly.logging.LDLogger;
import com.openpanel.sdk.internal.http.HttpHelpers;
import com.openpanel.sdk.subsystems.ClientContext;
import com.openpanel.sdk.subsystems.EventTransport;
import com.openpanel.sdk.subsystems.HttpConfiguration;
import com.openpanel.sdk.subsystems.LoggingConfiguration;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A client for the OpenPanel event API.
 * <p>
 * A {@code Tracker} is immutable. The methods that change its settings, such as
 * {@link #withDefaultHeaders()} or {@link #withGlobalProperties(Map)}, return a new instance and leave
 * the receiver unchanged; all instances derived from one another share a single HTTP client. Each
 * tracking method makes exactly one blocking request on the calling thread and returns the raw
 * response, without retrying and without treating an unsuccessful HTTP status as an error.
 * <pre><code>
 *     Tracker tracker = Tracker.fromEnvironment()
 *         .withDefaultHeaders()
 *         .withGlobalProperties(ImmutableMap.of("app_version", "1.2.3"));
 *     try (TrackerResponse response = tracker.track("signup", ImmutableMap.of("plan", "pro"))) {
 *       ...
 *     }
 * </code></pre>
 */
public final class Tracker implements Closeable {
  static final String REVENUE_EVENT_NAME = "revenue";
  static final String AMOUNT_PROPERTY = "amount";
  static final String DEVICE_ID_PATH = "device-id";
  static final String DEVICE_ID_KEY = "deviceId";

  static final String CONTENT_TYPE_HEADER = "Content-Type";
  static final String CLIENT_ID_HEADER = "openpanel-client-id";
  static final String CLIENT_SECRET_HEADER = "openpanel-client-secret";
  static final String JSON_CONTENT_TYPE = "application/json";

  private final URI apiUrl;
  private final String clientId;
  private final String clientSecret;
  private final HeaderSet headers;
  private final ImmutableMap<String, String> globalProperties;
  private final boolean disabled;
  private final EventTransport transport;
  private final EventOutputFormatter formatter;
  private final LDLogger logger;

  /**
   * Creates a tracker from environment variables, falling back to a {@code .env} file in the
   * working directory.
   * <p>
   * The returned tracker has no headers yet; call {@link #withDefaultHeaders()} to add the content
   * type and credentials.
   *
   * @return a new tracker
   * @throws ConfigurationException if a required variable is missing, the URL is invalid, or the
   *   {@code .env} file cannot be read
   * @see TrackerConfig#fromEnvironment()
   */
  public static Tracker fromEnvironment() throws ConfigurationException {
    return new Tracker(TrackerConfig.fromEnvironment().build());
  }

  /**
   * Creates a tracker with the given configuration.
   *
   * @param config the configuration
   */
  public Tracker(TrackerConfig config) {
    checkNotNull(config, "config");
    ClientContext bootstrapContext = new ClientContext(null, null);
    LoggingConfiguration logging = config.logging.build(bootstrapContext);
    HttpConfiguration http = config.http.build(new ClientContext(null, logging));
    ClientContext context = new ClientContext(http, logging);

    this.apiUrl = config.apiUrl;
    this.clientId = config.clientId;
    this.clientSecret = config.clientSecret;
    this.headers = HeaderSet.empty();
    this.globalProperties = ImmutableMap.of();
    this.disabled = false;
    this.transport = config.transport.build(context);
    this.formatter = new EventOutputFormatter();
    this.logger = context.getBaseLogger();
  }

  private Tracker(Tracker from, HeaderSet headers, ImmutableMap<String, String> globalProperties, boolean disabled) {
    this.apiUrl = from.apiUrl;
    this.clientId = from.clientId;
    this.clientSecret = from.clientSecret;
    this.headers = headers;
    this.globalProperties = globalProperties;
    this.disabled = disabled;
    this.transport = from.transport;
    this.formatter = from.formatter;
    this.logger = from.logger;
  }

  /**
   * Returns a copy of this tracker with the standard headers added: a JSON content type and the
   * client credentials.
   *
   * @return a new tracker
   * @throws HeaderException if the client ID or secret cannot be used as a header value
   */
  public Tracker withDefaultHeaders() throws HeaderException {
    HeaderSet newHeaders = headers
        .with(CONTENT_TYPE_HEADER, JSON_CONTENT_TYPE)
        .with(CLIENT_ID_HEADER, clientId)
        .with(CLIENT_SECRET_HEADER, clientSecret);
    return new Tracker(this, newHeaders, globalProperties, disabled);
  }

  /**
   * Returns a copy of this tracker with one header added. An existing header with the same name,
   * ignoring case, is replaced.
   *
   * @param name the header name
   * @param value the header value
   * @return a new tracker
   * @throws HeaderException if the name or value is not valid in an HTTP header
   */
  public Tracker withHeader(String name, String value) throws HeaderException {
    return new Tracker(this, headers.with(name, value), globalProperties, disabled);
  }

  /**
   * Returns a copy of this tracker whose global properties are the given map. These are added to the
   * properties of every track, revenue and identify call, and take precedence over properties with
   * the same name passed to those calls. Any previous global properties are discarded.
   *
   * @param properties the global properties
   * @return a new tracker
   */
  public Tracker withGlobalProperties(Map<String, String> properties) {
    return new Tracker(this, headers, ImmutableMap.copyOf(properties), disabled);
  }

  /**
   * Returns a copy of this tracker that makes no requests. All tracking calls and
   * {@link #fetchDeviceId()} on it throw {@link TrackerDisabledException}.
   *
   * @return a new tracker
   */
  public Tracker disable() {
    return new Tracker(this, headers, globalProperties, true);
  }

  /**
   * Returns true if this tracker was created by {@link #disable()}.
   *
   * @return true if disabled
   */
  public boolean isDisabled() {
    return disabled;
  }

  /**
   * Returns the headers sent with every request.
   *
   * @return the header set
   */
  public HeaderSet getHeaders() {
    return headers;
  }

  /**
   * Returns the global properties.
   *
   * @return an immutable map
   */
  public Map<String, String> getGlobalProperties() {
    return globalProperties;
  }

  /**
   * Sends an event with no properties other than the global ones.
   *
   * @param name the event name
   * @return the HTTP response
   * @throws TrackerException if the event could not be sent
   * @see #track(String, String, Map, EventFilter)
   */
  public TrackerResponse track(String name) throws TrackerException {
    return track(name, null, null, null);
  }

  /**
   * Sends an event.
   *
   * @param name the event name
   * @param properties the event properties, or null
   * @return the HTTP response
   * @throws TrackerException if the event could not be sent
   * @see #track(String, String, Map, EventFilter)
   */
  public TrackerResponse track(String name, Map<String, String> properties) throws TrackerException {
    return track(name, null, properties, null);
  }

  /**
   * Sends an event unless the filter rejects it.
   *
   * @param name the event name
   * @param properties the event properties, or null
   * @param filter a filter, or null
   * @return the HTTP response
   * @throws TrackerException if the event was filtered or could not be sent
   * @see #track(String, String, Map, EventFilter)
   */
  public TrackerResponse track(String name, Map<String, String> properties, EventFilter filter)
      throws TrackerException {
    return track(name, null, properties, filter);
  }

  /**
   * Sends an event attributed to a profile, unless the filter rejects it.
   * <p>
   * The event's properties are the given properties combined with the global properties; where both
   * define the same name, the global value is used. If a filter is given, it sees those combined
   * properties, and if it rejects them no request is made. The filter is consulted before the
   * disabled state is checked.
   *
   * @param name the event name
   * @param profileId the profile ID, or null
   * @param properties the event properties, or null
   * @param filter a filter, or null
   * @return the HTTP response
   * @throws EventFilteredException if the filter rejected the event
   * @throws TrackerDisabledException if this tracker is disabled
   * @throws SerializationException if the event could not be encoded
   * @throws RequestException if the request failed
   */
  public TrackerResponse track(String name, String profileId, Map<String, String> properties, EventFilter filter)
      throws TrackerException {
    checkNotNull(name, "name");
    Map<String, String> merged = createPropertiesWithGlobals(properties);
    if (filter != null && filter.rejects(Collections.unmodifiableMap(merged))) {
      logger.debug("Event \"{}\" was rejected by filter", name);
      throw new EventFilteredException(name);
    }
    return sendEvent(new Event.Track(name, profileId, null, merged));
  }

  /**
   * Sends a revenue event with no properties other than the global ones.
   *
   * @param amount the amount
   * @return the HTTP response
   * @throws TrackerException if the event could not be sent
   * @see #revenue(long, String, Map)
   */
  public TrackerResponse revenue(long amount) throws TrackerException {
    return revenue(amount, null, null);
  }

  /**
   * Sends a revenue event.
   *
   * @param amount the amount
   * @param properties the event properties, or null
   * @return the HTTP response
   * @throws TrackerException if the event could not be sent
   * @see #revenue(long, String, Map)
   */
  public TrackerResponse revenue(long amount, Map<String, String> properties) throws TrackerException {
    return revenue(amount, null, properties);
  }

  /**
   * Sends a revenue event attributed to a profile.
   * <p>
   * This is a track event named {@code revenue}. The amount is sent as a number in the payload and
   * also as the {@code amount} property, which takes precedence over any global property of that name.
   *
   * @param amount the amount
   * @param profileId the profile ID, or null
   * @param properties the event properties, or null
   * @return the HTTP response
   * @throws TrackerDisabledException if this tracker is disabled
   * @throws SerializationException if the event could not be encoded
   * @throws RequestException if the request failed
   */
  public TrackerResponse revenue(long amount, String profileId, Map<String, String> properties)
      throws TrackerException {
    Map<String, String> merged = createPropertiesWithGlobals(properties);
    merged.put(AMOUNT_PROPERTY, String.valueOf(amount));
    return sendEvent(new Event.Track(REVENUE_EVENT_NAME, profileId, amount, merged));
  }

  /**
   * Sends a profile description. The user's properties are combined with the global properties,
   * with the global values taking precedence.
   *
   * @param user the user
   * @return the HTTP response
   * @throws TrackerDisabledException if this tracker is disabled
   * @throws SerializationException if the event could not be encoded
   * @throws RequestException if the request failed
   */
  public TrackerResponse identify(IdentifyUser user) throws TrackerException {
    checkNotNull(user, "user");
    IdentifyUser merged = user.withProperties(createPropertiesWithGlobals(user.getProperties()));
    return sendEvent(new Event.Identify(merged));
  }

  /**
   * Adds a value to a numeric profile property.
   *
   * @param profileId the profile ID
   * @param property the property name
   * @param value the amount to add
   * @return the HTTP response
   * @throws TrackerException if the event could not be sent
   */
  public TrackerResponse increment(String profileId, String property, long value) throws TrackerException {
    return sendEvent(new Event.PropertyDelta(EventKind.INCREMENT, checkNotNull(profileId, "profileId"),
        checkNotNull(property, "property"), value));
  }

  /**
   * Subtracts a value from a numeric profile property. The value is sent as given; the server
   * applies the subtraction.
   *
   * @param profileId the profile ID
   * @param property the property name
   * @param value the amount to subtract
   * @return the HTTP response
   * @throws TrackerException if the event could not be sent
   */
  public TrackerResponse decrement(String profileId, String property, long value) throws TrackerException {
    return sendEvent(new Event.PropertyDelta(EventKind.DECREMENT, checkNotNull(profileId, "profileId"),
        checkNotNull(property, "property"), value));
  }

  /**
   * Asks the server for the device ID it associates with this client.
   *
   * @return the device ID, or an empty string if the response did not include one
   * @throws TrackerDisabledException if this tracker is disabled
   * @throws SerializationException if the response body is not a JSON object of strings
   * @throws RequestException if the request failed or the body could not be read
   */
  public String fetchDeviceId() throws TrackerException {
    if (disabled) {
      throw new TrackerDisabledException();
    }
    URI uri = HttpHelpers.concatenateUriPath(apiUrl, DEVICE_ID_PATH);
    logger.debug("Sending request to {}", uri);
    String body;
    try (TrackerResponse response = transport.get(uri, headers)) {
      body = response.readBodyAsString();
    } catch (IOException e) {
      throw new RequestException("Error reading device ID response", e);
    }
    String deviceId = JsonHelpers.deserializeStringMap(body).get(DEVICE_ID_KEY);
    return deviceId == null ? "" : deviceId;
  }

  /**
   * Releases the HTTP client shared by this tracker and every tracker derived from it.
   *
   * @throws IOException if the transport could not be closed
   */
  @Override
  public void close() throws IOException {
    logger.debug("Closing tracker");
    transport.close();
  }

  Map<String, String> createPropertiesWithGlobals(Map<String, String> properties) {
    Map<String, String> merged = new LinkedHashMap<>();
    if (properties != null) {
      merged.putAll(properties);
    }
    merged.putAll(globalProperties);
    return merged;
  }

  private TrackerResponse sendEvent(Event event) throws TrackerException {
    if (disabled) {
      throw new TrackerDisabledException();
    }
    byte[] body = formatter.formatEvent(event);
    logger.debug("Sending request to {}", apiUrl);
    logger.debug("Sending payload {}", new String(body, StandardCharsets.UTF_8));
    return transport.post(apiUrl, headers, body);
  }
}
