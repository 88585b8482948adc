package com.openpanel.sdk;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;

@SuppressWarnings("javadoc")
public class EventOutputFormatterTest {
  private final EventOutputFormatter formatter = new EventOutputFormatter();

  private String format(Event event) throws Exception {
    return new String(formatter.formatEvent(event), StandardCharsets.UTF_8);
  }

  @Test
  public void trackEvent() throws Exception {
    Event event = new Event.Track("signup", null, null, ImmutableMap.of("plan", "pro", "source", "ad"));

    assertEquals("{\"type\":\"track\",\"payload\":{\"name\":\"signup\",\"properties\":{\"plan\":\"pro\",\"source\":\"ad\"}}}",
        format(event));
  }

  @Test
  public void trackEventWithProfileAndAmount() throws Exception {
    Event event = new Event.Track("revenue", "user-1", 250L, ImmutableMap.of("amount", "250"));

    assertEquals("{\"type\":\"track\",\"payload\":{\"name\":\"revenue\",\"profileId\":\"user-1\",\"amount\":250," +
        "\"properties\":{\"amount\":\"250\"}}}", format(event));
  }

  @Test
  public void identifyEvent() throws Exception {
    IdentifyUser user = IdentifyUser.builder("user-1").email("a@b.c").lastName("Smith").property("k", "v").build();

    assertEquals("{\"type\":\"identify\",\"payload\":{\"profileId\":\"user-1\",\"email\":\"a@b.c\"," +
        "\"lastName\":\"Smith\",\"properties\":{\"k\":\"v\"}}}", format(new Event.Identify(user)));
  }

  @Test
  public void incrementEvent() throws Exception {
    Event event = new Event.PropertyDelta(EventKind.INCREMENT, "user-1", "visits", 2);

    assertEquals("{\"type\":\"increment\",\"payload\":{\"profileId\":\"user-1\",\"property\":\"visits\",\"value\":2}}",
        format(event));
  }

  @Test
  public void decrementEventKeepsSign() throws Exception {
    Event event = new Event.PropertyDelta(EventKind.DECREMENT, "user-1", "credits", -7);

    assertEquals("{\"type\":\"decrement\",\"payload\":{\"profileId\":\"user-1\",\"property\":\"credits\",\"value\":-7}}",
        format(event));
  }

  @Test
  public void nonAsciiTextIsEncodedAsUtf8() throws Exception {
    Event event = new Event.Track("café", null, null, ImmutableMap.of("city", "Zürich"));

    byte[] bytes = formatter.formatEvent(event);

    assertEquals("{\"type\":\"track\",\"payload\":{\"name\":\"café\",\"properties\":{\"city\":\"Zürich\"}}}",
        new String(bytes, StandardCharsets.UTF_8));
  }
}
