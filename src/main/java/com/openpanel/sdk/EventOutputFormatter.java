package com.openpanel.sdk;

import com.google.gson.stream.JsonWriter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Transforms events into the JSON envelope format that we send to OpenPanel. Rather than creating
 * intermediate objects to represent this schema, we use the Gson streaming output API to construct
 * JSON directly.
 */
final class EventOutputFormatter {
  /**
   * Serializes an event as a UTF-8 JSON envelope of the form <code>{"type":..., "payload":{...}}</code>.
   *
   * @param event the event
   * @return the JSON bytes
   * @throws SerializationException if the JSON could not be written
   */
  byte[] formatEvent(Event event) throws SerializationException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonWriter jw = new JsonWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8))) {
      jw.beginObject();
      jw.name("type").value(event.getKind().getTag());
      jw.name("payload");
      jw.beginObject();
      writePayload(event, jw);
      jw.endObject();
      jw.endObject();
    } catch (IOException | IllegalStateException e) {
      throw new SerializationException(e);
    }
    return out.toByteArray();
  }

  private void writePayload(Event event, JsonWriter jw) throws IOException {
    if (event instanceof Event.Track) {
      Event.Track te = (Event.Track)event;
      jw.name("name").value(te.getName());
      if (te.getProfileId() != null) {
        jw.name("profileId").value(te.getProfileId());
      }
      if (te.getAmount() != null) {
        jw.name("amount").value(te.getAmount().longValue());
      }
      writeProperties(te.getProperties(), jw);
    } else if (event instanceof Event.Identify) {
      IdentifyUser user = ((Event.Identify)event).getUser();
      jw.name("profileId").value(user.getProfileId());
      writeOptionalString("email", user.getEmail(), jw);
      writeOptionalString("firstName", user.getFirstName(), jw);
      writeOptionalString("lastName", user.getLastName(), jw);
      writeProperties(user.getProperties(), jw);
    } else if (event instanceof Event.PropertyDelta) {
      Event.PropertyDelta de = (Event.PropertyDelta)event;
      jw.name("profileId").value(de.getProfileId());
      jw.name("property").value(de.getProperty());
      jw.name("value").value(de.getValue());
    }
  }

  private static void writeOptionalString(String key, String value, JsonWriter jw) throws IOException {
    if (value != null) {
      jw.name(key).value(value);
    }
  }

  private static void writeProperties(Map<String, String> properties, JsonWriter jw) throws IOException {
    jw.name("properties");
    jw.beginObject();
    for (Map.Entry<String, String> e: properties.entrySet()) {
      jw.name(e.getKey()).value(e.getValue());
    }
    jw.endObject();
  }
}
