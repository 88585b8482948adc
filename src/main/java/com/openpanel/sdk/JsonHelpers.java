package com.openpanel.sdk;

import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import java.io.IOException;
import java.io.StringReader;
import java.util.LinkedHashMap;
import java.util.Map;

abstract class JsonHelpers {
  private JsonHelpers() {}

  /**
   * Deserializes a JSON object whose values are all strings or nulls. Parsing is strict: unquoted or
   * single-quoted names, trailing commas, non-string values and trailing content are all rejected.
   * We should use this helper method instead of reading JSON directly so that we consistently use
   * our wrapper exception.
   *
   * @param json the serialized JSON string
   * @return the deserialized map; values that were JSON nulls are null
   * @throws SerializationException if the input is not a JSON object of strings
   */
  static Map<String, String> deserializeStringMap(String json) throws SerializationException {
    Map<String, String> result = new LinkedHashMap<>();
    try (JsonReader reader = new JsonReader(new StringReader(json))) {
      reader.setLenient(false);
      if (reader.peek() != JsonToken.BEGIN_OBJECT) {
        throw new SerializationException("expected a JSON object but got " + reader.peek());
      }
      reader.beginObject();
      while (reader.hasNext()) {
        String name = reader.nextName();
        JsonToken valueToken = reader.peek();
        if (valueToken == JsonToken.STRING) {
          result.put(name, reader.nextString());
        } else if (valueToken == JsonToken.NULL) {
          reader.nextNull();
          result.put(name, null);
        } else {
          throw new SerializationException("expected a string value for \"" + name + "\" but got " + valueToken);
        }
      }
      reader.endObject();
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        throw new SerializationException("unexpected content after JSON object");
      }
    } catch (IOException | IllegalStateException e) {
      // MalformedJsonException and EOFException are both IOExceptions
      throw new SerializationException(e);
    }
    return result;
  }
}
