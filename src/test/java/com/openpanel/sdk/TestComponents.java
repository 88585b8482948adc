package com.openpanel.sdk;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.openpanel.sdk.subsystems.ComponentConfigurer;
import com.openpanel.sdk.subsystems.EventTransport;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@SuppressWarnings("javadoc")
public class TestComponents {
  static final String CLIENT_ID = "test-client-id";
  static final String CLIENT_SECRET = "test-client-secret";

  public static ComponentConfigurer<EventTransport> transportFactory(EventTransport transport) {
    return context -> transport;
  }

  public static JsonObject parseJsonObject(String json) {
    return JsonParser.parseString(json).getAsJsonObject();
  }

  /**
   * An {@link EventTransport} that makes no network requests; it remembers what it was asked to
   * send and answers with a configurable status and body.
   */
  public static final class RecordingTransport implements EventTransport {
    public final List<Request> requests = Collections.synchronizedList(new ArrayList<>());
    public volatile int status = 200;
    public volatile String responseBody = "";
    public volatile boolean closed = false;

    public static final class Request {
      public final String method;
      public final URI uri;
      public final HeaderSet headers;
      public final String body;

      Request(String method, URI uri, HeaderSet headers, String body) {
        this.method = method;
        this.uri = uri;
        this.headers = headers;
        this.body = body;
      }

      public JsonObject bodyJson() {
        return parseJsonObject(body);
      }
    }

    @Override
    public TrackerResponse post(URI uri, HeaderSet headers, byte[] body) {
      requests.add(new Request("POST", uri, headers, new String(body, StandardCharsets.UTF_8)));
      return makeResponse();
    }

    @Override
    public TrackerResponse get(URI uri, HeaderSet headers) {
      requests.add(new Request("GET", uri, headers, null));
      return makeResponse();
    }

    @Override
    public void close() {
      closed = true;
    }

    public Request requireSingleRequest() {
      if (requests.size() != 1) {
        throw new AssertionError("expected exactly one request but got " + requests.size());
      }
      return requests.get(0);
    }

    private TrackerResponse makeResponse() {
      return new TrackerResponse(status, Collections.<String, List<String>>emptyMap(),
          new ByteArrayInputStream(responseBody.getBytes(StandardCharsets.UTF_8)));
    }
  }
}
