package com.openpanel.sdk;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class HeaderSetTest {
  @Test
  public void emptySetHasNoHeaders() {
    assertTrue(HeaderSet.empty().isEmpty());
    assertEquals(0, HeaderSet.empty().size());
    assertNull(HeaderSet.empty().get("anything"));
  }

  @Test
  public void headersKeepInsertionOrder() throws Exception {
    HeaderSet headers = HeaderSet.empty().with("b", "1").with("a", "2").with("c", "3");

    assertEquals(ImmutableMap.of("b", "1", "a", "2", "c", "3"), headers.asMap());
    List<String> names = new ArrayList<>();
    for (Map.Entry<String, String> e: headers) {
      names.add(e.getKey());
    }
    assertThat(names, contains("b", "a", "c"));
  }

  @Test
  public void replacedHeaderKeepsPositionAndTakesNewName() throws Exception {
    HeaderSet headers = HeaderSet.empty()
        .with("Content-Type", "application/json")
        .with("X-Other", "1")
        .with("content-type", "text/plain");

    assertEquals(2, headers.size());
    assertEquals("text/plain", headers.get("CONTENT-TYPE"));
    assertEquals(ImmutableMap.of("content-type", "text/plain", "X-Other", "1"), headers.asMap());
  }

  @Test
  public void withDoesNotModifyReceiver() throws Exception {
    HeaderSet original = HeaderSet.empty().with("a", "1");
    original.with("a", "2");

    assertEquals("1", original.get("a"));
  }

  @Test
  public void tabIsAllowedInValue() throws Exception {
    assertEquals("a\tb", HeaderSet.empty().with("x", "a\tb").get("x"));
  }

  @Test
  public void invalidValuesAreRejected() {
    for (String value: new String[] { "line\nbreak", "carriage\rreturn", "nul\u0000", "del\u007f", "café" }) {
      try {
        HeaderSet.empty().with("x-test", value);
        fail("expected exception for value " + value);
      } catch (HeaderException e) {
        assertEquals(TrackerException.Kind.HEADER, e.getKind());
        assertThat(e.getMessage(), not(containsString(value)));
      }
    }
  }

  @Test
  public void invalidNamesAreRejected() {
    for (String name: new String[] { "", "has space", "colon:", "new\nline", "café" }) {
      try {
        HeaderSet.empty().with(name, "v");
        fail("expected exception for name " + name);
      } catch (HeaderException e) {
        assertEquals(TrackerException.Kind.HEADER, e.getKind());
      }
    }
  }

  @Test
  public void toStringOmitsValues() throws Exception {
    HeaderSet headers = HeaderSet.empty().with("openpanel-client-secret", "s3cr3t");

    assertEquals("HeaderSet(openpanel-client-secret)", headers.toString());
  }

  @Test
  public void equalityIsByContent() throws Exception {
    assertEquals(HeaderSet.empty().with("a", "1"), HeaderSet.empty().with("a", "0").with("a", "1"));
    assertEquals(HeaderSet.empty().with("a", "1").hashCode(), HeaderSet.empty().with("a", "1").hashCode());
  }
}
