package com.openpanel.sdk;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;

@SuppressWarnings("javadoc")
public class IdentifyUserTest {
  @Test
  public void onlyProfileIdIsRequired() {
    IdentifyUser user = IdentifyUser.builder("p").build();

    assertEquals("p", user.getProfileId());
    assertNull(user.getEmail());
    assertNull(user.getFirstName());
    assertNull(user.getLastName());
    assertEquals(ImmutableMap.of(), user.getProperties());
  }

  @Test
  public void propertiesAreCopied() {
    Map<String, String> props = new HashMap<>();
    props.put("a", "1");
    IdentifyUser user = IdentifyUser.builder("p").properties(props).build();
    props.put("b", "2");

    assertEquals(ImmutableMap.of("a", "1"), user.getProperties());
  }

  @Test
  public void withPropertiesReturnsNewInstance() {
    IdentifyUser user = IdentifyUser.builder("p").email("e").property("a", "1").build();
    IdentifyUser changed = user.withProperties(ImmutableMap.of("b", "2"));

    assertEquals(ImmutableMap.of("a", "1"), user.getProperties());
    assertEquals(ImmutableMap.of("b", "2"), changed.getProperties());
    assertEquals("e", changed.getEmail());
    assertNotEquals(user, changed);
  }

  @Test(expected = NullPointerException.class)
  public void nullProfileIdIsRejected() {
    IdentifyUser.builder(null);
  }
}
