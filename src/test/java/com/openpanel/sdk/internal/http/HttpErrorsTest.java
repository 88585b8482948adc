package com.openpanel.sdk.internal.http;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class HttpErrorsTest {
  @Test
  public void successStatuses() {
    assertTrue(HttpErrors.isSuccessStatus(200));
    assertTrue(HttpErrors.isSuccessStatus(202));
    assertFalse(HttpErrors.isSuccessStatus(301));
    assertFalse(HttpErrors.isSuccessStatus(404));
  }

  @Test
  public void errorDescriptions() {
    assertEquals("HTTP error 401 (invalid client credentials)", HttpErrors.httpErrorDescription(401));
    assertEquals("HTTP error 403 (invalid client credentials)", HttpErrors.httpErrorDescription(403));
    assertEquals("HTTP error 429 (too many requests)", HttpErrors.httpErrorDescription(429));
    assertEquals("HTTP error 500", HttpErrors.httpErrorDescription(500));
  }
}
