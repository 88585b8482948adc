package com.openpanel.sdk;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.openpanel.sdk.internal.http.HttpHelpers;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable, ordered set of HTTP headers with case-insensitive names.
 * <p>
 * Adding a header whose name matches an existing one, ignoring case, replaces the earlier value; the
 * header keeps its original position. Every name and value is validated when it is added, so a
 * {@link HeaderSet} can always be sent as is.
 */
public final class HeaderSet implements Iterable<Map.Entry<String, String>> {
  private static final HeaderSet EMPTY = new HeaderSet(ImmutableMap.<String, Map.Entry<String, String>>of());

  // keyed by lowercase name; the entry keeps the name as last given
  private final ImmutableMap<String, Map.Entry<String, String>> headers;

  private HeaderSet(ImmutableMap<String, Map.Entry<String, String>> headers) {
    this.headers = headers;
  }

  /**
   * Returns a set with no headers.
   *
   * @return an empty instance
   */
  public static HeaderSet empty() {
    return EMPTY;
  }

  /**
   * Returns a copy of this set with one header added or replaced.
   *
   * @param name the header name
   * @param value the header value
   * @return a new instance
   * @throws HeaderException if the name is not a valid HTTP token, or the value contains control
   *   characters other than tab or non-ASCII characters
   */
  public HeaderSet with(String name, String value) throws HeaderException {
    checkNotNull(name, "name");
    checkNotNull(value, "value");
    if (!HttpHelpers.isValidHeaderName(name)) {
      throw new HeaderException("Invalid header name: \"" + name + "\"");
    }
    if (!HttpHelpers.isAsciiHeaderValue(value)) {
      throw new HeaderException("Value of header \"" + name + "\" contains characters that are not allowed in HTTP headers");
    }
    Map<String, Map.Entry<String, String>> updated = new LinkedHashMap<>(headers);
    updated.put(name.toLowerCase(Locale.ROOT), Maps.immutableEntry(name, value));
    return new HeaderSet(ImmutableMap.copyOf(updated));
  }

  /**
   * Returns the value of a header.
   *
   * @param name the header name, in any case
   * @return the value, or null if there is no such header
   */
  public String get(String name) {
    Map.Entry<String, String> entry = headers.get(name.toLowerCase(Locale.ROOT));
    return entry == null ? null : entry.getValue();
  }

  /**
   * Returns the number of headers.
   *
   * @return the header count
   */
  public int size() {
    return headers.size();
  }

  /**
   * Returns true if there are no headers.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return headers.isEmpty();
  }

  /**
   * Returns the headers as an ordered map from name to value.
   *
   * @return an immutable map
   */
  public Map<String, String> asMap() {
    ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
    for (Map.Entry<String, String> e: headers.values()) {
      builder.put(e.getKey(), e.getValue());
    }
    return builder.build();
  }

  @Override
  public Iterator<Map.Entry<String, String>> iterator() {
    return headers.values().iterator();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof HeaderSet && ((HeaderSet)other).asMap().equals(asMap());
  }

  @Override
  public int hashCode() {
    return asMap().hashCode();
  }

  // values are left out because they usually include the client secret
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("HeaderSet(");
    boolean first = true;
    for (Map.Entry<String, String> e: headers.values()) {
      if (!first) {
        sb.append(",");
      }
      sb.append(e.getKey());
      first = false;
    }
    return sb.append(")").toString();
  }
}
