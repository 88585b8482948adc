package com.openpanel.sdk;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A description of a user profile, as sent by {@link Tracker#identify(IdentifyUser)}.
 * <p>
 * Only the profile ID is required. Instances are immutable; create them with {@link #builder(String)}:
 * <pre><code>
 *     IdentifyUser user = IdentifyUser.builder("user-123")
 *         .email("jane@example.com")
 *         .firstName("Jane")
 *         .property("plan", "pro")
 *         .build();
 * </code></pre>
 */
public final class IdentifyUser {
  private final String profileId;
  private final String email;
  private final String firstName;
  private final String lastName;
  private final ImmutableMap<String, String> properties;

  private IdentifyUser(String profileId, String email, String firstName, String lastName,
      ImmutableMap<String, String> properties) {
    this.profileId = profileId;
    this.email = email;
    this.firstName = firstName;
    this.lastName = lastName;
    this.properties = properties;
  }

  /**
   * Creates a builder for a user with the given profile ID.
   *
   * @param profileId the profile ID; may not be null
   * @return a builder
   */
  public static Builder builder(String profileId) {
    return new Builder(profileId);
  }

  /**
   * Returns the profile ID.
   *
   * @return the profile ID
   */
  public String getProfileId() {
    return profileId;
  }

  /**
   * Returns the email address.
   *
   * @return the email address, or null
   */
  public String getEmail() {
    return email;
  }

  /**
   * Returns the first name.
   *
   * @return the first name, or null
   */
  public String getFirstName() {
    return firstName;
  }

  /**
   * Returns the last name.
   *
   * @return the last name, or null
   */
  public String getLastName() {
    return lastName;
  }

  /**
   * Returns the custom properties.
   *
   * @return an immutable map, never null
   */
  public Map<String, String> getProperties() {
    return properties;
  }

  IdentifyUser withProperties(Map<String, String> newProperties) {
    return new IdentifyUser(profileId, email, firstName, lastName, ImmutableMap.copyOf(newProperties));
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof IdentifyUser)) {
      return false;
    }
    IdentifyUser o = (IdentifyUser)other;
    return profileId.equals(o.profileId) && Objects.equals(email, o.email) &&
        Objects.equals(firstName, o.firstName) && Objects.equals(lastName, o.lastName) &&
        properties.equals(o.properties);
  }

  @Override
  public int hashCode() {
    return Objects.hash(profileId, email, firstName, lastName, properties);
  }

  @Override
  public String toString() {
    return "IdentifyUser(" + profileId + ")";
  }

  /**
   * Builder for {@link IdentifyUser}.
   */
  public static final class Builder {
    private final String profileId;
    private String email;
    private String firstName;
    private String lastName;
    private final Map<String, String> properties = new LinkedHashMap<>();

    private Builder(String profileId) {
      this.profileId = checkNotNull(profileId, "profileId");
    }

    /**
     * Sets the email address.
     *
     * @param email the email address, or null
     * @return the builder
     */
    public Builder email(String email) {
      this.email = email;
      return this;
    }

    /**
     * Sets the first name.
     *
     * @param firstName the first name, or null
     * @return the builder
     */
    public Builder firstName(String firstName) {
      this.firstName = firstName;
      return this;
    }

    /**
     * Sets the last name.
     *
     * @param lastName the last name, or null
     * @return the builder
     */
    public Builder lastName(String lastName) {
      this.lastName = lastName;
      return this;
    }

    /**
     * Adds or replaces one custom property.
     *
     * @param name the property name
     * @param value the property value
     * @return the builder
     */
    public Builder property(String name, String value) {
      properties.put(checkNotNull(name, "name"), checkNotNull(value, "value"));
      return this;
    }

    /**
     * Adds or replaces custom properties.
     *
     * @param properties the properties to add
     * @return the builder
     */
    public Builder properties(Map<String, String> properties) {
      for (Map.Entry<String, String> e: properties.entrySet()) {
        property(e.getKey(), e.getValue());
      }
      return this;
    }

    /**
     * Creates the user.
     *
     * @return an immutable {@link IdentifyUser}
     */
    public IdentifyUser build() {
      return new IdentifyUser(profileId, email, firstName, lastName, ImmutableMap.copyOf(properties));
    }
  }
}
