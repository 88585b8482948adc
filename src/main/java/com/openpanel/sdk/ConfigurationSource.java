package com.openpanel.sdk;

/**
 * A source of named configuration values, such as the process environment or a {@code .env} file.
 *
 * @see ConfigurationSources
 */
@FunctionalInterface
public interface ConfigurationSource {
  /**
   * Looks up a value.
   *
   * @param name the variable name
   * @return the value, or null if this source does not define it
   * @throws ConfigurationException if the source exists but could not be read
   */
  String get(String name) throws ConfigurationException;
}
