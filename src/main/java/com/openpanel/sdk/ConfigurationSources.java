package com.openpanel.sdk;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Factory methods for the standard {@link ConfigurationSource} implementations.
 */
public abstract class ConfigurationSources {
  private ConfigurationSources() {}

  /**
   * The name of the file read by {@link #defaultSource()}, relative to the working directory.
   */
  public static final String DEFAULT_DOTENV_FILE = ".env";

  private static final String EXPORT_PREFIX = "export ";
  private static final Splitter KEY_VALUE_SPLITTER = Splitter.on('=').limit(2).trimResults();

  /**
   * Returns a source that reads process environment variables.
   *
   * @return a configuration source
   */
  public static ConfigurationSource environment() {
    return System::getenv;
  }

  /**
   * Returns a source backed by a fixed map. The map is copied.
   *
   * @param values the values
   * @return a configuration source
   */
  public static ConfigurationSource fromMap(Map<String, String> values) {
    ImmutableMap<String, String> copy = ImmutableMap.copyOf(values);
    return copy::get;
  }

  /**
   * Returns a source that reads a {@code .env} file.
   * <p>
   * The file is read the first time a value is requested. Each line is {@code KEY=VALUE}, optionally
   * preceded by {@code export }; blank lines and lines starting with {@code #} are skipped, and so is
   * any line without an {@code =}. An unquoted value ends at a {@code #} that follows whitespace.
   * Single-quoted values are taken literally; double-quoted values expand {@code \n}, {@code \r},
   * {@code \t} and escaped quotes and backslashes. A line whose quote is never closed is skipped.
   * A file that does not exist defines no values.
   *
   * @param path the file location
   * @return a configuration source
   */
  public static ConfigurationSource dotenvFile(Path path) {
    return new DotenvFileSource(checkNotNull(path, "path"));
  }

  /**
   * Returns a source that asks each of the given sources in turn and uses the first non-null value.
   *
   * @param sources the sources, in order of precedence
   * @return a configuration source
   */
  public static ConfigurationSource firstOf(ConfigurationSource... sources) {
    List<ConfigurationSource> list = ImmutableList.copyOf(sources);
    return name -> {
      for (ConfigurationSource s: list) {
        String value = s.get(name);
        if (value != null) {
          return value;
        }
      }
      return null;
    };
  }

  /**
   * Returns the source used by {@link Tracker#fromEnvironment()}: environment variables, then the
   * {@code .env} file in the working directory.
   *
   * @return a configuration source
   */
  public static ConfigurationSource defaultSource() {
    return firstOf(environment(), dotenvFile(Paths.get(DEFAULT_DOTENV_FILE)));
  }

  static Map<String, String> parseDotenv(List<String> lines) {
    Map<String, String> values = new LinkedHashMap<>();
    for (String rawLine: lines) {
      String line = rawLine.trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      if (line.startsWith(EXPORT_PREFIX)) {
        line = line.substring(EXPORT_PREFIX.length()).trim();
      }
      List<String> parts = KEY_VALUE_SPLITTER.splitToList(line);
      if (parts.size() != 2 || parts.get(0).isEmpty() || CharMatcher.whitespace().matchesAnyOf(parts.get(0))) {
        continue;
      }
      String value = parseValue(parts.get(1));
      if (value != null) {
        values.put(parts.get(0), value);
      }
    }
    return values;
  }

  // Returns null for a value with an unterminated quote.
  private static String parseValue(String raw) {
    if (raw.startsWith("\"")) {
      return parseDoubleQuoted(raw);
    }
    if (raw.startsWith("'")) {
      int end = raw.indexOf('\'', 1);
      return end < 0 ? null : raw.substring(1, end);
    }
    return stripInlineComment(raw);
  }

  private static String parseDoubleQuoted(String raw) {
    StringBuilder sb = new StringBuilder();
    for (int i = 1; i < raw.length(); i++) {
      char ch = raw.charAt(i);
      if (ch == '"') {
        return sb.toString();
      }
      if (ch == '\\' && i + 1 < raw.length()) {
        char next = raw.charAt(++i);
        switch (next) {
        case 'n':
          sb.append('\n');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 't':
          sb.append('\t');
          break;
        case '"':
        case '\\':
        case '\'':
        case '$':
          sb.append(next);
          break;
        default:
          sb.append(ch).append(next);
        }
      } else {
        sb.append(ch);
      }
    }
    return null;
  }

  // an unquoted value ends at a '#' that starts the value or follows whitespace
  private static String stripInlineComment(String raw) {
    for (int i = 0; i < raw.length(); i++) {
      if (raw.charAt(i) == '#' && (i == 0 || CharMatcher.whitespace().matches(raw.charAt(i - 1)))) {
        return raw.substring(0, i).trim();
      }
    }
    return raw;
  }

  private static final class DotenvFileSource implements ConfigurationSource {
    private final Path path;
    private volatile Map<String, String> values;

    DotenvFileSource(Path path) {
      this.path = path;
    }

    @Override
    public String get(String name) throws ConfigurationException {
      Map<String, String> loaded = values;
      if (loaded == null) {
        loaded = load();
        values = loaded;
      }
      return loaded.get(name);
    }

    private Map<String, String> load() throws ConfigurationException {
      List<String> lines;
      try {
        lines = Files.readAllLines(path, StandardCharsets.UTF_8);
      } catch (NoSuchFileException e) {
        return ImmutableMap.of();
      } catch (IOException e) {
        throw new ConfigurationException("Unable to read " + path, e);
      }
      return ImmutableMap.copyOf(parseDotenv(lines));
    }
  }
}
