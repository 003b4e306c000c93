package com.onthegomap.geojts.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value settings for the codec read from command-line arguments, JVM properties, environmental variables or a
 * config file.
 * <p>
 * Keys match regardless of case and of whether words are separated by {@code _}, {@code -} or {@code .}, so
 * {@code output_dimension}, {@code output-dimension} and {@code OUTPUT_DIMENSION} are the same setting.
 * <p>
 * A renamed setting can be read as {@code "new_name|old_name"}: the old name still works but logs a warning.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);
  private static final String JVM_PREFIX = "geojts.";
  private static final String ENV_PREFIX = "GEOJTS_";

  /** Returns the raw value for a normalized key, or null. */
  private final UnaryOperator<String> lookup;
  private boolean silent = false;

  private Arguments(UnaryOperator<String> lookup) {
    this.lookup = lookup;
  }

  /** Returns {@code key} in lower case with words separated by {@code _}. */
  static String normalize(String key) {
    return key.strip().replaceAll("[._-]+", "_").toLowerCase(Locale.ROOT);
  }

  /**
   * Returns arguments from JVM system properties prefixed with {@code geojts.}, for example
   * {@code java -Dgeojts.write_bbox=true ...}
   */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty);
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter) {
    return new Arguments(key -> getter.apply(JVM_PREFIX + key));
  }

  /**
   * Returns arguments from environmental variables prefixed with {@code GEOJTS_}, for example
   * {@code GEOJTS_WRITE_BBOX=true java ...}
   */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter) {
    return new Arguments(key -> getter.apply(ENV_PREFIX + key.toUpperCase(Locale.ROOT)));
  }

  /** Returns arguments read from {@code properties}. */
  public static Arguments from(Properties properties) {
    Map<String, String> map = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      map.put(name, properties.getProperty(name));
    }
    return of(map);
  }

  /**
   * Returns arguments parsed from a main method's {@code args}.
   * <p>
   * Accepts {@code key=value}, {@code --key value}, and bare {@code --key} or {@code key} which set it to
   * {@code true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new LinkedHashMap<>();
    int i = 0;
    while (i < args.length) {
      String arg = args[i++].strip();
      int equals = arg.indexOf('=');
      if (equals >= 0) {
        parsed.put(stripDashes(arg.substring(0, equals)), arg.substring(equals + 1));
      } else if (arg.startsWith("-") && i < args.length && !args[i].strip().startsWith("-")) {
        parsed.put(stripDashes(arg), args[i++].strip());
      } else {
        parsed.put(stripDashes(arg), "true");
      }
    }
    return of(parsed);
  }

  private static String stripDashes(String key) {
    return key.replaceFirst("^[\\s-]+", "");
  }

  /**
   * Returns arguments loaded from a {@code .properties} file.
   *
   * @throws IllegalArgumentException if the file cannot be read
   */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    return from(properties);
  }

  /**
   * Returns arguments from every source, checked in this order:
   * <ol>
   * <li>command-line arguments: {@code java ... key=value}</li>
   * <li>JVM properties: {@code java -Dgeojts.key=value ...}</li>
   * <li>environmental variables: {@code GEOJTS_KEY=value java ...}</li>
   * <li>the file named by a {@code config} argument from any of the above</li>
   * </ol>
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments arguments = fromEnvOrArgs(args);
    Path configFile = arguments.file("config", "path to config file", null);
    return configFile == null ? arguments : arguments.orElse(fromConfigFile(configFile));
  }

  /** Returns arguments from command-line arguments, then JVM properties, then environmental variables. */
  public static Arguments fromEnvOrArgs(String... args) {
    return fromArgs(args).orElse(fromJvmProperties()).orElse(fromEnvironment());
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> normalized = new LinkedHashMap<>();
    map.forEach((key, value) -> normalized.put(normalize(key), value));
    return new Arguments(normalized::get);
  }

  /** Shorthand for {@link #of(Map)} from alternating keys and values. */
  public static Arguments of(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected key/value pairs, got " + keysAndValues.length + " items");
    }
    Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      map.put(keysAndValues[i].toString(), keysAndValues[i + 1].toString());
    }
    return of(map);
  }

  /** Returns arguments that read from {@code this} first and from {@code other} where a key is not set here. */
  public Arguments orElse(Arguments other) {
    Arguments result = new Arguments(key -> {
      String value = lookup.apply(key);
      return value != null ? value : other.lookup.apply(key);
    });
    result.silent = silent;
    return result;
  }

  /** Stops logging values as they are read and returns this instance. */
  public Arguments silence() {
    silent = true;
    return this;
  }

  public boolean silenced() {
    return silent;
  }

  private String get(String key) {
    String[] names = key.split("\\|");
    for (int i = 0; i < names.length; i++) {
      String value = lookup.apply(normalize(names[i]));
      if (value != null) {
        if (i > 0) {
          LOGGER.warn("Argument '{}' is deprecated, use '{}'", names[i].strip(), names[0].strip());
        }
        return value.strip();
      }
    }
    return null;
  }

  private <T> T logged(String key, String description, T value) {
    if (!silent) {
      LOGGER.debug("argument: {}={} ({})", key.split("\\|")[0], value, description);
    }
    return value;
  }

  public String getString(String key, String description, String defaultValue) {
    String value = get(key);
    return logged(key, description, value == null ? defaultValue : value);
  }

  /** Returns the path in {@code key}, or {@code defaultValue} when it is not set. */
  public Path file(String key, String description, Path defaultValue) {
    String value = get(key);
    return logged(key, description, value == null ? defaultValue : Path.of(value));
  }

  /**
   * Returns the path in {@code key} of a file that must exist.
   *
   * @throws IllegalArgumentException if the file does not exist
   */
  public Path inputFile(String key, String description, Path defaultValue) {
    Path path = file(key, description, defaultValue);
    if (path != null && !Files.exists(path)) {
      throw new IllegalArgumentException(path + " does not exist");
    }
    return path;
  }

  /** Returns true if {@code key} is {@code "true"} in any case, false for any other value. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    String value = get(key);
    return logged(key, description, value == null ? defaultValue : "true".equalsIgnoreCase(value));
  }

  /**
   * Returns {@code key} parsed as an integer.
   *
   * @throws IllegalArgumentException if the value is not an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    String value = get(key);
    if (value == null) {
      return logged(key, description, defaultValue);
    }
    try {
      return logged(key, description, Integer.parseInt(value));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Argument '" + key + "' must be an integer, got '" + value + "'", e);
    }
  }
}
