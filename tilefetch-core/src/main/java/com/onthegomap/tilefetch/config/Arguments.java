package com.onthegomap.tilefetch.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value options for a download read from command-line arguments, JVM properties, environmental variables or a
 * properties file.
 * <p>
 * Keys match regardless of case and of which of {@code _ - .} separates their words, so {@code "HTTP_TIMEOUT"},
 * {@code "http-timeout"} and {@code "http.timeout"} all name the same option.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  /** Looks up the raw value for a key already in {@link #normalize(String) normalized} form. */
  private final UnaryOperator<String> provider;
  private final boolean silent;

  private Arguments(UnaryOperator<String> provider, boolean silent) {
    this.provider = provider;
    this.silent = silent;
  }

  private Arguments(UnaryOperator<String> provider) {
    this(provider, false);
  }

  /**
   * Returns arguments from JVM system properties prefixed with {@code tilefetch.}
   * <p>
   * For example {@code java -Dtilefetch.output_dir=/data -jar ...}
   */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty);
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter) {
    return new Arguments(key -> getter.apply("tilefetch." + key.replace('_', '.')));
  }

  /**
   * Returns arguments from environmental variables prefixed with {@code TILEFETCH_}
   * <p>
   * For example {@code TILEFETCH_OUTPUT_DIR=/data java -jar ...}
   */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter) {
    return new Arguments(key -> getter.apply("TILEFETCH_" + key.toUpperCase(Locale.ROOT)));
  }

  /**
   * Returns arguments parsed from a command line like {@code lat=12.97 --lon 77.59 --minzoom=12 --verbose}.
   * <p>
   * A {@code --key} with no value after it is set to {@code true}. Negative numbers like {@code --lon -122.4} are
   * values, not flags.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new LinkedHashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i].strip();
      String[] kv = arg.split("=", 2);
      String key = kv[0].replaceAll("^[\\s-]+", "");
      if (kv.length == 2) {
        parsed.put(key, kv[1]);
      } else if (arg.startsWith("-") && i < args.length - 1 && !isFlag(args[i + 1])) {
        parsed.put(key, args[++i].strip());
      } else {
        parsed.put(key, "true");
      }
    }
    return of(parsed);
  }

  private static boolean isFlag(String arg) {
    String stripped = arg.strip();
    return stripped.startsWith("-") && !stripped.matches("^-[\\d.]+$");
  }

  /**
   * Returns arguments from a {@code .properties} file.
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
    Map<String, String> map = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      map.put(name, properties.getProperty(name));
    }
    return of(map);
  }

  /**
   * Returns arguments from the command line, then JVM properties, then environmental variables, then the properties
   * file named by a {@code config} option in any of those, using the first one that sets each key.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments fromArgsOrEnv = fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
    Path configFile = fromArgsOrEnv.file("config", "path to config file", null);
    return configFile == null ? fromArgsOrEnv : fromArgsOrEnv.orElse(fromConfigFile(configFile));
  }

  private static String normalize(String key) {
    return key.strip().replaceAll("[._-]", "_").toLowerCase(Locale.ROOT);
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> normalized = new LinkedHashMap<>();
    map.forEach((key, value) -> normalized.put(normalize(key), value));
    return new Arguments(normalized::get);
  }

  /** Shorthand for {@link #of(Map)} with alternating keys and values. */
  public static Arguments of(Object... args) {
    Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < args.length; i += 2) {
      map.put(args[i].toString(), args[i + 1].toString());
    }
    return of(map);
  }

  /** Returns arguments that read from {@code this} first and {@code other} for keys that {@code this} does not set. */
  public Arguments orElse(Arguments other) {
    return new Arguments(key -> {
      String value = provider.apply(key);
      return value != null ? value : other.provider.apply(key);
    }, silent);
  }

  /** Returns these same arguments without logging each value as it is read. */
  public Arguments silenced() {
    return new Arguments(provider, true);
  }

  private String getArg(String key) {
    String value = provider.apply(normalize(key));
    return value == null ? null : value.strip();
  }

  private String getArg(String key, String defaultValue) {
    String value = getArg(key);
    return value == null ? defaultValue : value;
  }

  private String getRequiredArg(String key, String description) {
    String value = getArg(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required parameter: " + key + " (" + description + ")");
    }
    return value;
  }

  private void logArgValue(String key, String description, Object value) {
    if (!silent) {
      LOGGER.debug("argument: {}={} ({})", key, value, description);
    }
  }

  public String getString(String key, String description, String defaultValue) {
    String value = getArg(key, defaultValue);
    logArgValue(key, description, value);
    return value;
  }

  /**
   * Returns a required string argument.
   *
   * @throws IllegalArgumentException if the argument is missing
   */
  public String getString(String key, String description) {
    String value = getRequiredArg(key, description);
    logArgValue(key, description, value);
    return value;
  }

  /** Returns a {@link Path} from {@code key}, or {@code defaultValue} if it is not set. */
  public Path file(String key, String description, Path defaultValue) {
    String value = getArg(key);
    Path file = value == null ? defaultValue : Path.of(value);
    logArgValue(key, description, file);
    return file;
  }

  /**
   * Returns an argument as integer.
   *
   * @throws NumberFormatException if the argument cannot be parsed as an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    int parsed = Integer.parseInt(getArg(key, Integer.toString(defaultValue)));
    logArgValue(key, description, parsed);
    return parsed;
  }

  public double getDouble(String key, String description, double defaultValue) {
    double parsed = Double.parseDouble(getArg(key, Double.toString(defaultValue)));
    logArgValue(key, description, parsed);
    return parsed;
  }

  /**
   * Returns a required argument as double.
   *
   * @throws IllegalArgumentException if the argument is missing
   * @throws NumberFormatException    if the argument cannot be parsed as a double
   */
  public double getDouble(String key, String description) {
    double parsed = Double.parseDouble(getRequiredArg(key, description));
    logArgValue(key, description, parsed);
    return parsed;
  }

  /**
   * Returns an argument written like {@code "15s"}, {@code "0.05s"} or {@code "1h30m"} as a {@link Duration}.
   *
   * @throws DateTimeParseException if the argument cannot be parsed as a duration
   */
  public Duration getDuration(String key, String description, String defaultValue) {
    Duration parsed = Duration.parse("PT" + getArg(key, defaultValue));
    logArgValue(key, description, parsed);
    return parsed;
  }
}
