package ca.gc.cra.netmap.config;

import ca.gc.cra.netmap.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parsing helpers shared by the configuration records. */
final class ConfigValues {
  private static final Pattern SHORT_DURATION = Pattern.compile("^(\\d+)\\s*(ms|s|m|h|d)$");

  private ConfigValues() {}

  static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException("not a boolean: '" + value + "'");
    };
  }

  static int parseInt(String name, String value, int defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was '" + value + "')", ex);
    }
  }

  static double parseDouble(String name, String value, double defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be a number (was '" + value + "')", ex);
    }
  }

  /**
   * Accepts ISO-8601 ({@code PT24H}) or shorthand ({@code 500ms}, {@code 30s}, {@code 5m},
   * {@code 24h}, {@code 7d}).
   */
  static Duration parseDuration(String name, String value, Duration defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String trimmed = value.trim().toLowerCase(Locale.ROOT);
    Matcher matcher = SHORT_DURATION.matcher(trimmed);
    if (matcher.matches()) {
      long amount = Long.parseLong(matcher.group(1));
      return switch (matcher.group(2)) {
        case "ms" -> Duration.ofMillis(amount);
        case "s" -> Duration.ofSeconds(amount);
        case "m" -> Duration.ofMinutes(amount);
        case "h" -> Duration.ofHours(amount);
        default -> Duration.ofDays(amount);
      };
    }
    try {
      return Duration.parse(trimmed.toUpperCase(Locale.ROOT));
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(name + " must be a duration such as 30s or PT24H (was '" + value + "')", ex);
    }
  }

  static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  static Set<String> parseList(String value, Set<String> defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    Set<String> out = new LinkedHashSet<>();
    Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(token -> !token.isEmpty())
        .forEach(out::add);
    return Set.copyOf(out);
  }

  static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  static String firstNonBlank(Map<String, String> map, String... keys) {
    for (String key : keys) {
      String val = map.get(key);
      if (val != null && !val.isBlank()) {
        return val;
      }
    }
    return null;
  }

  static Path defaultBaseDirectory() {
    String home = System.getProperty("user.home", ".");
    return Path.of(home, ".netmap").toAbsolutePath().normalize();
  }
}
