package ca.gc.cra.netmap.api;

import ca.gc.cra.netmap.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns netmap option arguments into settings named the way the config layer reads them.
 *
 * <p>Accepts {@code key=value}, {@code --key=value} and the bare switches {@code --force} and
 * {@code --dry-run}. Kebab-case names become camelCase, so {@code --observed-at=X},
 * {@code observed-at=X} and {@code observedAt=X} are the same setting. The {@code --os} and
 * {@code --type} choices are lower-cased; the switches only take {@code true} or {@code false}.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._]+$");
  /** Settings that may be given as a bare flag. */
  static final Set<String> SWITCHES = Set.of("force", "dryRun");
  private static final Set<String> CHOICES = Set.of("os", "type");

  private CliArgsParser() {}

  /**
   * Parses option arguments.
   *
   * @param args option arguments; {@code null} returns an empty map
   * @return mutable map in argument order; later duplicates win
   * @throws IllegalArgumentException for an argument that is neither {@code key=value} nor a known
   *     switch, a bad switch value, or a value holding control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx < 0 && arg.startsWith("-")) {
        String name = settingName(arg);
        if (!SWITCHES.contains(name)) {
          throw new IllegalArgumentException("unknown flag " + arg + " (only --force and --dry-run stand alone)");
        }
        map.put(name, "true");
        continue;
      }
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = settingName(arg.substring(0, idx));
      String value = arg.substring(idx + 1).trim();
      validateKey(key);
      validateValue(key, value);
      map.put(key, canonicalValue(key, value));
    }
    return map;
  }

  /**
   * Strips leading dashes and turns kebab-case into camelCase.
   *
   * @param raw option name such as {@code --observed-at}
   * @return setting name such as {@code observedAt}
   */
  static String settingName(String raw) {
    String stripped = raw.trim();
    int start = 0;
    while (start < stripped.length() && stripped.charAt(start) == '-') {
      start++;
    }
    StringBuilder sb = new StringBuilder(stripped.length() - start);
    boolean upper = false;
    for (int i = start; i < stripped.length(); i++) {
      char c = stripped.charAt(i);
      if (c == '-') {
        upper = sb.length() > 0;
        continue;
      }
      sb.append(upper ? Character.toUpperCase(c) : c);
      upper = false;
    }
    return sb.toString();
  }

  private static String canonicalValue(String key, String value) {
    if (SWITCHES.contains(key)) {
      String lower = value.toLowerCase(Locale.ROOT);
      if (!lower.equals("true") && !lower.equals("false")) {
        throw new IllegalArgumentException(key + " must be true or false (was '" + value + "')");
      }
      return lower;
    }
    return CHOICES.contains(key) ? value.toLowerCase(Locale.ROOT) : value;
  }

  private static void validateKey(String key) {
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
  }

  private static void validateValue(String key, String value) {
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
    }
    Strings.requireNonBlank(key, value);
  }
}
