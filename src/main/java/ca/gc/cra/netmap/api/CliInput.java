package ca.gc.cra.netmap.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Raw CLI arguments split into positionals, options and the help and verbose switches every
 * command shares. Options are left untouched for {@link CliArgsParser}.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> positionals;
  private final String[] optionArgs;
  private final boolean help;
  private final boolean verbose;

  private CliInput(List<String> positionals, String[] optionArgs, boolean help, boolean verbose) {
    this.positionals = positionals;
    this.optionArgs = optionArgs;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(List.of(), new String[0], false, false);
    }

    List<String> positionals = new ArrayList<>();
    List<String> options = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else if (arg.startsWith("-") || arg.indexOf('=') >= 0) {
        options.add(arg);
      } else {
        positionals.add(arg);
      }
    }
    return new CliInput(List.copyOf(positionals), options.toArray(String[]::new), help, verbose);
  }

  public List<String> positionals() {
    return positionals;
  }

  /** Option arguments in the order given, for {@link CliArgsParser#toMap(String[])}. */
  public String[] optionArgs() {
    return Arrays.copyOf(optionArgs, optionArgs.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }
}
