package ca.gc.cra.netmap.api;

import ca.gc.cra.netmap.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * NETMAP CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: netmap <ingest|graph|host> [options]";
  private static final String HELP_TEXT = """
      NETMAP identity resolution and topology fusion

      Usage:
        netmap <command> [options]

      Commands:
        ingest   Merge an ARP, route, traceroute or alias dump into the graph (ingest --help for details)
        graph    Print the fused topology as JSON (graph --help for details)
        host     Print one host by id, following merges

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first positional is the command
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.positionals().isEmpty()) {
      if (input.help()) {
        CliPrinter.help(HELP_TEXT);
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = input.positionals().get(0);
    String[] delegateArgs = withoutFirst(args, command);

    return switch (command.toLowerCase(Locale.ROOT)) {
      case "ingest" -> IngestCli.run(delegateArgs);
      case "graph" -> GraphCli.run(delegateArgs);
      case "host" -> HostCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutFirst(String[] args, String token) {
    List<String> rest = new ArrayList<>(args.length);
    boolean removed = false;
    for (String arg : args) {
      if (!removed && arg != null && arg.trim().equals(token)) {
        removed = true;
        continue;
      }
      rest.add(arg);
    }
    return rest.toArray(String[]::new);
  }
}
