package ca.gc.cra.netmap.api;

import ca.gc.cra.netmap.application.port.StoreCorruptionException;
import ca.gc.cra.netmap.config.CompositionRoot;
import ca.gc.cra.netmap.config.QueryConfig;
import ca.gc.cra.netmap.domain.graph.GraphSnapshot;
import ca.gc.cra.netmap.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.netmap.infrastructure.store.SnapshotJsonWriter;
import ca.gc.cra.netmap.logging.LoggingConfigurator;
import ca.gc.cra.netmap.validation.Paths;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code netmap graph}: prints a filtered JSON snapshot of the topology.
 *
 * @since 0.1.0
 */
public final class GraphCli {
  private static final Logger log = LoggerFactory.getLogger(GraphCli.class);
  private static final String SUMMARY_USAGE =
      "usage: graph [includeStale=true|false] [minConfidence=0..1] [out=FILE] [store=PATH] [config=YAML]";
  private static final String HELP_TEXT = """
      NETMAP graph

      Usage:
        graph [options]

      Optional:
        includeStale=true|false   Include links not re-observed within the staleness window
        minConfidence=0..1        Drop links below this confidence
        out=FILE                  Write JSON to FILE instead of stdout
        store=PATH|store=memory   Graph store file (default ~/.netmap/graph.json)
        config=YAML               Settings file
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private GraphCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.help(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (!input.positionals().isEmpty()) {
      log.error("Unexpected arguments: {}", input.positionals());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.optionArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    TelemetrySettings telemetry;
    try {
      effective = ConfigCliUtils.effectiveConfig("graph", kv, log);
      telemetry = TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    QueryConfig config;
    try {
      config = QueryConfig.fromMap(effective);
      config.out().ifPresent(out -> Paths.validateWritableFile(out, true));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid graph arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = ConfigCliUtils.openRoot(config.store(), config.fusion(), telemetry)) {
      GraphSnapshot snapshot = root.graphQueryUseCase().getGraph(config.filter());
      SnapshotJsonWriter writer = new SnapshotJsonWriter();
      if (config.out().isPresent()) {
        Path out = config.out().get();
        try (Writer file = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
          writer.writeSnapshot(snapshot, file);
        }
        log.info("Wrote {} hosts and {} links to {}", snapshot.hosts().size(), snapshot.links().size(), out);
      } else {
        writer.writeSnapshot(snapshot, CliPrinter.writer());
      }
      return ExitCode.SUCCESS;
    } catch (StoreCorruptionException ex) {
      log.error("Graph store is corrupt: {}", ex.getMessage());
      return ExitCode.STORE_CORRUPTION;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid store configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("I/O failure while producing the graph", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in graph query", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
