package ca.gc.cra.netmap.api;

import ca.gc.cra.netmap.application.pipeline.BatchStatus;
import ca.gc.cra.netmap.application.pipeline.IngestOptions;
import ca.gc.cra.netmap.application.pipeline.MergeReport;
import ca.gc.cra.netmap.application.port.StoreCorruptionException;
import ca.gc.cra.netmap.application.port.StoreTransactionException;
import ca.gc.cra.netmap.config.CompositionRoot;
import ca.gc.cra.netmap.config.IngestConfig;
import ca.gc.cra.netmap.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.netmap.infrastructure.parse.DumpOs;
import ca.gc.cra.netmap.infrastructure.parse.DumpParseException;
import ca.gc.cra.netmap.infrastructure.parse.DumpType;
import ca.gc.cra.netmap.infrastructure.parse.ParsedDump;
import ca.gc.cra.netmap.logging.LoggingConfigurator;
import ca.gc.cra.netmap.validation.Paths;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code netmap ingest}: parses one dump and merges it into the graph store.
 *
 * @since 0.1.0
 */
public final class IngestCli {
  private static final Logger log = LoggerFactory.getLogger(IngestCli.class);
  private static final String SUMMARY_USAGE =
      "usage: ingest <dump-file> [--type=arp|route|traceroute|alias] [--os=linux|windows|openbsd] "
          + "[--source=HOST] [--observed-at=ISO-8601] [--force] [--dry-run] "
          + "[store=PATH|store=memory] [config=YAML]";
  private static final String HELP_TEXT = """
      NETMAP ingest

      Usage:
        ingest ./arp-web01.txt --source=10.0.0.5 [options]

      Required:
        <dump-file>                 ARP table, routing table, traceroute or alias file

      Optional:
        --type=arp|route|traceroute|alias
                                    Dump type (sniffed when omitted)
        --os=linux|windows|openbsd  Producing OS (sniffed when omitted)
        --source=HOST               Host the dump was taken on; required for Linux and OpenBSD
                                    dumps and Windows route tables, checked for Windows ARP dumps
        --observed-at=ISO-8601      Capture time (default: file modification time)
        --force                     Drop the store and identity clusters first
        --dry-run                   Normalize and fuse, then roll back
        store=PATH|store=memory     Graph store file (default ~/.netmap/graph.json)
        config=YAML                 Settings file (default ~/.netmap/netmap.yaml when present)
        maxAttempts=N               Store attempts per batch (default 5)
        transactionTimeout=5s       Lock and commit bound per attempt
        stalenessWindow=24h         Age after which links turn stale
        confirmThreshold=N          Distinct observations that confirm a link (default 2)
        trustedSources=A,B          Sources whose single observation confirms a link
        metricsExporter=otlp|none   Metrics exporter (default none)
        otelEndpoint=URL            OTLP metrics endpoint when exporter=otlp
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Exit codes:
        0 success (rejected records are reported, not fatal), 2 invalid arguments or dump,
        3 I/O error, 4 configuration error, 6 store failure after retries, 7 corrupt store
      """;

  private IngestCli() {}

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
      log.debug("Verbose logging enabled for ingest CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.optionArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    List<String> positionals = input.positionals();
    if (positionals.size() > 1) {
      log.error("Expected one dump file but got {}", positionals);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (positionals.size() == 1) {
      kv.put("dump", positionals.get(0));
    }

    Map<String, String> effective;
    TelemetrySettings telemetry;
    try {
      effective = ConfigCliUtils.effectiveConfig("ingest", kv, log);
      telemetry = TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    IngestConfig config;
    try {
      config = IngestConfig.fromMap(effective);
      Paths.requireReadableFile(config.dumpFile());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid ingest arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CompositionRoot root;
    try {
      root = ConfigCliUtils.openRoot(config.store(), config.fusion(), telemetry);
    } catch (StoreCorruptionException ex) {
      log.error("Graph store is corrupt; restore it from the .bak copy or ingest with --force: {}", ex.getMessage());
      return ExitCode.STORE_CORRUPTION;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid store configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to open graph store", ex);
      return ExitCode.IO_ERROR;
    }

    try (root) {
      ParsedDump dump = root.dumpParsers().read(
          config.dumpFile(),
          config.dumpType().flatMap(DumpType::fromLabel),
          config.dumpOs().flatMap(DumpOs::fromLabel),
          config.sourceHostId(),
          config.observedAt());
      MergeReport report = root.ingestUseCase().ingest(
          dump.sourceHostId(), dump.records(), new IngestOptions(config.forceRecreate(), config.dryRun()));
      CliPrinter.report(report);
      if (report.status() == BatchStatus.FAILED) {
        return ExitCode.STORE_FAILURE;
      }
      if (report.committed()) {
        sweep(root);
      }
      return ExitCode.SUCCESS;
    } catch (DumpParseException ex) {
      log.error("Unusable dump {}: {}", config.dumpFile(), ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("I/O failure while reading {}", config.dumpFile(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Ingest interrupted; the batch was not stored");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during ingest", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void sweep(CompositionRoot root) throws InterruptedException {
    try {
      int stale = root.stalenessSweeper().sweep();
      if (stale > 0) {
        log.info("{} links turned stale", stale);
      }
    } catch (StoreTransactionException ex) {
      log.warn("Staleness sweep skipped: {}", ex.getMessage());
    }
  }
}
