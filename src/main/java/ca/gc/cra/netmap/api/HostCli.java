package ca.gc.cra.netmap.api;

import ca.gc.cra.netmap.application.port.StoreCorruptionException;
import ca.gc.cra.netmap.config.CompositionRoot;
import ca.gc.cra.netmap.config.QueryConfig;
import ca.gc.cra.netmap.domain.graph.Host;
import ca.gc.cra.netmap.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.netmap.infrastructure.store.SnapshotJsonWriter;
import ca.gc.cra.netmap.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code netmap host}: prints one host, following merge redirects from absorbed ids.
 *
 * @since 0.1.0
 */
public final class HostCli {
  private static final Logger log = LoggerFactory.getLogger(HostCli.class);
  private static final String SUMMARY_USAGE = "usage: host id=HOST_ID [store=PATH] [config=YAML]";

  private HostCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.optionArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.positionals().size() == 1 && !kv.containsKey("id")) {
      kv.put("id", input.positionals().get(0));
    } else if (!input.positionals().isEmpty()) {
      log.error("Unexpected arguments: {}", input.positionals());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    TelemetrySettings telemetry;
    try {
      effective = ConfigCliUtils.effectiveConfig("host", kv, log);
      telemetry = TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    QueryConfig config;
    try {
      config = QueryConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid host arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String hostId = config.hostId().orElse("");

    try (CompositionRoot root = ConfigCliUtils.openRoot(config.store(), config.fusion(), telemetry)) {
      Optional<Host> host = root.graphQueryUseCase().getHost(hostId);
      if (host.isEmpty()) {
        log.error("No host {}", hostId);
        return ExitCode.NOT_FOUND;
      }
      if (!host.get().id().equals(hostId)) {
        log.info("Host {} was merged into {}", hostId, host.get().id());
      }
      new SnapshotJsonWriter().writeHost(host.get(), CliPrinter.writer());
      return ExitCode.SUCCESS;
    } catch (StoreCorruptionException ex) {
      log.error("Graph store is corrupt: {}", ex.getMessage());
      return ExitCode.STORE_CORRUPTION;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid store configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("I/O failure while printing host {}", hostId, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in host query", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
