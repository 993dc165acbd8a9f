package ca.gc.cra.netmap.application.pipeline;

import ca.gc.cra.netmap.application.fusion.FusionBatch;
import ca.gc.cra.netmap.application.fusion.TopologyFusionEngine;
import ca.gc.cra.netmap.application.identity.IdentityResolver;
import ca.gc.cra.netmap.application.normalize.NormalizationError;
import ca.gc.cra.netmap.application.normalize.NormalizationException;
import ca.gc.cra.netmap.application.normalize.RecordNormalizer;
import ca.gc.cra.netmap.application.port.CommitResult;
import ca.gc.cra.netmap.application.port.GraphStorePort;
import ca.gc.cra.netmap.application.port.MetricsPort;
import ca.gc.cra.netmap.application.port.StoreTransactionException;
import ca.gc.cra.netmap.config.StoreConfig;
import ca.gc.cra.netmap.domain.observation.ObservationId;
import ca.gc.cra.netmap.domain.observation.ObservationRecord;
import ca.gc.cra.netmap.domain.observation.RawObservation;
import ca.gc.cra.netmap.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Ingests one batch of raw observations (one dump file) into the topology
 * graph.
 * <p><strong>Why:</strong> Dumps arrive from many vantage points at once; each must land
 * atomically and converge with everything else regardless of arrival order.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating the normalizer, the fusion
 * engine and the graph store.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize raw records, skipping and reporting the malformed ones.</li>
 *   <li>Fuse the batch in one store transaction locked on the identifiers it touches.</li>
 *   <li>Retry transient store failures with exponential backoff, then report the batch failed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe. {@link #submit} runs batches on a bounded worker
 * pool; {@link #ingest} runs on the caller's thread.</p>
 * <p><strong>Observability:</strong> Puts {@code batch.id} and {@code source.host} in the MDC and
 * emits {@code ingest.records.*} and {@code ingest.batch.*} metrics.</p>
 *
 * @since 0.1.0
 */
public final class IngestUseCase implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(IngestUseCase.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  static final String MDC_BATCH = "batch.id";
  static final String MDC_SOURCE = "source.host";

  private final GraphStorePort store;
  private final IdentityResolver resolver;
  private final TopologyFusionEngine engine;
  private final RecordNormalizer normalizer;
  private final StoreConfig config;
  private final MetricsPort metrics;
  private final Object poolLock = new Object();
  private ExecutorService workers;

  /**
   * Creates the use case.
   *
   * @param store graph store receiving the batches; must not be {@code null}
   * @param resolver identity resolver, reset on forced recreation; must not be {@code null}
   * @param engine fusion engine; must not be {@code null}
   * @param normalizer record normalizer; must not be {@code null}
   * @param config timeouts, retry policy and worker count; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public IngestUseCase(
      GraphStorePort store,
      IdentityResolver resolver,
      TopologyFusionEngine engine,
      RecordNormalizer normalizer,
      StoreConfig config,
      MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Queues a batch on the worker pool.
   *
   * @param sourceHostId vantage host of the batch
   * @param records raw parser output
   * @param options batch switches
   * @return future completing with the batch report; cancelling it before commit leaves no trace
   */
  public Future<MergeReport> submit(String sourceHostId, List<RawObservation> records, IngestOptions options) {
    Objects.requireNonNull(records, "records");
    List<RawObservation> batch = List.copyOf(records);
    return workers().submit(() -> ingest(sourceHostId, batch, options));
  }

  /**
   * Ingests a batch on the calling thread.
   *
   * @param sourceHostId vantage host of the batch
   * @param records raw parser output
   * @param options batch switches
   * @return batch report; {@link BatchStatus#FAILED} when the store rejected every attempt
   * @throws InterruptedException when interrupted before commit; nothing of the batch is stored
   */
  public MergeReport ingest(String sourceHostId, List<RawObservation> records, IngestOptions options)
      throws InterruptedException {
    Objects.requireNonNull(sourceHostId, "sourceHostId");
    Objects.requireNonNull(records, "records");
    Objects.requireNonNull(options, "options");
    String batchId = UUID.randomUUID().toString();
    MDC.put(MDC_BATCH, batchId);
    MDC.put(MDC_SOURCE, sourceHostId);
    long started = System.nanoTime();
    try {
      log.info("Ingesting {} records from {}", records.size(), sourceHostId);
      if (options.forceRecreate()) {
        Optional<MergeReport> failed = recreate(batchId, sourceHostId);
        if (failed.isPresent()) {
          return failed.get();
        }
      }
      Normalized normalized = normalize(sourceHostId, records);
      MergeReport report = fuse(batchId, sourceHostId, normalized, options.dryRun());
      metrics.add("ingest.records.rejected", report.rejected());
      metrics.add("ingest.records.duplicate", report.duplicates());
      if (report.status() == BatchStatus.COMMITTED) {
        metrics.add("ingest.records.accepted", report.accepted());
      }
      log.info("Batch {}: accepted={} rejected={} duplicates={} created={} conflicts={} attempts={}",
          report.status(), report.accepted(), report.rejected(), report.duplicates(),
          report.created().size(), report.conflicts().size(), report.attempts());
      return report;
    } finally {
      metrics.observe("ingest.batch.latencyNanos", System.nanoTime() - started);
      MDC.remove(MDC_BATCH);
      MDC.remove(MDC_SOURCE);
    }
  }

  private Optional<MergeReport> recreate(String batchId, String sourceHostId) throws InterruptedException {
    try {
      store.recreate(config.transactionTimeout());
      resolver.reset();
      log.warn("Graph store recreated before batch");
      return Optional.empty();
    } catch (StoreTransactionException ex) {
      metrics.increment("ingest.batch.failed");
      log.error("Could not recreate graph store", ex);
      return Optional.of(new MergeReport(batchId, sourceHostId, BatchStatus.FAILED, 0, 0, 0,
          List.of(), List.of(), List.of(), List.of(), 1, Optional.of(ex.getMessage())));
    }
  }

  private Normalized normalize(String sourceHostId, List<RawObservation> records) {
    List<ObservationRecord> accepted = new ArrayList<>();
    List<NormalizationError> errors = new ArrayList<>();
    Set<ObservationId> seen = new HashSet<>();
    int duplicates = 0;
    for (RawObservation raw : records) {
      try {
        ObservationRecord record = normalizer.normalize(sourceHostId, raw);
        if (seen.add(record.id())) {
          accepted.add(record);
        } else {
          duplicates++;
        }
      } catch (NormalizationException ex) {
        errors.add(ex.error());
        log.debug("Rejected record {}", ex.error());
      }
    }
    if (!errors.isEmpty()) {
      log.warn("Rejected {} of {} records", errors.size(), records.size());
    }
    Set<String> lockKeys = new TreeSet<>();
    accepted.forEach(record -> lockKeys.addAll(TopologyFusionEngine.lockKeys(record)));
    return new Normalized(accepted, errors, duplicates, lockKeys);
  }

  private MergeReport fuse(String batchId, String sourceHostId, Normalized normalized, boolean dryRun)
      throws InterruptedException {
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        CommitResult<FusionBatch> result = store.execute(
            normalized.lockKeys(), config.transactionTimeout(), tx -> {
              FusionBatch batch = engine.begin(tx);
              normalized.records().forEach(batch::apply);
              if (dryRun) {
                tx.rollbackOnly();
              }
              return batch;
            });
        FusionBatch batch = result.value();
        int storedDuplicates = normalized.records().size() - batch.fusedCount();
        return new MergeReport(
            batchId,
            sourceHostId,
            result.committed() ? BatchStatus.COMMITTED : BatchStatus.DRY_RUN,
            batch.fusedCount(),
            normalized.errors().size(),
            normalized.duplicates() + storedDuplicates,
            normalized.errors(),
            result.created(),
            batch.conflicts(),
            batch.identity().appliedMerges(),
            attempt,
            Optional.empty());
      } catch (StoreTransactionException ex) {
        if (attempt >= config.maxAttempts()) {
          metrics.increment("ingest.batch.failed");
          log.error("Batch failed after {} attempts: {}", attempt, ex.getMessage());
          return new MergeReport(batchId, sourceHostId, BatchStatus.FAILED, 0,
              normalized.errors().size(), normalized.duplicates(), normalized.errors(),
              List.of(), List.of(), List.of(), attempt, Optional.of(ex.getMessage()));
        }
        Duration delay = backoff(attempt - 1);
        metrics.increment("ingest.batch.retry");
        log.warn("Store attempt {} failed ({}); retrying in {} ms", attempt, ex.getMessage(), delay.toMillis());
        TimeUnit.MILLISECONDS.sleep(delay.toMillis());
      }
    }
  }

  /**
   * Delay before retry number {@code retry} (zero-based): {@code backoffInitial * 2^retry}, capped
   * at {@code backoffMax}.
   */
  Duration backoff(int retry) {
    Duration cap = config.backoffMax();
    Duration delay = config.backoffInitial();
    for (int i = 0; i < retry && delay.compareTo(cap) < 0; i++) {
      delay = delay.multipliedBy(2);
    }
    return delay.compareTo(cap) > 0 ? cap : delay;
  }

  private ExecutorService workers() {
    synchronized (poolLock) {
      if (workers == null) {
        workers = ExecutorFactories.newIngestPool(
            config.workers(),
            "netmap-ingest",
            (thread, ex) -> log.error("Ingest worker {} failed", thread.getName(), ex));
      }
      return workers;
    }
  }

  /** Stops the worker pool, waiting briefly for running batches. */
  @Override
  public void close() {
    ExecutorService executor;
    synchronized (poolLock) {
      executor = workers;
      workers = null;
    }
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Ingest workers active after {} ms; forcing shutdown", SHUTDOWN_TIMEOUT.toMillis());
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private record Normalized(
      List<ObservationRecord> records,
      List<NormalizationError> errors,
      int duplicates,
      Set<String> lockKeys) {}
}
