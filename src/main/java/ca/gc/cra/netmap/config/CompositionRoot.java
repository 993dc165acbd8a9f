package ca.gc.cra.netmap.config;

import ca.gc.cra.netmap.application.fusion.LinkAssessor;
import ca.gc.cra.netmap.application.fusion.StalenessSweeper;
import ca.gc.cra.netmap.application.fusion.TopologyFusionEngine;
import ca.gc.cra.netmap.application.identity.IdentityResolver;
import ca.gc.cra.netmap.application.normalize.RecordNormalizer;
import ca.gc.cra.netmap.application.pipeline.GraphQueryUseCase;
import ca.gc.cra.netmap.application.pipeline.IngestUseCase;
import ca.gc.cra.netmap.application.port.ClockPort;
import ca.gc.cra.netmap.application.port.GraphStorePort;
import ca.gc.cra.netmap.application.port.MetricsPort;
import ca.gc.cra.netmap.application.port.StoreCorruptionException;
import ca.gc.cra.netmap.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.netmap.infrastructure.parse.DumpParsers;
import ca.gc.cra.netmap.infrastructure.store.InMemoryGraphStore;
import ca.gc.cra.netmap.infrastructure.store.JsonFileGraphStore;
import ca.gc.cra.netmap.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires NETMAP use cases to concrete adapters.
 * <p><strong>Role:</strong> Composition root for the CLI and for embedding applications.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the graph store selected by {@link StoreConfig} and rebuild identity clusters from it.</li>
 *   <li>Share one resolver, assessor and fusion engine between ingestion, queries and sweeps.</li>
 *   <li>Own the worker pool and sweep scheduler, and release them on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Build on one thread; the use cases it returns are thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final StoreConfig storeConfig;
  private final FusionConfig fusionConfig;
  private final GraphStorePort store;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final IdentityResolver resolver = new IdentityResolver();
  private final LinkAssessor assessor;
  private final TopologyFusionEngine engine;
  private final DumpParsers dumpParsers = DumpParsers.defaults();
  private IngestUseCase ingestUseCase;
  private ScheduledExecutorService sweepScheduler;

  /**
   * Creates a root around an already open store.
   *
   * @param storeConfig store limits used by ingestion
   * @param fusionConfig fusion parameters
   * @param store open graph store; closed with this root
   * @param metrics metrics sink; closed with this root when it is {@link AutoCloseable}
   * @param clock time source
   */
  public CompositionRoot(
      StoreConfig storeConfig,
      FusionConfig fusionConfig,
      GraphStorePort store,
      MetricsPort metrics,
      ClockPort clock) {
    this.storeConfig = Objects.requireNonNull(storeConfig, "storeConfig");
    this.fusionConfig = Objects.requireNonNull(fusionConfig, "fusionConfig");
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.assessor = new LinkAssessor(fusionConfig);
    this.engine = new TopologyFusionEngine(resolver, assessor, clock, metrics);
    resolver.rebuild(store.snapshot());
  }

  /**
   * Opens the store named by {@code storeConfig}: the JSON file store when a path is set, the
   * in-memory store otherwise.
   *
   * @param storeConfig store settings
   * @param fusionConfig fusion parameters
   * @param metrics metrics sink
   * @return wired root
   * @throws StoreCorruptionException when the store file cannot be decoded
   * @throws IOException when the store file cannot be read
   */
  public static CompositionRoot open(StoreConfig storeConfig, FusionConfig fusionConfig, MetricsPort metrics)
      throws StoreCorruptionException, IOException {
    GraphStorePort store = storeConfig.path().isPresent()
        ? JsonFileGraphStore.open(storeConfig.path().get(), storeConfig.backup())
        : new InMemoryGraphStore();
    if (storeConfig.inMemory()) {
      log.info("Using in-memory graph store; nothing will be persisted");
    }
    return new CompositionRoot(storeConfig, fusionConfig, store, metrics, new SystemClockAdapter());
  }

  /** Lazily built ingestion use case sharing this root's resolver and store. */
  public synchronized IngestUseCase ingestUseCase() {
    if (ingestUseCase == null) {
      ingestUseCase = new IngestUseCase(store, resolver, engine, new RecordNormalizer(), storeConfig, metrics);
    }
    return ingestUseCase;
  }

  public GraphQueryUseCase graphQueryUseCase() {
    return new GraphQueryUseCase(store, assessor, clock);
  }

  public StalenessSweeper stalenessSweeper() {
    return new StalenessSweeper(store, assessor, clock, metrics, storeConfig.transactionTimeout());
  }

  /**
   * Starts the periodic staleness sweep on a daemon thread owned by this root.
   *
   * @return handle for cancelling the schedule
   */
  public synchronized ScheduledFuture<?> startStalenessSweeps() {
    if (sweepScheduler == null) {
      sweepScheduler = ExecutorFactories.newSweepScheduler(
          "netmap-sweep", (thread, ex) -> log.error("Sweep thread {} failed", thread.getName(), ex));
    }
    return stalenessSweeper().start(sweepScheduler, fusionConfig.sweepInterval());
  }

  public DumpParsers dumpParsers() {
    return dumpParsers;
  }

  public GraphStorePort store() {
    return store;
  }

  public IdentityResolver resolver() {
    return resolver;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  public FusionConfig fusionConfig() {
    return fusionConfig;
  }

  /** Stops workers and the sweep thread, then closes the store and the metrics sink. */
  @Override
  public synchronized void close() {
    RuntimeException failure = null;
    if (sweepScheduler != null) {
      sweepScheduler.shutdownNow();
      sweepScheduler = null;
    }
    if (ingestUseCase != null) {
      failure = closeResource(ingestUseCase, failure);
      ingestUseCase = null;
    }
    failure = closeResource(store, failure);
    if (metrics instanceof AutoCloseable closeable) {
      failure = closeResource(closeable, failure);
    }
    if (failure != null) {
      throw failure;
    }
  }

  private static RuntimeException closeResource(AutoCloseable resource, RuntimeException failure) {
    try {
      resource.close();
      return failure;
    } catch (Exception ex) {
      RuntimeException wrapped = ex instanceof RuntimeException runtime
          ? runtime
          : new IllegalStateException("Failed to close " + resource.getClass().getSimpleName(), ex);
      if (failure == null) {
        return wrapped;
      }
      failure.addSuppressed(wrapped);
      return failure;
    }
  }
}
