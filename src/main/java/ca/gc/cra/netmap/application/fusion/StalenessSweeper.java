package ca.gc.cra.netmap.application.fusion;

import ca.gc.cra.netmap.application.port.ClockPort;
import ca.gc.cra.netmap.application.port.GraphStorePort;
import ca.gc.cra.netmap.application.port.MetricsPort;
import ca.gc.cra.netmap.application.port.StoreTransactionException;
import ca.gc.cra.netmap.domain.graph.Link;
import ca.gc.cra.netmap.domain.graph.LinkStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically re-evaluates the status of every stored link.
 *
 * <p><strong>What:</strong> Demotes links whose latest support is older than the staleness window.
 * Queries evaluate staleness lazily as well, so the sweep only keeps the persisted status
 * current.</p>
 * <p><strong>Concurrency:</strong> Runs as a store transaction with no lock keys; the reassessment
 * happens in a commit action against the latest state, so it never overwrites support merged by a
 * concurrent batch.</p>
 * <p><strong>Observability:</strong> Increments {@code fusion.links.stale} per demoted link.</p>
 *
 * @since 0.1.0
 */
public final class StalenessSweeper {
  private static final Logger log = LoggerFactory.getLogger(StalenessSweeper.class);

  private final GraphStorePort store;
  private final LinkAssessor assessor;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Duration timeout;

  public StalenessSweeper(
      GraphStorePort store, LinkAssessor assessor, ClockPort clock, MetricsPort metrics, Duration timeout) {
    this.store = Objects.requireNonNull(store, "store");
    this.assessor = Objects.requireNonNull(assessor, "assessor");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  /**
   * Reassesses every link once.
   *
   * @return number of links that turned stale
   * @throws StoreTransactionException when the store cannot commit in time
   * @throws InterruptedException when interrupted before commit
   */
  public int sweep() throws StoreTransactionException, InterruptedException {
    AtomicInteger demoted = new AtomicInteger();
    store.execute(Set.of(), timeout, tx -> {
      tx.onCommit(view -> {
        Instant now = clock.now();
        for (Link link : List.copyOf(view.links())) {
          Link assessed = assessor.assess(link, now);
          if (assessed == link) {
            continue;
          }
          view.putLink(assessed);
          if (assessed.status() == LinkStatus.STALE && link.status() != LinkStatus.STALE) {
            demoted.incrementAndGet();
          }
        }
      });
      return null;
    });
    if (demoted.get() > 0) {
      metrics.add("fusion.links.stale", demoted.get());
      log.info("Staleness sweep demoted {} links", demoted.get());
    }
    return demoted.get();
  }

  /**
   * Schedules {@link #sweep()} at a fixed delay.
   *
   * @param scheduler scheduler owning the sweep thread
   * @param interval delay between sweeps
   * @return handle for cancelling the schedule
   */
  public ScheduledFuture<?> start(ScheduledExecutorService scheduler, Duration interval) {
    long millis = interval.toMillis();
    return scheduler.scheduleWithFixedDelay(this::sweepQuietly, millis, millis, TimeUnit.MILLISECONDS);
  }

  private void sweepQuietly() {
    try {
      sweep();
    } catch (StoreTransactionException ex) {
      log.warn("Staleness sweep skipped: {}", ex.getMessage());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Staleness sweep interrupted");
    }
  }
}
