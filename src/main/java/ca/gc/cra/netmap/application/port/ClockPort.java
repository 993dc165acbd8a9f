package ca.gc.cra.netmap.application.port;

import java.time.Instant;

/**
 * Source of the current instant for staleness decisions.
 *
 * <p>Injected so tests can pin time; production wiring uses the system clock adapter.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ClockPort {
  /** Clock backed by {@link Instant#now()}. */
  ClockPort SYSTEM = Instant::now;

  /**
   * Returns the current instant.
   *
   * @return now
   */
  Instant now();
}
