package ca.gc.cra.netmap.infrastructure.time;

import ca.gc.cra.netmap.application.port.ClockPort;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link ClockPort} backed by a {@link Clock}, the system UTC clock unless told otherwise.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter over {@code clock}; tests pass {@link Clock#fixed}.
   *
   * @param clock time source
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Instant now() {
    return clock.instant();
  }
}
