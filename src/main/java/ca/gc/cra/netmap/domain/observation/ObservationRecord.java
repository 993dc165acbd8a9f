package ca.gc.cra.netmap.domain.observation;

import java.time.Instant;

/**
 * Normalized, immutable observation produced from one line of a host-local dump.
 *
 * <p><strong>What:</strong> Closed variant over the record kinds the fusion engine understands.
 * Anything that does not fit a variant is rejected at the normalizer boundary.</p>
 * <p><strong>Identity:</strong> {@link #id()} is a fingerprint of {@link #canonicalForm()} so
 * equal records always share an id.</p>
 *
 * @since 0.1.0
 */
public sealed interface ObservationRecord permits ArpEntry, RouteEntry, HostAlias, TraceHop {
  /** Fingerprint of the canonical form. */
  ObservationId id();

  /** Identity of the host the dump was taken on (or of the operator for aliases). */
  String sourceHostId();

  /** When the observation was captured. */
  Instant observedAt();

  RecordKind kind();

  /**
   * Stable text rendering of every field, used to derive {@link #id()}.
   *
   * @return canonical rendering
   */
  String canonicalForm();
}
