package ca.gc.cra.netmap.application.normalize;

import java.util.Objects;

/**
 * Why one raw record was rejected.
 *
 * @param origin where the record came from ({@code file:line})
 * @param kind raw kind label as supplied
 * @param reason human-readable rejection reason
 */
public record NormalizationError(String origin, String kind, String reason) {
  public NormalizationError {
    Objects.requireNonNull(origin, "origin");
    kind = kind == null ? "" : kind;
    Objects.requireNonNull(reason, "reason");
  }

  @Override
  public String toString() {
    return origin + " [" + kind + "]: " + reason;
  }
}
