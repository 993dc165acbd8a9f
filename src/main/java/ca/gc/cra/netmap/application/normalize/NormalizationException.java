package ca.gc.cra.netmap.application.normalize;

import java.util.Objects;

/**
 * Raised by {@link RecordNormalizer} for a record that does not fit any observation variant.
 * Record-level only: the batch skips the record and carries on.
 */
public final class NormalizationException extends Exception {
  private final transient NormalizationError error;

  public NormalizationException(NormalizationError error) {
    super(Objects.requireNonNull(error, "error").toString());
    this.error = error;
  }

  public NormalizationException(NormalizationError error, Throwable cause) {
    super(Objects.requireNonNull(error, "error").toString(), cause);
    this.error = error;
  }

  public NormalizationError error() {
    return error;
  }
}
