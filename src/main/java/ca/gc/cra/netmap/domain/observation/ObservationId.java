package ca.gc.cra.netmap.domain.observation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content fingerprint of an observation record.
 *
 * <p>Two records with the same canonical form (kind, source, timestamp and payload) share an id,
 * which is what lets re-ingested dumps collapse onto the existing history.</p>
 *
 * @param value lowercase hex digest prefix
 * @since 0.1.0
 */
public record ObservationId(String value) implements Comparable<ObservationId> {
  private static final int DIGEST_HEX_CHARS = 32;

  public ObservationId {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("observation id must not be blank");
    }
  }

  /**
   * Derives the id for a canonical record rendering.
   *
   * @param canonicalForm stable text rendering of the record
   * @return fingerprint id
   */
  public static ObservationId fingerprint(String canonicalForm) {
    Objects.requireNonNull(canonicalForm, "canonicalForm");
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(canonicalForm.getBytes(StandardCharsets.UTF_8));
      return new ObservationId(HexFormat.of().formatHex(hash).substring(0, DIGEST_HEX_CHARS));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }

  @Override
  public int compareTo(ObservationId other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
