package ca.gc.cra.netmap.domain.observation;

import java.util.Locale;
import java.util.Optional;

/** Closed set of observation record kinds accepted by the normalizer. */
public enum RecordKind {
  ARP("arp"),
  ROUTE("route"),
  ALIAS("alias"),
  HOP("hop");

  private final String label;

  RecordKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * Looks up a kind by its lowercase label.
   *
   * @param raw label such as {@code arp}
   * @return matching kind, or empty when unknown
   */
  public static Optional<RecordKind> fromLabel(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (RecordKind kind : values()) {
      if (kind.label.equals(normalized)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
