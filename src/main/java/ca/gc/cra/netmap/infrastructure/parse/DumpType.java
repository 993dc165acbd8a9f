package ca.gc.cra.netmap.infrastructure.parse;

import java.util.Locale;
import java.util.Optional;

/** Kind of host-local dump. */
public enum DumpType {
  ARP("arp"),
  ROUTE("route"),
  ALIAS("alias"),
  TRACEROUTE("traceroute");

  private final String label;

  DumpType(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public static Optional<DumpType> fromLabel(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (DumpType type : values()) {
      if (type.label.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
