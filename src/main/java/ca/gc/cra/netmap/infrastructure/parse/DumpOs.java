package ca.gc.cra.netmap.infrastructure.parse;

import java.util.Locale;
import java.util.Optional;

/** Operating system whose tool produced a dump. Alias files are OS-neutral ({@link #ANY}). */
public enum DumpOs {
  LINUX("linux"),
  WINDOWS("windows"),
  OPENBSD("openbsd"),
  ANY("any");

  private final String label;

  DumpOs(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public static Optional<DumpOs> fromLabel(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (DumpOs os : values()) {
      if (os.label.equals(normalized)) {
        return Optional.of(os);
      }
    }
    return Optional.empty();
  }
}
