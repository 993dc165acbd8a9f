package ca.gc.cra.netmap.infrastructure.parse;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Dump text handed to a {@link DumpParser}.
 *
 * @param name file name used in record origins
 * @param lines dump lines without terminators
 * @param observedAt capture time stamped on every record
 * @param sourceHostId operator-supplied vantage host, if any
 */
public record DumpInput(String name, List<String> lines, Instant observedAt, Optional<String> sourceHostId) {
  public DumpInput {
    Objects.requireNonNull(name, "name");
    lines = List.copyOf(lines);
    Objects.requireNonNull(observedAt, "observedAt");
    sourceHostId = sourceHostId == null ? Optional.empty() : sourceHostId;
  }

  String origin(int lineNumber) {
    return name + ":" + lineNumber;
  }
}
