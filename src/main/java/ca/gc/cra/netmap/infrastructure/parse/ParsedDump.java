package ca.gc.cra.netmap.infrastructure.parse;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import java.util.List;
import java.util.Objects;

/**
 * Parser output for one dump.
 *
 * @param format format that was parsed
 * @param sourceHostId vantage host the records belong to
 * @param records one raw observation per usable line
 * @param skippedLines lines that matched no record pattern (headers included)
 */
public record ParsedDump(DumpFormat format, String sourceHostId, List<RawObservation> records, int skippedLines) {
  public ParsedDump {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(sourceHostId, "sourceHostId");
    records = List.copyOf(records);
  }
}
