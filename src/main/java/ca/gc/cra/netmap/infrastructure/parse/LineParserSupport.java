package ca.gc.cra.netmap.infrastructure.parse;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import ca.gc.cra.netmap.logging.Logs;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;

/** Helpers shared by the line-oriented parsers. */
final class LineParserSupport {
  private LineParserSupport() {
    // Utility
  }

  static String requireSource(DumpInput input, DumpFormat format) throws DumpParseException {
    return input.sourceHostId().orElseThrow(() -> new DumpParseException(
        format + " dumps do not name the host they were taken on; supply --source"));
  }

  static RawObservation record(String kind, DumpInput input, int lineNumber, String... keyValues) {
    Map<String, String> fields = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      fields.put(keyValues[i], keyValues[i + 1]);
    }
    return new RawObservation(kind, input.observedAt(), fields, input.origin(lineNumber));
  }

  static void skipped(Logger log, DumpInput input, int lineNumber, String line, String reason) {
    if (log.isDebugEnabled() && !line.isBlank()) {
      log.debug("Skipping {} ({}): {}", input.origin(lineNumber), reason, Logs.line(line));
    }
  }
}
