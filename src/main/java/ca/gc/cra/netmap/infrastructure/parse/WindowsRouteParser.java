package ca.gc.cra.netmap.infrastructure.parse;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the IPv4 {@code Active Routes} table of Windows {@code route print}.
 *
 * <pre>
 * Network Destination        Netmask          Gateway       Interface  Metric
 *           0.0.0.0          0.0.0.0      192.168.1.1    192.168.1.100     25
 *         127.0.0.0        255.0.0.0         On-link         127.0.0.1    331
 * </pre>
 *
 * <p>The interface column is the local address of the outgoing interface. The persistent route
 * and IPv6 tables are ignored. The dump does not name its host, so a source host id is required.</p>
 */
public final class WindowsRouteParser implements DumpParser {
  private static final Logger log = LoggerFactory.getLogger(WindowsRouteParser.class);
  private static final Pattern HEADER =
      Pattern.compile("^\\s*Network Destination\\s+Netmask\\s+Gateway\\s+Interface\\s+Metric\\s*$");
  private static final Pattern ENTRY =
      Pattern.compile("^\\s*(\\S+)\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)\\s+(\\d+)\\s*$");

  @Override
  public DumpFormat format() {
    return DumpFormat.WINDOWS_ROUTE;
  }

  @Override
  public ParsedDump parse(DumpInput input) throws DumpParseException {
    String source = LineParserSupport.requireSource(input, format());
    List<RawObservation> records = new ArrayList<>();
    boolean inTable = false;
    int skipped = 0;
    int lineNumber = 0;
    for (String line : input.lines()) {
      lineNumber++;
      if (HEADER.matcher(line).matches()) {
        inTable = true;
        skipped++;
        continue;
      }
      if (line.startsWith("====")) {
        inTable = false;
        skipped++;
        continue;
      }
      Matcher m = ENTRY.matcher(line);
      if (!inTable || !m.matches()) {
        LineParserSupport.skipped(log, input, lineNumber, line, "outside the active route table");
        skipped++;
        continue;
      }
      records.add(LineParserSupport.record("route", input, lineNumber,
          RawObservation.DESTINATION, m.group(1),
          RawObservation.NETMASK, m.group(2),
          RawObservation.GATEWAY, m.group(3),
          RawObservation.INTERFACE, m.group(4),
          RawObservation.METRIC, m.group(5)));
    }
    return new ParsedDump(format(), source, records, skipped);
  }
}
