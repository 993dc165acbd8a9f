package ca.gc.cra.netmap.infrastructure.parse;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses {@code route -n} output from Linux net-tools.
 *
 * <pre>
 * Kernel IP routing table
 * Destination     Gateway         Genmask         Flags Metric Ref    Use Iface
 * 0.0.0.0         10.0.0.1        0.0.0.0         UG    100    0        0 eth0
 * </pre>
 *
 * <p>Routes without the {@code U} (up) flag are skipped.</p>
 */
public final class LinuxRouteParser implements DumpParser {
  private static final Logger log = LoggerFactory.getLogger(LinuxRouteParser.class);
  private static final Pattern ENTRY = Pattern.compile(
      "^\\s*(\\S+)\\s+(\\S+)\\s+(\\S+)\\s+([A-Z!]+)\\s+(\\d+)\\s+\\S+\\s+\\S+\\s+(\\S+)\\s*$");

  @Override
  public DumpFormat format() {
    return DumpFormat.LINUX_ROUTE;
  }

  @Override
  public ParsedDump parse(DumpInput input) throws DumpParseException {
    String source = LineParserSupport.requireSource(input, format());
    List<RawObservation> records = new ArrayList<>();
    int skipped = 0;
    int lineNumber = 0;
    for (String line : input.lines()) {
      lineNumber++;
      Matcher m = ENTRY.matcher(line);
      if (!m.matches() || m.group(1).equals("Destination")) {
        LineParserSupport.skipped(log, input, lineNumber, line, "not a route entry");
        skipped++;
        continue;
      }
      if (m.group(4).indexOf('U') < 0) {
        LineParserSupport.skipped(log, input, lineNumber, line, "route is not up");
        skipped++;
        continue;
      }
      records.add(LineParserSupport.record("route", input, lineNumber,
          RawObservation.DESTINATION, m.group(1),
          RawObservation.GATEWAY, m.group(2),
          RawObservation.NETMASK, m.group(3),
          RawObservation.METRIC, m.group(5),
          RawObservation.INTERFACE, m.group(6)));
    }
    return new ParsedDump(format(), source, records, skipped);
  }
}
