package ca.gc.cra.netmap.infrastructure.parse;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses OpenBSD {@code arp -an} output.
 *
 * <pre>
 * Host                                 Ethernet Address   Netif Expire    Flags
 * 10.0.0.1                             00:0d:b9:12:34:56    em0 19m58s
 * </pre>
 */
public final class OpenBsdArpParser implements DumpParser {
  private static final Logger log = LoggerFactory.getLogger(OpenBsdArpParser.class);
  private static final Pattern ENTRY = Pattern.compile(
      "^\\s*(\\S+)\\s+((?:[0-9A-Fa-f]{1,2}:){5}[0-9A-Fa-f]{1,2})\\s+(\\S+)(?:\\s+.*)?$");

  @Override
  public DumpFormat format() {
    return DumpFormat.OPENBSD_ARP;
  }

  @Override
  public ParsedDump parse(DumpInput input) throws DumpParseException {
    String source = LineParserSupport.requireSource(input, format());
    List<RawObservation> records = new ArrayList<>();
    int skipped = 0;
    int lineNumber = 0;
    for (String line : input.lines()) {
      lineNumber++;
      if (line.contains("(incomplete)")) {
        LineParserSupport.skipped(log, input, lineNumber, line, "incomplete entry");
        skipped++;
        continue;
      }
      Matcher m = ENTRY.matcher(line);
      if (!m.matches()) {
        LineParserSupport.skipped(log, input, lineNumber, line, "not an ARP entry");
        skipped++;
        continue;
      }
      records.add(LineParserSupport.record("arp", input, lineNumber,
          RawObservation.LOCAL_INTERFACE, m.group(3),
          RawObservation.NEIGHBOR_IP, m.group(1),
          RawObservation.NEIGHBOR_LINK_ADDRESS, m.group(2)));
    }
    return new ParsedDump(format(), source, records, skipped);
  }
}
