package ca.gc.cra.netmap.infrastructure.parse;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses {@code arp -n} output from Linux net-tools.
 *
 * <pre>
 * Address                  HWtype  HWaddress           Flags Mask            Iface
 * 10.137.1.8               ether   00:16:3e:5e:6c:06   C                     vif2.0
 * </pre>
 *
 * <p>The table does not name the host it was taken on, so a source host id is required.</p>
 */
public final class LinuxArpParser implements DumpParser {
  private static final Logger log = LoggerFactory.getLogger(LinuxArpParser.class);
  private static final Pattern ENTRY = Pattern.compile(
      "^\\s*(\\S+)\\s+\\S+\\s+((?:[0-9A-Fa-f]{1,2}:){5}[0-9A-Fa-f]{1,2})\\s+\\S+(?:\\s+\\S+)?\\s+(\\S+)\\s*$");

  @Override
  public DumpFormat format() {
    return DumpFormat.LINUX_ARP;
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
