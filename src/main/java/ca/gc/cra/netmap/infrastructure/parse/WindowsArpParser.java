package ca.gc.cra.netmap.infrastructure.parse;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses Windows {@code arp -a} output.
 *
 * <pre>
 * Interface: 10.137.2.16 --- 0x11
 *   Internet Address      Physical Address      Type
 *   10.137.2.1            fe-ff-ff-ff-ff-ff     dynamic
 * </pre>
 *
 * <p>Each {@code Interface:} section names the local address the following entries were learned
 * on; that address becomes the entry's local interface. The first section's address is the default
 * source host id. A supplied source must be one of the section addresses.</p>
 */
public final class WindowsArpParser implements DumpParser {
  private static final Logger log = LoggerFactory.getLogger(WindowsArpParser.class);
  private static final Pattern INTERFACE = Pattern.compile("^Interface:\\s+(\\S+)\\s+---.*$");
  private static final Pattern ENTRY = Pattern.compile(
      "^\\s+(\\S+)\\s+((?:[0-9A-Fa-f]{2}-){5}[0-9A-Fa-f]{2})\\s+(\\S+)\\s*$");

  @Override
  public DumpFormat format() {
    return DumpFormat.WINDOWS_ARP;
  }

  @Override
  public ParsedDump parse(DumpInput input) throws DumpParseException {
    List<RawObservation> records = new ArrayList<>();
    Set<String> localAddresses = new LinkedHashSet<>();
    Optional<String> local = Optional.empty();
    int skipped = 0;
    int lineNumber = 0;
    for (String line : input.lines()) {
      lineNumber++;
      Matcher section = INTERFACE.matcher(line);
      if (section.matches()) {
        local = Optional.of(section.group(1));
        localAddresses.add(section.group(1));
        continue;
      }
      Matcher m = ENTRY.matcher(line);
      if (!m.matches() || local.isEmpty()) {
        LineParserSupport.skipped(log, input, lineNumber, line,
            local.isEmpty() ? "entry outside an Interface section" : "not an ARP entry");
        skipped++;
        continue;
      }
      records.add(LineParserSupport.record("arp", input, lineNumber,
          RawObservation.LOCAL_INTERFACE, local.get(),
          RawObservation.NEIGHBOR_IP, m.group(1),
          RawObservation.NEIGHBOR_LINK_ADDRESS, m.group(2)));
    }
    if (localAddresses.isEmpty()) {
      throw new DumpParseException("Windows ARP dump " + input.name() + " has no Interface: section");
    }
    String first = localAddresses.iterator().next();
    String source = input.sourceHostId().orElse(first);
    if (!localAddresses.contains(source)) {
      throw new DumpParseException("the dump was taken on " + String.join(", ", localAddresses)
          + " but the supplied source is " + source);
    }
    return new ParsedDump(format(), source, records, skipped);
  }
}
