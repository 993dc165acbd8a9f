package ca.gc.cra.netmap.infrastructure.parse;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses {@code traceroute} output from Linux.
 *
 * <pre>
 * traceroute to 8.8.8.8 (8.8.8.8), 30 hops max, 60 byte packets
 *  1  10.0.0.1 (10.0.0.1)  0.412 ms  0.398 ms  0.377 ms
 *  2  * * *
 *  3  core1.isp.example (203.0.113.9)  8.912 ms * 9.004 ms
 * </pre>
 *
 * <p>Each responding hop becomes one {@code hop} record naming the address that answered at the
 * preceding TTL, when it answered. Silent hops ({@code * * *}) are skipped; only the first address
 * of a hop that answered from several is used. Output with and without {@code -n} is accepted.</p>
 */
public final class LinuxTracerouteParser implements DumpParser {
  private static final Logger log = LoggerFactory.getLogger(LinuxTracerouteParser.class);
  private static final Pattern HEADER = Pattern.compile("^traceroute6? to \\S+ \\(([^)]+)\\),");
  private static final Pattern HOP = Pattern.compile("^\\s*(\\d+)\\s+(.*)$");
  private static final Pattern NAMED = Pattern.compile("^(\\S+)\\s+\\(([^)]+)\\)");
  private static final Pattern BARE = Pattern.compile("^([0-9A-Fa-f.:]+)(?:\\s|$)");

  @Override
  public DumpFormat format() {
    return DumpFormat.LINUX_TRACEROUTE;
  }

  @Override
  public ParsedDump parse(DumpInput input) throws DumpParseException {
    String source = LineParserSupport.requireSource(input, format());
    String target = null;
    List<RawObservation> records = new ArrayList<>();
    int skipped = 0;
    int lineNumber = 0;
    int lastHop = 0;
    String lastAddress = null;
    for (String line : input.lines()) {
      lineNumber++;
      Matcher header = HEADER.matcher(line);
      if (header.find()) {
        target = header.group(1).trim();
        lastHop = 0;
        lastAddress = null;
        skipped++;
        continue;
      }
      Matcher m = HOP.matcher(line);
      if (target == null || !m.matches()) {
        LineParserSupport.skipped(log, input, lineNumber, line, "not a hop");
        skipped++;
        continue;
      }
      int hop = Integer.parseInt(m.group(1));
      String address = replyAddress(m.group(2));
      String previous = hop == lastHop + 1 ? lastAddress : null;
      lastHop = hop;
      lastAddress = address;
      if (address == null) {
        LineParserSupport.skipped(log, input, lineNumber, line, "no reply");
        skipped++;
        continue;
      }
      if (address.equals(previous)) {
        LineParserSupport.skipped(log, input, lineNumber, line, "repeats the previous hop");
        skipped++;
        continue;
      }
      records.add(previous == null
          ? LineParserSupport.record("hop", input, lineNumber,
              RawObservation.TARGET, target,
              RawObservation.HOP, m.group(1),
              RawObservation.ADDRESS, address)
          : LineParserSupport.record("hop", input, lineNumber,
              RawObservation.TARGET, target,
              RawObservation.HOP, m.group(1),
              RawObservation.PREVIOUS_HOP, previous,
              RawObservation.ADDRESS, address));
    }
    if (target == null) {
      throw new DumpParseException(format() + " dump " + input.name() + " has no 'traceroute to' header");
    }
    return new ParsedDump(format(), source, records, skipped);
  }

  /** First replying address of a hop line body, or {@code null} when every attempt timed out. */
  private static String replyAddress(String body) {
    String rest = body.trim();
    while (rest.startsWith("*")) {
      rest = rest.substring(1).trim();
    }
    if (rest.isEmpty()) {
      return null;
    }
    Matcher named = NAMED.matcher(rest);
    if (named.find()) {
      return named.group(2).trim();
    }
    Matcher bare = BARE.matcher(rest);
    return bare.find() ? bare.group(1) : null;
  }
}
