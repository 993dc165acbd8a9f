package ca.gc.cra.netmap.infrastructure.parse;

import ca.gc.cra.netmap.domain.observation.RawObservation;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses operator alias files.
 *
 * <pre>
 * # netmap aliases
 * # host            link address
 * 10.0.0.5          00:16:3e:aa:bb:cc
 * </pre>
 *
 * <p>Each line states that a link address belongs to the host known by the given source host id.
 * Without {@code --source} the records are attributed to {@value #DEFAULT_SOURCE}.</p>
 */
public final class AliasFileParser implements DumpParser {
  static final String DEFAULT_SOURCE = "operator";
  private static final Logger log = LoggerFactory.getLogger(AliasFileParser.class);
  private static final Pattern ENTRY = Pattern.compile("^\\s*(\\S+)\\s+(\\S+)\\s*(?:#.*)?$");

  @Override
  public DumpFormat format() {
    return DumpFormat.ALIAS;
  }

  @Override
  public ParsedDump parse(DumpInput input) {
    String source = input.sourceHostId().orElse(DEFAULT_SOURCE);
    List<RawObservation> records = new ArrayList<>();
    int skipped = 0;
    int lineNumber = 0;
    for (String line : input.lines()) {
      lineNumber++;
      if (line.isBlank() || line.stripLeading().startsWith("#")) {
        skipped++;
        continue;
      }
      Matcher m = ENTRY.matcher(line);
      if (!m.matches()) {
        LineParserSupport.skipped(log, input, lineNumber, line, "expected '<host> <link address>'");
        skipped++;
        continue;
      }
      records.add(LineParserSupport.record("alias", input, lineNumber,
          RawObservation.HOST, m.group(1),
          RawObservation.LINK_ADDRESS, m.group(2)));
    }
    return new ParsedDump(format(), source, records, skipped);
  }
}
