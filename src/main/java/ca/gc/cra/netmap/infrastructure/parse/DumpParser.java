package ca.gc.cra.netmap.infrastructure.parse;

/**
 * Turns the text of one dump format into raw observations.
 *
 * <p>Parsers are line oriented and lenient: a line that does not look like a record is skipped and
 * logged at DEBUG, and field validation is left to the record normalizer.</p>
 *
 * @since 0.1.0
 */
public interface DumpParser {
  DumpFormat format();

  /**
   * Parses {@code input}.
   *
   * @param input dump text and metadata
   * @return records plus the vantage host they were taken on
   * @throws DumpParseException when the vantage host is missing or contradicts the dump
   */
  ParsedDump parse(DumpInput input) throws DumpParseException;
}
