package ca.gc.cra.netmap.infrastructure.parse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Registry of {@link DumpParser}s keyed by {@link DumpFormat}, plus the
 * file entry point used by the {@code ingest} command.
 * <p><strong>Format resolution:</strong> An explicit type and OS are used as given. Missing parts
 * are sniffed with {@link DumpFormatDetector}; a sniffed format that contradicts an explicit part is
 * refused rather than guessed around.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class DumpParsers {
  private static final Logger log = LoggerFactory.getLogger(DumpParsers.class);

  private final Map<DumpFormat, DumpParser> parsers;
  private final DumpFormatDetector detector;

  /**
   * Creates a registry.
   *
   * @param parsers available parsers; later entries replace earlier ones for the same format
   * @param detector format sniffer
   */
  public DumpParsers(Collection<? extends DumpParser> parsers, DumpFormatDetector detector) {
    Map<DumpFormat, DumpParser> byFormat = new LinkedHashMap<>();
    for (DumpParser parser : Objects.requireNonNull(parsers, "parsers")) {
      byFormat.put(parser.format(), parser);
    }
    this.parsers = Map.copyOf(byFormat);
    this.detector = Objects.requireNonNull(detector, "detector");
  }

  /** Registry with every built-in parser. */
  public static DumpParsers defaults() {
    return new DumpParsers(List.of(
        new LinuxArpParser(),
        new WindowsArpParser(),
        new OpenBsdArpParser(),
        new LinuxRouteParser(),
        new WindowsRouteParser(),
        new LinuxTracerouteParser(),
        new AliasFileParser()), new DumpFormatDetector());
  }

  /**
   * Returns the parser for {@code format}.
   *
   * @param format dump format
   * @return parser
   * @throws DumpParseException when the format is unsupported
   */
  public DumpParser parser(DumpFormat format) throws DumpParseException {
    DumpParser parser = parsers.get(format);
    if (parser == null) {
      throw new DumpParseException("no parser for " + format + " dumps");
    }
    return parser;
  }

  /**
   * Resolves the format of {@code lines} from the explicit hints and the detector.
   *
   * @param lines dump lines
   * @param type explicit type, if any
   * @param os explicit OS, if any
   * @return resolved format
   * @throws DumpParseException when the format cannot be determined or contradicts the hints
   */
  public DumpFormat resolveFormat(List<String> lines, Optional<DumpType> type, Optional<DumpOs> os)
      throws DumpParseException {
    if (type.isPresent() && type.get() == DumpType.ALIAS) {
      return DumpFormat.ALIAS;
    }
    if (type.isPresent() && os.isPresent()) {
      return new DumpFormat(type.get(), os.get());
    }
    Optional<DumpFormat> detected = detector.detect(lines);
    if (detected.isEmpty()) {
      throw new DumpParseException("unable to detect the dump format; supply --type and --os");
    }
    DumpFormat format = detected.get();
    if (type.isPresent() && type.get() != format.type()) {
      throw new DumpParseException("--type=" + type.get().label() + " but the dump looks like " + format);
    }
    if (os.isPresent() && format.os() != DumpOs.ANY && os.get() != format.os()) {
      throw new DumpParseException("--os=" + os.get().label() + " but the dump looks like " + format);
    }
    return format;
  }

  /**
   * Reads and parses a dump file.
   *
   * @param file dump file, read as UTF-8
   * @param type explicit type, if any
   * @param os explicit OS, if any
   * @param sourceHostId explicit vantage host, if any
   * @param observedAt capture time; defaults to the file's modification time
   * @return parsed dump
   * @throws DumpParseException when the dump cannot be used
   * @throws IOException when the file cannot be read
   */
  public ParsedDump read(
      Path file,
      Optional<DumpType> type,
      Optional<DumpOs> os,
      Optional<String> sourceHostId,
      Optional<Instant> observedAt) throws DumpParseException, IOException {
    Objects.requireNonNull(file, "file");
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    DumpFormat format = resolveFormat(lines, type, os);
    Instant at = observedAt.isPresent()
        ? observedAt.get()
        : Files.getLastModifiedTime(file).toInstant();
    DumpInput input = new DumpInput(file.getFileName().toString(), lines, at, sourceHostId);
    ParsedDump parsed = parser(format).parse(input);
    log.info("Parsed {} dump {}: {} records, {} lines skipped (source {})",
        format, file, parsed.records().size(), parsed.skippedLines(), parsed.sourceHostId());
    return parsed;
  }
}
