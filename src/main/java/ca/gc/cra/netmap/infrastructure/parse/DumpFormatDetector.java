package ca.gc.cra.netmap.infrastructure.parse;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sniffs the format of a dump from its text.
 *
 * <p>Every line is tried against each signature in order and the first hit wins, so a dump whose
 * header was trimmed can still be recognized from a later marker.</p>
 * <p>Thread-safe; holds only compiled patterns.</p>
 */
public final class DumpFormatDetector {
  private static final Logger log = LoggerFactory.getLogger(DumpFormatDetector.class);

  private static final List<Signature> SIGNATURES = List.of(
      new Signature(DumpFormat.ALIAS, "^#\\s*netmap aliases\\s*$"),
      new Signature(DumpFormat.WINDOWS_ARP, "^Interface:\\s+"),
      new Signature(DumpFormat.LINUX_ARP, "^Address\\s+HWtype\\s+HWaddress\\s+Flags\\s+Mask\\s+Iface\\s*$"),
      new Signature(DumpFormat.OPENBSD_ARP, "^Host\\s+Ethernet\\s+Address\\s+Netif\\s+Expire\\s+Flags\\s*$"),
      new Signature(DumpFormat.LINUX_TRACEROUTE, "^traceroute6? to \\S+ \\([^)]+\\), \\d+ hops max"),
      new Signature(DumpFormat.LINUX_ROUTE, "^Kernel IP routing table\\s*$"),
      new Signature(DumpFormat.LINUX_ROUTE, "^Destination\\s+Gateway\\s+Genmask\\s+"),
      new Signature(DumpFormat.WINDOWS_ROUTE, "^\\s*Network Destination\\s+Netmask\\s+Gateway\\s+Interface\\s+Metric\\s*$"));

  /**
   * Returns the first format whose signature matches a line of the dump.
   *
   * @param lines dump lines
   * @return detected format, or empty when nothing matches
   */
  public Optional<DumpFormat> detect(List<String> lines) {
    Objects.requireNonNull(lines, "lines");
    for (String line : lines) {
      for (Signature signature : SIGNATURES) {
        if (signature.pattern().matcher(line).find()) {
          log.debug("Detected {} dump", signature.format());
          return Optional.of(signature.format());
        }
      }
    }
    return Optional.empty();
  }

  private record Signature(DumpFormat format, Pattern pattern) {
    Signature(DumpFormat format, String regex) {
      this(format, Pattern.compile(regex));
    }
  }
}
