package ca.gc.cra.netmap.infrastructure.parse;

import java.util.Objects;

/**
 * Dump type plus the OS that produced it, e.g. {@code arp/windows}.
 *
 * @param type dump kind
 * @param os producing OS
 */
public record DumpFormat(DumpType type, DumpOs os) {
  public static final DumpFormat LINUX_ARP = new DumpFormat(DumpType.ARP, DumpOs.LINUX);
  public static final DumpFormat WINDOWS_ARP = new DumpFormat(DumpType.ARP, DumpOs.WINDOWS);
  public static final DumpFormat OPENBSD_ARP = new DumpFormat(DumpType.ARP, DumpOs.OPENBSD);
  public static final DumpFormat LINUX_ROUTE = new DumpFormat(DumpType.ROUTE, DumpOs.LINUX);
  public static final DumpFormat WINDOWS_ROUTE = new DumpFormat(DumpType.ROUTE, DumpOs.WINDOWS);
  public static final DumpFormat ALIAS = new DumpFormat(DumpType.ALIAS, DumpOs.ANY);
  public static final DumpFormat LINUX_TRACEROUTE = new DumpFormat(DumpType.TRACEROUTE, DumpOs.LINUX);

  public DumpFormat {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(os, "os");
  }

  @Override
  public String toString() {
    return type.label() + "/" + os.label();
  }
}
