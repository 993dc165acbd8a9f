package ca.gc.cra.netmap.api;

import ca.gc.cra.netmap.application.fusion.ConflictReport;
import ca.gc.cra.netmap.application.identity.HostMergeEvent;
import ca.gc.cra.netmap.application.normalize.NormalizationError;
import ca.gc.cra.netmap.application.pipeline.MergeReport;
import ca.gc.cra.netmap.domain.graph.EntityRef;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output of the netmap commands: usage text, merge reports and JSON documents.
 *
 * <p>Writes to the native stdout descriptor so results stay separate from log output, which goes
 * to stderr.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {}

  public static void println(String message) {
    writer().println(message);
  }

  /** Prints a help block without its trailing blank lines. */
  public static void help(String text) {
    writer().println(text.stripTrailing());
  }

  /**
   * Prints one summary line for the batch, then one indented line per rejected record, address
   * conflict, host merge and created entity, followed by the failure reason of a failed batch.
   *
   * @param report outcome of one ingest
   */
  public static void report(MergeReport report) {
    PrintWriter out = writer();
    out.println(String.format(
        "batch %s %s: source=%s accepted=%d rejected=%d duplicates=%d created=%d conflicts=%d merges=%d attempts=%d",
        report.batchId(),
        report.status(),
        report.sourceHostId(),
        report.accepted(),
        report.rejected(),
        report.duplicates(),
        report.created().size(),
        report.conflicts().size(),
        report.hostMerges().size(),
        report.attempts()));
    for (NormalizationError error : report.errors()) {
      out.println("  rejected " + error.origin() + " [" + error.kind() + "]: " + error.reason());
    }
    for (ConflictReport conflict : report.conflicts()) {
      out.println("  conflict " + conflict.address() + " claimed by " + String.join(", ", conflict.interfaceIds())
          + " (observation " + conflict.observation().value() + ")");
    }
    for (HostMergeEvent merge : report.hostMerges()) {
      out.println("  merged " + merge.absorbed() + " into " + merge.survivor()
          + " (" + merge.evidenceKind().label() + " " + merge.observation().value() + ")");
    }
    for (EntityRef ref : report.created()) {
      out.println("  created " + ref);
    }
    report.failure().ifPresent(reason -> out.println("  failure: " + reason));
  }

  /** Writer for JSON documents; {@code graph} and {@code host} stream into it. */
  static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }
}
