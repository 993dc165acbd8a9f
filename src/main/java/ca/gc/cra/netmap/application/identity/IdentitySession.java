package ca.gc.cra.netmap.application.identity;

import ca.gc.cra.netmap.domain.graph.Claim;
import ca.gc.cra.netmap.domain.graph.HostMerge;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Identity evidence gathered by one transaction.
 *
 * <p>Evidence is only recorded while the transaction runs; {@link IdentityResolver} applies it
 * under the store's commit lock. After a successful commit {@link #appliedMerges()} lists the host
 * unions that actually joined two clusters.</p>
 *
 * <p>Not thread-safe: a session belongs to one transaction on one worker.</p>
 */
public final class IdentitySession {
  private final List<Attachment> attachments = new ArrayList<>();
  private final List<Label> labels = new ArrayList<>();
  private final List<HostMerge> unions = new ArrayList<>();
  private final List<HostMergeEvent> applied = new ArrayList<>();

  IdentitySession() {}

  /**
   * Assigns {@code interfaceId} to the host holding {@code seed}.
   *
   * @param interfaceId interface id
   * @param seed host seed the interface belongs to
   * @param claim attaching observation
   */
  public void attach(String interfaceId, String seed, Claim claim) {
    attachments.add(new Attachment(
        Objects.requireNonNull(interfaceId, "interfaceId"),
        Objects.requireNonNull(seed, "seed"),
        Objects.requireNonNull(claim, "claim")));
  }

  public void label(String seed, String label, Claim claim) {
    labels.add(new Label(
        Objects.requireNonNull(seed, "seed"),
        Objects.requireNonNull(label, "label"),
        Objects.requireNonNull(claim, "claim")));
  }

  /**
   * Records evidence that two seeds are the same host.
   *
   * @param merge seeds plus justifying observation
   */
  public void union(HostMerge merge) {
    unions.add(Objects.requireNonNull(merge, "merge"));
  }

  /**
   * Returns the unions that joined two distinct clusters when this session was committed.
   *
   * @return applied unions in application order
   */
  public List<HostMergeEvent> appliedMerges() {
    return Collections.unmodifiableList(applied);
  }

  boolean isEmpty() {
    return attachments.isEmpty() && labels.isEmpty() && unions.isEmpty();
  }

  List<Attachment> attachments() {
    return attachments;
  }

  List<Label> labels() {
    return labels;
  }

  List<HostMerge> unions() {
    return unions;
  }

  void recordApplied(List<HostMergeEvent> events) {
    applied.clear();
    applied.addAll(events);
  }

  record Attachment(String interfaceId, String seed, Claim claim) {}

  record Label(String seed, String label, Claim claim) {}
}
