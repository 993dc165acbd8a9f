package ca.gc.cra.netmap.application.identity;

import ca.gc.cra.netmap.application.port.CommitView;
import ca.gc.cra.netmap.application.port.StoreTransaction;
import ca.gc.cra.netmap.domain.graph.GraphState;
import ca.gc.cra.netmap.domain.graph.Host;
import ca.gc.cra.netmap.domain.graph.HostMerge;
import ca.gc.cra.netmap.domain.graph.NetInterface;
import ca.gc.cra.netmap.domain.identity.SeedClusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps raw identifiers to canonical hosts.
 *
 * <p><strong>What:</strong> Keeps every host seed ({@code host/src/<source>} and
 * {@code host/mac/<link address>}) in {@link SeedClusters} and applies the identity evidence of
 * each transaction at commit time: interface attachment, labels and host unions.</p>
 * <p><strong>Why:</strong> Unions must see the latest clusters, including those committed by
 * batches that touched unrelated identifiers, so they run inside the store's commit lock rather
 * than against the transaction's snapshot.</p>
 * <p><strong>Merging:</strong> A union re-points every member seed of the smaller-ranked cluster at
 * the elected survivor and moves its interfaces. Survivor ids and tombstone targets depend only on
 * cluster membership, so any ingestion order ends with the same host records.</p>
 * <p><strong>Ambiguity:</strong> Only {@code SAME_SOURCE} attachment and explicit aliases merge
 * hosts. Shared IP addresses never do; they are annotated as conflicts by the fusion engine.</p>
 * <p><strong>Thread-safety:</strong> Commit actions are serialized by the store; the published
 * clusters are swapped after the new state is published so a failed commit leaves them
 * untouched.</p>
 *
 * @since 0.1.0
 */
public final class IdentityResolver {
  private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

  private volatile SeedClusters clusters = new SeedClusters();

  /**
   * Opens an identity session whose evidence is applied when {@code tx} commits.
   *
   * @param tx open transaction
   * @return session collecting identity evidence
   */
  public IdentitySession open(StoreTransaction tx) {
    IdentitySession session = new IdentitySession();
    tx.onCommit(view -> apply(session, view));
    return session;
  }

  /**
   * Returns the canonical host id currently elected for {@code seed}.
   *
   * @param seed host seed id
   * @return canonical id, or empty when the seed was never committed
   */
  public Optional<String> canonical(String seed) {
    SeedClusters current = clusters;
    return current.contains(seed) ? Optional.of(current.canonical(seed)) : Optional.empty();
  }

  /** Forgets every cluster; used together with a store recreate. */
  public void reset() {
    clusters = new SeedClusters();
    log.info("Identity clusters reset");
  }

  /**
   * Rebuilds the clusters from persisted host records, e.g. after opening a store file.
   *
   * @param state persisted state
   */
  public void rebuild(GraphState state) {
    SeedClusters rebuilt = new SeedClusters();
    for (Host host : state.hosts().values()) {
      rebuilt.add(host.id());
      if (!host.isActive()) {
        continue;
      }
      for (String seed : host.memberSeeds()) {
        rebuilt.add(seed);
        rebuilt.union(host.id(), seed);
      }
    }
    for (Host host : state.hosts().values()) {
      host.mergedInto().ifPresent(survivor -> {
        rebuilt.add(survivor);
        rebuilt.union(host.id(), survivor);
      });
    }
    clusters = rebuilt;
    log.debug("Rebuilt identity clusters from {} host records", state.hosts().size());
  }

  private void apply(IdentitySession session, CommitView view) {
    if (session.isEmpty()) {
      return;
    }
    SeedClusters next = clusters.copy();
    for (IdentitySession.Attachment attachment : session.attachments()) {
      ensureSeed(next, view, attachment.seed());
    }
    for (IdentitySession.Label label : session.labels()) {
      ensureSeed(next, view, label.seed());
    }
    for (HostMerge merge : session.unions()) {
      ensureSeed(next, view, merge.seedA());
      ensureSeed(next, view, merge.seedB());
    }

    List<HostMergeEvent> applied = new ArrayList<>();
    for (HostMerge merge : session.unions()) {
      Optional<SeedClusters.Union> union = next.union(merge.seedA(), merge.seedB());
      union.ifPresent(u -> {
        join(view, u.survivor(), u.absorbed());
        applied.add(new HostMergeEvent(u.survivor(), u.absorbed(), merge.evidenceKind(), merge.observation()));
        log.info("Merged host {} into {} on {} evidence", u.absorbed(), u.survivor(), merge.evidenceKind().label());
      });
      String canonical = next.canonical(merge.seedA());
      view.putHost(requireHost(view, canonical).withMerge(merge));
    }

    for (IdentitySession.Attachment attachment : session.attachments()) {
      String canonical = next.canonical(attachment.seed());
      view.putHost(requireHost(view, canonical).withInterface(attachment.interfaceId(), attachment.claim()));
      NetInterface iface = view.networkInterface(attachment.interfaceId())
          .orElseThrow(() -> new IllegalStateException("attached interface " + attachment.interfaceId() + " is missing"));
      if (!iface.hostId().equals(Optional.of(canonical))) {
        view.putInterface(iface.withHostId(canonical));
      }
    }
    for (IdentitySession.Label label : session.labels()) {
      String canonical = next.canonical(label.seed());
      view.putHost(requireHost(view, canonical).withLabel(label.label(), label.claim()));
    }

    session.recordApplied(applied);
    view.afterPublish(() -> clusters = next);
  }

  private static void ensureSeed(SeedClusters next, CommitView view, String seed) {
    if (next.add(seed) && view.host(seed).isEmpty()) {
      view.putHost(Host.seed(seed));
    }
  }

  private static void join(CommitView view, String survivorId, String absorbedId) {
    Host survivor = requireHost(view, survivorId);
    Host absorbed = requireHost(view, absorbedId);
    Host combined = survivor.absorb(absorbed);
    view.putHost(combined);
    for (String seed : new TreeSet<>(combined.memberSeeds())) {
      if (!seed.equals(survivorId)) {
        Host member = view.host(seed).orElseGet(() -> Host.seed(seed));
        view.putHost(member.absorbedInto(survivorId));
      }
    }
    for (String interfaceId : absorbed.interfaceIds()) {
      view.networkInterface(interfaceId)
          .ifPresent(iface -> view.putInterface(iface.withHostId(survivorId)));
    }
  }

  private static Host requireHost(CommitView view, String id) {
    return view.host(id)
        .orElseThrow(() -> new IllegalStateException("host " + id + " has no record"));
  }
}
