package ca.gc.cra.netmap.application.port;

import ca.gc.cra.netmap.domain.graph.Host;
import ca.gc.cra.netmap.domain.graph.Link;
import ca.gc.cra.netmap.domain.graph.NetInterface;
import java.util.Collection;
import java.util.Optional;

/**
 * Read/replace access to the state being committed.
 *
 * <p>Only valid inside a {@link CommitAction}. Puts replace the stored entity outright; callers are
 * responsible for merging.</p>
 */
public interface CommitView {
  Optional<Host> host(String id);

  void putHost(Host host);

  Optional<NetInterface> networkInterface(String id);

  void putInterface(NetInterface iface);

  Optional<Link> link(String id);

  void putLink(Link link);

  Collection<Link> links();

  /**
   * Runs {@code action} once the new state is published. Not run when the commit fails.
   *
   * @param action follow-up
   */
  void afterPublish(Runnable action);
}
