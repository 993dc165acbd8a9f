package ca.gc.cra.netmap.application.port;

/** Work performed against the latest state while the store holds its commit lock. */
@FunctionalInterface
public interface CommitAction {
  void apply(CommitView view);
}
