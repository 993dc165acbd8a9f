package ca.gc.cra.netmap.infrastructure.store;

import ca.gc.cra.netmap.application.port.CommitResult;
import ca.gc.cra.netmap.application.port.GraphStorePort;
import ca.gc.cra.netmap.application.port.StoreCorruptionException;
import ca.gc.cra.netmap.application.port.StoreTransactionException;
import ca.gc.cra.netmap.application.port.TransactionWork;
import ca.gc.cra.netmap.domain.graph.GraphState;
import ca.gc.cra.netmap.validation.Paths;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link GraphStorePort} that keeps the graph in memory and rewrites one JSON
 * file on every commit.
 * <p><strong>Durability:</strong> Each state is written to {@code <file>.tmp}, flushed, and moved
 * over the store file atomically where the filesystem allows it. With backups enabled the previous
 * file is copied to {@code <file>.bak} first. A failed write aborts the commit, so the file and the
 * published state never diverge.</p>
 * <p><strong>Thread-safety:</strong> Writes happen under the in-memory store's commit lock.</p>
 *
 * @since 0.1.0
 */
public final class JsonFileGraphStore implements GraphStorePort {
  private static final Logger log = LoggerFactory.getLogger(JsonFileGraphStore.class);

  private final Path file;
  private final boolean backup;
  private final GraphJsonCodec codec;
  private final InMemoryGraphStore delegate;

  private JsonFileGraphStore(Path file, boolean backup, GraphJsonCodec codec, GraphState initial) {
    this.file = file;
    this.backup = backup;
    this.codec = codec;
    this.delegate = new InMemoryGraphStore(initial, this::write);
  }

  /**
   * Opens the store at {@code path}, loading it when present and starting empty otherwise.
   *
   * @param path store file
   * @param backup whether to keep the previous file as {@code .bak}
   * @return open store
   * @throws StoreCorruptionException when the existing file cannot be decoded
   * @throws IOException when the file cannot be read
   */
  public static JsonFileGraphStore open(Path path, boolean backup) throws StoreCorruptionException, IOException {
    Objects.requireNonNull(path, "path");
    Path file = Paths.validateWritableFile(path, true);
    GraphJsonCodec codec = new GraphJsonCodec();
    GraphState initial = GraphState.empty();
    if (Files.exists(file)) {
      try (InputStream in = Files.newInputStream(file)) {
        initial = codec.read(in);
      }
      log.info("Loaded graph store {} ({} entities, {} observations)",
          file, initial.entityCount(), initial.observations().size());
    } else {
      log.info("Graph store {} does not exist yet; starting empty", file);
    }
    return new JsonFileGraphStore(file, backup, codec, initial);
  }

  public Path file() {
    return file;
  }

  @Override
  public <T> CommitResult<T> execute(Set<String> lockKeys, Duration timeout, TransactionWork<T> work)
      throws StoreTransactionException, InterruptedException {
    return delegate.execute(lockKeys, timeout, work);
  }

  @Override
  public GraphState snapshot() {
    return delegate.snapshot();
  }

  @Override
  public void recreate(Duration timeout) throws StoreTransactionException, InterruptedException {
    delegate.recreate(timeout);
  }

  private void write(GraphState next) throws IOException {
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    try (OutputStream out = Files.newOutputStream(tmp)) {
      codec.write(next, out);
      out.flush();
    }
    if (backup && Files.exists(file)) {
      Path bak = file.resolveSibling(file.getFileName() + ".bak");
      Files.copy(file, bak, StandardCopyOption.REPLACE_EXISTING);
    }
    try {
      Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; replacing in place", file);
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }
    log.debug("Persisted graph store {} ({} entities)", file, next.entityCount());
  }
}
