package ca.gc.cra.netmap.infrastructure.store;

import ca.gc.cra.netmap.domain.graph.GraphSnapshot;
import ca.gc.cra.netmap.domain.graph.Host;
import ca.gc.cra.netmap.domain.graph.LinkView;
import ca.gc.cra.netmap.domain.graph.NetInterface;
import ca.gc.cra.netmap.domain.graph.Reachability;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Renders query results as pretty-printed JSON for operators and scripts. Entity fields use the
 * same layout as the store file; links additionally carry their host-level endpoints.
 */
public final class SnapshotJsonWriter {
  private final JsonFactory factory = new JsonFactory();
  private final GraphJsonCodec codec = new GraphJsonCodec();

  /**
   * Writes {@code snapshot}; {@code out} is flushed but left open.
   *
   * @param snapshot snapshot to render
   * @param out destination
   * @throws IOException when writing fails
   */
  public void writeSnapshot(GraphSnapshot snapshot, Writer out) throws IOException {
    Objects.requireNonNull(snapshot, "snapshot");
    try (JsonGenerator gen = generator(out)) {
      gen.writeStartObject();
      gen.writeStringField("takenAt", snapshot.takenAt().toString());
      gen.writeArrayFieldStart("hosts");
      for (Host host : snapshot.hosts()) {
        codec.writeHost(gen, host);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("interfaces");
      for (NetInterface iface : snapshot.interfaces()) {
        codec.writeInterface(gen, iface);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("links");
      for (LinkView view : snapshot.links()) {
        gen.writeStartObject();
        gen.writeStringField("fromHostId", view.fromHostId());
        gen.writeStringField("toNodeId", view.toNodeId());
        if (view.toHostId().isPresent()) {
          gen.writeStringField("toHostId", view.toHostId().get());
        }
        gen.writeFieldName("link");
        codec.writeLink(gen, view.link());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("reachability");
      for (Reachability node : snapshot.reachability()) {
        codec.writeReachability(gen, node);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    out.write(System.lineSeparator());
    out.flush();
  }

  /**
   * Writes one host record.
   *
   * @param host host to render
   * @param out destination; flushed but left open
   * @throws IOException when writing fails
   */
  public void writeHost(Host host, Writer out) throws IOException {
    Objects.requireNonNull(host, "host");
    try (JsonGenerator gen = generator(out)) {
      codec.writeHost(gen, host);
    }
    out.write(System.lineSeparator());
    out.flush();
  }

  private JsonGenerator generator(Writer out) throws IOException {
    JsonGenerator gen = factory.createGenerator(Objects.requireNonNull(out, "out"));
    gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    gen.useDefaultPrettyPrinter();
    return gen;
  }
}
