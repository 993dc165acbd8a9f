package ca.gc.cra.netmap.infrastructure.store;

import ca.gc.cra.netmap.application.port.StoreCorruptionException;
import ca.gc.cra.netmap.domain.graph.Claim;
import ca.gc.cra.netmap.domain.graph.GraphState;
import ca.gc.cra.netmap.domain.graph.Host;
import ca.gc.cra.netmap.domain.graph.HostMerge;
import ca.gc.cra.netmap.domain.graph.HostStatus;
import ca.gc.cra.netmap.domain.graph.InterfaceOrigin;
import ca.gc.cra.netmap.domain.graph.IpConflict;
import ca.gc.cra.netmap.domain.graph.Link;
import ca.gc.cra.netmap.domain.graph.LinkKind;
import ca.gc.cra.netmap.domain.graph.LinkStatus;
import ca.gc.cra.netmap.domain.graph.NetInterface;
import ca.gc.cra.netmap.domain.graph.OwnerClaim;
import ca.gc.cra.netmap.domain.graph.Reachability;
import ca.gc.cra.netmap.domain.net.Cidr;
import ca.gc.cra.netmap.domain.net.IpAddress;
import ca.gc.cra.netmap.domain.net.LinkAddress;
import ca.gc.cra.netmap.domain.observation.ArpEntry;
import ca.gc.cra.netmap.domain.observation.HostAlias;
import ca.gc.cra.netmap.domain.observation.ObservationId;
import ca.gc.cra.netmap.domain.observation.ObservationRecord;
import ca.gc.cra.netmap.domain.observation.RecordKind;
import ca.gc.cra.netmap.domain.observation.RouteEntry;
import ca.gc.cra.netmap.domain.observation.TraceHop;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Reads and writes a {@link GraphState} as one JSON document.
 *
 * <p>Layout: {@code {"format":"netmap-graph","version":1,"hosts":[...],"interfaces":[...],
 * "links":[...],"reachability":[...],"observations":[...]}}. Every record carries its own id;
 * attribute values carry their provenance as {@code {"firstSeen","lastSeen","observations"}}.
 * Collections are written in id order so equal states serialize to identical bytes.</p>
 *
 * <p>Observation ids are recomputed on load; a mismatch means the file was edited or damaged and is
 * reported as corruption.</p>
 */
public final class GraphJsonCodec {
  static final String FORMAT = "netmap-graph";
  static final int VERSION = 1;

  private final JsonFactory factory = new JsonFactory();

  /**
   * Writes {@code state} to {@code out}; the stream is left open.
   *
   * @param state state to write
   * @param out destination
   * @throws IOException when writing fails
   */
  public void write(GraphState state, OutputStream out) throws IOException {
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeStringField("format", FORMAT);
      gen.writeNumberField("version", VERSION);
      gen.writeArrayFieldStart("hosts");
      for (Host host : state.hosts().values()) {
        writeHost(gen, host);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("interfaces");
      for (NetInterface iface : state.interfaces().values()) {
        writeInterface(gen, iface);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("links");
      for (Link link : state.links().values()) {
        writeLink(gen, link);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("reachability");
      for (Reachability node : state.reachability().values()) {
        writeReachability(gen, node);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("observations");
      for (ObservationRecord record : state.observations().values()) {
        writeObservation(gen, record);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  /**
   * Reads a state written by {@link #write}.
   *
   * @param in source; left open
   * @return decoded state
   * @throws IOException when reading fails
   * @throws StoreCorruptionException when the document is malformed or inconsistent
   */
  public GraphState read(InputStream in) throws IOException, StoreCorruptionException {
    JsonTree root;
    try (JsonParser parser = factory.createParser(in)) {
      parser.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
      root = JsonTree.read(parser);
    } catch (JsonProcessingException ex) {
      throw new StoreCorruptionException("graph store is not valid JSON: " + ex.getOriginalMessage(), ex);
    } catch (IllegalArgumentException ex) {
      throw new StoreCorruptionException("graph store is malformed: " + ex.getMessage(), ex);
    }
    try {
      if (!FORMAT.equals(root.string("format")) || root.number("version") != VERSION) {
        throw new StoreCorruptionException(
            "unsupported graph store format " + root.string("format") + " v" + root.number("version"));
      }
      Map<String, Host> hosts = index(root, "hosts", this::readHost, Host::id);
      Map<String, NetInterface> interfaces = index(root, "interfaces", this::readInterface, NetInterface::id);
      Map<String, Link> links = index(root, "links", this::readLink, Link::id);
      Map<String, Reachability> reachability = index(root, "reachability", this::readReachability, Reachability::id);
      Map<ObservationId, ObservationRecord> observations = index(root, "observations", this::readObservation, ObservationRecord::id);
      return new GraphState(hosts, interfaces, links, reachability, observations);
    } catch (IllegalArgumentException | NullPointerException | DateTimeException ex) {
      throw new StoreCorruptionException("graph store is malformed: " + ex.getMessage(), ex);
    }
  }

  private static <K extends Comparable<? super K>, V> Map<K, V> index(
      JsonTree root, String name, Function<JsonTree, V> decoder, Function<V, K> key) {
    Map<K, V> out = new TreeMap<>();
    for (JsonTree node : root.objects(name)) {
      V value = decoder.apply(node);
      if (out.put(key.apply(value), value) != null) {
        throw new IllegalArgumentException(node.path() + " duplicates id " + key.apply(value));
      }
    }
    return out;
  }

  void writeHost(JsonGenerator gen, Host host) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("id", host.id());
    gen.writeStringField("status", host.status().name());
    if (host.mergedInto().isPresent()) {
      gen.writeStringField("mergedInto", host.mergedInto().get());
    }
    writeStrings(gen, "memberSeeds", host.memberSeeds());
    writeStrings(gen, "interfaceIds", host.interfaceIds());
    writeClaims(gen, "labels", host.labels(), Function.identity());
    if (host.seen().isPresent()) {
      gen.writeFieldName("seen");
      writeClaim(gen, host.seen().get());
    }
    gen.writeArrayFieldStart("merges");
    for (HostMerge merge : host.merges()) {
      gen.writeStartObject();
      gen.writeStringField("seedA", merge.seedA());
      gen.writeStringField("seedB", merge.seedB());
      gen.writeStringField("evidence", merge.evidenceKind().label());
      gen.writeStringField("observation", merge.observation().value());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private Host readHost(JsonTree node) {
    TreeSet<HostMerge> merges = new TreeSet<>();
    for (JsonTree merge : node.objects("merges")) {
      merges.add(new HostMerge(
          merge.string("seedA"),
          merge.string("seedB"),
          recordKind(merge.string("evidence")),
          new ObservationId(merge.string("observation"))));
    }
    return new Host(
        node.string("id"),
        HostStatus.valueOf(node.string("status")),
        node.optionalString("mergedInto"),
        new TreeSet<>(node.strings("memberSeeds")),
        new TreeSet<>(node.strings("interfaceIds")),
        readClaims(node, "labels", Function.identity()),
        node.optionalObject("seen").map(GraphJsonCodec::readClaim),
        merges);
  }

  void writeInterface(JsonGenerator gen, NetInterface iface) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("id", iface.id());
    gen.writeStringField("origin", iface.origin().name());
    if (iface.hostId().isPresent()) {
      gen.writeStringField("hostId", iface.hostId().get());
    }
    if (iface.sourceHostId().isPresent()) {
      gen.writeStringField("sourceHostId", iface.sourceHostId().get());
    }
    writeClaims(gen, "linkAddresses", iface.linkAddresses(), LinkAddress::value);
    writeClaims(gen, "addresses", iface.addresses(), IpAddress::toString);
    writeClaims(gen, "names", iface.names(), Function.identity());
    gen.writeArrayFieldStart("conflicts");
    for (IpConflict conflict : iface.conflicts().values()) {
      gen.writeStartObject();
      gen.writeStringField("address", conflict.address().toString());
      writeStrings(gen, "interfaceIds", conflict.interfaceIds());
      writeStrings(gen, "observations", conflict.observations().stream().map(ObservationId::value).toList());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeFieldName("seen");
    writeClaim(gen, iface.seen());
    gen.writeEndObject();
  }

  private NetInterface readInterface(JsonTree node) {
    SortedMap<IpAddress, IpConflict> conflicts = new TreeMap<>();
    for (JsonTree conflict : node.objects("conflicts")) {
      IpAddress address = IpAddress.parse(conflict.string("address"));
      conflicts.put(address, new IpConflict(
          address,
          new TreeSet<>(conflict.strings("interfaceIds")),
          observationIds(conflict.strings("observations"))));
    }
    return new NetInterface(
        node.string("id"),
        InterfaceOrigin.valueOf(node.string("origin")),
        node.optionalString("hostId"),
        node.optionalString("sourceHostId"),
        readClaims(node, "linkAddresses", LinkAddress::new),
        readClaims(node, "addresses", IpAddress::parse),
        readClaims(node, "names", Function.identity()),
        conflicts,
        readClaim(node.object("seen")));
  }

  void writeLink(JsonGenerator gen, Link link) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("id", link.id());
    gen.writeStringField("kind", link.kind().name());
    gen.writeStringField("endpointA", link.endpointA());
    gen.writeStringField("endpointB", link.endpointB());
    if (link.destination().isPresent()) {
      gen.writeStringField("destination", link.destination().get().toString());
    }
    if (link.gateway().isPresent()) {
      gen.writeStringField("gateway", link.gateway().get().toString());
    }
    if (link.metric().isPresent()) {
      gen.writeNumberField("metric", link.metric().get());
    }
    if (link.gatewayOwner().isPresent()) {
      gen.writeFieldName("gatewayOwner");
      writeOwner(gen, link.gatewayOwner().get());
    }
    writeStrings(gen, "support", link.support().stream().map(ObservationId::value).toList());
    writeStrings(gen, "sources", link.sources());
    gen.writeStringField("firstSeen", link.firstSeen().toString());
    gen.writeStringField("lastSeen", link.lastSeen().toString());
    gen.writeNumberField("confidence", link.confidence());
    gen.writeStringField("status", link.status().name());
    gen.writeEndObject();
  }

  private Link readLink(JsonTree node) {
    return new Link(
        node.string("id"),
        LinkKind.valueOf(node.string("kind")),
        node.string("endpointA"),
        node.string("endpointB"),
        node.optionalString("destination").map(Cidr::parse),
        node.optionalString("gateway").map(IpAddress::parse),
        node.optionalNumber("metric").map(Long::intValue),
        node.optionalObject("gatewayOwner").map(GraphJsonCodec::readOwner),
        observationIds(node.strings("support")),
        new TreeSet<>(node.strings("sources")),
        Instant.parse(node.string("firstSeen")),
        Instant.parse(node.string("lastSeen")),
        node.decimal("confidence"),
        LinkStatus.valueOf(node.string("status")));
  }

  void writeReachability(JsonGenerator gen, Reachability node) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("id", node.id());
    gen.writeStringField("destination", node.destination().toString());
    if (node.gateway().isPresent()) {
      gen.writeStringField("gateway", node.gateway().get().toString());
    }
    if (node.resolvedBy().isPresent()) {
      gen.writeFieldName("resolvedBy");
      writeOwner(gen, node.resolvedBy().get());
    }
    gen.writeFieldName("seen");
    writeClaim(gen, node.seen());
    gen.writeEndObject();
  }

  private Reachability readReachability(JsonTree node) {
    return new Reachability(
        node.string("id"),
        Cidr.parse(node.string("destination")),
        node.optionalString("gateway").map(IpAddress::parse),
        node.optionalObject("resolvedBy").map(GraphJsonCodec::readOwner),
        readClaim(node.object("seen")));
  }

  private void writeObservation(JsonGenerator gen, ObservationRecord record) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("id", record.id().value());
    gen.writeStringField("kind", record.kind().label());
    gen.writeStringField("sourceHostId", record.sourceHostId());
    gen.writeStringField("observedAt", record.observedAt().toString());
    if (record instanceof ArpEntry arp) {
      gen.writeStringField("localInterface", arp.localInterface());
      gen.writeStringField("neighborIp", arp.neighborIp().toString());
      gen.writeStringField("neighborLinkAddress", arp.neighborLinkAddress().value());
    } else if (record instanceof RouteEntry route) {
      gen.writeStringField("destination", route.destination().toString());
      if (route.gateway().isPresent()) {
        gen.writeStringField("gateway", route.gateway().get().toString());
      }
      gen.writeStringField("outgoingInterface", route.outgoingInterface());
      gen.writeNumberField("metric", route.metric());
    } else if (record instanceof HostAlias alias) {
      gen.writeStringField("hostId", alias.hostId());
      gen.writeStringField("linkAddress", alias.linkAddress().value());
    } else if (record instanceof TraceHop hop) {
      gen.writeStringField("target", hop.target().toString());
      gen.writeNumberField("hop", hop.hop());
      if (hop.previousHop().isPresent()) {
        gen.writeStringField("previousHop", hop.previousHop().get().toString());
      }
      gen.writeStringField("address", hop.address().toString());
    }
    gen.writeEndObject();
  }

  private ObservationRecord readObservation(JsonTree node) {
    String source = node.string("sourceHostId");
    Instant observedAt = Instant.parse(node.string("observedAt"));
    ObservationRecord record = switch (recordKind(node.string("kind"))) {
      case ARP -> ArpEntry.create(
          source,
          observedAt,
          node.string("localInterface"),
          IpAddress.parse(node.string("neighborIp")),
          new LinkAddress(node.string("neighborLinkAddress")));
      case ROUTE -> RouteEntry.create(
          source,
          observedAt,
          Cidr.parse(node.string("destination")),
          node.optionalString("gateway").map(IpAddress::parse),
          node.string("outgoingInterface"),
          Math.toIntExact(node.number("metric")));
      case ALIAS -> HostAlias.create(
          source, observedAt, node.string("hostId"), new LinkAddress(node.string("linkAddress")));
      case HOP -> TraceHop.create(
          source,
          observedAt,
          IpAddress.parse(node.string("target")),
          Math.toIntExact(node.number("hop")),
          node.optionalString("previousHop").map(IpAddress::parse),
          IpAddress.parse(node.string("address")));
    };
    String stored = node.string("id");
    if (!record.id().value().equals(stored)) {
      throw new IllegalArgumentException(node.path() + " id " + stored + " does not match its content");
    }
    return record;
  }

  private static void writeOwner(JsonGenerator gen, OwnerClaim owner) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("interfaceId", owner.interfaceId());
    gen.writeStringField("lastSeen", owner.lastSeen().toString());
    gen.writeEndObject();
  }

  private static OwnerClaim readOwner(JsonTree node) {
    return new OwnerClaim(node.string("interfaceId"), Instant.parse(node.string("lastSeen")));
  }

  private static <K> void writeClaims(
      JsonGenerator gen, String name, Map<K, Claim> claims, Function<K, String> format) throws IOException {
    gen.writeArrayFieldStart(name);
    for (Map.Entry<K, Claim> entry : claims.entrySet()) {
      gen.writeStartObject();
      gen.writeStringField("value", format.apply(entry.getKey()));
      gen.writeFieldName("claim");
      writeClaim(gen, entry.getValue());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static <K extends Comparable<? super K>> SortedMap<K, Claim> readClaims(
      JsonTree node, String name, Function<String, K> parse) {
    SortedMap<K, Claim> out = new TreeMap<>();
    for (JsonTree entry : node.objects(name)) {
      out.put(parse.apply(entry.string("value")), readClaim(entry.object("claim")));
    }
    return out;
  }

  private static void writeClaim(JsonGenerator gen, Claim claim) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("firstSeen", claim.firstSeen().toString());
    gen.writeStringField("lastSeen", claim.lastSeen().toString());
    writeStrings(gen, "observations", claim.observations().stream().map(ObservationId::value).toList());
    gen.writeEndObject();
  }

  private static Claim readClaim(JsonTree node) {
    return new Claim(
        Instant.parse(node.string("firstSeen")),
        Instant.parse(node.string("lastSeen")),
        observationIds(node.strings("observations")));
  }

  private static void writeStrings(JsonGenerator gen, String name, Collection<String> values) throws IOException {
    gen.writeArrayFieldStart(name);
    for (String value : values) {
      gen.writeString(value);
    }
    gen.writeEndArray();
  }

  private static TreeSet<ObservationId> observationIds(Collection<String> values) {
    TreeSet<ObservationId> out = new TreeSet<>();
    values.forEach(value -> out.add(new ObservationId(value)));
    return out;
  }

  private static RecordKind recordKind(String label) {
    Optional<RecordKind> kind = RecordKind.fromLabel(label);
    return kind.orElseThrow(() -> new IllegalArgumentException("unknown record kind " + label));
  }
}
