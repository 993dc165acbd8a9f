package ca.gc.cra.netmap.infrastructure.store;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Streams a JSON document into maps, lists and scalars, and reads typed fields back out of it.
 * Missing or mistyped fields raise {@link IllegalArgumentException} naming the path.
 */
final class JsonTree {
  private final Map<String, Object> fields;
  private final String path;

  private JsonTree(Map<String, Object> fields, String path) {
    this.fields = fields;
    this.path = path;
  }

  /**
   * Reads one top-level JSON object.
   *
   * @param parser parser positioned before the document
   * @return root object
   * @throws IOException on malformed JSON
   */
  static JsonTree read(JsonParser parser) throws IOException {
    JsonToken token = parser.nextToken();
    if (token != JsonToken.START_OBJECT) {
      throw new IllegalArgumentException("document must be a JSON object (found " + token + ")");
    }
    Map<String, Object> root = readObject(parser);
    if (parser.nextToken() != null) {
      throw new IllegalArgumentException("document contains trailing content");
    }
    return new JsonTree(root, "$");
  }

  String string(String name) {
    Object value = fields.get(name);
    if (!(value instanceof String text)) {
      throw missing(name, "string");
    }
    return text;
  }

  Optional<String> optionalString(String name) {
    Object value = fields.get(name);
    if (value == null) {
      return Optional.empty();
    }
    if (!(value instanceof String text)) {
      throw missing(name, "string");
    }
    return Optional.of(text);
  }

  long number(String name) {
    Object value = fields.get(name);
    if (!(value instanceof Number number)) {
      throw missing(name, "number");
    }
    return number.longValue();
  }

  Optional<Long> optionalNumber(String name) {
    return fields.get(name) == null ? Optional.empty() : Optional.of(number(name));
  }

  double decimal(String name) {
    Object value = fields.get(name);
    if (!(value instanceof Number number)) {
      throw missing(name, "number");
    }
    return number.doubleValue();
  }

  JsonTree object(String name) {
    return optionalObject(name).orElseThrow(() -> missing(name, "object"));
  }

  @SuppressWarnings("unchecked")
  Optional<JsonTree> optionalObject(String name) {
    Object value = fields.get(name);
    if (value == null) {
      return Optional.empty();
    }
    if (!(value instanceof Map<?, ?> map)) {
      throw missing(name, "object");
    }
    return Optional.of(new JsonTree((Map<String, Object>) map, path + "." + name));
  }

  @SuppressWarnings("unchecked")
  List<JsonTree> objects(String name) {
    List<JsonTree> out = new ArrayList<>();
    int index = 0;
    for (Object item : list(name)) {
      if (!(item instanceof Map<?, ?> map)) {
        throw new IllegalArgumentException(path + "." + name + "[" + index + "] must be an object");
      }
      out.add(new JsonTree((Map<String, Object>) map, path + "." + name + "[" + index + "]"));
      index++;
    }
    return out;
  }

  List<String> strings(String name) {
    List<String> out = new ArrayList<>();
    for (Object item : list(name)) {
      if (!(item instanceof String text)) {
        throw new IllegalArgumentException(path + "." + name + " must hold strings");
      }
      out.add(text);
    }
    return out;
  }

  String path() {
    return path;
  }

  private List<?> list(String name) {
    Object value = fields.get(name);
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> items)) {
      throw missing(name, "array");
    }
    return items;
  }

  private IllegalArgumentException missing(String name, String type) {
    return new IllegalArgumentException(path + "." + name + " must be a " + type);
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IllegalArgumentException("unexpected end of document");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("unsupported JSON token " + token);
    };
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("expected field name but found " + token);
      }
      String name = parser.getCurrentName();
      map.put(name, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private static List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }
}
