package io.netguard.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper over Jackson streaming: parses documents into {@link Map}/{@link List} graphs and renders
 * single-line documents through a {@link JsonGenerator} callback.
 *
 * @since 0.1.0
 */
final class JsonSupport {
  private static final JsonFactory FACTORY = new JsonFactory();

  private JsonSupport() {}

  /** Writes one JSON document with a generator. */
  @FunctionalInterface
  interface Writer {
    void write(JsonGenerator gen) throws IOException;
  }

  /**
   * Renders a compact single-line JSON document.
   *
   * @param writer callback emitting exactly one value
   * @return JSON text without a trailing newline
   */
  static String render(Writer writer) {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      writer.write(gen);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON", ex);
    }
    return out.toString();
  }

  /**
   * Parses a JSON object.
   *
   * @param json document text
   * @return mutable map graph
   * @throws IllegalArgumentException when the text is not a single JSON object
   */
  @SuppressWarnings("unchecked")
  static Map<String, Object> parseObject(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = FACTORY.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("Expected JSON object but found " + token);
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return (Map<String, Object>) value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  static String string(Map<String, Object> map, String field) {
    Object value = map.get(field);
    if (value == null) {
      throw new IllegalArgumentException("Missing field " + field);
    }
    return value.toString();
  }

  static String optString(Map<String, Object> map, String field, String fallback) {
    Object value = map.get(field);
    return value == null ? fallback : value.toString();
  }

  static long longValue(Map<String, Object> map, String field, long fallback) {
    Object value = map.get(field);
    return value instanceof Number n ? n.longValue() : fallback;
  }

  static double doubleValue(Map<String, Object> map, String field, double fallback) {
    Object value = map.get(field);
    return value instanceof Number n ? n.doubleValue() : fallback;
  }

  static boolean bool(Map<String, Object> map, String field, boolean fallback) {
    Object value = map.get(field);
    return value instanceof Boolean b ? b : fallback;
  }

  static Instant instant(Map<String, Object> map, String field) {
    Object value = map.get(field);
    if (value == null) {
      return null;
    }
    try {
      return Instant.parse(value.toString());
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("Invalid timestamp in field " + field + ": " + value, ex);
    }
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> object(Map<String, Object> map, String field) {
    Object value = map.get(field);
    if (value instanceof Map<?, ?> m) {
      return (Map<String, Object>) m;
    }
    throw new IllegalArgumentException("Missing object field " + field);
  }

  static List<Object> array(Map<String, Object> map, String field) {
    Object value = map.get(field);
    if (value instanceof List<?> list) {
      return new ArrayList<>(list);
    }
    return List.of();
  }

  static void writeInstant(JsonGenerator gen, String field, Instant value) throws IOException {
    if (value == null) {
      gen.writeNullField(field);
    } else {
      gen.writeStringField(field, value.toString());
    }
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private static List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
