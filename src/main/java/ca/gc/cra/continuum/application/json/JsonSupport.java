package ca.gc.cra.continuum.application.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming JSON helper that converts between JSON text and plain {@link Map}/{@link List} object graphs.
 *
 * <p>Parsing preserves key order; writing emits maps in iteration order so evidence records keep their declared
 * field order on the wire.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses the supplied JSON string into a mutable object graph of maps, lists, and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(String json) {
    return readDocument(json, (parser, first) -> first == null ? Map.of() : readValue(parser, first));
  }

  /**
   * Parses a JSON object.
   *
   * @param json JSON document whose root is an object
   * @return parsed ordered map
   * @throws IllegalArgumentException when parsing fails or the root is not an object
   */
  public Map<String, Object> parseObject(String json) {
    return readDocument(json, (parser, first) -> {
      if (first == null) {
        return new LinkedHashMap<String, Object>();
      }
      if (first != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("JSON document root must be an object");
      }
      return readObject(parser);
    });
  }

  /**
   * Serializes an object graph to compact JSON.
   *
   * @param value maps, lists, arrays, strings, numbers, booleans or {@code null}; other types use {@code toString}
   * @return JSON text
   */
  public String write(Object value) {
    return write(value, false);
  }

  /**
   * Serializes an object graph to JSON.
   *
   * @param value object graph
   * @param pretty whether to indent the output
   * @return JSON text
   */
  public String write(Object value, boolean pretty) {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      if (pretty) {
        generator.useDefaultPrettyPrinter();
      }
      writeValue(generator, value);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize JSON", ex);
    }
    return out.toString();
  }

  /**
   * Serializes an object graph to UTF-8 JSON bytes.
   *
   * @param value object graph
   * @return UTF-8 encoded JSON
   */
  public byte[] writeBytes(Object value) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(512);
    try (JsonGenerator generator = factory.createGenerator(out)) {
      writeValue(generator, value);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize JSON", ex);
    }
    return out.toByteArray();
  }

  private <T> T readDocument(String json, RootReader<T> root) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      T value = root.read(parser, parser.nextToken());
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
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

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
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

  private void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof Collection<?> collection) {
      generator.writeStartArray();
      for (Object item : collection) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else if (value instanceof Object[] array) {
      generator.writeStartArray();
      for (Object item : array) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else if (value instanceof Boolean bool) {
      generator.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof BigInteger big) {
      generator.writeNumber(big);
    } else if (value instanceof BigDecimal decimal) {
      generator.writeNumber(decimal);
    } else if (value instanceof Number number) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        generator.writeNull();
      } else {
        generator.writeNumber(d);
      }
    } else {
      generator.writeString(value.toString());
    }
  }

  @FunctionalInterface
  private interface RootReader<T> {
    T read(JsonParser parser, JsonToken first) throws IOException;
  }
}
