package io.intellixity.classql.render;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.intellixity.classql.result.ResultRow;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON writers used for rendering: compact, and pretty with two-space indentation,
 * one element per line and {@code "key": value} separators.
 */
final class RenderJson {
  private final ObjectWriter compact;
  private final ObjectWriter pretty;

  RenderJson(ObjectMapper mapper) {
    Objects.requireNonNull(mapper, "mapper");
    this.compact = mapper.writer().without(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    this.pretty = compact.with(new TwoSpacePrettyPrinter());
  }

  /** Mapper used when the caller supplies none: java.time values are written as ISO strings. */
  static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
  }

  String compact(Object value) {
    return write(compact, value);
  }

  /** Serialized form of one cell value, or its string form when the mapper cannot write it. */
  String cellText(Object value) {
    try {
      return compact.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      return String.valueOf(value);
    }
  }

  String pretty(Object value) {
    return write(pretty, value);
  }

  // Values the mapper rejects are retried with unsupported leaves replaced by their string form.
  private static String write(ObjectWriter writer, Object value) {
    try {
      return writer.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      try {
        return writer.writeValueAsString(plain(value));
      } catch (JsonProcessingException again) {
        again.addSuppressed(e);
        throw new IllegalStateException("Failed to serialize render value of type "
            + (value == null ? "null" : value.getClass().getName()), again);
      }
    }
  }

  static Object plain(Object value) {
    if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
      return value;
    }
    if (value instanceof ResultRow row) return plain(row.asMap());
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : map.entrySet()) out.put(String.valueOf(e.getKey()), plain(e.getValue()));
      return out;
    }
    if (value instanceof Iterable<?> items) {
      List<Object> out = new ArrayList<>();
      for (Object item : items) out.add(plain(item));
      return out;
    }
    return String.valueOf(value);
  }

  static final class TwoSpacePrettyPrinter extends DefaultPrettyPrinter {
    TwoSpacePrettyPrinter() {
      DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
      indentObjectsWith(indenter);
      indentArraysWith(indenter);
    }

    private TwoSpacePrettyPrinter(TwoSpacePrettyPrinter base) {
      super(base);
    }

    @Override
    public DefaultPrettyPrinter createInstance() {
      return new TwoSpacePrettyPrinter(this);
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
      g.writeRaw(": ");
    }
  }
}
