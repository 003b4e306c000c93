package com.onthegomap.geojts.feature;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onthegomap.geojts.util.JsonMappers;
import java.io.IOException;
import java.util.Map;

/**
 * Converts the {@code properties} member of a feature to and from a caller-defined type.
 * <p>
 * Features never look inside their properties, so the same envelope code serves any property schema through an
 * implementation of this interface. Neither method is called for absent properties.
 *
 * @param <P> type of the properties
 */
public interface PropertyCodec<P> {

  /**
   * Returns the JSON representation of {@code properties}.
   *
   * @throws IllegalArgumentException if {@code properties} cannot be represented
   */
  JsonNode encode(P properties);

  /**
   * Returns the properties represented by {@code node}.
   *
   * @throws IOException if {@code node} cannot be interpreted
   */
  P decode(JsonNode node) throws IOException;

  /** Returns a codec that binds properties to {@code type} with Jackson databind. */
  static <P> PropertyCodec<P> of(ObjectMapper mapper, Class<P> type) {
    return of(mapper, mapper.constructType(type));
  }

  /** Returns a codec that binds properties to the generic {@code type} with Jackson databind. */
  static <P> PropertyCodec<P> of(ObjectMapper mapper, TypeReference<P> type) {
    return of(mapper, mapper.constructType(type));
  }

  /** Returns a codec that binds properties to {@code type} with Jackson databind. */
  static <P> PropertyCodec<P> of(ObjectMapper mapper, JavaType type) {
    return new PropertyCodec<>() {
      @Override
      public JsonNode encode(P properties) {
        return mapper.valueToTree(properties);
      }

      @Override
      public P decode(JsonNode node) throws IOException {
        return mapper.treeToValue(node, type);
      }

      @Override
      public String toString() {
        return "PropertyCodec[" + type + "]";
      }
    };
  }

  /** Shorthand for {@link #of(ObjectMapper, Class)} using the default mapper. */
  static <P> PropertyCodec<P> of(Class<P> type) {
    return of(JsonMappers.defaultMapper(), type);
  }

  /** Returns a codec for free-form properties as a map from key to plain Java values. */
  static PropertyCodec<Map<String, Object>> map() {
    return of(JsonMappers.defaultMapper(), new TypeReference<Map<String, Object>>() {});
  }

  /** Returns a codec that passes the properties node through unchanged. */
  static PropertyCodec<JsonNode> tree() {
    return new PropertyCodec<>() {
      @Override
      public JsonNode encode(JsonNode properties) {
        return properties;
      }

      @Override
      public JsonNode decode(JsonNode node) {
        return node;
      }
    };
  }
}
