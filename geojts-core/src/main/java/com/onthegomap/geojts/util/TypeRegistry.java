package com.onthegomap.geojts.util;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.onthegomap.geojts.GeoJsonException;
import java.util.Set;

/**
 * An immutable mapping from the {@code type} tag of a GeoJSON object to the routine that decodes it.
 * <p>
 * The tag is read before any other member so that decoding fails fast on unknown objects. The node handed on to the
 * routine still contains the tag.
 *
 * @param <T> type of the decode routine
 */
public final class TypeRegistry<T> {

  /** Name of the member that holds the tag. */
  public static final String TYPE = "type";

  private final ImmutableMap<String, T> routines;
  private final GeoJsonException.Kind unknownKind;
  private final String description;

  private TypeRegistry(ImmutableMap<String, T> routines, GeoJsonException.Kind unknownKind, String description) {
    this.routines = routines;
    this.unknownKind = unknownKind;
    this.description = description;
  }

  /**
   * Returns a builder for a new registry.
   *
   * @param unknownKind error kind to report for missing or unrecognized tags
   * @param description what the registered objects are, used in error messages
   */
  public static <T> Builder<T> builder(GeoJsonException.Kind unknownKind, String description) {
    return new Builder<>(unknownKind, description);
  }

  /**
   * Returns the recognized tag of {@code node}.
   *
   * @throws GeoJsonException if {@code node} is not an object, has no textual tag, or the tag is not registered
   */
  public String tag(JsonNode node, JsonPointer path) throws GeoJsonException {
    if (node == null || !node.isObject()) {
      throw new GeoJsonException(unknownKind, path,
        "Expected " + description + " object but got " + (node == null ? "nothing" : node.getNodeType()));
    }
    JsonNode tag = node.get(TYPE);
    if (tag == null || !tag.isTextual()) {
      throw new GeoJsonException(unknownKind, path.appendProperty(TYPE), "Missing " + description + " type");
    }
    String result = tag.textValue();
    if (!routines.containsKey(result)) {
      throw new GeoJsonException(unknownKind, path.appendProperty(TYPE),
        "Unknown " + description + " type '" + result + "', expected one of " + routines.keySet());
    }
    return result;
  }

  /**
   * Returns the routine registered for the tag of {@code node}.
   *
   * @throws GeoJsonException if the tag is missing or unknown
   */
  public T resolve(JsonNode node, JsonPointer path) throws GeoJsonException {
    return routines.get(tag(node, path));
  }

  /** Returns the recognized tags in registration order. */
  public Set<String> tags() {
    return routines.keySet();
  }

  public static final class Builder<T> {

    private final ImmutableMap.Builder<String, T> routines = ImmutableMap.builder();
    private final GeoJsonException.Kind unknownKind;
    private final String description;

    private Builder(GeoJsonException.Kind unknownKind, String description) {
      this.unknownKind = unknownKind;
      this.description = description;
    }

    public Builder<T> put(String tag, T routine) {
      routines.put(tag, routine);
      return this;
    }

    /**
     * @throws IllegalArgumentException if the same tag was registered twice
     */
    public TypeRegistry<T> build() {
      return new TypeRegistry<>(routines.buildOrThrow(), unknownKind, description);
    }
  }
}
