package com.onthegomap.geojts.feature;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.onthegomap.geojts.GeoJsonException;
import com.onthegomap.geojts.geo.GeometryCodec;
import com.onthegomap.geojts.util.TypeRegistry;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@link Feature} and {@link FeatureCollection} envelopes to and from GeoJSON objects represented as Jackson
 * nodes.
 * <p>
 * Geometries are delegated to a {@link GeometryCodec} and properties to a caller-supplied {@link PropertyCodec}.
 * Features are written with members in the order {@code type}, {@code id}, {@code geometry}, {@code properties}. A
 * missing geometry or properties is written as {@code null}, a missing id is left out.
 */
public class FeatureCodec {

  public static final String ID = "id";
  public static final String GEOMETRY = "geometry";
  public static final String PROPERTIES = "properties";
  public static final String FEATURES = "features";

  private static final Logger LOGGER = LoggerFactory.getLogger(FeatureCodec.class);
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private static final TypeRegistry<EnvelopeReader> READERS =
    TypeRegistry.<EnvelopeReader>builder(GeoJsonException.Kind.UNKNOWN_ENVELOPE_TYPE, "GeoJSON")
      .put(Feature.TYPE, (codec, node, path, geometryClass, properties) ->
        codec.readFeature(node, path, geometryClass, properties))
      .put(FeatureCollection.TYPE, (codec, node, path, geometryClass, properties) ->
        codec.readCollection(node, path, geometryClass, properties))
      .build();

  private final GeometryCodec geometries;

  public FeatureCodec(GeometryCodec geometries) {
    this.geometries = geometries;
  }

  public FeatureCodec() {
    this(new GeometryCodec());
  }

  /** Returns the tags of every envelope this codec can decode. */
  public static Set<String> tags() {
    return READERS.tags();
  }

  public GeometryCodec geometries() {
    return geometries;
  }

  /* Encoding */

  /** Returns the GeoJSON object for {@code feature} with properties encoded by {@code properties}. */
  public <G extends Geometry, P> ObjectNode encode(Feature<G, P> feature, PropertyCodec<? super P> properties) {
    ObjectNode result = NODES.objectNode();
    result.put(TypeRegistry.TYPE, Feature.TYPE);
    if (geometries.writeBbox() && feature.hasGeometry()) {
      geometries.putBbox(result, feature.geometry());
    }
    Object id = feature.id();
    if (id instanceof String string) {
      result.put(ID, string);
    } else if (id instanceof Long value) {
      result.put(ID, value);
    } else if (id instanceof Double value) {
      result.put(ID, value);
    } else if (id instanceof BigInteger value) {
      result.put(ID, value);
    } else if (id instanceof BigDecimal value) {
      result.put(ID, value);
    } else if (id instanceof Number value) {
      result.put(ID, value.doubleValue());
    }
    result.set(GEOMETRY, feature.hasGeometry() ? geometries.encode(feature.geometry()) : NODES.nullNode());
    JsonNode propertiesNode = feature.properties() == null ? null : properties.encode(feature.properties());
    result.set(PROPERTIES, propertiesNode == null ? NODES.nullNode() : propertiesNode);
    return result;
  }

  /** Returns the GeoJSON object for {@code collection} with properties encoded by {@code properties}. */
  public <G extends Geometry, P> ObjectNode encode(FeatureCollection<G, P> collection,
    PropertyCodec<? super P> properties) {
    ObjectNode result = NODES.objectNode();
    result.put(TypeRegistry.TYPE, FeatureCollection.TYPE);
    if (geometries.writeBbox()) {
      putBbox(result, collection);
    }
    ArrayNode features = result.putArray(FEATURES);
    for (Feature<G, P> feature : collection) {
      features.add(encode(feature, properties));
    }
    return result;
  }

  /** Returns the GeoJSON object for either kind of envelope. */
  public <G extends Geometry, P> ObjectNode encode(GeoJsonObject<G, P> object, PropertyCodec<? super P> properties) {
    if (object instanceof Feature<G, P> feature) {
      return encode(feature, properties);
    } else if (object instanceof FeatureCollection<G, P> collection) {
      return encode(collection, properties);
    }
    throw new IllegalArgumentException("Unsupported GeoJSON object: " + object);
  }

  private void putBbox(ObjectNode node, FeatureCollection<?, ?> collection) {
    Envelope envelope = new Envelope();
    for (var feature : collection) {
      if (feature.hasGeometry()) {
        envelope.expandToInclude(feature.geometry().getEnvelopeInternal());
      }
    }
    if (!envelope.isNull()) {
      geometries.putBbox(node, geometries.factory().toGeometry(envelope));
    }
  }

  /* Decoding */

  /**
   * Returns the feature or feature collection that {@code node} represents.
   *
   * @param node          the GeoJSON object
   * @param geometryClass type every feature geometry must have
   * @param properties    decodes the properties of each feature
   * @throws GeoJsonException if {@code node} is not a valid {@code Feature} or {@code FeatureCollection}
   */
  @SuppressWarnings("unchecked")
  public <G extends Geometry, P> GeoJsonObject<G, P> decodeObject(JsonNode node, Class<G> geometryClass,
    PropertyCodec<P> properties) throws GeoJsonException {
    JsonPointer path = JsonPointer.empty();
    return (GeoJsonObject<G, P>) READERS.resolve(node, path).read(this, node, path, geometryClass, properties);
  }

  /**
   * Returns the feature that {@code node} represents.
   *
   * @throws GeoJsonException with {@link GeoJsonException.Kind#UNKNOWN_ENVELOPE_TYPE} if {@code node} is not a
   *                          {@code Feature}, or any error from decoding its members
   */
  public <G extends Geometry, P> Feature<G, P> decodeFeature(JsonNode node, Class<G> geometryClass,
    PropertyCodec<P> properties) throws GeoJsonException {
    return decodeFeature(node, JsonPointer.empty(), geometryClass, properties);
  }

  /** Returns the feature that {@code node} represents, reporting errors relative to {@code path}. */
  public <G extends Geometry, P> Feature<G, P> decodeFeature(JsonNode node, JsonPointer path, Class<G> geometryClass,
    PropertyCodec<P> properties) throws GeoJsonException {
    expect(Feature.TYPE, node, path);
    return readFeature(node, path, geometryClass, properties);
  }

  /**
   * Returns the feature collection that {@code node} represents.
   *
   * @throws GeoJsonException with {@link GeoJsonException.Kind#UNKNOWN_ENVELOPE_TYPE} if {@code node} is not a
   *                          {@code FeatureCollection}, {@link GeoJsonException.Kind#MISSING_FEATURES_ARRAY} if it has
   *                          no {@code features} array, or any error from decoding a feature
   */
  public <G extends Geometry, P> FeatureCollection<G, P> decodeFeatureCollection(JsonNode node,
    Class<G> geometryClass, PropertyCodec<P> properties) throws GeoJsonException {
    JsonPointer path = JsonPointer.empty();
    expect(FeatureCollection.TYPE, node, path);
    return readCollection(node, path, geometryClass, properties);
  }

  private static void expect(String expected, JsonNode node, JsonPointer path) throws GeoJsonException {
    String actual = READERS.tag(node, path);
    if (!expected.equals(actual)) {
      throw new GeoJsonException(GeoJsonException.Kind.UNKNOWN_ENVELOPE_TYPE, path.appendProperty(TypeRegistry.TYPE),
        "Expected " + expected + " but got " + actual);
    }
  }

  private <G extends Geometry, P> Feature<G, P> readFeature(JsonNode node, JsonPointer path, Class<G> geometryClass,
    PropertyCodec<P> properties) throws GeoJsonException {
    Object id = readId(node.get(ID), path.appendProperty(ID));
    G geometry = null;
    JsonNode geometryNode = node.get(GEOMETRY);
    if (geometryNode != null && !geometryNode.isNull()) {
      geometry = geometries.decode(geometryNode, path.appendProperty(GEOMETRY), geometryClass);
    }
    P props = null;
    JsonNode propertiesNode = node.get(PROPERTIES);
    if (propertiesNode != null && !propertiesNode.isNull()) {
      props = readProperties(propertiesNode, path.appendProperty(PROPERTIES), properties);
    }
    return new Feature<>(id, geometry, props);
  }

  private static <P> P readProperties(JsonNode node, JsonPointer path, PropertyCodec<P> properties)
    throws GeoJsonException {
    try {
      return properties.decode(node);
    } catch (IOException | RuntimeException e) {
      throw new GeoJsonException(GeoJsonException.Kind.PROPERTY_DECODE_ERROR, path,
        "Unable to decode properties with " + properties + ": " + e.getMessage(), e);
    }
  }

  private static Object readId(JsonNode node, JsonPointer path) throws GeoJsonException {
    if (node == null || node.isNull()) {
      return null;
    } else if (node.isTextual()) {
      return node.textValue();
    } else if (node.isIntegralNumber()) {
      return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
    } else if (node.isBigDecimal()) {
      return node.decimalValue();
    } else if (node.isNumber()) {
      return node.doubleValue();
    }
    throw new GeoJsonException(GeoJsonException.Kind.MALFORMED_ID, path,
      "Feature id must be a string or number but got " + node.getNodeType());
  }

  private <G extends Geometry, P> FeatureCollection<G, P> readCollection(JsonNode node, JsonPointer path,
    Class<G> geometryClass, PropertyCodec<P> properties) throws GeoJsonException {
    JsonNode featuresNode = node.get(FEATURES);
    JsonPointer featuresPath = path.appendProperty(FEATURES);
    if (featuresNode == null || !featuresNode.isArray()) {
      throw new GeoJsonException(GeoJsonException.Kind.MISSING_FEATURES_ARRAY, featuresPath,
        "FeatureCollection must have a features array");
    }
    List<Feature<G, P>> features = new ArrayList<>(featuresNode.size());
    for (int i = 0; i < featuresNode.size(); i++) {
      features.add(decodeFeature(featuresNode.get(i), featuresPath.appendIndex(i), geometryClass, properties));
    }
    LOGGER.trace("Decoded FeatureCollection with {} features", features.size());
    return new FeatureCollection<>(features);
  }

  @FunctionalInterface
  private interface EnvelopeReader {
    GeoJsonObject<?, ?> read(FeatureCodec codec, JsonNode node, JsonPointer path,
      Class<? extends Geometry> geometryClass, PropertyCodec<?> properties) throws GeoJsonException;
  }
}
