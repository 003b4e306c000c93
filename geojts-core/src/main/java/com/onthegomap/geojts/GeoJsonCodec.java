package com.onthegomap.geojts;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.onthegomap.geojts.config.GeoJsonConfig;
import com.onthegomap.geojts.feature.Feature;
import com.onthegomap.geojts.feature.FeatureCodec;
import com.onthegomap.geojts.feature.FeatureCollection;
import com.onthegomap.geojts.feature.GeoJsonObject;
import com.onthegomap.geojts.feature.PropertyCodec;
import com.onthegomap.geojts.geo.GeometryCodec;
import com.onthegomap.geojts.util.JsonMappers;
import java.io.UncheckedIOException;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes geometries and features to GeoJSON text and decodes them back.
 * <p>
 * Instances are immutable and safe to share between threads. For example:
 * <pre>{@code
 * GeoJsonCodec codec = GeoJsonCodec.create();
 * String json = codec.encode(point);
 * Point decoded = codec.decode(json, Point.class);
 * }</pre>
 */
public class GeoJsonCodec {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeoJsonCodec.class);

  private final GeoJsonConfig config;
  private final GeometryCodec geometries;
  private final FeatureCodec features;
  private final JsonMapper mapper;
  private final ObjectWriter writer;

  private GeoJsonCodec(GeoJsonConfig config) {
    this.config = config;
    this.geometries = new GeometryCodec(config);
    this.features = new FeatureCodec(geometries);
    this.mapper = JsonMappers.newBaseBuilder().addModule(new GeoJsonModule(config)).build();
    this.writer = config.pretty() ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
  }

  /** Returns a codec with the default configuration. */
  public static GeoJsonCodec create() {
    return create(GeoJsonConfig.defaults());
  }

  public static GeoJsonCodec create(GeoJsonConfig config) {
    return new GeoJsonCodec(config);
  }

  public GeoJsonConfig config() {
    return config;
  }

  public GeometryCodec geometries() {
    return geometries;
  }

  public FeatureCodec features() {
    return features;
  }

  /** Returns a mapper with {@link GeoJsonModule} registered that binds JTS geometries and features directly. */
  public ObjectMapper mapper() {
    return mapper;
  }

  /* Geometries */

  /**
   * Returns the GeoJSON text for {@code geometry}.
   *
   * @throws IllegalArgumentException if an ordinate is NaN or infinite
   */
  public String encode(Geometry geometry) {
    return write(geometries.encode(geometry));
  }

  /**
   * Returns the geometry that {@code json} represents.
   *
   * @throws GeoJsonException if {@code json} is not a valid GeoJSON geometry
   */
  public Geometry decode(String json) throws GeoJsonException {
    return geometries.decode(parse(json));
  }

  /**
   * Returns the geometry that {@code json} represents, which must be a {@code geometryClass}.
   *
   * @throws GeoJsonException if {@code json} is not a valid GeoJSON geometry of the requested kind
   */
  public <G extends Geometry> G decode(String json, Class<G> geometryClass) throws GeoJsonException {
    return geometries.decode(parse(json), JsonPointer.empty(), geometryClass);
  }

  /* Features */

  public <G extends Geometry, P> String encodeFeature(Feature<G, P> feature, PropertyCodec<? super P> properties) {
    return write(features.encode(feature, properties));
  }

  public <G extends Geometry, P> Feature<G, P> decodeFeature(String json, Class<G> geometryClass,
    PropertyCodec<P> properties) throws GeoJsonException {
    return features.decodeFeature(parse(json), geometryClass, properties);
  }

  public <G extends Geometry, P> String encodeFeatureCollection(FeatureCollection<G, P> collection,
    PropertyCodec<? super P> properties) {
    return write(features.encode(collection, properties));
  }

  public <G extends Geometry, P> FeatureCollection<G, P> decodeFeatureCollection(String json,
    Class<G> geometryClass, PropertyCodec<P> properties) throws GeoJsonException {
    FeatureCollection<G, P> result = features.decodeFeatureCollection(parse(json), geometryClass, properties);
    LOGGER.debug("Decoded {} features", result.size());
    return result;
  }

  /** Returns the {@code Feature} or {@code FeatureCollection} that {@code json} represents. */
  public <G extends Geometry, P> GeoJsonObject<G, P> decodeObject(String json, Class<G> geometryClass,
    PropertyCodec<P> properties) throws GeoJsonException {
    return features.decodeObject(parse(json), geometryClass, properties);
  }

  /** Returns a property codec that binds properties to {@code type} with this codec's mapper. */
  public <P> PropertyCodec<P> properties(Class<P> type) {
    return PropertyCodec.of(mapper, type);
  }

  private JsonNode parse(String json) throws GeoJsonException {
    JsonNode result;
    try {
      result = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      JsonLocation location = e.getLocation();
      String where = location == null ? "" : " at line " + location.getLineNr() + " column " + location.getColumnNr();
      throw new GeoJsonException(GeoJsonException.Kind.MALFORMED_JSON, JsonPointer.empty(),
        "Invalid JSON" + where + ": " + e.getOriginalMessage(), e);
    }
    if (result == null || result.isMissingNode()) {
      throw new GeoJsonException(GeoJsonException.Kind.MALFORMED_JSON, JsonPointer.empty(), "No JSON content");
    }
    return result;
  }

  private String write(JsonNode node) {
    try {
      return writer.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }
}
