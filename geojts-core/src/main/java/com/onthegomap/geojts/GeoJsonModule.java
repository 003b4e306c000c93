package com.onthegomap.geojts;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.module.SimpleSerializers;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.onthegomap.geojts.config.GeoJsonConfig;
import com.onthegomap.geojts.feature.Feature;
import com.onthegomap.geojts.feature.FeatureCodec;
import com.onthegomap.geojts.feature.FeatureCollection;
import com.onthegomap.geojts.feature.GeoJsonObject;
import com.onthegomap.geojts.feature.PropertyCodec;
import com.onthegomap.geojts.geo.GeometryCodec;
import java.io.IOException;
import java.util.List;
import org.locationtech.jts.geom.Geometry;

/**
 * Jackson module that binds JTS geometries, {@link Feature} and {@link FeatureCollection} to GeoJSON.
 * <p>
 * Feature properties are bound with the mapper this module is registered on, using the property type declared on the
 * target, for example {@code new TypeReference<Feature<Point, Animal>>() {}}. A raw {@code Feature} binds geometry to
 * {@link Geometry} and properties to plain maps and lists.
 */
public class GeoJsonModule extends SimpleModule {

  private final transient FeatureCodec features;

  public GeoJsonModule(GeoJsonConfig config) {
    super(GeoJsonModule.class.getSimpleName(), Version.unknownVersion());
    this.features = new FeatureCodec(new GeometryCodec(config));
  }

  public GeoJsonModule() {
    this(GeoJsonConfig.defaults());
  }

  @Override
  public void setupModule(SetupContext context) {
    super.setupModule(context);
    ObjectMapper owner = context.getOwner();
    context.addSerializers(new SimpleSerializers(List.<JsonSerializer<?>>of(
      new GeometrySerializer(features.geometries()),
      new GeoJsonObjectSerializer(features, owner)
    )));
    context.addDeserializers(new GeoJsonDeserializers(features, owner));
  }

  private static Class<? extends Geometry> geometryClass(JavaType type) {
    Class<?> raw = type.getRawClass();
    return Geometry.class.isAssignableFrom(raw) ? raw.asSubclass(Geometry.class) : Geometry.class;
  }

  static class GeometrySerializer extends StdSerializer<Geometry> {

    private final transient GeometryCodec geometries;

    GeometrySerializer(GeometryCodec geometries) {
      super(Geometry.class);
      this.geometries = geometries;
    }

    @Override
    public void serialize(Geometry value, JsonGenerator gen, SerializerProvider provider) throws IOException {
      geometries.encode(value).serialize(gen, provider);
    }
  }

  static class GeoJsonObjectSerializer extends StdSerializer<GeoJsonObject<?, ?>> {

    private final transient FeatureCodec features;
    private final transient PropertyCodec<Object> properties;

    GeoJsonObjectSerializer(FeatureCodec features, ObjectMapper owner) {
      super(GeoJsonObject.class, false);
      this.features = features;
      this.properties = PropertyCodec.of(owner, Object.class);
    }

    @Override
    public void serialize(GeoJsonObject<?, ?> value, JsonGenerator gen, SerializerProvider provider)
      throws IOException {
      features.encode(value, properties).serialize(gen, provider);
    }
  }

  static class GeometryDeserializer extends StdDeserializer<Geometry> {

    private final transient GeometryCodec geometries;
    private final Class<? extends Geometry> geometryClass;

    GeometryDeserializer(GeometryCodec geometries, Class<? extends Geometry> geometryClass) {
      super(geometryClass);
      this.geometries = geometries;
      this.geometryClass = geometryClass;
    }

    @Override
    public Geometry deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      JsonNode node = ctxt.readTree(p);
      return geometries.decode(node, JsonPointer.empty(), geometryClass);
    }
  }

  static class GeoJsonObjectDeserializer extends StdDeserializer<GeoJsonObject<?, ?>> {

    private final transient FeatureCodec features;
    private final Class<? extends Geometry> geometryClass;
    private final transient PropertyCodec<Object> properties;

    GeoJsonObjectDeserializer(FeatureCodec features, JavaType type, ObjectMapper owner) {
      super(type);
      this.features = features;
      this.geometryClass = geometryClass(type.containedTypeOrUnknown(0));
      this.properties = PropertyCodec.of(owner, type.containedTypeOrUnknown(1));
    }

    @Override
    public GeoJsonObject<?, ?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      JsonNode node = ctxt.readTree(p);
      Class<?> target = handledType();
      if (target == Feature.class) {
        return features.decodeFeature(node, geometryClass, properties);
      } else if (target == FeatureCollection.class) {
        return features.decodeFeatureCollection(node, geometryClass, properties);
      }
      return features.decodeObject(node, geometryClass, properties);
    }
  }

  private static class GeoJsonDeserializers extends Deserializers.Base {

    private final FeatureCodec features;
    private final ObjectMapper owner;

    GeoJsonDeserializers(FeatureCodec features, ObjectMapper owner) {
      this.features = features;
      this.owner = owner;
    }

    @Override
    public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config,
      BeanDescription beanDesc) {
      Class<?> raw = type.getRawClass();
      if (Geometry.class.isAssignableFrom(raw)) {
        return new GeometryDeserializer(features.geometries(), geometryClass(type));
      } else if (raw == Feature.class || raw == FeatureCollection.class || raw == GeoJsonObject.class) {
        return new GeoJsonObjectDeserializer(features, type, owner);
      }
      return null;
    }
  }
}
