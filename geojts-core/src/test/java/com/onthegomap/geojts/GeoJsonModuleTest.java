package com.onthegomap.geojts;

import static com.onthegomap.geojts.TestUtils.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.onthegomap.geojts.feature.Feature;
import com.onthegomap.geojts.feature.FeatureCollection;
import com.onthegomap.geojts.feature.GeoJsonObject;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

class GeoJsonModuleTest {

  record Animal(String name, int age) {}

  record Place(String name, Point location) {}

  private final JsonMapper mapper = JsonMapper.builder().addModule(new GeoJsonModule()).build();

  @Test
  void testGeometry() throws JsonProcessingException {
    String json = mapper.writeValueAsString(newLineString(0, 0, 1.5, 2));
    assertEquals("{\"type\":\"LineString\",\"coordinates\":[[0,0],[1.5,2]]}", json);
    assertEquals(newLineString(0, 0, 1.5, 2), mapper.readValue(json, LineString.class));
    assertEquals(newLineString(0, 0, 1.5, 2), mapper.readValue(json, Geometry.class));
  }

  @Test
  void testGeometryOfWrongClass() {
    var error = assertThrows(GeoJsonException.class,
      () -> mapper.readValue("{\"type\":\"Point\",\"coordinates\":[1,2]}", Polygon.class));
    assertEquals(GeoJsonException.Kind.UNKNOWN_GEOMETRY_TYPE, error.kind());
  }

  @Test
  void testMalformedGeometry() {
    var error = assertThrows(GeoJsonException.class,
      () -> mapper.readValue("{\"type\":\"Point\",\"coordinates\":[1]}", Point.class));
    assertEquals(GeoJsonException.Kind.MALFORMED_COORDINATES, error.kind());
    assertEquals("/coordinates", error.path().toString());
  }

  @Test
  void testGeometryInsideBean() throws JsonProcessingException {
    var place = new Place("home", newPoint(1, 2));
    String json = mapper.writeValueAsString(place);
    assertSameJson("{\"name\": \"home\", \"location\": {\"type\": \"Point\", \"coordinates\": [1, 2]}}", json);
    assertEquals(place, mapper.readValue(json, Place.class));
    assertNull(mapper.readValue("{\"name\": \"nowhere\", \"location\": null}", Place.class).location());
  }

  @Test
  void testErrorInsideBeanKeepsKind() {
    var error = assertThrows(GeoJsonException.class, () -> mapper.readValue(
      "{\"name\": \"home\", \"location\": {\"type\": \"LineString\", \"coordinates\": [[1, 2], [3, 4]]}}",
      Place.class));
    assertEquals(GeoJsonException.Kind.UNKNOWN_GEOMETRY_TYPE, error.kind());
  }

  @Test
  void testTypedFeature() throws JsonProcessingException {
    var feature = new Feature<>("brutus", newPoint(32.6, 12.3), new Animal("Brutus", 4));
    String json = mapper.writeValueAsString(feature);
    assertSameJson("""
      {
        "type": "Feature",
        "id": "brutus",
        "geometry": {"type": "Point", "coordinates": [32.6, 12.3]},
        "properties": {"name": "Brutus", "age": 4}
      }
      """, json);
    Feature<Point, Animal> decoded = mapper.readValue(json, new TypeReference<>() {});
    assertEquals(feature, decoded);
    assertEquals("Brutus", decoded.properties().name());
  }

  @Test
  void testTypedFeatureCollection() throws JsonProcessingException {
    var collection = FeatureCollection.of(
      new Feature<>(newPoint(32.6, 12.3), new Animal("Brutus", 4)),
      new Feature<>(newPoint(45.1, 19.8), new Animal("Tweety", 2))
    );
    String json = mapper.writeValueAsString(collection);
    FeatureCollection<Point, Animal> decoded = mapper.readValue(json, new TypeReference<>() {});
    assertEquals(collection, decoded);
  }

  @Test
  void testRawFeatureUsesPlainProperties() throws JsonProcessingException {
    Feature<?, ?> decoded = mapper.readValue("""
      {"type": "Feature", "geometry": {"type": "Point", "coordinates": [1, 2]}, "properties": {"a": [1, 2]}}
      """, Feature.class);
    assertEquals(newPoint(1, 2), decoded.geometry());
    assertEquals(Map.of("a", List.of(1, 2)), decoded.properties());
  }

  @Test
  void testGeoJsonObject() throws JsonProcessingException {
    GeoJsonObject<Geometry, Animal> decoded = mapper.readValue("""
      {"type": "FeatureCollection", "features": [{"type": "Feature", "properties": {"name": "Tweety", "age": 2}}]}
      """, new TypeReference<>() {});
    var collection = assertInstanceOf(FeatureCollection.class, decoded);
    assertEquals(new Feature<Geometry, Animal>(null, new Animal("Tweety", 2)), collection.get(0));
  }

  @Test
  void testFeatureGeometryClassChecked() {
    var error = assertThrows(GeoJsonException.class, () -> mapper.readValue("""
      {"type": "Feature", "geometry": {"type": "LineString", "coordinates": [[1, 2], [3, 4]]}}
      """, new TypeReference<Feature<Point, Animal>>() {}));
    assertEquals(GeoJsonException.Kind.UNKNOWN_GEOMETRY_TYPE, error.kind());
    assertEquals("/geometry/type", error.path().toString());
  }

  @Test
  void testFeaturePropertyError() {
    var error = assertThrows(GeoJsonException.class, () -> mapper.readValue("""
      {"type": "Feature", "properties": {"name": "Brutus", "age": "four"}}
      """, new TypeReference<Feature<Point, Animal>>() {}));
    assertEquals(GeoJsonException.Kind.PROPERTY_DECODE_ERROR, error.kind());
  }
}
