package com.onthegomap.geojts.geo;

import static com.onthegomap.geojts.TestUtils.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.onthegomap.geojts.GeoJsonException;
import com.onthegomap.geojts.util.JsonMappers;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

class GeometryCodecTest {

  private final GeometryCodec codec = new GeometryCodec();

  private static JsonNode json(String text) throws JsonProcessingException {
    return JsonMappers.defaultMapper().readTree(text);
  }

  private static String text(JsonNode node) throws JsonProcessingException {
    return JsonMappers.defaultMapper().writeValueAsString(node);
  }

  private Geometry roundTrip(Geometry geometry) throws JsonProcessingException {
    return codec.decode(json(text(codec.encode(geometry))));
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "POINT(15 20)",
    "LINESTRING(0 0, 10 10, 20 25, 50 60)",
    "POLYGON((0 0,10 0,10 10,0 10,0 0),(5 5,7 5,7 7,5 7, 5 5))",
    "MULTIPOINT(0 0, 20 20, 60 60)",
    "MULTILINESTRING((10 10, 20 20), (15 15, 30 15))",
    "MULTIPOLYGON(((0 0,10 0,10 10,0 10,0 0)),((5 5,7 5,7 7,5 7, 5 5)))",
    "GEOMETRYCOLLECTION(POINT(10 10), POINT(30 30), LINESTRING(15 15, 20 20))",
    "LINEARRING(0 0, 1 0, 1 1, 0 0)",
    "POINT EMPTY",
    "LINESTRING EMPTY",
    "POLYGON EMPTY",
    "MULTIPOLYGON EMPTY",
    "GEOMETRYCOLLECTION EMPTY",
    "GEOMETRYCOLLECTION(MULTIPOINT(1 2, 3 4), GEOMETRYCOLLECTION(POINT(5 6)))",
  })
  void testRoundTrip(String wkt) throws JsonProcessingException {
    Geometry geometry = wkt(wkt);
    Geometry decoded = roundTrip(geometry);
    assertEquals(geometry, decoded);
    assertEquals(geometry.getGeometryType(), decoded.getGeometryType());
  }

  @Test
  void testEncodePoint() throws JsonProcessingException {
    assertEquals("{\"type\":\"Point\",\"coordinates\":[15,20]}", text(codec.encode(newPoint(15, 20))));
    assertEquals(newPoint(15, 20), codec.decode(json("{\"type\":\"Point\",\"coordinates\":[15,20]}")));
  }

  @Test
  void testPolygonWithHole() throws JsonProcessingException {
    Polygon polygon = newPolygon(
      newCoordinateList(0, 0, 10, 0, 10, 10, 0, 10, 0, 0),
      List.of(newCoordinateList(5, 5, 7, 5, 7, 7, 5, 7, 5, 5))
    );
    assertSameJson("""
      {
        "type": "Polygon",
        "coordinates": [
          [[0, 0], [10, 0], [10, 10], [0, 10], [0, 0]],
          [[5, 5], [7, 5], [7, 7], [5, 7], [5, 5]]
        ]
      }
      """, text(codec.encode(polygon)));
    Polygon decoded = assertInstanceOf(Polygon.class, roundTrip(polygon));
    assertEquals(1, decoded.getNumInteriorRing());
    assertEquals(polygon, decoded);
  }

  @Test
  void testGeometryCollectionKeepsOrder() throws JsonProcessingException {
    GeometryCollection collection = newGeometryCollection(
      newPoint(10, 10),
      newPoint(30, 30),
      newLineString(15, 15, 20, 20)
    );
    assertSameJson("""
      {
        "type": "GeometryCollection",
        "geometries": [
          {"type": "Point", "coordinates": [10, 10]},
          {"type": "Point", "coordinates": [30, 30]},
          {"type": "LineString", "coordinates": [[15, 15], [20, 20]]}
        ]
      }
      """, text(codec.encode(collection)));
    Geometry decoded = roundTrip(collection);
    assertEquals(3, decoded.getNumGeometries());
    assertEquals("Point", decoded.getGeometryN(0).getGeometryType());
    assertEquals("Point", decoded.getGeometryN(1).getGeometryType());
    assertEquals("LineString", decoded.getGeometryN(2).getGeometryType());
    assertEquals(collection, decoded);
  }

  @Test
  void testFractionalOrdinatesPassThrough() throws JsonProcessingException {
    assertEquals("{\"type\":\"Point\",\"coordinates\":[32.6,12.3]}", text(codec.encode(newPoint(32.6, 12.3))));
    Point decoded = (Point) codec.decode(json("{\"type\":\"Point\",\"coordinates\":[0.1,-179.99999999]}"));
    assertEquals(0.1, decoded.getX());
    assertEquals(-179.99999999, decoded.getY());
  }

  @Test
  void testNegativeZeroStaysDouble() throws JsonProcessingException {
    assertEquals("{\"type\":\"Point\",\"coordinates\":[-0.0,1]}", text(codec.encode(newPoint(-0d, 1))));
  }

  @ParameterizedTest
  @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
  void testNonFiniteOrdinateRejected(double value) {
    Point point = newPoint(value, 1);
    assertThrows(IllegalArgumentException.class, () -> codec.encode(point));
  }

  @Test
  void testZOrdinate() throws JsonProcessingException {
    Point point = newPoint(1, 2, 3);
    assertEquals("{\"type\":\"Point\",\"coordinates\":[1,2,3]}", text(codec.encode(point)));
    Point decoded = (Point) roundTrip(point);
    assertEquals(3, decoded.getCoordinate().getZ());

    var flat = new GeometryCodec(GeoUtils.JTS_FACTORY, 2, false);
    assertEquals("{\"type\":\"Point\",\"coordinates\":[1,2]}", text(flat.encode(point)));
  }

  @Test
  void testMixedArityPositions() throws JsonProcessingException {
    String input = "{\"type\":\"LineString\",\"coordinates\":[[0,0],[1,1,5]]}";
    LineString decoded = (LineString) codec.decode(json(input));
    assertTrue(Double.isNaN(decoded.getCoordinateN(0).getZ()));
    assertEquals(5, decoded.getCoordinateN(1).getZ());
    assertEquals(input, text(codec.encode(decoded)));
  }

  @Test
  void testEmptyGeometries() throws JsonProcessingException {
    assertEquals("{\"type\":\"Point\",\"coordinates\":[]}", text(codec.encode(GeoUtils.JTS_FACTORY.createPoint())));
    assertEquals("{\"type\":\"Polygon\",\"coordinates\":[]}",
      text(codec.encode(GeoUtils.JTS_FACTORY.createPolygon())));
    assertEquals("{\"type\":\"GeometryCollection\",\"geometries\":[]}",
      text(codec.encode(GeoUtils.JTS_FACTORY.createGeometryCollection())));
    assertTrue(codec.decode(json("{\"type\":\"LineString\",\"coordinates\":[]}")).isEmpty());
    assertTrue(codec.decode(json("{\"type\":\"Polygon\",\"coordinates\":[[]]}")).isEmpty());
  }

  @Test
  void testEmptyPointInsideMultiPoint() throws JsonProcessingException {
    Geometry decoded = codec.decode(json("{\"type\":\"MultiPoint\",\"coordinates\":[[1,2],[]]}"));
    assertEquals(2, decoded.getNumGeometries());
    assertTrue(decoded.getGeometryN(1).isEmpty());
  }

  @Test
  void testWriteBbox() throws JsonProcessingException {
    var withBbox = new GeometryCodec(GeoUtils.JTS_FACTORY, 3, true);
    assertEquals("{\"type\":\"LineString\",\"bbox\":[0,0,10,5],\"coordinates\":[[0,0],[10,5]]}",
      text(withBbox.encode(newLineString(0, 0, 10, 5))));
    assertFalse(withBbox.encode(GeoUtils.JTS_FACTORY.createPoint()).has(GeometryCodec.BBOX));
  }

  @Test
  void testBboxIgnoredOnDecode() throws JsonProcessingException {
    assertEquals(newPoint(1, 2),
      codec.decode(json("{\"type\":\"Point\",\"bbox\":[1,2,1,2],\"coordinates\":[1,2],\"extra\":true}")));
  }

  @Test
  void testDecodedGeometryUsesConfiguredFactory() throws JsonProcessingException {
    var mercator = new GeometryCodec(GeoUtils.factory(3857, false), 3, false);
    Geometry decoded = mercator.decode(json("{\"type\":\"Point\",\"coordinates\":[1,2]}"));
    assertEquals(3857, decoded.getSRID());
  }

  @Test
  void testDecodeExpectedClass() throws JsonProcessingException {
    JsonNode point = json("{\"type\":\"Point\",\"coordinates\":[1,2]}");
    assertEquals(newPoint(1, 2), codec.decode(point, JsonPointer.empty(), Point.class));
    assertEquals(newPoint(1, 2), codec.decode(point, JsonPointer.empty(), Geometry.class));
    assertGeoJsonError(GeoJsonException.Kind.UNKNOWN_GEOMETRY_TYPE, "/type",
      () -> codec.decode(point, JsonPointer.empty(), Polygon.class));

    JsonNode ring = json("{\"type\":\"LinearRing\",\"coordinates\":[[0,0],[1,0],[1,1],[0,0]]}");
    assertInstanceOf(LinearRing.class, codec.decode(ring, JsonPointer.empty(), LineString.class));
  }

  @Test
  void testUnknownType() throws JsonProcessingException {
    JsonNode node = json("{\"type\":\"NotAType\",\"coordinates\":[1,2]}");
    var error = assertGeoJsonError(GeoJsonException.Kind.UNKNOWN_GEOMETRY_TYPE, "/type", () -> codec.decode(node));
    assertTrue(error.getMessage().contains("NotAType"), error.getMessage());
  }

  @ParameterizedTest
  @CsvSource(delimiter = ';', textBlock = """
    UNKNOWN_GEOMETRY_TYPE; /type; {"coordinates": [1, 2]}
    UNKNOWN_GEOMETRY_TYPE; /type; {"type": 1, "coordinates": [1, 2]}
    UNKNOWN_GEOMETRY_TYPE; /type; {"type": "Feature", "coordinates": [1, 2]}
    UNKNOWN_GEOMETRY_TYPE; ''; [1, 2]
    MALFORMED_COORDINATES; /coordinates; {"type": "Point"}
    MALFORMED_COORDINATES; /coordinates; {"type": "Point", "coordinates": 1}
    MALFORMED_COORDINATES; /coordinates; {"type": "Point", "coordinates": [1]}
    MALFORMED_COORDINATES; /coordinates; {"type": "Point", "coordinates": [1, 2, 3, 4]}
    MALFORMED_COORDINATES; /coordinates/1; {"type": "Point", "coordinates": [1, "a"]}
    MALFORMED_COORDINATES; /coordinates/0; {"type": "Point", "coordinates": [null, 2]}
    MALFORMED_COORDINATES; /coordinates/0; {"type": "Point", "coordinates": [1e400, 2]}
    MALFORMED_COORDINATES; /coordinates/1/2; {"type": "LineString", "coordinates": [[0, 0], [1, 1, -1e400]]}
    MALFORMED_COORDINATES; /coordinates/0; {"type": "LineString", "coordinates": [1, 2]}
    MALFORMED_COORDINATES; /coordinates/1; {"type": "LineString", "coordinates": [[1, 2], []]}
    MALFORMED_COORDINATES; /coordinates; {"type": "LineString", "coordinates": [[0, 0]]}
    MALFORMED_COORDINATES; /coordinates; {"type": "Polygon", "coordinates": [[[0, 0], [1, 0], [1, 1], [0, 0.5]]]}
    MALFORMED_COORDINATES; /coordinates/0/0; {"type": "Polygon", "coordinates": [[0, 0]]}
    MALFORMED_COORDINATES; /coordinates/1/0/4; {"type": "MultiPolygon", "coordinates": [[[[0, 0], [1, 0], [1, 1], [0, 0]]], [[[0, 0], [1, 0], [1, 1], [0, 0], [1]]]]}
    MALFORMED_COORDINATES; /coordinates/0/0; {"type": "MultiLineString", "coordinates": [[0, 0]]}
    MALFORMED_COORDINATES; /geometries; {"type": "GeometryCollection"}
    MALFORMED_COORDINATES; /geometries; {"type": "GeometryCollection", "geometries": {}}
    UNKNOWN_GEOMETRY_TYPE; /geometries/1/type; {"type": "GeometryCollection", "geometries": [{"type": "Point", "coordinates": [1, 2]}, {"type": "Foo"}]}
    MALFORMED_COORDINATES; /geometries/0/geometries/0/coordinates/1; {"type": "GeometryCollection", "geometries": [{"type": "GeometryCollection", "geometries": [{"type": "Point", "coordinates": [1, true]}]}]}
    """)
  void testMalformedGeometry(GeoJsonException.Kind kind, String path, String input) throws JsonProcessingException {
    JsonNode node = json(input);
    assertGeoJsonError(kind, path, () -> codec.decode(node));
  }

  @Test
  void testRejectsInvalidOutputDimension() {
    assertThrows(IllegalArgumentException.class, () -> new GeometryCodec(GeoUtils.JTS_FACTORY, 4, false));
  }

  @Test
  void testTags() {
    assertEquals(
      List.of("Point", "LineString", "LinearRing", "Polygon", "MultiPoint", "MultiLineString", "MultiPolygon",
        "GeometryCollection"),
      List.copyOf(GeometryCodec.tags())
    );
  }
}
