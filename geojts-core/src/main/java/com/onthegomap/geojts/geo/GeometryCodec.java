package com.onthegomap.geojts.geo;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.onthegomap.geojts.GeoJsonException;
import com.onthegomap.geojts.config.GeoJsonConfig;
import com.onthegomap.geojts.util.TypeRegistry;
import java.util.Set;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/**
 * Converts JTS geometries to and from GeoJSON geometry objects represented as Jackson nodes.
 * <p>
 * The {@code coordinates} member is shaped according to {@link GeoJsonGeometryType}. Ordinates pass through as
 * doubles without rounding. Instances hold only immutable configuration and can be shared between threads.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7946#section-3.1">RFC 7946 section 3.1</a>
 */
public class GeometryCodec {

  public static final String COORDINATES = "coordinates";
  public static final String GEOMETRIES = "geometries";
  public static final String BBOX = "bbox";

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
  /** Doubles with a smaller magnitude than this are exact longs. */
  private static final double MAX_EXACT_LONG = 0x1p53;

  private static final TypeRegistry<GeometryReader> READERS = buildReaders();

  private final GeometryFactory factory;
  private final int outputDimension;
  private final boolean writeBbox;

  /**
   * @param factory         factory used to construct decoded geometries
   * @param outputDimension maximum number of ordinates to write per position, 2 or 3
   * @param writeBbox       whether to write a {@code bbox} member on non-empty geometries
   */
  public GeometryCodec(GeometryFactory factory, int outputDimension, boolean writeBbox) {
    if (outputDimension < GeoJsonGeometryType.MIN_ARITY || outputDimension > GeoJsonGeometryType.MAX_ARITY) {
      throw new IllegalArgumentException("outputDimension must be 2 or 3, was " + outputDimension);
    }
    this.factory = factory;
    this.outputDimension = outputDimension;
    this.writeBbox = writeBbox;
  }

  public GeometryCodec(GeoJsonConfig config) {
    this(config.geometryFactory(), config.outputDimension(), config.writeBbox());
  }

  public GeometryCodec() {
    this(GeoUtils.JTS_FACTORY, GeoJsonGeometryType.MAX_ARITY, false);
  }

  private static TypeRegistry<GeometryReader> buildReaders() {
    var builder = TypeRegistry.<GeometryReader>builder(GeoJsonException.Kind.UNKNOWN_GEOMETRY_TYPE, "geometry");
    for (GeoJsonGeometryType type : GeoJsonGeometryType.values()) {
      if (type.isCollection()) {
        builder.put(type.tag(), GeometryCodec::readCollection);
      } else {
        builder.put(type.tag(), (codec, node, path) -> codec.readCoordinates(type, node, path));
      }
    }
    return builder.build();
  }

  /** Returns the tags of every geometry object this codec can decode. */
  public static Set<String> tags() {
    return READERS.tags();
  }

  public GeometryFactory factory() {
    return factory;
  }

  public boolean writeBbox() {
    return writeBbox;
  }

  /* Encoding */

  /**
   * Returns the GeoJSON geometry object for {@code geometry}.
   *
   * @throws IllegalArgumentException if an ordinate is NaN or infinite, which JSON cannot represent
   */
  public ObjectNode encode(Geometry geometry) {
    GeoJsonGeometryType type = GeoJsonGeometryType.of(geometry);
    ObjectNode result = NODES.objectNode();
    result.put(TypeRegistry.TYPE, type.tag());
    if (writeBbox) {
      putBbox(result, geometry);
    }
    if (type.isCollection()) {
      ArrayNode children = result.putArray(GEOMETRIES);
      for (int i = 0; i < geometry.getNumGeometries(); i++) {
        children.add(encode(geometry.getGeometryN(i)));
      }
    } else {
      result.set(COORDINATES, coordinates(type, geometry));
    }
    return result;
  }

  /** Adds a {@code bbox} member with the 2D extent of {@code geometry} to {@code node} unless it is empty. */
  public void putBbox(ObjectNode node, Geometry geometry) {
    Envelope envelope = geometry.getEnvelopeInternal();
    if (!envelope.isNull()) {
      node.putArray(BBOX)
        .add(ordinate(envelope.getMinX()))
        .add(ordinate(envelope.getMinY()))
        .add(ordinate(envelope.getMaxX()))
        .add(ordinate(envelope.getMaxY()));
    }
  }

  private ArrayNode coordinates(GeoJsonGeometryType type, Geometry geometry) {
    return switch (type) {
      case POINT -> geometry.isEmpty() ? NODES.arrayNode() :
        position(((Point) geometry).getCoordinateSequence(), 0);
      case LINE_STRING, LINEAR_RING -> positions(((LineString) geometry).getCoordinateSequence());
      case POLYGON -> rings((Polygon) geometry);
      case MULTI_POINT, MULTI_LINE_STRING, MULTI_POLYGON -> {
        ArrayNode result = NODES.arrayNode(geometry.getNumGeometries());
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
          result.add(coordinates(type.component(), geometry.getGeometryN(i)));
        }
        yield result;
      }
      case GEOMETRY_COLLECTION -> throw new IllegalArgumentException(type.tag() + " does not have coordinates");
    };
  }

  private ArrayNode rings(Polygon polygon) {
    ArrayNode result = NODES.arrayNode(polygon.getNumInteriorRing() + 1);
    if (!polygon.isEmpty()) {
      result.add(positions(polygon.getExteriorRing().getCoordinateSequence()));
      for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
        result.add(positions(polygon.getInteriorRingN(i).getCoordinateSequence()));
      }
    }
    return result;
  }

  private ArrayNode positions(CoordinateSequence sequence) {
    ArrayNode result = NODES.arrayNode(sequence.size());
    for (int i = 0; i < sequence.size(); i++) {
      result.add(position(sequence, i));
    }
    return result;
  }

  private ArrayNode position(CoordinateSequence sequence, int index) {
    ArrayNode result = NODES.arrayNode(outputDimension);
    result.add(ordinate(sequence.getX(index)));
    result.add(ordinate(sequence.getY(index)));
    double z = sequence.getZ(index);
    if (outputDimension > 2 && !Double.isNaN(z)) {
      result.add(ordinate(z));
    }
    return result;
  }

  private static JsonNode ordinate(double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("GeoJSON cannot represent ordinate " + value);
    }
    if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_LONG &&
      Double.doubleToRawLongBits(value) != Double.doubleToRawLongBits(-0d)) {
      return NODES.numberNode((long) value);
    }
    return NODES.numberNode(value);
  }

  /* Decoding */

  /**
   * Returns the geometry that a GeoJSON geometry object represents.
   *
   * @throws GeoJsonException if the {@code type} is unknown or the coordinates do not fit it
   */
  public Geometry decode(JsonNode node) throws GeoJsonException {
    return decode(node, JsonPointer.empty());
  }

  /**
   * Returns the geometry that {@code node} represents, reporting errors relative to {@code path}.
   *
   * @throws GeoJsonException if the {@code type} is unknown or the coordinates do not fit it
   */
  public Geometry decode(JsonNode node, JsonPointer path) throws GeoJsonException {
    return READERS.resolve(node, path).read(this, node, path);
  }

  /**
   * Returns the geometry that {@code node} represents, which must be an instance of {@code geometryClass}.
   *
   * @throws GeoJsonException with {@link GeoJsonException.Kind#UNKNOWN_GEOMETRY_TYPE} if {@code node} holds another
   *                          kind of geometry, or any other error {@link #decode(JsonNode, JsonPointer)} reports
   */
  public <G extends Geometry> G decode(JsonNode node, JsonPointer path, Class<G> geometryClass)
    throws GeoJsonException {
    GeometryReader reader = READERS.resolve(node, path);
    GeoJsonGeometryType type = GeoJsonGeometryType.fromTag(node.get(TypeRegistry.TYPE).textValue());
    if (!geometryClass.isAssignableFrom(type.geometryClass())) {
      throw new GeoJsonException(GeoJsonException.Kind.UNKNOWN_GEOMETRY_TYPE, path.appendProperty(TypeRegistry.TYPE),
        "Expected " + geometryClass.getSimpleName() + " but got " + type.tag());
    }
    return geometryClass.cast(reader.read(this, node, path));
  }

  private Geometry readCollection(JsonNode node, JsonPointer path) throws GeoJsonException {
    JsonNode children = node.get(GEOMETRIES);
    JsonPointer childrenPath = path.appendProperty(GEOMETRIES);
    if (children == null || !children.isArray()) {
      throw new GeoJsonException(GeoJsonException.Kind.MALFORMED_COORDINATES, childrenPath,
        "Expected geometries array but got " + GeoJsonGeometryType.describe(children));
    }
    Geometry[] geometries = new Geometry[children.size()];
    for (int i = 0; i < geometries.length; i++) {
      geometries[i] = decode(children.get(i), childrenPath.appendIndex(i));
    }
    return factory.createGeometryCollection(geometries);
  }

  private Geometry readCoordinates(GeoJsonGeometryType type, JsonNode node, JsonPointer path)
    throws GeoJsonException {
    JsonNode coordinates = node.get(COORDINATES);
    JsonPointer coordinatesPath = path.appendProperty(COORDINATES);
    type.validate(coordinates, coordinatesPath);
    try {
      return geometry(type, coordinates);
    } catch (IllegalArgumentException e) {
      // JTS refuses unclosed rings and lines with a single point
      throw new GeoJsonException(GeoJsonException.Kind.MALFORMED_COORDINATES, coordinatesPath,
        "Invalid " + type.tag() + ": " + e.getMessage(), e);
    }
  }

  private Geometry geometry(GeoJsonGeometryType type, JsonNode coordinates) {
    return switch (type) {
      case POINT -> point(coordinates);
      case LINE_STRING -> factory.createLineString(sequence(coordinates));
      case LINEAR_RING -> factory.createLinearRing(sequence(coordinates));
      case POLYGON -> polygon(coordinates);
      case MULTI_POINT -> factory.createMultiPoint(points(coordinates));
      case MULTI_LINE_STRING -> factory.createMultiLineString(lineStrings(coordinates));
      case MULTI_POLYGON -> factory.createMultiPolygon(polygons(coordinates));
      case GEOMETRY_COLLECTION -> throw new IllegalStateException(type.tag() + " does not have coordinates");
    };
  }

  private Point[] points(JsonNode positions) {
    Point[] result = new Point[positions.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = point(positions.get(i));
    }
    return result;
  }

  private LineString[] lineStrings(JsonNode lines) {
    LineString[] result = new LineString[lines.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = factory.createLineString(sequence(lines.get(i)));
    }
    return result;
  }

  private Polygon[] polygons(JsonNode polygons) {
    Polygon[] result = new Polygon[polygons.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = polygon(polygons.get(i));
    }
    return result;
  }

  private Point point(JsonNode position) {
    if (position.isEmpty()) {
      return factory.createPoint();
    }
    CoordinateSequence sequence = factory.getCoordinateSequenceFactory().create(1, position.size());
    setPosition(sequence, 0, position);
    return factory.createPoint(sequence);
  }

  private Polygon polygon(JsonNode rings) {
    if (rings.isEmpty()) {
      return factory.createPolygon();
    }
    LinearRing shell = factory.createLinearRing(sequence(rings.get(0)));
    LinearRing[] holes = new LinearRing[rings.size() - 1];
    for (int i = 0; i < holes.length; i++) {
      holes[i] = factory.createLinearRing(sequence(rings.get(i + 1)));
    }
    return factory.createPolygon(shell, holes);
  }

  private CoordinateSequence sequence(JsonNode positions) {
    int dimension = GeoJsonGeometryType.MIN_ARITY;
    for (JsonNode position : positions) {
      dimension = Math.max(dimension, position.size());
    }
    CoordinateSequence result = factory.getCoordinateSequenceFactory().create(positions.size(), dimension);
    for (int i = 0; i < positions.size(); i++) {
      setPosition(result, i, positions.get(i));
    }
    return result;
  }

  private static void setPosition(CoordinateSequence sequence, int index, JsonNode position) {
    for (int ordinate = 0; ordinate < sequence.getDimension(); ordinate++) {
      sequence.setOrdinate(index, ordinate,
        ordinate < position.size() ? position.get(ordinate).doubleValue() : Double.NaN);
    }
  }

  @FunctionalInterface
  private interface GeometryReader {
    Geometry read(GeometryCodec codec, JsonNode node, JsonPointer path) throws GeoJsonException;
  }
}
