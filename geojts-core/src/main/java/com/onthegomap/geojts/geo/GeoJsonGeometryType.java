package com.onthegomap.geojts.geo;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.onthegomap.geojts.GeoJsonException;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/**
 * The GeoJSON geometry kinds and the shape of their {@code coordinates} member.
 * <p>
 * {@link #depth()} is the number of nested arrays around each ordinate: 1 for {@code [x, y]}, 2 for
 * {@code [[x, y], ...]} and so on. Multi-geometries list the coordinates of their {@link #component()} kind.
 * {@code GeometryCollection} has no coordinates and a depth of 0.
 */
public enum GeoJsonGeometryType {
  POINT("Point", 1, Point.class, null),
  LINE_STRING("LineString", 2, LineString.class, null),
  LINEAR_RING("LinearRing", 2, LinearRing.class, null),
  POLYGON("Polygon", 3, Polygon.class, null),
  MULTI_POINT("MultiPoint", 2, MultiPoint.class, POINT),
  MULTI_LINE_STRING("MultiLineString", 3, MultiLineString.class, LINE_STRING),
  MULTI_POLYGON("MultiPolygon", 4, MultiPolygon.class, POLYGON),
  GEOMETRY_COLLECTION("GeometryCollection", 0, GeometryCollection.class, null);

  /** Minimum number of ordinates in a position. */
  public static final int MIN_ARITY = 2;
  /** Maximum number of ordinates in a position. */
  public static final int MAX_ARITY = 3;

  private static final ImmutableMap<String, GeoJsonGeometryType> BY_TAG = Arrays.stream(values())
    .collect(ImmutableMap.toImmutableMap(GeoJsonGeometryType::tag, Function.identity()));

  private final String tag;
  private final int depth;
  private final Class<? extends Geometry> geometryClass;
  private final GeoJsonGeometryType component;

  GeoJsonGeometryType(String tag, int depth, Class<? extends Geometry> geometryClass,
    GeoJsonGeometryType component) {
    this.tag = tag;
    this.depth = depth;
    this.geometryClass = geometryClass;
    this.component = component;
  }

  /** Returns the kind of {@code geometry}, which is also the tag JTS reports for it. */
  public static GeoJsonGeometryType of(Geometry geometry) {
    GeoJsonGeometryType result = BY_TAG.get(geometry.getGeometryType());
    if (result == null) {
      throw new IllegalArgumentException("Unsupported geometry type: " + geometry.getGeometryType());
    }
    return result;
  }

  /** Returns the kind for a GeoJSON {@code type} tag, or {@code null} if it is not a geometry tag. */
  public static GeoJsonGeometryType fromTag(String tag) {
    return BY_TAG.get(tag);
  }

  /** The value of the {@code type} member. */
  public String tag() {
    return tag;
  }

  public int depth() {
    return depth;
  }

  public Class<? extends Geometry> geometryClass() {
    return geometryClass;
  }

  /** The kind each element of a multi-geometry is made of, or {@code null} for single geometries. */
  public GeoJsonGeometryType component() {
    return component;
  }

  public boolean isCollection() {
    return this == GEOMETRY_COLLECTION;
  }

  /** Returns true if an empty position {@code []} is allowed, which encodes an empty point. */
  public boolean allowsEmptyPosition() {
    return this == POINT || component == POINT;
  }

  /**
   * Verifies that {@code coordinates} has exactly the nesting depth and position arity of this kind.
   * <p>
   * Empty arrays are accepted at any level above the positions since they encode empty geometries or components.
   *
   * @throws GeoJsonException with {@link GeoJsonException.Kind#MALFORMED_COORDINATES} pointing at the first node that
   *                          does not fit
   */
  public void validate(JsonNode coordinates, JsonPointer path) throws GeoJsonException {
    if (isCollection()) {
      throw new IllegalStateException(tag + " does not have coordinates");
    }
    validate(coordinates, depth, path);
  }

  private void validate(JsonNode node, int remaining, JsonPointer path) throws GeoJsonException {
    if (node == null || !node.isArray()) {
      throw malformed(path, "Expected array for " + tag + " coordinates at nesting level " + (depth - remaining + 1) +
        " of " + depth + " but got " + describe(node));
    }
    if (remaining == 1) {
      validatePosition(node, path);
    } else {
      for (int i = 0; i < node.size(); i++) {
        validate(node.get(i), remaining - 1, path.appendIndex(i));
      }
    }
  }

  private void validatePosition(JsonNode position, JsonPointer path) throws GeoJsonException {
    int arity = position.size();
    if (arity == 0 && allowsEmptyPosition()) {
      return;
    }
    if (arity < MIN_ARITY || arity > MAX_ARITY) {
      throw malformed(path,
        "Expected position with " + MIN_ARITY + " or " + MAX_ARITY + " ordinates in " + tag + " but got " + arity);
    }
    for (int i = 0; i < arity; i++) {
      JsonNode ordinate = position.get(i);
      if (!ordinate.isNumber()) {
        throw malformed(path.appendIndex(i), "Expected numeric ordinate in " + tag + " but got " + describe(ordinate));
      }
      if (!Double.isFinite(ordinate.doubleValue())) {
        throw malformed(path.appendIndex(i), "Ordinate " + ordinate + " in " + tag + " is out of double range");
      }
    }
  }

  private static GeoJsonException malformed(JsonPointer path, String message) {
    return new GeoJsonException(GeoJsonException.Kind.MALFORMED_COORDINATES, path, message);
  }

  static String describe(JsonNode node) {
    if (node == null || node.isMissingNode()) {
      return "nothing";
    }
    return node.getNodeType().name().toLowerCase(Locale.ROOT) + " " + node;
  }
}
