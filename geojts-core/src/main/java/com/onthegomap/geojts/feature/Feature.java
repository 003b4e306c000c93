package com.onthegomap.geojts.feature;

import org.locationtech.jts.geom.Geometry;

/**
 * A geometry paired with properties and an optional identifier.
 * <p>
 * Equality compares geometries with {@link Geometry#equalsExact(Geometry)}, so a decoded feature equals the feature it
 * was encoded from when its properties have value equality.
 *
 * @param id         {@link String} or {@link Number} identifier, or {@code null} if the feature has none. Integral
 *                   numbers are normalized to {@link Long} and floats to {@link Double}
 * @param geometry   the geometry, or {@code null} for an unlocated feature
 * @param properties the properties, or {@code null} if the feature has none
 * @param <G>        type of the geometry
 * @param <P>        type of the properties
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7946#section-3.2">RFC 7946 section 3.2</a>
 */
public record Feature<G extends Geometry, P>(Object id, G geometry, P properties) implements GeoJsonObject<G, P> {

  public static final String TYPE = "Feature";

  public Feature {
    id = normalizeId(id);
  }

  public Feature(G geometry, P properties) {
    this(null, geometry, properties);
  }

  private static Object normalizeId(Object id) {
    if (id == null || id instanceof String || id instanceof Long) {
      return id;
    } else if (id instanceof Integer || id instanceof Short || id instanceof Byte) {
      return ((Number) id).longValue();
    } else if (id instanceof Double || id instanceof Float) {
      double value = ((Number) id).doubleValue();
      if (!Double.isFinite(value)) {
        throw new IllegalArgumentException("GeoJSON cannot represent feature id " + value);
      }
      return value;
    } else if (id instanceof Number) {
      return id;
    }
    throw new IllegalArgumentException("Feature id must be a string or number, got " + id.getClass().getName());
  }

  public boolean hasId() {
    return id != null;
  }

  public boolean hasGeometry() {
    return geometry != null;
  }

  @Override
  public String type() {
    return TYPE;
  }
}
