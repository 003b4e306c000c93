package com.onthegomap.geojts.feature;

import org.locationtech.jts.geom.Geometry;

/**
 * A top-level GeoJSON object that wraps geometries with caller-defined properties.
 *
 * @param <G> type of geometry each feature holds
 * @param <P> type of the properties each feature holds
 */
public sealed interface GeoJsonObject<G extends Geometry, P> permits Feature, FeatureCollection {

  /** Returns the value of the {@code type} member. */
  String type();
}
