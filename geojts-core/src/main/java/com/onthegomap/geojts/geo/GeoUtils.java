package com.onthegomap.geojts.geo;

import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.geom.impl.CoordinateArraySequenceFactory;
import org.locationtech.jts.geom.impl.PackedCoordinateSequenceFactory;

/**
 * A collection of utilities for working with JTS data structures.
 */
public class GeoUtils {

  /** SRID of WGS 84 longitude/latitude, the only coordinate reference system RFC 7946 allows. */
  public static final int WGS84_SRID = 4326;

  public static final GeometryFactory JTS_FACTORY =
    new GeometryFactory(new PrecisionModel(), WGS84_SRID, PackedCoordinateSequenceFactory.DOUBLE_FACTORY);

  private GeoUtils() {}

  /**
   * Returns a geometry factory with floating precision that assigns {@code srid} to every geometry it creates.
   *
   * @param srid   spatial reference ID to assign
   * @param packed if true, store coordinates in packed {@code double[]} sequences, otherwise in arrays of
   *               {@link org.locationtech.jts.geom.Coordinate}
   */
  public static GeometryFactory factory(int srid, boolean packed) {
    if (packed && srid == WGS84_SRID) {
      return JTS_FACTORY;
    }
    return new GeometryFactory(new PrecisionModel(), srid,
      packed ? PackedCoordinateSequenceFactory.DOUBLE_FACTORY : CoordinateArraySequenceFactory.instance());
  }
}
