package com.onthegomap.geojts.config;

import com.onthegomap.geojts.geo.GeoJsonGeometryType;
import com.onthegomap.geojts.geo.GeoUtils;
import org.locationtech.jts.geom.GeometryFactory;

/**
 * Holder for the parameters that control how geometries and features are written and read.
 *
 * @param arguments         the arguments this configuration was read from
 * @param srid              spatial reference ID assigned to decoded geometries
 * @param packedCoordinates store decoded coordinates in packed {@code double[]} sequences
 * @param outputDimension   maximum number of ordinates written per position, 2 drops z values
 * @param writeBbox         write an RFC 7946 {@code bbox} member on geometries, features and collections
 * @param pretty            indent encoded output
 */
public record GeoJsonConfig(
  Arguments arguments,
  int srid,
  boolean packedCoordinates,
  int outputDimension,
  boolean writeBbox,
  boolean pretty
) {

  public GeoJsonConfig {
    if (outputDimension < GeoJsonGeometryType.MIN_ARITY || outputDimension > GeoJsonGeometryType.MAX_ARITY) {
      throw new IllegalArgumentException(
        "output_dimension must be " + GeoJsonGeometryType.MIN_ARITY + " or " + GeoJsonGeometryType.MAX_ARITY +
          ", was " + outputDimension);
    }
  }

  public static GeoJsonConfig defaults() {
    return from(Arguments.of().silence());
  }

  public static GeoJsonConfig from(Arguments arguments) {
    return new GeoJsonConfig(
      arguments,
      arguments.getInteger("srid", "spatial reference ID of decoded geometries", GeoUtils.WGS84_SRID),
      arguments.getBoolean("packed_coordinates", "store decoded coordinates in packed double arrays", true),
      arguments.getInteger("output_dimension", "maximum ordinates to write per position (2 or 3)",
        GeoJsonGeometryType.MAX_ARITY),
      arguments.getBoolean("write_bbox", "write bbox members on encoded objects", false),
      arguments.getBoolean("pretty", "indent encoded GeoJSON", false)
    );
  }

  /** Returns the factory decoded geometries are built with. */
  public GeometryFactory geometryFactory() {
    return GeoUtils.factory(srid, packedCoordinates);
  }
}
