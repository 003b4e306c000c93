package com.onthegomap.geojts.examples;

import com.onthegomap.geojts.GeoJsonCodec;
import com.onthegomap.geojts.GeoJsonException;
import com.onthegomap.geojts.config.Arguments;
import com.onthegomap.geojts.config.GeoJsonConfig;
import com.onthegomap.geojts.feature.Feature;
import com.onthegomap.geojts.feature.FeatureCollection;
import com.onthegomap.geojts.feature.PropertyCodec;
import com.onthegomap.geojts.geo.GeoUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads animal sightings from a GeoJSON {@code FeatureCollection}, logs each one, and writes them back out.
 *
 * <p>To run this example:
 *
 * <ol>
 *   <li>build the examples: {@code mvn clean package}
 *   <li>then run this example: {@code java -cp ... com.onthegomap.geojts.examples.AnimalFeatures
 *       input="path/to/animals.geojson" output="data/animals.geojson" pretty=true}
 * </ol>
 * <p>
 * Without {@code input} it writes two built-in sightings. Every key can also be set through {@code -Dgeojts.key=value}
 * JVM properties, {@code GEOJTS_KEY} environment variables, or a {@code config=path/to/file.properties} file.
 */
public class AnimalFeatures {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnimalFeatures.class);

  private AnimalFeatures() {}

  /** Returns the built-in sightings used when no input file is given. */
  public static FeatureCollection<Point, Animal> defaultSightings() {
    return FeatureCollection.of(
      new Feature<>(sighting(32.6, 12.3), new Animal("Brutus", 4)),
      new Feature<>(sighting(45.1, 19.8), new Animal("Tweety", 2))
    );
  }

  private static Point sighting(double lon, double lat) {
    return GeoUtils.JTS_FACTORY.createPoint(new Coordinate(lon, lat));
  }

  static String describe(Animal animal) {
    return animal == null ? "unknown animal" : animal.name() + " (age " + animal.age() + ")";
  }

  static String describe(Point point) {
    return point == null || point.isEmpty() ? "at an unknown location" : "at " + point.getX() + ", " + point.getY();
  }

  /*
   * Main entrypoint for the example program
   */
  public static void main(String[] args) throws Exception {
    run(Arguments.fromArgsOrConfigFile(args));
  }

  static FeatureCollection<Point, Animal> run(Arguments args) throws IOException {
    Path input = args.inputFile("input", "GeoJSON FeatureCollection of animal sightings to read", null);
    Path output = args.file("output", "where to write the sightings as GeoJSON", null);
    GeoJsonCodec codec = GeoJsonCodec.create(GeoJsonConfig.from(args));
    PropertyCodec<Animal> animals = codec.properties(Animal.class);

    FeatureCollection<Point, Animal> sightings;
    if (input == null) {
      sightings = defaultSightings();
    } else {
      try {
        sightings = codec.decodeFeatureCollection(Files.readString(input), Point.class, animals);
      } catch (GeoJsonException e) {
        e.log("Error reading " + input);
        throw e;
      }
    }

    for (var sighting : sightings) {
      LOGGER.info("{} seen {}", describe(sighting.properties()), describe(sighting.geometry()));
    }

    String json = codec.encodeFeatureCollection(sightings, animals);
    if (output != null) {
      Files.writeString(output, json);
      LOGGER.info("Wrote {} sightings to {}", sightings.size(), output);
    } else {
      LOGGER.info(json);
    }
    return sightings;
  }
}
