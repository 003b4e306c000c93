package com.onthegomap.geojts.feature;

import java.util.Iterator;
import java.util.List;
import org.locationtech.jts.geom.Geometry;

/**
 * An ordered list of features. Order is preserved exactly through encoding and decoding.
 *
 * @param features the features, in document order
 * @param <G>      type of geometry each feature holds
 * @param <P>      type of the properties each feature holds
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7946#section-3.3">RFC 7946 section 3.3</a>
 */
public record FeatureCollection<G extends Geometry, P>(List<Feature<G, P>> features)
  implements GeoJsonObject<G, P>, Iterable<Feature<G, P>> {

  public static final String TYPE = "FeatureCollection";

  public FeatureCollection {
    features = List.copyOf(features);
  }

  @SafeVarargs
  public static <G extends Geometry, P> FeatureCollection<G, P> of(Feature<G, P>... features) {
    return new FeatureCollection<>(List.of(features));
  }

  public int size() {
    return features.size();
  }

  public Feature<G, P> get(int index) {
    return features.get(index);
  }

  @Override
  public Iterator<Feature<G, P>> iterator() {
    return features.iterator();
  }

  @Override
  public String type() {
    return TYPE;
  }
}
