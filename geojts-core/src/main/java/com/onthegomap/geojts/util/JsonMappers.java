package com.onthegomap.geojts.util;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_ABSENT;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Shared Jackson mapper configuration.
 */
public final class JsonMappers {

  private static final JsonMapper DEFAULT_MAPPER = newBaseBuilder().build();

  private JsonMappers() {}

  /** Returns a mapper with the base configuration, used when the caller does not supply one. */
  public static JsonMapper defaultMapper() {
    return DEFAULT_MAPPER;
  }

  /**
   * Returns a builder that supports {@link java.util.Optional} values, omits absent bean properties and rejects
   * trailing content after the root value.
   */
  public static JsonMapper.Builder newBaseBuilder() {
    return JsonMapper.builder()
      .addModule(new Jdk8Module())
      .serializationInclusion(NON_ABSENT)
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }
}
