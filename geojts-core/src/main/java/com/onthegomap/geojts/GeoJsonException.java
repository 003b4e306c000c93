package com.onthegomap.geojts;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonMappingException;
import java.io.Closeable;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An error caused by GeoJSON input that does not have the structure the codec expects.
 * <p>
 * Every error carries a {@link Kind} that callers can switch on and the JSON pointer to the node that caused it, for
 * example {@code /features/1/geometry/coordinates/0}. This extends {@link JsonMappingException} so that errors raised
 * from inside an {@link com.fasterxml.jackson.databind.ObjectMapper} propagate without being re-wrapped.
 */
public class GeoJsonException extends JsonMappingException {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeoJsonException.class);

  private final Kind kind;
  private final transient JsonPointer path;

  /**
   * Constructs a new exception caused by {@code cause}.
   *
   * @param kind    category of the failure
   * @param path    pointer to the offending node, relative to the document being decoded
   * @param message description of the failure
   * @param cause   the original exception that was thrown
   */
  public GeoJsonException(Kind kind, JsonPointer path, String message, Throwable cause) {
    super((Closeable) null, describe(path, message), cause);
    this.kind = kind;
    this.path = path == null ? JsonPointer.empty() : path;
  }

  public GeoJsonException(Kind kind, JsonPointer path, String message) {
    this(kind, path, message, null);
  }

  private static String describe(JsonPointer path, String message) {
    String location = path == null || path.matches() ? "/" : path.toString();
    return message + " (at " + location + ")";
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the pointer to the node that caused this error, or the empty pointer for the document root. */
  public JsonPointer path() {
    return path;
  }

  /** Returns a unique code for this error condition, suitable for counting occurrences. */
  public String stat() {
    return kind.name().toLowerCase(Locale.ROOT);
  }

  /** Logs the error at {@code WARN} level prefixed with {@code logContext}. */
  public void log(String logContext) {
    LOGGER.warn("{}: [{}] {}", logContext, stat(), getOriginalMessage());
  }

  /** The categories of failure a decode operation can report. */
  public enum Kind {
    /** Geometry {@code type} missing, not recognized, or not the geometry kind requested. */
    UNKNOWN_GEOMETRY_TYPE,
    /** Coordinate array nesting, tuple arity or ordinate values do not match the geometry kind. */
    MALFORMED_COORDINATES,
    /** Envelope {@code type} missing, not recognized, or not the envelope requested. */
    UNKNOWN_ENVELOPE_TYPE,
    /** A {@code FeatureCollection} without a {@code features} array. */
    MISSING_FEATURES_ARRAY,
    /** The caller-supplied property codec could not interpret the {@code properties} node. */
    PROPERTY_DECODE_ERROR,
    /** A feature {@code id} that is neither a string nor a number. */
    MALFORMED_ID,
    /** The input text is not valid JSON. */
    MALFORMED_JSON
  }
}
