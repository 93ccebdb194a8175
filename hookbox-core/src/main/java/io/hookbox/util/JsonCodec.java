package io.hookbox.util;

import java.util.List;
import java.util.Map;

/**
 * Codec for the JSON columns of a subscription: the event name list and the
 * custom header map.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) delegates to Jackson.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return JacksonJsonCodec.INSTANCE;
  }

  /**
   * Encodes a string map as a JSON object string. Returns {@code null} if the map is null or empty.
   *
   * @param headers the headers to encode
   * @return JSON string, or {@code null}
   */
  String toJson(Map<String, String> headers);

  /**
   * Parses a JSON object string into an insertion-ordered string map. Returns an
   * empty map for {@code null}, empty, or {@code "null"} input.
   *
   * @throws IllegalArgumentException if the input is not a valid JSON object
   */
  Map<String, String> parseObject(String json);

  /**
   * Encodes a list of strings as a JSON array. A {@code null} list encodes as {@code []}.
   */
  String toJsonArray(List<String> values);

  /**
   * Parses a JSON array of strings. Returns an empty list for {@code null} or empty input.
   *
   * @throws IllegalArgumentException if the input is not a JSON array of strings
   */
  List<String> parseArray(String json);
}
