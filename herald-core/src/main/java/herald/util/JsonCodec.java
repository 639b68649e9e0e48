package herald.util;

import java.util.List;
import java.util.Map;

/**
 * Codec for the JSON columns of Herald's tables: string lists ({@code services},
 * {@code tags}) and flat string maps ({@code metadata}, template {@code variables}).
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and only
 * understands those two shapes. Applications that already ship Jackson or Gson can implement
 * this interface and hand it to the JDBC stores.
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
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a string map as a JSON object. A {@code null} map encodes as {@code "{}"}.
   *
   * @param values the map to encode
   * @return JSON object text (never {@code null})
   */
  String toJson(Map<String, String> values);

  /**
   * Encodes a string list as a JSON array. A {@code null} list encodes as {@code "[]"}.
   *
   * @param values the list to encode
   * @return JSON array text (never {@code null})
   */
  String toJsonArray(List<String> values);

  /**
   * Parses a JSON object into an insertion-ordered string map. Returns an empty map for
   * {@code null}, blank or {@code "null"} input. Members whose value is JSON {@code null} are
   * left out of the map.
   *
   * @param json the JSON text
   * @return parsed map (never {@code null})
   * @throws IllegalArgumentException if the input is not a flat JSON object of strings
   */
  Map<String, String> parseObject(String json);

  /**
   * Parses a JSON array of strings. Returns an empty list for {@code null}, blank or
   * {@code "null"} input. JSON {@code null} elements are left out of the list.
   *
   * @param json the JSON text
   * @return parsed list (never {@code null})
   * @throws IllegalArgumentException if the input is not a JSON array of strings
   */
  List<String> parseArray(String json);
}
