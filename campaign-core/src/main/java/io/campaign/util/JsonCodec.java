package io.campaign.util;

import java.util.List;
import java.util.Map;

/**
 * Codec for the two JSON shapes the engine persists: flat string maps (engagement metadata)
 * and arrays of flat string maps (retry error history).
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies. Applications
 * that already ship Jackson or Gson can implement this interface and hand it to the stores.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a string map as a JSON object. Returns {@code null} for a null or empty map.
   */
  String toJson(Map<String, String> values);

  /**
   * Parses a JSON object into a string map; {@code null}, blank and {@code "null"} give an empty map.
   *
   * @throws IllegalArgumentException if the input is not a flat JSON object of strings
   */
  Map<String, String> parseObject(String json);

  /**
   * Encodes a list of string maps as a JSON array of objects. An empty list gives {@code "[]"}.
   */
  String toJsonArray(List<Map<String, String>> items);

  /**
   * Parses a JSON array of flat objects; {@code null}, blank and {@code "null"} give an empty list.
   *
   * @throws IllegalArgumentException if the input is not an array of flat JSON objects
   */
  List<Map<String, String>> parseArray(String json);
}
