package io.campaign.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void emptyMapEncodesToNull() {
    assertNull(codec.toJson(Map.of()));
    assertNull(codec.toJson(null));
  }

  @Test
  void escapesSpecialCharacters() {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("quote", "say \"hi\"");
    values.put("lines", "a\nb\tc");

    String json = codec.toJson(values);

    assertEquals("{\"quote\":\"say \\\"hi\\\"\",\"lines\":\"a\\nb\\tc\"}", json);
    assertEquals(values, codec.parseObject(json));
  }

  @Test
  void parsesUnicodeEscapesAndWhitespace() {
    Map<String, String> parsed = codec.parseObject(" { \"platform\" : \"caf\\u00e9\" } ");

    assertEquals(Map.of("platform", "caf\u00e9"), parsed);
  }

  @Test
  void nullValuesAreDroppedOnParse() {
    assertEquals(Map.of("a", "1"), codec.parseObject("{\"a\":\"1\",\"b\":null}"));
  }

  @Test
  void nullAndBlankInputsParseAsEmpty() {
    assertTrue(codec.parseObject(null).isEmpty());
    assertTrue(codec.parseObject("  ").isEmpty());
    assertTrue(codec.parseObject("null").isEmpty());
    assertTrue(codec.parseArray(null).isEmpty());
    assertTrue(codec.parseArray("[]").isEmpty());
  }

  @Test
  void arrayOfObjects() {
    List<Map<String, String>> items = List.of(Map.of("code", "ETIMEDOUT"), Map.of("code", "ECONNRESET"));

    String json = codec.toJsonArray(items);

    assertEquals("[{\"code\":\"ETIMEDOUT\"},{\"code\":\"ECONNRESET\"}]", json);
    assertEquals(items, codec.parseArray(json));
    assertEquals("[]", codec.toJsonArray(List.of()));
  }

  @Test
  void malformedInputIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1]"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":1}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"b\""));
    assertThrows(IllegalArgumentException.class, () -> codec.parseArray("[{\"a\":\"b\"} x]"));
  }
}
