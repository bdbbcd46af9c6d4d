package io.campaign.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-dependency {@link JsonCodec}. Supports flat objects whose values are strings or
 * {@code null} (nulls are dropped on parse) and arrays of such objects.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    appendObject(sb, values);
    return sb.toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (isNullLiteral(json)) {
      return Collections.emptyMap();
    }
    Cursor cursor = new Cursor(json.trim());
    Map<String, String> result = readObject(cursor);
    cursor.expectEnd();
    return result;
  }

  @Override
  public String toJsonArray(List<Map<String, String>> items) {
    StringBuilder sb = new StringBuilder("[");
    if (items != null) {
      for (int i = 0; i < items.size(); i++) {
        if (i > 0) {
          sb.append(',');
        }
        appendObject(sb, items.get(i));
      }
    }
    return sb.append(']').toString();
  }

  @Override
  public List<Map<String, String>> parseArray(String json) {
    if (isNullLiteral(json)) {
      return List.of();
    }
    Cursor cursor = new Cursor(json.trim());
    cursor.expect('[');
    List<Map<String, String>> result = new ArrayList<>();
    if (cursor.peekSkippingWhitespace() == ']') {
      cursor.advance();
      cursor.expectEnd();
      return result;
    }
    while (true) {
      result.add(readObject(cursor));
      char next = cursor.nextSkippingWhitespace();
      if (next == ']') {
        cursor.expectEnd();
        return result;
      }
      if (next != ',') {
        throw new IllegalArgumentException("Expected ',' or ']' at index " + (cursor.index - 1));
      }
    }
  }

  private static boolean isNullLiteral(String json) {
    if (json == null) {
      return true;
    }
    String trimmed = json.trim();
    return trimmed.isEmpty() || "null".equals(trimmed);
  }

  private static void appendObject(StringBuilder sb, Map<String, String> values) {
    sb.append('{');
    boolean first = true;
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON object keys must not be null");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape(entry.getKey())).append("\":");
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        sb.append('"').append(escape(entry.getValue())).append('"');
      }
    }
    sb.append('}');
  }

  private static Map<String, String> readObject(Cursor cursor) {
    cursor.expect('{');
    Map<String, String> result = new LinkedHashMap<>();
    if (cursor.peekSkippingWhitespace() == '}') {
      cursor.advance();
      return result;
    }
    while (true) {
      cursor.expect('"');
      String key = cursor.readString();
      cursor.expect(':');
      char valueStart = cursor.peekSkippingWhitespace();
      if (valueStart == 'n') {
        cursor.expectLiteral("null");
      } else {
        cursor.expect('"');
        result.put(key, cursor.readString());
      }
      char next = cursor.nextSkippingWhitespace();
      if (next == '}') {
        return result;
      }
      if (next != ',') {
        throw new IllegalArgumentException("Expected ',' or '}' at index " + (cursor.index - 1));
      }
    }
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.toString();
  }

  /** Position in the input being parsed. */
  private static final class Cursor {
    private final String input;
    private int index;

    private Cursor(String input) {
      this.input = input;
    }

    char peekSkippingWhitespace() {
      skipWhitespace();
      if (index >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      return input.charAt(index);
    }

    char nextSkippingWhitespace() {
      char c = peekSkippingWhitespace();
      index++;
      return c;
    }

    void advance() {
      index++;
    }

    void expect(char expected) {
      char c = nextSkippingWhitespace();
      if (c != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at index " + (index - 1) + " but found '" + c + "'");
      }
    }

    void expectLiteral(String literal) {
      if (!input.startsWith(literal, index)) {
        throw new IllegalArgumentException("Expected " + literal + " at index " + index);
      }
      index += literal.length();
    }

    void expectEnd() {
      skipWhitespace();
      if (index != input.length()) {
        throw new IllegalArgumentException("Unexpected trailing content at index " + index);
      }
    }

    /** Reads a string body; the opening quote has already been consumed. */
    String readString() {
      StringBuilder sb = new StringBuilder();
      while (index < input.length()) {
        char c = input.charAt(index++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (index >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char escaped = input.charAt(index++);
        switch (escaped) {
          case '"', '\\', '/' -> sb.append(escaped);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (index + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(index, index + 4), 16));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid unicode escape", e);
            }
            index += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private void skipWhitespace() {
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          return;
        }
        index++;
      }
    }
  }
}
