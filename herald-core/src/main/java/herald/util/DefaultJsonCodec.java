package herald.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency-free JSON codec for flat string maps and string arrays.
 *
 * <p>Accessible via {@link JsonCodec#getDefault()}. Null map values and null array elements
 * are dropped on decode; numbers, booleans and nested structures are rejected.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return "{}";
    }
    StringBuilder sb = new StringBuilder().append('{');
    boolean first = true;
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("map cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      appendString(sb, entry.getKey()).append(':');
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        appendString(sb, entry.getValue());
      }
    }
    return sb.append('}').toString();
  }

  @Override
  public String toJsonArray(List<String> values) {
    if (values == null || values.isEmpty()) {
      return "[]";
    }
    StringBuilder sb = new StringBuilder().append('[');
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      String value = values.get(i);
      if (value == null) {
        sb.append("null");
      } else {
        appendString(sb, value);
      }
    }
    return sb.append(']').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (isAbsent(json)) {
      return Collections.emptyMap();
    }
    Cursor in = new Cursor(json.trim());
    in.expect('{', "Expected JSON object");
    Map<String, String> result = new LinkedHashMap<>();
    if (in.consumeIf('}')) {
      in.expectEnd();
      return result;
    }
    while (true) {
      if (in.peek() != '"') {
        throw new IllegalArgumentException("Expected string key");
      }
      String key = in.readString();
      in.expect(':', "Expected ':' after key");
      String value = in.readStringOrNull();
      if (value != null) {
        result.put(key, value);
      }
      if (in.consumeIf(',')) {
        continue;
      }
      in.expect('}', "Expected ',' or '}'");
      in.expectEnd();
      return result;
    }
  }

  @Override
  public List<String> parseArray(String json) {
    if (isAbsent(json)) {
      return Collections.emptyList();
    }
    Cursor in = new Cursor(json.trim());
    in.expect('[', "Expected JSON array");
    List<String> result = new ArrayList<>();
    if (in.consumeIf(']')) {
      in.expectEnd();
      return result;
    }
    while (true) {
      String value = in.readStringOrNull();
      if (value != null) {
        result.add(value);
      }
      if (in.consumeIf(',')) {
        continue;
      }
      in.expect(']', "Expected ',' or ']'");
      in.expectEnd();
      return result;
    }
  }

  private static boolean isAbsent(String json) {
    if (json == null) {
      return true;
    }
    String trimmed = json.trim();
    return trimmed.isEmpty() || "null".equals(trimmed);
  }

  private static StringBuilder appendString(StringBuilder sb, String value) {
    sb.append('"');
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
    return sb.append('"');
  }

  private static final class Cursor {
    private final String input;
    private int pos;

    Cursor(String input) {
      this.input = input;
    }

    char peek() {
      skipWhitespace();
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      return input.charAt(pos);
    }

    boolean consumeIf(char expected) {
      if (peek() == expected) {
        pos++;
        return true;
      }
      return false;
    }

    void expect(char expected, String message) {
      if (!consumeIf(expected)) {
        throw new IllegalArgumentException(message);
      }
    }

    void expectEnd() {
      skipWhitespace();
      if (pos != input.length()) {
        throw new IllegalArgumentException("Trailing characters after JSON value");
      }
    }

    String readStringOrNull() {
      if (peek() == '"') {
        return readString();
      }
      if (input.startsWith("null", pos)) {
        pos += 4;
        return null;
      }
      throw new IllegalArgumentException("Expected string value or null");
    }

    String readString() {
      expect('"', "Expected string");
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(pos++);
        switch (next) {
          case '"', '\\', '/' -> sb.append(next);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (pos + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            pos += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private void skipWhitespace() {
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          return;
        }
        pos++;
      }
    }
  }
}
