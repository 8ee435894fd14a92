package mailsched.extract;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the first flat JSON object out of a model answer.
 *
 * <p>Model answers often wrap the object in prose or a fenced code block, so everything
 * before the first {@code '{'} is ignored, as is anything after the closing brace.
 * Values may be strings, numbers, booleans or {@code null}; numbers and booleans are
 * returned as their literal text and {@code null} values are omitted. Nested objects and
 * arrays are rejected.
 */
final class FlatJsonReader {

  private FlatJsonReader() {
  }

  /**
   * @throws IllegalArgumentException if no well-formed flat object is found
   */
  static Map<String, String> readObject(String text) {
    if (text == null) {
      throw new IllegalArgumentException("No JSON object in empty answer");
    }
    int idx = text.indexOf('{');
    if (idx < 0) {
      throw new IllegalArgumentException("No JSON object in answer");
    }
    int len = text.length();
    idx++;
    Map<String, String> result = new LinkedHashMap<>();
    while (true) {
      idx = skipWhitespace(text, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char ch = text.charAt(idx);
      if (ch == '}') {
        return result;
      }
      if (ch != '"') {
        throw new IllegalArgumentException("Expected string key at " + idx);
      }
      Token key = readString(text, idx + 1);
      idx = skipWhitespace(text, key.next());
      if (idx >= len || text.charAt(idx) != ':') {
        throw new IllegalArgumentException("Expected ':' after key " + key.value());
      }
      idx = skipWhitespace(text, idx + 1);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char start = text.charAt(idx);
      if (start == '"') {
        Token value = readString(text, idx + 1);
        result.put(key.value(), value.value());
        idx = value.next();
      } else if (start == '{' || start == '[') {
        throw new IllegalArgumentException("Nested value for key " + key.value());
      } else {
        Token literal = readLiteral(text, idx);
        if (!"null".equals(literal.value())) {
          result.put(key.value(), literal.value());
        }
        idx = literal.next();
      }
      idx = skipWhitespace(text, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char next = text.charAt(idx);
      if (next == ',') {
        idx++;
      } else if (next == '}') {
        return result;
      } else {
        throw new IllegalArgumentException("Expected ',' or '}' at " + idx);
      }
    }
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
      i++;
    }
    return i;
  }

  private static Token readLiteral(String input, int startIndex) {
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == ',' || c == '}' || Character.isWhitespace(c)) {
        break;
      }
      i++;
    }
    String literal = input.substring(startIndex, i);
    if (literal.isEmpty()) {
      throw new IllegalArgumentException("Missing value at " + startIndex);
    }
    if (!literal.equals("null") && !literal.equals("true") && !literal.equals("false")
        && !literal.matches("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?")) {
      throw new IllegalArgumentException("Invalid literal: " + literal);
    }
    return new Token(literal, i);
  }

  private static Token readString(String input, int startIndex) {
    StringBuilder sb = new StringBuilder();
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new Token(sb.toString(), i + 1);
      }
      if (c != '\\') {
        sb.append(c);
        i++;
        continue;
      }
      if (i + 1 >= input.length()) {
        throw new IllegalArgumentException("Invalid escape sequence");
      }
      char escaped = input.charAt(i + 1);
      switch (escaped) {
        case '"', '\\', '/' -> sb.append(escaped);
        case 'b' -> sb.append('\b');
        case 'f' -> sb.append('\f');
        case 'n' -> sb.append('\n');
        case 'r' -> sb.append('\r');
        case 't' -> sb.append('\t');
        case 'u' -> {
          if (i + 5 >= input.length()) {
            throw new IllegalArgumentException("Invalid unicode escape");
          }
          try {
            sb.append((char) Integer.parseInt(input.substring(i + 2, i + 6), 16));
          } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid unicode escape", ex);
          }
          i += 4;
        }
        default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
      }
      i += 2;
    }
    throw new IllegalArgumentException("Unterminated string");
  }

  private record Token(String value, int next) {
  }
}
