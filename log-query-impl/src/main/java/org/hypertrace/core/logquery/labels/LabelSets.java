package org.hypertrace.core.logquery.labels;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts label sets between their map form and their string form, {@code {app="foo",
 * env="prod"}}. The string form lists names in ascending order and quotes values with backslash
 * escapes.
 */
public class LabelSets {
  public static final String EMPTY = "{}";

  public static String format(Map<String, String> labels) {
    if (labels.isEmpty()) {
      return EMPTY;
    }
    StringBuilder builder = new StringBuilder("{");
    boolean first = true;
    for (Map.Entry<String, String> label : new TreeMap<>(labels).entrySet()) {
      if (!first) {
        builder.append(", ");
      }
      first = false;
      builder.append(label.getKey()).append('=');
      quote(builder, label.getValue());
    }
    return builder.append('}').toString();
  }

  /**
   * Parses the string form of a label set, keeping the order in which labels appear.
   *
   * @throws IllegalArgumentException if the string is not a well formed label set
   */
  public static Map<String, String> parse(String labelSet) {
    String input = labelSet.trim();
    if (input.length() < 2 || input.charAt(0) != '{' || input.charAt(input.length() - 1) != '}') {
      throw new IllegalArgumentException("invalid label set: " + labelSet);
    }
    Map<String, String> labels = new LinkedHashMap<>();
    int position = 1;
    int end = input.length() - 1;
    while (position < end) {
      position = skipSpaces(input, position, end);
      if (position >= end) {
        break;
      }
      int nameStart = position;
      while (position < end && input.charAt(position) != '=') {
        position++;
      }
      String name = input.substring(nameStart, position).trim();
      if (name.isEmpty() || position >= end) {
        throw new IllegalArgumentException("invalid label set: " + labelSet);
      }
      position = skipSpaces(input, position + 1, end);
      if (position >= end || input.charAt(position) != '"') {
        throw new IllegalArgumentException("invalid label set: " + labelSet);
      }
      StringBuilder value = new StringBuilder();
      position++;
      boolean closed = false;
      while (position < end) {
        char current = input.charAt(position++);
        if (current == '"') {
          closed = true;
          break;
        }
        if (current == '\\' && position < end) {
          value.append(unescape(input.charAt(position++)));
        } else {
          value.append(current);
        }
      }
      if (!closed) {
        throw new IllegalArgumentException("unterminated label value in: " + labelSet);
      }
      labels.put(name, value.toString());
      position = skipSpaces(input, position, end);
      if (position < end && input.charAt(position) == ',') {
        position++;
      }
    }
    return Collections.unmodifiableMap(labels);
  }

  private static int skipSpaces(String input, int position, int end) {
    while (position < end && Character.isWhitespace(input.charAt(position))) {
      position++;
    }
    return position;
  }

  private static void quote(StringBuilder builder, String value) {
    builder.append('"');
    for (int i = 0; i < value.length(); i++) {
      char current = value.charAt(i);
      switch (current) {
        case '"':
          builder.append("\\\"");
          break;
        case '\\':
          builder.append("\\\\");
          break;
        case '\n':
          builder.append("\\n");
          break;
        case '\t':
          builder.append("\\t");
          break;
        case '\r':
          builder.append("\\r");
          break;
        default:
          builder.append(current);
      }
    }
    builder.append('"');
  }

  private static char unescape(char escaped) {
    switch (escaped) {
      case 'n':
        return '\n';
      case 't':
        return '\t';
      case 'r':
        return '\r';
      default:
        return escaped;
    }
  }
}
