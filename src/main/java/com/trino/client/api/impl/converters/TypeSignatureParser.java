package com.trino.client.api.impl.converters;

import com.google.common.collect.ImmutableSet;
import com.trino.client.exception.TrinoProtocolException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive descent parser for Trino type text.
 *
 * <p>Row fields are written {@code name type}, but anonymous fields are written as a bare type,
 * and some type names span several words ({@code timestamp(3) with time zone}). A field is
 * therefore first read as a whole type; only when that does not yield a known type is the first
 * word taken as the field name.
 */
public final class TypeSignatureParser {

  static final Set<String> KNOWN_TYPES =
      ImmutableSet.of(
          "boolean",
          "tinyint",
          "smallint",
          "integer",
          "bigint",
          "real",
          "double",
          "decimal",
          "varchar",
          "char",
          "varbinary",
          "json",
          "date",
          "time",
          "time with time zone",
          "timestamp",
          "timestamp with time zone",
          "interval year to month",
          "interval day to second",
          "array",
          "map",
          "row",
          "uuid",
          "ipaddress",
          "unknown",
          "hyperloglog",
          "p4hyperloglog",
          "qdigest",
          "tdigest",
          "setdigest",
          "geometry",
          "sphericalgeography",
          "bingtile",
          "color");

  private final String text;
  private int position;

  private TypeSignatureParser(String text) {
    this.text = text;
  }

  public static TypeSignature parse(String typeText) throws TrinoProtocolException {
    if (typeText == null || typeText.trim().isEmpty()) {
      throw new TrinoProtocolException("Column type is missing");
    }
    TypeSignatureParser parser = new TypeSignatureParser(typeText);
    TypeSignature signature = parser.parseType();
    parser.skipWhitespace();
    if (!parser.atEnd()) {
      throw parser.error("unexpected trailing characters");
    }
    return signature;
  }

  private TypeSignature parseType() throws TrinoProtocolException {
    skipWhitespace();
    String base = readWords();
    if (base.isEmpty()) {
      throw error("expected a type name");
    }
    List<Long> numericArguments = new ArrayList<>();
    List<TypeSignature> typeArguments = new ArrayList<>();
    List<String> fieldNames = new ArrayList<>();
    String suffix = "";

    skipWhitespace();
    if (peek() == '(') {
      position++;
      boolean row = TypeSignature.ROW.equals(normalize(base));
      do {
        skipWhitespace();
        if (row) {
          parseRowField(fieldNames, typeArguments);
        } else if (Character.isDigit(peek())) {
          numericArguments.add(readNumber());
        } else {
          typeArguments.add(parseType());
        }
        skipWhitespace();
      } while (consume(','));
      expect(')');
      int mark = position;
      skipWhitespace();
      suffix = readWords();
      if (suffix.isEmpty()) {
        position = mark;
      }
    }
    String rawType = normalize(suffix.isEmpty() ? base : base + " " + suffix);
    return new TypeSignature(rawType, numericArguments, typeArguments, fieldNames);
  }

  private void parseRowField(List<String> fieldNames, List<TypeSignature> fieldTypes)
      throws TrinoProtocolException {
    if (peek() == '"') {
      fieldNames.add(readQuotedIdentifier());
      fieldTypes.add(parseType());
      return;
    }
    int start = position;
    TypeSignature anonymous = tryParseType();
    if (anonymous != null && KNOWN_TYPES.contains(anonymous.getRawType())) {
      fieldNames.add(null);
      fieldTypes.add(anonymous);
      return;
    }
    position = start;
    String name = readIdentifier();
    skipWhitespace();
    if (peek() == ',' || peek() == ')') {
      // A lone word is an anonymous field of a type this parser does not know.
      fieldNames.add(null);
      fieldTypes.add(TypeSignature.leaf(normalize(name)));
      return;
    }
    fieldNames.add(name);
    fieldTypes.add(parseType());
  }

  private TypeSignature tryParseType() {
    try {
      TypeSignature signature = parseType();
      skipWhitespace();
      return peek() == ',' || peek() == ')' ? signature : null;
    } catch (TrinoProtocolException e) {
      return null;
    }
  }

  /** Reads whitespace separated words up to a delimiter; {@code timestamp with time zone}. */
  private String readWords() {
    StringBuilder words = new StringBuilder();
    while (true) {
      int mark = position;
      skipWhitespace();
      String word = readIdentifier();
      if (word.isEmpty()) {
        position = mark;
        return words.toString();
      }
      if (words.length() > 0) {
        words.append(' ');
      }
      words.append(word);
    }
  }

  private String readIdentifier() {
    int start = position;
    while (!atEnd()) {
      char c = text.charAt(position);
      if (Character.isLetterOrDigit(c) || c == '_') {
        position++;
      } else {
        break;
      }
    }
    return text.substring(start, position);
  }

  private String readQuotedIdentifier() throws TrinoProtocolException {
    expect('"');
    StringBuilder name = new StringBuilder();
    while (true) {
      if (atEnd()) {
        throw error("unterminated quoted identifier");
      }
      char c = text.charAt(position++);
      if (c == '"') {
        if (peek() == '"') {
          name.append('"');
          position++;
        } else {
          return name.toString();
        }
      } else {
        name.append(c);
      }
    }
  }

  private long readNumber() throws TrinoProtocolException {
    int start = position;
    while (Character.isDigit(peek())) {
      position++;
    }
    try {
      return Long.parseLong(text.substring(start, position));
    } catch (NumberFormatException e) {
      throw error("invalid numeric type argument");
    }
  }

  private void skipWhitespace() {
    while (!atEnd() && Character.isWhitespace(text.charAt(position))) {
      position++;
    }
  }

  private boolean atEnd() {
    return position >= text.length();
  }

  private char peek() {
    return atEnd() ? '\0' : text.charAt(position);
  }

  private boolean consume(char expected) {
    if (peek() == expected) {
      position++;
      return true;
    }
    return false;
  }

  private void expect(char expected) throws TrinoProtocolException {
    if (!consume(expected)) {
      throw error("expected '" + expected + "'");
    }
  }

  private TrinoProtocolException error(String detail) {
    return new TrinoProtocolException(
        String.format("Cannot parse type '%s' at position %d: %s", text, position, detail));
  }

  private static String normalize(String name) {
    return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }
}
