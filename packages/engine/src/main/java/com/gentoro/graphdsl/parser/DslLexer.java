package com.gentoro.graphdsl.parser;

import com.gentoro.graphdsl.ast.Location;
import com.gentoro.graphdsl.exception.ParseException;

/**
 * Character-level tokenizer for graph DSL source.
 *
 * <p>Besides regular tokens the lexer can hand out the raw text of a stanza's query pattern (see
 * {@link #readQuery()}): query patterns belong to the query engine and are not tokenized here.
 */
final class DslLexer {

  enum TokenType {
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    COMMA,
    DOT,
    DOUBLE_COLON,
    ARROW,
    EQUALS,
    CAPTURE,
    REGEX_GROUP,
    IDENTIFIER,
    SYMBOL,
    STRING,
    INTEGER,
    HASH_LITERAL,
    EOF
  }

  record Token(TokenType type, String text, int line, int column) {
    Location location() {
      return new Location(line, column);
    }

    boolean is(TokenType t) {
      return type == t;
    }

    boolean isKeyword(String keyword) {
      return type == TokenType.IDENTIFIER && text.equals(keyword);
    }

    @Override
    public String toString() {
      return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
  }

  private final String s;
  private int i = 0;
  private int line = 1;
  private int column = 1;

  DslLexer(String source) {
    this.s = source;
  }

  /** True when only whitespace and comments remain. */
  boolean atEnd() {
    skipTrivia();
    return i >= s.length();
  }

  Location location() {
    return new Location(line, column);
  }

  Token next() {
    skipTrivia();
    int startLine = line;
    int startColumn = column;
    if (i >= s.length()) return t(TokenType.EOF, "", startLine, startColumn);
    char c = s.charAt(i);

    switch (c) {
      case '(':
        advance();
        return t(TokenType.LPAREN, "(", startLine, startColumn);
      case ')':
        advance();
        return t(TokenType.RPAREN, ")", startLine, startColumn);
      case '[':
        advance();
        return t(TokenType.LBRACKET, "[", startLine, startColumn);
      case ']':
        advance();
        return t(TokenType.RBRACKET, "]", startLine, startColumn);
      case '{':
        advance();
        return t(TokenType.LBRACE, "{", startLine, startColumn);
      case '}':
        advance();
        return t(TokenType.RBRACE, "}", startLine, startColumn);
      case ',':
        advance();
        return t(TokenType.COMMA, ",", startLine, startColumn);
      case '.':
        advance();
        return t(TokenType.DOT, ".", startLine, startColumn);
      default:
        break;
    }

    if (c == ':') {
      if (match("::")) return t(TokenType.DOUBLE_COLON, "::", startLine, startColumn);
      throw new ParseException("Expected '::'", startLine, startColumn);
    }

    if (c == '"') {
      return t(TokenType.STRING, readString(), startLine, startColumn);
    }

    if (c == '@') {
      advance();
      String name = readIdentifier();
      if (name.isEmpty()) {
        throw new ParseException("Expected capture name after '@'", startLine, startColumn);
      }
      return t(TokenType.CAPTURE, name, startLine, startColumn);
    }

    if (c == '$') {
      advance();
      int start = i;
      while (i < s.length() && Character.isDigit(s.charAt(i))) advance();
      if (i == start) {
        throw new ParseException("Expected group number after '$'", startLine, startColumn);
      }
      return t(TokenType.REGEX_GROUP, "$" + s.substring(start, i), startLine, startColumn);
    }

    if (c == '#') {
      advance();
      String word = readIdentifier();
      if (!word.equals("true") && !word.equals("false") && !word.equals("null")) {
        throw new ParseException("Unknown literal '#" + word + "'", startLine, startColumn);
      }
      return t(TokenType.HASH_LITERAL, word, startLine, startColumn);
    }

    if (Character.isDigit(c)) {
      int start = i;
      while (i < s.length() && Character.isDigit(s.charAt(i))) advance();
      return t(TokenType.INTEGER, s.substring(start, i), startLine, startColumn);
    }

    if (isIdentifierStart(c)) {
      return t(TokenType.IDENTIFIER, readIdentifier(), startLine, startColumn);
    }

    if (isSymbolChar(c)) {
      if (match("->")) return t(TokenType.ARROW, "->", startLine, startColumn);
      int start = i;
      while (i < s.length() && isSymbolChar(s.charAt(i)) && !s.startsWith("->", i)) advance();
      String symbol = s.substring(start, i);
      if (symbol.equals("=")) return t(TokenType.EQUALS, "=", startLine, startColumn);
      return t(TokenType.SYMBOL, symbol, startLine, startColumn);
    }

    throw new ParseException("Unexpected character '" + c + "'", startLine, startColumn);
  }

  /**
   * Read the raw query pattern of a stanza: everything up to the first '{' that is not nested in
   * parentheses or brackets and not part of a string or comment. The brace itself is not consumed.
   */
  String readQuery() {
    skipTrivia();
    int startLine = line;
    int startColumn = column;
    int start = i;
    int depth = 0;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (c == '"') {
        skipQueryString(startLine, startColumn);
        continue;
      }
      if (c == ';') {
        skipComment();
        continue;
      }
      if (c == '(' || c == '[') {
        depth++;
      } else if (c == ')' || c == ']') {
        depth--;
      } else if (c == '{' && depth <= 0) {
        String query = s.substring(start, i).trim();
        if (query.isEmpty()) {
          throw new ParseException("Expected a query pattern", startLine, startColumn);
        }
        return query;
      }
      advance();
    }
    throw new ParseException("Expected '{' after query pattern", startLine, startColumn);
  }

  private String readString() {
    int startLine = line;
    int startColumn = column;
    advance(); // opening quote
    StringBuilder sb = new StringBuilder();
    while (i < s.length()) {
      char ch = s.charAt(i);
      advance();
      if (ch == '"') {
        return sb.toString();
      }
      if (ch == '\\') {
        if (i >= s.length()) break;
        char esc = s.charAt(i);
        advance();
        switch (esc) {
          case '\\' -> sb.append('\\');
          case '"' -> sb.append('"');
          case '0' -> sb.append('\0');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          default -> throw new ParseException(
              "Invalid escape sequence '\\" + esc + "'", line, column - 2);
        }
      } else {
        sb.append(ch);
      }
    }
    throw new ParseException("Unterminated string literal", startLine, startColumn);
  }

  // Query strings follow the query engine's escaping rules; only the extent matters here.
  private void skipQueryString(int queryLine, int queryColumn) {
    advance();
    while (i < s.length()) {
      char ch = s.charAt(i);
      advance();
      if (ch == '"') return;
      if (ch == '\\' && i < s.length()) advance();
    }
    throw new ParseException("Unterminated string in query pattern", queryLine, queryColumn);
  }

  private String readIdentifier() {
    int start = i;
    if (i < s.length() && isIdentifierStart(s.charAt(i))) {
      advance();
      while (i < s.length() && isIdentifierPart(s.charAt(i))) {
        // a '-' directly followed by '>' starts an arrow, not part of the name
        if (s.startsWith("->", i)) break;
        advance();
      }
    }
    return s.substring(start, i);
  }

  private void skipTrivia() {
    while (i < s.length()) {
      char c = s.charAt(i);
      if (Character.isWhitespace(c)) {
        advance();
      } else if (c == ';') {
        skipComment();
      } else {
        break;
      }
    }
  }

  private void skipComment() {
    while (i < s.length() && s.charAt(i) != '\n') advance();
  }

  private boolean match(String op) {
    if (s.startsWith(op, i)) {
      for (int k = 0; k < op.length(); k++) advance();
      return true;
    }
    return false;
  }

  private void advance() {
    if (s.charAt(i) == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    i++;
  }

  private static Token t(TokenType type, String text, int line, int column) {
    return new Token(type, text, line, column);
  }

  private static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '-';
  }

  private static boolean isSymbolChar(char c) {
    return c == '+' || c == '-' || c == '*' || c == '/' || c == '<' || c == '>' || c == '='
        || c == '!';
  }
}
