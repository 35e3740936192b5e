package com.gentoro.graphdsl.tree.memory;

import com.gentoro.graphdsl.exception.QueryException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses query pattern text into {@link PatternNode.TopLevel} patterns.
 *
 * <pre>
 * query     := (pattern | predicate)*
 * pattern   := ( '(' ('_' | IDENT) (child | predicate)* ')'
 *              | '(' pattern predicate* ')'
 *              | '[' pattern+ ']' | STRING | '_' ) ('@' IDENT)*
 * child     := (IDENT ':')? pattern
 * predicate := '(' '#' IDENT '?' (('@' IDENT) | STRING)* ')'
 * </pre>
 */
final class PatternParser {
  static final Set<String> PREDICATES = Set.of("eq?", "not-eq?", "match?", "not-match?");

  private final String s;
  private int i = 0;
  private final Set<String> captureNames = new LinkedHashSet<>();

  PatternParser(String source) {
    this.s = source;
  }

  List<PatternNode.TopLevel> parse() {
    List<PatternNode.TopLevel> patterns = new ArrayList<>();
    skipTrivia();
    while (i < s.length()) {
      if (isPredicateStart()) {
        if (patterns.isEmpty()) {
          throw error("Predicate must follow a pattern");
        }
        PatternNode.TopLevel last = patterns.remove(patterns.size() - 1);
        List<PatternNode.Predicate> predicates = new ArrayList<>(last.predicates());
        predicates.add(parsePredicate());
        patterns.add(new PatternNode.TopLevel(last.pattern(), predicates));
      } else {
        List<PatternNode.Predicate> predicates = new ArrayList<>();
        PatternNode pattern = parsePattern(predicates);
        patterns.add(new PatternNode.TopLevel(pattern, predicates));
      }
      skipTrivia();
    }
    if (patterns.isEmpty()) {
      throw error("Query contains no pattern");
    }
    return patterns;
  }

  /** Capture names in order of first appearance. */
  List<String> captureNames() {
    return new ArrayList<>(captureNames);
  }

  private PatternNode parsePattern(List<PatternNode.Predicate> predicates) {
    skipTrivia();
    if (i >= s.length()) {
      throw error("Unexpected end of query");
    }
    char c = s.charAt(i);
    PatternNode pattern;
    if (c == '(') {
      i++;
      skipTrivia();
      if (i < s.length() && "([\"".indexOf(s.charAt(i)) >= 0) {
        return parseGroup(predicates);
      }
      String kind = readIdentifier();
      if (kind.isEmpty()) {
        throw error("Expected node kind after '('");
      }
      List<PatternNode.Child> children = new ArrayList<>();
      skipTrivia();
      while (i < s.length() && s.charAt(i) != ')') {
        if (isPredicateStart()) {
          predicates.add(parsePredicate());
        } else {
          children.add(parseChild(predicates));
        }
        skipTrivia();
      }
      expect(')');
      pattern =
          new PatternNode.NodePattern(kind.equals("_") ? null : kind, children, parseCaptures());
    } else if (c == '[') {
      i++;
      List<PatternNode> alternatives = new ArrayList<>();
      skipTrivia();
      while (i < s.length() && s.charAt(i) != ']') {
        alternatives.add(parsePattern(predicates));
        skipTrivia();
      }
      expect(']');
      if (alternatives.isEmpty()) {
        throw error("Empty alternation");
      }
      pattern = new PatternNode.Alternation(alternatives, parseCaptures());
    } else if (c == '"') {
      String kind = readString();
      pattern = new PatternNode.AnonymousPattern(kind, parseCaptures());
    } else if (c == '_' && !isIdentifierPart(peekChar(1))) {
      i++;
      pattern = new PatternNode.AnyPattern(parseCaptures());
    } else {
      throw error("Unexpected '" + c + "' in query");
    }
    return pattern;
  }

  // ((pattern) (#predicate? ...)); the opening '(' is already consumed
  private PatternNode parseGroup(List<PatternNode.Predicate> predicates) {
    PatternNode inner = null;
    while (i < s.length() && s.charAt(i) != ')') {
      if (isPredicateStart()) {
        predicates.add(parsePredicate());
      } else if (inner == null) {
        inner = parsePattern(predicates);
      } else {
        throw error("Grouped sibling patterns are not supported");
      }
      skipTrivia();
    }
    expect(')');
    if (inner == null) {
      throw error("Empty group");
    }
    skipTrivia();
    if (i < s.length() && s.charAt(i) == '@') {
      throw error("Captures on a group are not supported");
    }
    return inner;
  }

  private PatternNode.Child parseChild(List<PatternNode.Predicate> predicates) {
    int mark = i;
    String name = readIdentifier();
    skipTrivia();
    if (!name.isEmpty() && i < s.length() && s.charAt(i) == ':') {
      i++;
      return new PatternNode.Child(name, parsePattern(predicates));
    }
    i = mark;
    return new PatternNode.Child(null, parsePattern(predicates));
  }

  private List<String> parseCaptures() {
    List<String> captures = new ArrayList<>();
    skipTrivia();
    while (i < s.length() && s.charAt(i) == '@') {
      i++;
      String name = readIdentifier();
      if (name.isEmpty()) {
        throw error("Expected capture name after '@'");
      }
      captures.add(name);
      captureNames.add(name);
      skipTrivia();
    }
    return captures;
  }

  private PatternNode.Predicate parsePredicate() {
    expect('(');
    skipTrivia();
    expect('#');
    String name = readIdentifier();
    if (i < s.length() && s.charAt(i) == '?') {
      i++;
      name = name + "?";
    }
    if (!PREDICATES.contains(name)) {
      throw error("Unsupported predicate #" + name);
    }
    List<PatternNode.Argument> arguments = new ArrayList<>();
    skipTrivia();
    while (i < s.length() && s.charAt(i) != ')') {
      if (s.charAt(i) == '@') {
        i++;
        String capture = readIdentifier();
        if (!captureNames.contains(capture)) {
          throw error("Predicate #" + name + " refers to unknown capture @" + capture);
        }
        arguments.add(new PatternNode.Argument(capture, true));
      } else if (s.charAt(i) == '"') {
        arguments.add(new PatternNode.Argument(readString(), false));
      } else {
        throw error("Expected capture or string argument to #" + name);
      }
      skipTrivia();
    }
    expect(')');
    if (arguments.size() != 2 || !arguments.get(0).capture()) {
      throw error("Predicate #" + name + " expects a capture and a second argument");
    }
    if (name.endsWith("match?") && arguments.get(1).capture()) {
      throw error("Predicate #" + name + " expects a string pattern as its second argument");
    }
    return new PatternNode.Predicate(name, arguments);
  }

  private boolean isPredicateStart() {
    int j = i;
    if (j >= s.length() || s.charAt(j) != '(') return false;
    j++;
    while (j < s.length() && Character.isWhitespace(s.charAt(j))) j++;
    return j < s.length() && s.charAt(j) == '#';
  }

  private String readString() {
    int start = i;
    i++;
    StringBuilder sb = new StringBuilder();
    while (i < s.length()) {
      char ch = s.charAt(i++);
      if (ch == '"') {
        return sb.toString();
      }
      if (ch == '\\' && i < s.length()) {
        char esc = s.charAt(i++);
        switch (esc) {
          case 'n' -> sb.append('\n');
          case 't' -> sb.append('\t');
          case 'r' -> sb.append('\r');
          case '0' -> sb.append('\0');
          case '"', '\\' -> sb.append(esc);
          default -> sb.append('\\').append(esc);
        }
      } else {
        sb.append(ch);
      }
    }
    i = start;
    throw error("Unterminated string");
  }

  private String readIdentifier() {
    int start = i;
    while (i < s.length() && isIdentifierPart(s.charAt(i))) i++;
    return s.substring(start, i);
  }

  private char peekChar(int offset) {
    return i + offset < s.length() ? s.charAt(i + offset) : '\0';
  }

  private void skipTrivia() {
    while (i < s.length()) {
      char c = s.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (c == ';') {
        while (i < s.length() && s.charAt(i) != '\n') i++;
      } else {
        break;
      }
    }
  }

  private void expect(char c) {
    skipTrivia();
    if (i >= s.length() || s.charAt(i) != c) {
      throw error("Expected '" + c + "'");
    }
    i++;
  }

  private QueryException error(String message) {
    QueryException e = new QueryException(message + " at offset " + i);
    e.withContext("offset", i);
    return e;
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '-';
  }
}
