package com.gentoro.graphdsl.parser;

import com.gentoro.graphdsl.ast.DslFile;
import com.gentoro.graphdsl.ast.Expression;
import com.gentoro.graphdsl.ast.Location;
import com.gentoro.graphdsl.ast.Stanza;
import com.gentoro.graphdsl.ast.Statement;
import com.gentoro.graphdsl.exception.ParseException;
import com.gentoro.graphdsl.graph.Value;
import com.gentoro.graphdsl.logging.LoggingService;
import com.gentoro.graphdsl.parser.DslLexer.Token;
import com.gentoro.graphdsl.parser.DslLexer.TokenType;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;

/**
 * Recursive-descent parser for graph DSL files.
 *
 * <p>Grammar summary:
 *
 * <pre>
 * file       := stanza*
 * stanza     := QUERY-TEXT '{' statement* '}'
 * statement  := 'node' expr
 *             | 'edge' expr '->' expr
 *             | 'attr' target attribute (',' attribute)*
 *             | ('let' | 'var' | 'set') variable '=' expr
 *             | 'scan' expr '{' (STRING '{' statement* '}')* '}'
 *             | 'print' expr (',' expr)*
 * target     := '(' expr ('->' expr)? ')' | expr ('->' expr)?
 * attribute  := IDENT ('=' expr)?
 * expr       := primary ('.' IDENT | '::' IDENT)*
 * primary    := '#true' | '#false' | '#null' | STRING | INTEGER
 *             | '[' elements ']' | '{' elements '}'
 *             | '@' IDENT | '$' DIGITS | IDENT
 *             | '(' (IDENT | SYMBOL) expr* ')' | '(' expr ')'
 * </pre>
 *
 * Query patterns are not parsed here; their raw text is stored on the {@link Stanza}.
 */
public final class DslParser {
  private static final Logger log = LoggingService.getLogger(DslParser.class);

  private final DslLexer lexer;
  private final List<Token> lookahead = new ArrayList<>();

  private DslParser(String source) {
    this.lexer = new DslLexer(source);
  }

  /**
   * Parse DSL source text.
   *
   * @throws ParseException on the first syntax error
   */
  public static DslFile parse(String source) {
    DslFile file = new DslParser(source).parseFile();
    log.debug("Parsed DSL file with {} stanza(s)", file.stanzas().size());
    return file;
  }

  private DslFile parseFile() {
    List<Stanza> stanzas = new ArrayList<>();
    while (!lexer.atEnd()) {
      Location location = lexer.location();
      String query = lexer.readQuery();
      List<Statement> statements = parseBlock();
      stanzas.add(new Stanza(query, statements, location));
    }
    return new DslFile(stanzas);
  }

  private List<Statement> parseBlock() {
    expect(TokenType.LBRACE, "'{'");
    List<Statement> statements = new ArrayList<>();
    while (!peek().is(TokenType.RBRACE)) {
      if (peek().is(TokenType.EOF)) {
        throw error(peek(), "Expected '}' to close block");
      }
      statements.add(parseStatement());
    }
    next();
    return statements;
  }

  private Statement parseStatement() {
    Token keyword = next();
    if (!keyword.is(TokenType.IDENTIFIER)) {
      throw error(keyword, "Expected a statement but found " + keyword);
    }
    Location location = keyword.location();
    switch (keyword.text()) {
      case "node":
        return new Statement.NodeStatement(parseExpression(), location);
      case "edge":
        {
          Expression source = parseExpression();
          expect(TokenType.ARROW, "'->'");
          Expression sink = parseExpression();
          return new Statement.EdgeStatement(source, sink, location);
        }
      case "attr":
        return parseAttr(location);
      case "let":
        {
          Expression.Variable variable = parseVariable();
          return new Statement.LetStatement(variable, parseAssignedValue(), location);
        }
      case "var":
        {
          Expression.Variable variable = parseVariable();
          return new Statement.VarStatement(variable, parseAssignedValue(), location);
        }
      case "set":
        {
          Expression.Variable variable = parseVariable();
          return new Statement.SetStatement(variable, parseAssignedValue(), location);
        }
      case "scan":
        return parseScan(location);
      case "print":
        {
          List<Expression> values = new ArrayList<>();
          values.add(parseExpression());
          while (peek().is(TokenType.COMMA)) {
            next();
            values.add(parseExpression());
          }
          return new Statement.PrintStatement(values, location);
        }
      default:
        throw error(keyword, "Unknown statement '" + keyword.text() + "'");
    }
  }

  private Statement parseAttr(Location location) {
    Expression node;
    Expression sink = null;
    if (peek().is(TokenType.LPAREN)) {
      next();
      node = parseExpression();
      if (peek().is(TokenType.ARROW)) {
        next();
        sink = parseExpression();
      }
      expect(TokenType.RPAREN, "')'");
    } else {
      node = parseExpression();
      if (peek().is(TokenType.ARROW)) {
        next();
        sink = parseExpression();
      }
    }

    List<Statement.AttributeAssignment> attributes = new ArrayList<>();
    do {
      if (!attributes.isEmpty()) next(); // comma
      Token name = expect(TokenType.IDENTIFIER, "attribute name");
      Expression value = new Expression.Literal(Value.TRUE);
      if (peek().is(TokenType.EQUALS)) {
        next();
        value = parseExpression();
      }
      attributes.add(new Statement.AttributeAssignment(name.text(), value));
    } while (peek().is(TokenType.COMMA));
    return new Statement.AttrStatement(node, sink, attributes, location);
  }

  private Statement parseScan(Location location) {
    Expression subject = parseExpression();
    expect(TokenType.LBRACE, "'{'");
    List<Statement.ScanArm> arms = new ArrayList<>();
    while (!peek().is(TokenType.RBRACE)) {
      Token regex = expect(TokenType.STRING, "regular expression");
      Pattern pattern;
      try {
        pattern = Pattern.compile(regex.text());
      } catch (PatternSyntaxException e) {
        throw new ParseException(
            "Invalid regular expression \"" + regex.text() + "\": " + e.getDescription(),
            regex.line(),
            regex.column(),
            e);
      }
      List<Statement> statements = parseBlock();
      arms.add(new Statement.ScanArm(pattern, statements, regex.location()));
    }
    next();
    return new Statement.ScanStatement(subject, arms, location);
  }

  private Expression.Variable parseVariable() {
    Token start = peek();
    Expression expression = parseExpression();
    if (expression instanceof Expression.Variable variable) {
      return variable;
    }
    throw error(start, "Expected a variable name or scoped variable");
  }

  private Expression parseAssignedValue() {
    expect(TokenType.EQUALS, "'='");
    return parseExpression();
  }

  private Expression parseExpression() {
    Expression expression = parsePrimary();
    while (true) {
      Token token = peek();
      if (token.is(TokenType.DOT)) {
        List<String> tags = new ArrayList<>();
        while (peek().is(TokenType.DOT)) {
          next();
          tags.add(expect(TokenType.IDENTIFIER, "tag name").text());
        }
        expression = new Expression.TagPath(expression, tags);
      } else if (token.is(TokenType.DOUBLE_COLON)) {
        next();
        String name = expect(TokenType.IDENTIFIER, "scoped variable name").text();
        expression = new Expression.ScopedVariable(expression, name);
      } else {
        return expression;
      }
    }
  }

  private Expression parsePrimary() {
    Token token = next();
    switch (token.type()) {
      case HASH_LITERAL:
        if (token.text().equals("true")) return new Expression.Literal(Value.TRUE);
        if (token.text().equals("false")) return new Expression.Literal(Value.FALSE);
        return new Expression.Literal(Value.NULL);
      case STRING:
        return new Expression.Literal(Value.of(token.text()));
      case INTEGER:
        return new Expression.Literal(Value.of(parseInteger(token)));
      case LBRACKET:
        return new Expression.ListLiteral(parseElements(TokenType.RBRACKET, "']'"));
      case LBRACE:
        return new Expression.SetLiteral(parseElements(TokenType.RBRACE, "'}'"));
      case CAPTURE:
        return new Expression.Capture(token.text());
      case REGEX_GROUP:
      case IDENTIFIER:
        return new Expression.UnscopedVariable(token.text());
      case LPAREN:
        return parseParenthesized();
      default:
        throw error(token, "Expected an expression but found " + token);
    }
  }

  // '(' has been consumed. A function name followed by anything but '.' or '::' is a call;
  // everything else is a grouped expression.
  private Expression parseParenthesized() {
    Token first = peek();
    boolean call =
        first.is(TokenType.SYMBOL)
            || (first.is(TokenType.IDENTIFIER)
                && !peek(1).is(TokenType.DOT)
                && !peek(1).is(TokenType.DOUBLE_COLON));
    if (call) {
      String function = next().text();
      List<Expression> arguments = new ArrayList<>();
      while (!peek().is(TokenType.RPAREN)) {
        if (peek().is(TokenType.EOF)) {
          throw error(peek(), "Expected ')' to close call to '" + function + "'");
        }
        arguments.add(parseExpression());
      }
      next();
      return new Expression.Call(function, arguments);
    }
    Expression inner = parseExpression();
    expect(TokenType.RPAREN, "')'");
    return inner;
  }

  private List<Expression> parseElements(TokenType close, String closeText) {
    List<Expression> elements = new ArrayList<>();
    while (!peek().is(close)) {
      elements.add(parseExpression());
      if (peek().is(TokenType.COMMA)) {
        next();
      } else if (!peek().is(close)) {
        throw error(peek(), "Expected ',' or " + closeText + " but found " + peek());
      }
    }
    next();
    return elements;
  }

  private long parseInteger(Token token) {
    String digits = token.text();
    // more than 10 digits can never fit in 32 bits; avoids long overflow below
    if (digits.length() > 10 || Long.parseLong(digits) > Value.MAX_INTEGER) {
      throw error(token, "Integer literal " + digits + " does not fit in 32 bits");
    }
    return Long.parseLong(digits);
  }

  private Token expect(TokenType type, String description) {
    Token token = next();
    if (!token.is(type)) {
      throw error(token, "Expected " + description + " but found " + token);
    }
    return token;
  }

  private Token peek() {
    return peek(0);
  }

  private Token peek(int offset) {
    while (lookahead.size() <= offset) {
      lookahead.add(lexer.next());
    }
    return lookahead.get(offset);
  }

  private Token next() {
    if (!lookahead.isEmpty()) {
      return lookahead.remove(0);
    }
    return lexer.next();
  }

  private static ParseException error(Token token, String message) {
    return new ParseException(message, token.line(), token.column());
  }
}
