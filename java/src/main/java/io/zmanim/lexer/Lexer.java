package io.zmanim.lexer;

import io.zmanim.Span;
import io.zmanim.ZmanimException;
import io.zmanim.ast.MonthName;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Tokenizes formula text into a list of tokens. Comments and whitespace are discarded. */
public final class Lexer {
  private static final Map<String, TokenKind> KEYWORDS =
      Map.ofEntries(Map.entry("if", TokenKind.IF), Map.entry("else", TokenKind.ELSE));

  private final String input;
  private int pos;

  private Lexer(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Tokenizes the input string into a list of tokens.
   *
   * @param input the formula text to tokenize
   * @return a list of tokens
   * @throws ZmanimException if the input contains invalid characters
   */
  public static List<Token> tokenize(String input) throws ZmanimException {
    return new Lexer(input).doTokenize();
  }

  private List<Token> doTokenize() throws ZmanimException {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespaceAndComments();
      if (pos >= input.length()) {
        break;
      }

      int start = pos;
      char ch = input.charAt(pos);

      boolean leadingDot =
          ch == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1));
      if (isDigit(ch) || leadingDot) {
        tokens.add(lexNumeric());
        continue;
      }

      if (isIdentStart(ch)) {
        tokens.add(lexWord());
        continue;
      }

      if (ch == '@') {
        pos++;
        if (pos >= input.length() || !isIdentStart(input.charAt(pos))) {
          throw ZmanimException.lex(
              "expected formula key after '@'", new Span(start, start + 1), input);
        }
        String key = readIdent();
        tokens.add(Token.reference(key, new Span(start, pos)));
        continue;
      }

      if (ch == '"') {
        tokens.add(lexString());
        continue;
      }

      Token op = lexOperator(start, ch);
      if (op != null) {
        tokens.add(op);
        continue;
      }

      throw ZmanimException.lex(
          "unexpected character '" + ch + "'", new Span(start, start + 1), input);
    }

    return tokens;
  }

  private void skipWhitespaceAndComments() throws ZmanimException {
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (Character.isWhitespace(c)) {
        pos++;
      } else if (c == '/' && peekChar(1) == '/') {
        while (pos < input.length() && input.charAt(pos) != '\n') {
          pos++;
        }
      } else if (c == '/' && peekChar(1) == '*') {
        int start = pos;
        int close = input.indexOf("*/", pos + 2);
        if (close < 0) {
          throw ZmanimException.lex(
              "unterminated block comment", new Span(start, start + 2), input);
        }
        pos = close + 2;
      } else {
        return;
      }
    }
  }

  private Token lexOperator(int start, char ch) {
    char next = peekChar(1);
    return switch (ch) {
      case '+' -> single(TokenKind.PLUS, start);
      case '-' -> single(TokenKind.MINUS, start);
      case '*' -> single(TokenKind.STAR, start);
      case '/' -> single(TokenKind.SLASH, start);
      case '(' -> single(TokenKind.LPAREN, start);
      case ')' -> single(TokenKind.RPAREN, start);
      case '{' -> single(TokenKind.LBRACE, start);
      case '}' -> single(TokenKind.RBRACE, start);
      case ',' -> single(TokenKind.COMMA, start);
      case '>' -> next == '=' ? pair(TokenKind.GE, start) : single(TokenKind.GT, start);
      case '<' -> next == '=' ? pair(TokenKind.LE, start) : single(TokenKind.LT, start);
      case '!' -> next == '=' ? pair(TokenKind.NE, start) : single(TokenKind.NOT, start);
      case '=' -> next == '=' ? pair(TokenKind.EQ, start) : null;
      case '&' -> next == '&' ? pair(TokenKind.AND, start) : null;
      case '|' -> next == '|' ? pair(TokenKind.OR, start) : null;
      default -> null;
    };
  }

  private Token single(TokenKind kind, int start) {
    pos = start + 1;
    return Token.symbol(kind, input.substring(start, pos), new Span(start, pos));
  }

  private Token pair(TokenKind kind, int start) {
    pos = start + 2;
    return Token.symbol(kind, input.substring(start, pos), new Span(start, pos));
  }

  private Token lexNumeric() {
    int start = pos;
    readNumber();

    // Day-month literal: 21-May
    if (pos - start <= 2 && peekChar(0) == '-' && isMonthAt(pos + 1)) {
      pos += 4;
      return Token.date(input.substring(start, pos), new Span(start, pos));
    }

    if (pos < input.length() && isIdentStart(input.charAt(pos))) {
      // Duration literal. Units are validated by the parser so that a bad
      // suffix is reported as a malformed duration rather than a stray word.
      readIdentTail();
      while (chainedDurationAhead()) {
        skipPlainWhitespace();
        readNumber();
        readIdentTail();
      }
      return Token.duration(input.substring(start, pos), new Span(start, pos));
    }

    String text = input.substring(start, pos);
    return Token.number(text, Double.parseDouble(text), new Span(start, pos));
  }

  private boolean chainedDurationAhead() {
    int p = pos;
    while (p < input.length() && (input.charAt(p) == ' ' || input.charAt(p) == '\t')) {
      p++;
    }
    if (p == pos || p >= input.length() || !isDigit(input.charAt(p))) {
      return false;
    }
    while (p < input.length() && (isDigit(input.charAt(p)) || input.charAt(p) == '.')) {
      p++;
    }
    return p < input.length() && isIdentStart(input.charAt(p));
  }

  private void skipPlainWhitespace() {
    while (pos < input.length() && (input.charAt(pos) == ' ' || input.charAt(pos) == '\t')) {
      pos++;
    }
  }

  private void readNumber() {
    while (pos < input.length() && isDigit(input.charAt(pos))) {
      pos++;
    }
    if (peekChar(0) == '.' && isDigit(peekChar(1))) {
      pos++;
      while (pos < input.length() && isDigit(input.charAt(pos))) {
        pos++;
      }
    }
  }

  private boolean isMonthAt(int p) {
    if (p + 3 > input.length()) {
      return false;
    }
    if (p + 3 < input.length() && isIdentPart(input.charAt(p + 3))) {
      return false;
    }
    return MonthName.fromAbbreviation(input.substring(p, p + 3)).isPresent();
  }

  private Token lexWord() {
    int start = pos;
    String word = readIdent();
    Span span = new Span(start, pos);
    TokenKind keyword = KEYWORDS.get(word);
    if (keyword != null) {
      return Token.symbol(keyword, word, span);
    }
    return Token.ident(word, span);
  }

  private Token lexString() throws ZmanimException {
    int start = pos;
    pos++; // skip opening quote
    int close = input.indexOf('"', pos);
    if (close < 0) {
      throw ZmanimException.lex("unterminated string", new Span(start, input.length()), input);
    }
    String contents = input.substring(pos, close);
    pos = close + 1;
    return Token.string(contents, new Span(start, pos));
  }

  private String readIdent() {
    int start = pos;
    readIdentTail();
    return input.substring(start, pos);
  }

  private void readIdentTail() {
    while (pos < input.length() && isIdentPart(input.charAt(pos))) {
      pos++;
    }
  }

  private char peekChar(int offset) {
    int p = pos + offset;
    return p < input.length() ? input.charAt(p) : '\0';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || isDigit(c);
  }
}
