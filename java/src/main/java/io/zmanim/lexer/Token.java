package io.zmanim.lexer;

import io.zmanim.Span;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param lexeme the source text of the token; for references the key without the "@"
 * @param span the location in the input
 * @param numberVal the numeric value (for NUMBER tokens)
 */
public record Token(TokenKind kind, String lexeme, Span span, double numberVal) {
  /** Creates an operator, punctuation or keyword token. */
  public static Token symbol(TokenKind kind, String lexeme, Span span) {
    return new Token(kind, lexeme, span, 0);
  }

  /** Creates an identifier token. */
  public static Token ident(String name, Span span) {
    return new Token(TokenKind.IDENT, name, span, 0);
  }

  /** Creates a number token. */
  public static Token number(String text, double value, Span span) {
    return new Token(TokenKind.NUMBER, text, span, value);
  }

  /** Creates a duration token; the parser decodes its lexeme. */
  public static Token duration(String text, Span span) {
    return new Token(TokenKind.DURATION, text, span, 0);
  }

  /** Creates a day-month token. */
  public static Token date(String text, Span span) {
    return new Token(TokenKind.DATE, text, span, 0);
  }

  /** Creates a string token holding the unquoted contents. */
  public static Token string(String contents, Span span) {
    return new Token(TokenKind.STRING, contents, span, 0);
  }

  /** Creates a reference token holding the referenced key. */
  public static Token reference(String key, Span span) {
    return new Token(TokenKind.REFERENCE, key, span, 0);
  }
}
