package io.zmanim.lexer;

/** The type of token. */
public enum TokenKind {
  // Keywords
  /** The "if" keyword. */
  IF,
  /** The "else" keyword. */
  ELSE,

  // Value-carrying tokens
  /** An identifier: primitive, function, direction, base or condition variable name. */
  IDENT,
  /** A numeric literal (e.g., "16.1"). */
  NUMBER,
  /** A duration literal, possibly chained (e.g., "72min", "1h 30min"). */
  DURATION,
  /** A day-month literal (e.g., "21-May"). */
  DATE,
  /** A double-quoted string literal. */
  STRING,
  /** A formula reference (e.g., "@alos_hashachar"). */
  REFERENCE,

  // Operators
  /** The "+" operator. */
  PLUS,
  /** The "-" operator. */
  MINUS,
  /** The "*" operator. */
  STAR,
  /** The "/" operator. */
  SLASH,
  /** The "&gt;" operator. */
  GT,
  /** The "&lt;" operator. */
  LT,
  /** The "&gt;=" operator. */
  GE,
  /** The "&lt;=" operator. */
  LE,
  /** The "==" operator. */
  EQ,
  /** The "!=" operator. */
  NE,
  /** The "&amp;&amp;" operator. */
  AND,
  /** The "||" operator. */
  OR,
  /** The "!" operator. */
  NOT,

  // Punctuation
  /** "(". */
  LPAREN,
  /** ")". */
  RPAREN,
  /** "{". */
  LBRACE,
  /** "}". */
  RBRACE,
  /** A comma separator. */
  COMMA
}
