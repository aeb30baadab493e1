package io.zmanim;

/** The category of a failure raised while lexing, parsing, checking or evaluating a formula. */
public enum ErrorKind {
  /** Lexer error - a character that cannot start any token. */
  LEX("lex"),
  /** Parser error - grammar violation, unknown name or wrong arity. */
  PARSE("parse"),
  /** Type error - operands or arguments of the wrong kind or outside their legal range. */
  TYPE("type"),
  /** Reference error - an {@code @key} with no resolved value. */
  REFERENCE("reference"),
  /** The formula graph contains a cycle. */
  CIRCULAR_REFERENCE("circular_reference"),
  /** Evaluation produced no time, e.g. the sun never reaches the requested angle. */
  EVAL("eval");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
