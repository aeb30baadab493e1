package io.zmanim.ast;

/**
 * A double-quoted string literal, compared against {@code season}.
 *
 * @param value the unquoted contents
 */
public record StringLit(String value) implements Expr {
  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitString(this);
  }
}
