package io.zmanim.ast;

/**
 * A numeric literal. A leading minus is folded into the value.
 *
 * @param value the number
 */
public record NumberLit(double value) implements Expr {
  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitNumber(this);
  }
}
