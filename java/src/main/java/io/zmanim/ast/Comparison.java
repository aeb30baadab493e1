package io.zmanim.ast;

/**
 * A comparison inside a condition.
 *
 * @param op the operator
 * @param lhs the left operand
 * @param rhs the right operand
 */
public record Comparison(ComparisonOperator op, Expr lhs, Expr rhs) implements Expr {
  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitComparison(this);
  }
}
