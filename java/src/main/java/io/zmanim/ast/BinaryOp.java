package io.zmanim.ast;

/**
 * An arithmetic operation.
 *
 * @param op the operator
 * @param lhs the left operand
 * @param rhs the right operand
 */
public record BinaryOp(ArithmeticOperator op, Expr lhs, Expr rhs) implements Expr {
  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitBinary(this);
  }
}
