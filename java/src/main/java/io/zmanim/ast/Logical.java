package io.zmanim.ast;

import java.util.List;

/**
 * A boolean connective. {@link LogicalOperator#NOT} has exactly one operand; {@code &&} and
 * {@code ||} have two.
 *
 * @param op the operator
 * @param operands the operands
 */
public record Logical(LogicalOperator op, List<Expr> operands) implements Expr {
  public Logical {
    operands = List.copyOf(operands);
  }

  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitLogical(this);
  }
}
