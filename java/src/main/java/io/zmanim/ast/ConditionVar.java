package io.zmanim.ast;

/**
 * A read of one of the condition variables.
 *
 * @param variable the variable
 */
public record ConditionVar(ConditionVariable variable) implements Expr {
  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitConditionVar(this);
  }
}
