package io.zmanim.ast;

import java.util.List;

/**
 * An if / else-if / else chain. Branches are tested in order; {@code otherwise} is the trailing
 * else expression, or null when the chain has none.
 *
 * @param branches the guarded branches, at least one
 * @param otherwise the else expression, or null
 */
public record Conditional(List<Branch> branches, Expr otherwise) implements Expr {
  public Conditional {
    branches = List.copyOf(branches);
  }

  /**
   * A single guarded branch.
   *
   * @param condition the boolean condition
   * @param body the expression taken when the condition holds
   */
  public record Branch(Expr condition, Expr body) {}

  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitConditional(this);
  }
}
