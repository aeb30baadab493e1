package io.zmanim.ast;

/**
 * A direction passed to a solar-angle function.
 *
 * @param direction the direction
 */
public record DirectionArg(Direction direction) implements Expr {
  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitDirection(this);
  }
}
