package io.zmanim.ast;

/**
 * A reference to an astronomical primitive such as {@code visible_sunrise}.
 *
 * @param primitive the primitive
 */
public record PrimitiveRef(Primitive primitive) implements Expr {
  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitPrimitive(this);
  }
}
