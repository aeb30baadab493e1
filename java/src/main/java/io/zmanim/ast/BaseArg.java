package io.zmanim.ast;

/**
 * A day-boundary base passed to {@code proportional_hours}. {@code start} and {@code end} are
 * set only for {@link Base#CUSTOM}.
 *
 * @param base the base
 * @param start the custom day start, or null
 * @param end the custom day end, or null
 */
public record BaseArg(Base base, Expr start, Expr end) implements Expr {
  /**
   * Creates a named, non-custom base.
   *
   * @param base the base
   * @return the argument node
   */
  public static BaseArg of(Base base) {
    return new BaseArg(base, null, null);
  }

  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitBase(this);
  }
}
