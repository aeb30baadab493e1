package io.zmanim.ast;

/**
 * A reference to another formula by key, written {@code @key}.
 *
 * @param key the referenced formula key
 */
public record Reference(String key) implements Expr {
  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitReference(this);
  }
}
