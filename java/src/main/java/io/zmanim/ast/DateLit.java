package io.zmanim.ast;

/**
 * A day-month literal such as {@code 21-May}, resolved against the evaluation year.
 *
 * @param day the day of month
 * @param month the month
 */
public record DateLit(int day, MonthName month) implements Expr {
  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitDate(this);
  }
}
