package io.zmanim.ast;

/**
 * A duration literal such as {@code 72min} or {@code 1h 30min}, held in minutes.
 *
 * @param minutes the signed length in minutes
 */
public record DurationLit(double minutes) implements Expr {
  /** The longest literal whose length fits in a {@code long} count of nanoseconds. */
  public static final double MAX_MINUTES = Long.MAX_VALUE / 60e9;

  /**
   * Converts this literal to a {@link java.time.Duration} with nanosecond precision.
   *
   * @return the duration
   */
  public java.time.Duration toDuration() {
    return java.time.Duration.ofNanos(Math.round(minutes * 60_000_000_000d));
  }

  @Override
  public <R, E extends Exception> R accept(ExprVisitor<R, E> visitor) throws E {
    return visitor.visitDuration(this);
  }
}
