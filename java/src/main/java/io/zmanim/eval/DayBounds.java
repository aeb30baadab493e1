package io.zmanim.eval;

import java.time.Duration;
import java.time.Instant;

/**
 * The start and end of the halachic day under some base.
 *
 * @param start the day start
 * @param end the day end
 */
public record DayBounds(Instant start, Instant end) {
  /**
   * Returns the instant {@code hours} proportional hours after the start, an hour being one
   * twelfth of the day.
   *
   * @param hours the number of proportional hours
   * @return the instant
   */
  public Instant at(double hours) {
    long dayNanos = Duration.between(start, end).toNanos();
    return start.plusNanos(Math.round(dayNanos * hours / 12.0));
  }

  /**
   * Returns bounds shifted outward by {@code offset} at both ends.
   *
   * @param offset the amount to move the start earlier and the end later
   * @return the widened bounds
   */
  public DayBounds widen(Duration offset) {
    return new DayBounds(start.minus(offset), end.plus(offset));
  }
}
