package io.zmanim.eval;

import java.time.Instant;

/**
 * An instant on the evaluation day.
 *
 * @param instant the instant
 */
public record TimeValue(Instant instant) implements Value {
  @Override
  public String typeName() {
    return "time";
  }
}
