package io.zmanim.eval;

import java.time.Duration;

/**
 * A signed span of time.
 *
 * @param duration the duration
 */
public record DurationValue(Duration duration) implements Value {
  @Override
  public String typeName() {
    return "duration";
  }
}
