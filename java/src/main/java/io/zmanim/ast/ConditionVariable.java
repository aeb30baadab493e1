package io.zmanim.ast;

import java.util.Arrays;
import java.util.Optional;

/** A read-only variable available inside conditions. */
public enum ConditionVariable {
  LATITUDE("latitude"),
  LONGITUDE("longitude"),
  DAY_LENGTH("day_length"),
  MONTH("month"),
  DAY("day"),
  DAY_OF_YEAR("day_of_year"),
  DATE("date"),
  SEASON("season");

  private final String displayName;

  ConditionVariable(String displayName) {
    this.displayName = displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Parses a condition variable name.
   *
   * @param s the name
   * @return the variable if known
   */
  public static Optional<ConditionVariable> parse(String s) {
    return Arrays.stream(values()).filter(v -> v.displayName.equals(s)).findFirst();
  }
}
