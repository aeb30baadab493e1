package io.zmanim.ast;

import java.util.Arrays;
import java.util.Optional;

/** A built-in function together with its arity. */
public enum FunctionName {
  SOLAR("solar", 2, false),
  SEASONAL_SOLAR("seasonal_solar", 2, false),
  PROPORTIONAL_HOURS("proportional_hours", 2, false),
  PROPORTIONAL_MINUTES("proportional_minutes", 2, false),
  MIDPOINT("midpoint", 2, false),
  FIRST_VALID("first_valid", 2, true),
  EARLIER_OF("earlier_of", 2, false),
  LATER_OF("later_of", 2, false);

  private final String displayName;
  private final int arity;
  private final boolean variadic;

  FunctionName(String displayName, int arity, boolean variadic) {
    this.displayName = displayName;
    this.arity = arity;
    this.variadic = variadic;
  }

  /**
   * Returns the exact argument count, or the minimum when {@link #isVariadic()}.
   *
   * @return the arity
   */
  public int arity() {
    return arity;
  }

  /**
   * Returns whether the function accepts more than {@link #arity()} arguments.
   *
   * @return true for variadic functions
   */
  public boolean isVariadic() {
    return variadic;
  }

  /**
   * Returns whether {@code count} arguments are acceptable.
   *
   * @param count the argument count
   * @return true if the count matches the arity
   */
  public boolean accepts(int count) {
    return variadic ? count >= arity : count == arity;
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Parses a function name.
   *
   * @param s the name
   * @return the function if known
   */
  public static Optional<FunctionName> parse(String s) {
    return Arrays.stream(values()).filter(f -> f.displayName.equals(s)).findFirst();
  }
}
