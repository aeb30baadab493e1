package io.zmanim.eval;

/**
 * The result of evaluating an expression.
 *
 * <p>{@link FailureValue} is an ordinary value: a time the sun does not produce on the given day
 * flows through arithmetic unchanged until {@code first_valid} replaces it or it reaches the top
 * of the formula.
 */
public sealed interface Value
    permits TimeValue, DurationValue, NumberValue, BooleanValue, TextValue, FailureValue {

  /**
   * Returns the kind name used in error messages.
   *
   * @return the type name
   */
  String typeName();

  /**
   * Returns whether this value is a failure.
   *
   * @return true for {@link FailureValue}
   */
  default boolean isFailure() {
    return false;
  }
}
