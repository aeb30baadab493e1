package io.zmanim.parser;

import io.zmanim.ast.Direction;
import io.zmanim.ast.FunctionName;
import java.util.Optional;

/**
 * Legal ranges and directions for function arguments. The parser applies these to literal
 * arguments; the executor applies them again to computed ones.
 */
public final class ArgumentRules {
  public static final double MIN_DEGREES = 0;
  public static final double MAX_DEGREES = 90;
  public static final double MIN_HOURS = 0.5;
  public static final double MAX_HOURS = 12;
  /** Exclusive lower bound. */
  public static final double MIN_PROPORTIONAL_MINUTES = 0;
  public static final double MAX_PROPORTIONAL_MINUTES = 200;

  private ArgumentRules() {}

  /**
   * Checks the numeric first argument of {@code fn}.
   *
   * @param fn the function being called
   * @param value the argument value
   * @return an error message, or empty if the value is legal
   */
  public static Optional<String> checkNumber(FunctionName fn, double value) {
    return switch (fn) {
      case SOLAR, SEASONAL_SOLAR ->
          value < MIN_DEGREES || value > MAX_DEGREES || Double.isNaN(value)
              ? Optional.of(fn + "() degrees must be between 0 and 90, got " + format(value))
              : Optional.<String>empty();
      case PROPORTIONAL_HOURS ->
          value < MIN_HOURS || value > MAX_HOURS || Double.isNaN(value)
              ? Optional.of(fn + "() hours must be between 0.5 and 12, got " + format(value))
              : Optional.<String>empty();
      case PROPORTIONAL_MINUTES ->
          value <= MIN_PROPORTIONAL_MINUTES
                  || value > MAX_PROPORTIONAL_MINUTES
                  || Double.isNaN(value)
              ? Optional.of(
                  fn + "() minutes must be greater than 0 and at most 200, got " + format(value))
              : Optional.<String>empty();
      default -> Optional.empty();
    };
  }

  /**
   * Checks the direction argument of {@code fn}.
   *
   * @param fn the function being called
   * @param direction the direction
   * @return an error message, or empty if the direction is accepted
   */
  public static Optional<String> checkDirection(FunctionName fn, Direction direction) {
    if ((fn == FunctionName.SEASONAL_SOLAR || fn == FunctionName.PROPORTIONAL_MINUTES)
        && !direction.isSunriseOrSunsetOffset()) {
      return Optional.of(
          fn
              + "() direction must be before_visible_sunrise or after_visible_sunset, got "
              + direction);
    }
    return Optional.empty();
  }

  /**
   * Formats a number without a trailing ".0".
   *
   * @param value the number
   * @return the text
   */
  public static String format(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value)) {
      return String.valueOf((long) value);
    }
    return String.valueOf(value);
  }
}
