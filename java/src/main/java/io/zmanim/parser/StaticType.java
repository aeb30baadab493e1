package io.zmanim.parser;

import io.zmanim.ast.ArithmeticOperator;
import io.zmanim.ast.ComparisonOperator;
import io.zmanim.ast.ConditionVariable;
import java.util.Optional;

/** The type of an expression as far as it can be known before evaluation. */
public enum StaticType {
  TIME("time"),
  DURATION("duration"),
  NUMBER("number"),
  BOOLEAN("boolean"),
  TEXT("text"),
  DIRECTION("direction"),
  BASE("base");

  private final String displayName;

  StaticType(String displayName) {
    this.displayName = displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Returns the result type of an arithmetic operation.
   *
   * @param op the operator
   * @param lhs the left operand type
   * @param rhs the right operand type
   * @return the result type, or empty if the combination is not allowed
   */
  public static Optional<StaticType> arithmetic(
      ArithmeticOperator op, StaticType lhs, StaticType rhs) {
    StaticType result =
        switch (op) {
          case ADD -> {
            if (lhs == TIME && rhs == DURATION || lhs == DURATION && rhs == TIME) {
              yield TIME;
            }
            yield sameScalar(lhs, rhs);
          }
          case SUBTRACT -> {
            if (lhs == TIME && rhs == DURATION) {
              yield TIME;
            }
            if (lhs == TIME && rhs == TIME) {
              yield DURATION;
            }
            yield sameScalar(lhs, rhs);
          }
          case MULTIPLY -> {
            if (lhs == DURATION && rhs == NUMBER || lhs == NUMBER && rhs == DURATION) {
              yield DURATION;
            }
            yield lhs == NUMBER && rhs == NUMBER ? NUMBER : null;
          }
          case DIVIDE -> {
            if (lhs == DURATION && rhs == NUMBER) {
              yield DURATION;
            }
            yield lhs == NUMBER && rhs == NUMBER ? NUMBER : null;
          }
        };
    return Optional.ofNullable(result);
  }

  private static StaticType sameScalar(StaticType lhs, StaticType rhs) {
    if (lhs == rhs && (lhs == DURATION || lhs == NUMBER)) {
      return lhs;
    }
    return null;
  }

  /**
   * Returns whether two operand types may be compared with {@code op}.
   *
   * @param op the comparison operator
   * @param lhs the left operand type
   * @param rhs the right operand type
   * @return true if the comparison is allowed
   */
  public static boolean comparable(ComparisonOperator op, StaticType lhs, StaticType rhs) {
    if (lhs != rhs) {
      return false;
    }
    return switch (lhs) {
      case NUMBER, DURATION, TIME -> true;
      case TEXT -> op.isEquality();
      default -> false;
    };
  }

  /**
   * Returns the type a condition variable evaluates to.
   *
   * @param variable the variable
   * @return its type
   */
  public static StaticType of(ConditionVariable variable) {
    return switch (variable) {
      case LATITUDE, LONGITUDE, MONTH, DAY, DAY_OF_YEAR, DATE -> NUMBER;
      case DAY_LENGTH -> DURATION;
      case SEASON -> TEXT;
    };
  }
}
