package io.zmanim.ast;

/** A comparison operator used in conditions. */
public enum ComparisonOperator {
  GT(">"),
  LT("<"),
  GE(">="),
  LE("<="),
  EQ("=="),
  NE("!=");

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  /**
   * Applies this operator to the result of a three-way comparison.
   *
   * @param cmp negative, zero or positive as from {@link Comparable#compareTo}
   * @return the boolean outcome
   */
  public boolean test(int cmp) {
    return switch (this) {
      case GT -> cmp > 0;
      case LT -> cmp < 0;
      case GE -> cmp >= 0;
      case LE -> cmp <= 0;
      case EQ -> cmp == 0;
      case NE -> cmp != 0;
    };
  }

  /**
   * Returns whether this operator only tests equality.
   *
   * @return true for == and !=
   */
  public boolean isEquality() {
    return this == EQ || this == NE;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
