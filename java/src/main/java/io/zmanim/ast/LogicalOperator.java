package io.zmanim.ast;

/** A boolean connective. {@link #NOT} takes exactly one operand. */
public enum LogicalOperator {
  AND("&&"),
  OR("||"),
  NOT("!");

  private final String symbol;

  LogicalOperator(String symbol) {
    this.symbol = symbol;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
