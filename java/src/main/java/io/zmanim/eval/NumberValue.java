package io.zmanim.eval;

/**
 * A plain number: degrees, hours, a month or a day of the year.
 *
 * @param value the number
 */
public record NumberValue(double value) implements Value {
  @Override
  public String typeName() {
    return "number";
  }
}
