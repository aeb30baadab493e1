package io.zmanim.ast;

import java.util.Arrays;
import java.util.Optional;

/** Represents a month of the year as written in day-month literals. */
public enum MonthName {
  JANUARY(1, "Jan"),
  FEBRUARY(2, "Feb"),
  MARCH(3, "Mar"),
  APRIL(4, "Apr"),
  MAY(5, "May"),
  JUNE(6, "Jun"),
  JULY(7, "Jul"),
  AUGUST(8, "Aug"),
  SEPTEMBER(9, "Sep"),
  OCTOBER(10, "Oct"),
  NOVEMBER(11, "Nov"),
  DECEMBER(12, "Dec");

  private final int monthNumber;
  private final String abbreviation;

  MonthName(int monthNumber, String abbreviation) {
    this.monthNumber = monthNumber;
    this.abbreviation = abbreviation;
  }

  /**
   * Returns the month number (January=1, December=12).
   *
   * @return the month number
   */
  public int number() {
    return monthNumber;
  }

  @Override
  public String toString() {
    return abbreviation;
  }

  /**
   * Looks up a month by its three-letter abbreviation. Matching is case sensitive ("May", not
   * "may").
   *
   * @param s the abbreviation
   * @return the month if valid
   */
  public static Optional<MonthName> fromAbbreviation(String s) {
    return Arrays.stream(values()).filter(m -> m.abbreviation.equals(s)).findFirst();
  }

  /**
   * Converts this MonthName to a java.time.Month.
   *
   * @return the corresponding Month
   */
  public java.time.Month toMonth() {
    return java.time.Month.of(monthNumber);
  }
}
