package io.zmanim.eval;

/** Meteorological season, by month and hemisphere. */
public enum Season {
  SPRING("spring"),
  SUMMER("summer"),
  AUTUMN("autumn"),
  WINTER("winter");

  private final String displayName;

  Season(String displayName) {
    this.displayName = displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Returns the season for a month at a latitude. Latitude zero counts as northern.
   *
   * @param month the month number, 1 to 12
   * @param latitude degrees north
   * @return the season
   */
  public static Season of(int month, double latitude) {
    boolean northern = latitude >= 0;
    return switch (month) {
      case 3, 4, 5 -> northern ? SPRING : AUTUMN;
      case 6, 7, 8 -> northern ? SUMMER : WINTER;
      case 9, 10, 11 -> northern ? AUTUMN : SPRING;
      default -> northern ? WINTER : SUMMER;
    };
  }
}
