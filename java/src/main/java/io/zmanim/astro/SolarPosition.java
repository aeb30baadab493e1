package io.zmanim.astro;

import java.time.LocalDate;

/**
 * The sun's declination and the equation of time at an instant, from the NOAA solar
 * calculator equations.
 *
 * @param declination the solar declination in degrees
 * @param equationOfTime apparent minus mean solar time, in minutes
 */
public record SolarPosition(double declination, double equationOfTime) {
  private static final double UNIX_EPOCH_JULIAN_DAY = 2440587.5;
  private static final double J2000 = 2451545.0;
  private static final double DAYS_PER_CENTURY = 36525.0;

  /**
   * Returns the Julian day number at 0h UT of {@code date}.
   *
   * @param date the calendar date
   * @return the Julian day
   */
  public static double julianDay(LocalDate date) {
    return date.toEpochDay() + UNIX_EPOCH_JULIAN_DAY;
  }

  /**
   * Computes the sun's position.
   *
   * @param julianDay the Julian day, fractional part included
   * @return the position
   */
  public static SolarPosition at(double julianDay) {
    double t = (julianDay - J2000) / DAYS_PER_CENTURY;

    double meanLongitude = normalize(280.46646 + t * (36000.76983 + t * 0.0003032));
    double meanAnomaly = 357.52911 + t * (35999.05029 - 0.0001537 * t);
    double eccentricity = 0.016708634 - t * (0.000042037 + 0.0000001267 * t);

    double m = Math.toRadians(meanAnomaly);
    double equationOfCenter =
        Math.sin(m) * (1.914602 - t * (0.004817 + 0.000014 * t))
            + Math.sin(2 * m) * (0.019993 - 0.000101 * t)
            + Math.sin(3 * m) * 0.000289;
    double trueLongitude = meanLongitude + equationOfCenter;

    double omega = Math.toRadians(125.04 - 1934.136 * t);
    double apparentLongitude = trueLongitude - 0.00569 - 0.00478 * Math.sin(omega);

    double meanObliquity =
        23 + (26 + (21.448 - t * (46.8150 + t * (0.00059 - t * 0.001813))) / 60) / 60;
    double obliquity = Math.toRadians(meanObliquity + 0.00256 * Math.cos(omega));

    double declination =
        Math.toDegrees(
            Math.asin(Math.sin(obliquity) * Math.sin(Math.toRadians(apparentLongitude))));

    double y = Math.pow(Math.tan(obliquity / 2), 2);
    double l0 = Math.toRadians(meanLongitude);
    double equationOfTime =
        4
            * Math.toDegrees(
                y * Math.sin(2 * l0)
                    - 2 * eccentricity * Math.sin(m)
                    + 4 * eccentricity * y * Math.sin(m) * Math.cos(2 * l0)
                    - 0.5 * y * y * Math.sin(4 * l0)
                    - 1.25 * eccentricity * eccentricity * Math.sin(2 * m));

    return new SolarPosition(declination, equationOfTime);
  }

  private static double normalize(double degrees) {
    double d = degrees % 360;
    return d < 0 ? d + 360 : d;
  }
}
