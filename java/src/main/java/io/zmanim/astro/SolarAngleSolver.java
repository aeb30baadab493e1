package io.zmanim.astro;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the instant the sun's center crosses a given zenith distance on a given day.
 *
 * <p>Each solve starts from solar noon and re-evaluates the sun's position at the previous
 * estimate until successive estimates agree. The loop is bounded; a day on which the sun never
 * reaches the angle, or on which the estimates do not settle, yields an empty result.
 */
public final class SolarAngleSolver {
  private static final Logger log = LoggerFactory.getLogger(SolarAngleSolver.class);

  /** Geometric horizon: the sun's center on the horizon. */
  public static final double GEOMETRIC_ZENITH = 90.0;

  /** 34 arc-minutes of refraction plus 16 arc-minutes of solar semi-diameter. */
  public static final double VISIBLE_ZENITH = 90.0 + 50.0 / 60.0;

  /** Upper bound on refinement steps for one solve. */
  public static final int MAX_ITERATIONS = 10;

  /** Estimates closer than this, in minutes, are considered converged. */
  static final double CONVERGENCE_MINUTES = 1e-4;

  private static final double MINUTES_PER_DAY = 1440.0;

  private SolarAngleSolver() {}

  /**
   * Returns the instant of apparent solar noon.
   *
   * @param date the local calendar date
   * @param longitude degrees east
   * @return solar noon
   */
  public static Instant solarNoon(LocalDate date, double longitude) {
    return toInstant(date, solarNoonMinutes(date, longitude));
  }

  /**
   * Returns the instant the sun is {@code degrees} below the geometric horizon.
   *
   * @param date the local calendar date
   * @param latitude degrees north
   * @param longitude degrees east
   * @param degrees the depression angle
   * @param morning true for the dawn crossing, false for dusk
   * @return the crossing, or empty if the sun does not reach that depression
   */
  public static Optional<Instant> depression(
      LocalDate date, double latitude, double longitude, double degrees, boolean morning) {
    return crossing(date, latitude, longitude, GEOMETRIC_ZENITH + degrees, morning);
  }

  /**
   * Returns the instant the sun's center is at {@code zenith} degrees from the zenith.
   *
   * @param date the local calendar date
   * @param latitude degrees north
   * @param longitude degrees east
   * @param zenith the zenith distance in degrees
   * @param morning true for the morning crossing, false for the evening one
   * @return the crossing, or empty if there is none or the solve did not converge
   */
  public static Optional<Instant> crossing(
      LocalDate date, double latitude, double longitude, double zenith, boolean morning) {
    OptionalDouble minutes = crossingMinutes(date, latitude, longitude, zenith, morning);
    if (minutes.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(toInstant(date, minutes.getAsDouble()));
  }

  private static OptionalDouble crossingMinutes(
      LocalDate date, double latitude, double longitude, double zenith, boolean morning) {
    double jd = SolarPosition.julianDay(date);
    double estimate = solarNoonMinutes(date, longitude);

    for (int i = 0; i < MAX_ITERATIONS; i++) {
      SolarPosition sun = SolarPosition.at(jd + estimate / MINUTES_PER_DAY);
      OptionalDouble hourAngle = hourAngle(latitude, sun.declination(), zenith);
      if (hourAngle.isEmpty()) {
        return OptionalDouble.empty();
      }
      double offset = 4 * hourAngle.getAsDouble();
      double next =
          720 - 4 * longitude - sun.equationOfTime() + (morning ? -offset : offset);
      if (Math.abs(next - estimate) < CONVERGENCE_MINUTES) {
        return OptionalDouble.of(next);
      }
      estimate = next;
    }

    log.debug(
        "no convergence for zenith {} on {} at ({}, {})", zenith, date, latitude, longitude);
    return OptionalDouble.empty();
  }

  private static double solarNoonMinutes(LocalDate date, double longitude) {
    double jd = SolarPosition.julianDay(date);
    double noon = 720 - 4 * longitude;
    for (int i = 0; i < 3; i++) {
      SolarPosition sun = SolarPosition.at(jd + noon / MINUTES_PER_DAY);
      noon = 720 - 4 * longitude - sun.equationOfTime();
    }
    return noon;
  }

  /** Hour angle in degrees, or empty when the sun never reaches {@code zenith}. */
  static OptionalDouble hourAngle(double latitude, double declination, double zenith) {
    double lat = Math.toRadians(latitude);
    double dec = Math.toRadians(declination);
    double cosH =
        Math.cos(Math.toRadians(zenith)) / (Math.cos(lat) * Math.cos(dec))
            - Math.tan(lat) * Math.tan(dec);
    if (Double.isNaN(cosH) || cosH > 1 || cosH < -1) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(Math.toDegrees(Math.acos(cosH)));
  }

  private static Instant toInstant(LocalDate date, double minutesFromUtcMidnight) {
    long nanos = Math.round(minutesFromUtcMidnight * 60_000_000_000d);
    return date.atStartOfDay(ZoneOffset.UTC).toInstant().plusNanos(nanos);
  }
}
