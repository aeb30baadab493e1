package io.zmanim.astro;

import io.zmanim.ast.Primitive;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/** Computes the fixed set of astronomical primitives for a date and location. */
public final class AstronomicalPrimitiveProvider {
  /** Polar radius used for the horizon dip, in meters. */
  static final double EARTH_RADIUS_METERS = 6_356_900;

  public static final double CIVIL_DEPRESSION = 6;
  public static final double NAUTICAL_DEPRESSION = 12;
  public static final double ASTRONOMICAL_DEPRESSION = 18;

  private final boolean ignoreElevation;

  /**
   * Creates a provider.
   *
   * @param ignoreElevation when true, visible sunrise and sunset are computed at sea level
   */
  public AstronomicalPrimitiveProvider(boolean ignoreElevation) {
    this.ignoreElevation = ignoreElevation;
  }

  /**
   * Computes every primitive for {@code date} at {@code location}.
   *
   * @param date the local calendar date
   * @param location the location
   * @return the primitives; events that do not occur are absent
   */
  public SolarDay primitives(LocalDate date, GeoLocation location) {
    double visibleZenith = SolarAngleSolver.VISIBLE_ZENITH + horizonDip(location);

    Map<Primitive, Instant> times = new EnumMap<>(Primitive.class);
    Instant noon = SolarAngleSolver.solarNoon(date, location.longitude());
    times.put(Primitive.SOLAR_NOON, noon);
    times.put(Primitive.SOLAR_MIDNIGHT, noon.minus(Duration.ofHours(12)));

    pair(times, date, location, visibleZenith, Primitive.VISIBLE_SUNRISE, Primitive.VISIBLE_SUNSET);
    pair(
        times,
        date,
        location,
        SolarAngleSolver.GEOMETRIC_ZENITH,
        Primitive.GEOMETRIC_SUNRISE,
        Primitive.GEOMETRIC_SUNSET);
    pair(
        times,
        date,
        location,
        SolarAngleSolver.GEOMETRIC_ZENITH + CIVIL_DEPRESSION,
        Primitive.CIVIL_DAWN,
        Primitive.CIVIL_DUSK);
    pair(
        times,
        date,
        location,
        SolarAngleSolver.GEOMETRIC_ZENITH + NAUTICAL_DEPRESSION,
        Primitive.NAUTICAL_DAWN,
        Primitive.NAUTICAL_DUSK);
    pair(
        times,
        date,
        location,
        SolarAngleSolver.GEOMETRIC_ZENITH + ASTRONOMICAL_DEPRESSION,
        Primitive.ASTRONOMICAL_DAWN,
        Primitive.ASTRONOMICAL_DUSK);

    return new SolarDay(date, location, times);
  }

  /**
   * Returns the dip of the apparent horizon for an observer above sea level, in degrees. Zero
   * when elevation is ignored or unknown.
   *
   * @param location the location
   * @return the dip angle
   */
  public double horizonDip(GeoLocation location) {
    if (ignoreElevation || location.elevation() == null) {
      return 0;
    }
    double h = location.elevationOrSeaLevel();
    return Math.toDegrees(Math.acos(EARTH_RADIUS_METERS / (EARTH_RADIUS_METERS + h)));
  }

  private static void pair(
      Map<Primitive, Instant> times,
      LocalDate date,
      GeoLocation location,
      double zenith,
      Primitive morning,
      Primitive evening) {
    double lat = location.latitude();
    double lon = location.longitude();
    SolarAngleSolver.crossing(date, lat, lon, zenith, true).ifPresent(t -> times.put(morning, t));
    SolarAngleSolver.crossing(date, lat, lon, zenith, false).ifPresent(t -> times.put(evening, t));
  }
}
