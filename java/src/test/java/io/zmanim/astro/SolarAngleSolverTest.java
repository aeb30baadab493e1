package io.zmanim.astro;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class SolarAngleSolverTest {
  private static final double JERUSALEM_LAT = 31.7683;
  private static final double JERUSALEM_LON = 35.2137;
  private static final ZoneId JERUSALEM_ZONE = ZoneId.of("Asia/Jerusalem");
  private static final LocalDate EQUINOX = LocalDate.of(2024, 3, 20);

  private static Instant visibleSunrise(LocalDate date, double lat, double lon) {
    return SolarAngleSolver.crossing(date, lat, lon, SolarAngleSolver.VISIBLE_ZENITH, true)
        .orElseThrow();
  }

  private static void assertLocalTime(String expected, Instant actual, ZoneId zone, int seconds) {
    LocalTime want = LocalTime.parse(expected);
    LocalTime got = actual.atZone(zone).toLocalTime();
    long diff = Math.abs(Duration.between(want, got).getSeconds());
    assertTrue(diff <= seconds, "expected " + want + " but got " + got);
  }

  @Test
  void testJerusalemSunriseAndSunsetOnEquinox() {
    Instant sunrise = visibleSunrise(EQUINOX, JERUSALEM_LAT, JERUSALEM_LON);
    Instant sunset =
        SolarAngleSolver.crossing(
                EQUINOX, JERUSALEM_LAT, JERUSALEM_LON, SolarAngleSolver.VISIBLE_ZENITH, false)
            .orElseThrow();
    assertLocalTime("05:42:36", sunrise, JERUSALEM_ZONE, 5);
    assertLocalTime("17:50:50", sunset, JERUSALEM_ZONE, 5);
  }

  @Test
  void testJerusalemSolarNoon() {
    Instant noon = SolarAngleSolver.solarNoon(EQUINOX, JERUSALEM_LON);
    assertLocalTime("11:46:28", noon, JERUSALEM_ZONE, 3);
  }

  @ParameterizedTest
  @CsvSource({"16.1, 72.16", "18, 81.26", "19.8, 89.92", "26, 120.12"})
  void testDawnAnglesMatchFixedMinuteEquivalents(double degrees, double minutesBeforeSunrise) {
    Instant sunrise = visibleSunrise(EQUINOX, JERUSALEM_LAT, JERUSALEM_LON);
    Instant dawn =
        SolarAngleSolver.depression(EQUINOX, JERUSALEM_LAT, JERUSALEM_LON, degrees, true)
            .orElseThrow();
    double minutes = Duration.between(dawn, sunrise).toMillis() / 60_000.0;
    assertEquals(minutesBeforeSunrise, minutes, 0.1);
  }

  @Test
  void testDuskIsAfterSunset() {
    Instant sunset =
        SolarAngleSolver.crossing(
                EQUINOX, JERUSALEM_LAT, JERUSALEM_LON, SolarAngleSolver.VISIBLE_ZENITH, false)
            .orElseThrow();
    Instant tzeis =
        SolarAngleSolver.depression(EQUINOX, JERUSALEM_LAT, JERUSALEM_LON, 8.5, false)
            .orElseThrow();
    assertTrue(tzeis.isAfter(sunset));
  }

  @Test
  void testNewYorkSummerSolstice() {
    LocalDate date = LocalDate.of(2024, 6, 21);
    ZoneId zone = ZoneId.of("America/New_York");
    Instant sunrise = visibleSunrise(date, 40.7128, -74.006);
    Instant sunset =
        SolarAngleSolver.crossing(date, 40.7128, -74.006, SolarAngleSolver.VISIBLE_ZENITH, false)
            .orElseThrow();
    assertLocalTime("05:25:07", sunrise, zone, 5);
    assertLocalTime("20:30:51", sunset, zone, 5);
    assertEquals(LocalDate.of(2024, 6, 21), sunset.atZone(zone).toLocalDate());
  }

  @Test
  void testMidnightSunHasNoSunriseAndNoDeepDepression() {
    LocalDate date = LocalDate.of(2024, 6, 21);
    assertTrue(
        SolarAngleSolver.crossing(date, 70, 20, SolarAngleSolver.VISIBLE_ZENITH, true).isEmpty());
    assertTrue(SolarAngleSolver.depression(date, 70, 20, 40, true).isEmpty());
    assertLocalTime("10:41:55", SolarAngleSolver.solarNoon(date, 20), ZoneOffset.UTC, 3);
  }

  @Test
  void testHourAngleOutOfRange() {
    assertTrue(SolarAngleSolver.hourAngle(89, 23, 90).isEmpty());
    assertEquals(90, SolarAngleSolver.hourAngle(0, 0, 90).getAsDouble(), 1e-9);
  }
}
