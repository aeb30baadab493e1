package io.zmanim.astro;

import java.time.ZoneId;

/**
 * A point on the earth together with the time zone its local times are reported in.
 *
 * @param latitude degrees north, negative in the southern hemisphere
 * @param longitude degrees east, negative in the western hemisphere
 * @param elevation meters above sea level, or null for sea level
 * @param zone the civil time zone
 */
public record GeoLocation(double latitude, double longitude, Double elevation, ZoneId zone) {
  public GeoLocation {
    if (latitude < -90 || latitude > 90 || Double.isNaN(latitude)) {
      throw new IllegalArgumentException("latitude out of range: " + latitude);
    }
    if (longitude < -180 || longitude > 180 || Double.isNaN(longitude)) {
      throw new IllegalArgumentException("longitude out of range: " + longitude);
    }
    if (zone == null) {
      throw new IllegalArgumentException("zone is required");
    }
  }

  /**
   * Creates a sea-level location.
   *
   * @param latitude degrees north
   * @param longitude degrees east
   * @param zone the civil time zone
   * @return the location
   */
  public static GeoLocation of(double latitude, double longitude, ZoneId zone) {
    return new GeoLocation(latitude, longitude, null, zone);
  }

  /**
   * Returns the elevation in meters, treating a missing elevation as sea level.
   *
   * @return the elevation, never negative
   */
  public double elevationOrSeaLevel() {
    return elevation == null ? 0 : Math.max(0, elevation);
  }
}
