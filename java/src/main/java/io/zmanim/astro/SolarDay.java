package io.zmanim.astro;

import io.zmanim.ast.Primitive;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The astronomical primitives of one date at one location. A primitive the sun does not produce
 * that day (no sunrise during polar night, no astronomical dusk in a white night) is absent.
 */
public final class SolarDay {
  private final LocalDate date;
  private final GeoLocation location;
  private final Map<Primitive, Instant> times;

  SolarDay(LocalDate date, GeoLocation location, Map<Primitive, Instant> times) {
    this.date = date;
    this.location = location;
    this.times = Collections.unmodifiableMap(new EnumMap<>(times));
  }

  /**
   * Returns the date these primitives were computed for.
   *
   * @return the local date
   */
  public LocalDate date() {
    return date;
  }

  /**
   * Returns the location these primitives were computed for.
   *
   * @return the location
   */
  public GeoLocation location() {
    return location;
  }

  /**
   * Returns the instant of a primitive.
   *
   * @param primitive the primitive
   * @return the instant, or empty if the event does not occur that day
   */
  public Optional<Instant> get(Primitive primitive) {
    return Optional.ofNullable(times.get(primitive));
  }

  /**
   * Returns visible sunset minus visible sunrise.
   *
   * @return the day length, or empty if either event is missing
   */
  public Optional<Duration> dayLength() {
    Instant sunrise = times.get(Primitive.VISIBLE_SUNRISE);
    Instant sunset = times.get(Primitive.VISIBLE_SUNSET);
    if (sunrise == null || sunset == null) {
      return Optional.empty();
    }
    return Optional.of(Duration.between(sunrise, sunset));
  }

  @Override
  public String toString() {
    return "SolarDay{" + date + ", " + location + ", " + times + "}";
  }
}
