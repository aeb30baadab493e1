package io.zmanim.ast;

import java.util.Map;
import java.util.Optional;

/** A named astronomical event computed for the evaluation date and location. */
public enum Primitive {
  VISIBLE_SUNRISE("visible_sunrise"),
  VISIBLE_SUNSET("visible_sunset"),
  GEOMETRIC_SUNRISE("geometric_sunrise"),
  GEOMETRIC_SUNSET("geometric_sunset"),
  SOLAR_NOON("solar_noon"),
  SOLAR_MIDNIGHT("solar_midnight"),
  CIVIL_DAWN("civil_dawn"),
  CIVIL_DUSK("civil_dusk"),
  NAUTICAL_DAWN("nautical_dawn"),
  NAUTICAL_DUSK("nautical_dusk"),
  ASTRONOMICAL_DAWN("astronomical_dawn"),
  ASTRONOMICAL_DUSK("astronomical_dusk");

  private final String displayName;

  Primitive(String displayName) {
    this.displayName = displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, Primitive> PARSE_MAP =
      Map.ofEntries(
          Map.entry("visible_sunrise", VISIBLE_SUNRISE),
          Map.entry("sunrise", VISIBLE_SUNRISE),
          Map.entry("visible_sunset", VISIBLE_SUNSET),
          Map.entry("sunset", VISIBLE_SUNSET),
          Map.entry("geometric_sunrise", GEOMETRIC_SUNRISE),
          Map.entry("geometric_sunset", GEOMETRIC_SUNSET),
          Map.entry("solar_noon", SOLAR_NOON),
          Map.entry("solar_midnight", SOLAR_MIDNIGHT),
          Map.entry("civil_dawn", CIVIL_DAWN),
          Map.entry("civil_dusk", CIVIL_DUSK),
          Map.entry("nautical_dawn", NAUTICAL_DAWN),
          Map.entry("nautical_dusk", NAUTICAL_DUSK),
          Map.entry("astronomical_dawn", ASTRONOMICAL_DAWN),
          Map.entry("astronomical_dusk", ASTRONOMICAL_DUSK));

  /**
   * Parses a primitive name. The aliases "sunrise" and "sunset" map to the visible variants.
   *
   * @param s the name
   * @return the primitive if known
   */
  public static Optional<Primitive> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s));
  }
}
