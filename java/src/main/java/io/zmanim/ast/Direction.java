package io.zmanim.ast;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The search direction for solar-angle functions. Each direction names the event it is measured
 * from and whether the result falls in the morning or the evening.
 */
public enum Direction {
  BEFORE_VISIBLE_SUNRISE("before_visible_sunrise", Anchor.VISIBLE_SUNRISE, true),
  AFTER_VISIBLE_SUNRISE("after_visible_sunrise", Anchor.VISIBLE_SUNRISE, false),
  BEFORE_VISIBLE_SUNSET("before_visible_sunset", Anchor.VISIBLE_SUNSET, true),
  AFTER_VISIBLE_SUNSET("after_visible_sunset", Anchor.VISIBLE_SUNSET, false),
  BEFORE_GEOMETRIC_SUNRISE("before_geometric_sunrise", Anchor.GEOMETRIC_SUNRISE, true),
  AFTER_GEOMETRIC_SUNRISE("after_geometric_sunrise", Anchor.GEOMETRIC_SUNRISE, false),
  BEFORE_GEOMETRIC_SUNSET("before_geometric_sunset", Anchor.GEOMETRIC_SUNSET, true),
  AFTER_GEOMETRIC_SUNSET("after_geometric_sunset", Anchor.GEOMETRIC_SUNSET, false),
  BEFORE_NOON("before_noon", Anchor.NOON, true),
  AFTER_NOON("after_noon", Anchor.NOON, false);

  /** The event a direction is measured from. */
  public enum Anchor {
    VISIBLE_SUNRISE,
    VISIBLE_SUNSET,
    GEOMETRIC_SUNRISE,
    GEOMETRIC_SUNSET,
    NOON
  }

  private final String displayName;
  private final Anchor anchor;
  private final boolean before;

  Direction(String displayName, Anchor anchor, boolean before) {
    this.displayName = displayName;
    this.anchor = anchor;
    this.before = before;
  }

  /**
   * Returns the event this direction is measured from.
   *
   * @return the anchor
   */
  public Anchor anchor() {
    return anchor;
  }

  /**
   * Returns whether the result lies before the anchor.
   *
   * @return true for "before_*" directions
   */
  public boolean isBefore() {
    return before;
  }

  /**
   * Returns whether a depression-angle search in this direction looks for the morning crossing.
   * Sunrise-anchored directions and {@link #BEFORE_NOON} search the dawn side.
   *
   * @return true for the morning side of the day
   */
  public boolean isMorning() {
    return switch (anchor) {
      case VISIBLE_SUNRISE, GEOMETRIC_SUNRISE -> true;
      case NOON -> before;
      case VISIBLE_SUNSET, GEOMETRIC_SUNSET -> false;
    };
  }

  /**
   * Returns whether this direction is accepted by {@code seasonal_solar} and {@code
   * proportional_minutes}: before visible sunrise or after visible sunset.
   *
   * @return true if the direction is one of the two sunrise/sunset offsets
   */
  public boolean isSunriseOrSunsetOffset() {
    return this == BEFORE_VISIBLE_SUNRISE || this == AFTER_VISIBLE_SUNSET;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, Direction> PARSE_MAP = buildParseMap();

  private static Map<String, Direction> buildParseMap() {
    Map<String, Direction> map = new HashMap<>();
    for (Direction d : values()) {
      map.put(d.displayName, d);
    }
    map.put("before_sunrise", BEFORE_VISIBLE_SUNRISE);
    map.put("after_sunrise", AFTER_VISIBLE_SUNRISE);
    map.put("after_sunset", AFTER_VISIBLE_SUNSET);
    return Map.copyOf(map);
  }

  /**
   * Parses a direction name. The short forms "before_sunrise", "after_sunrise" and
   * "after_sunset" map to their visible variants.
   *
   * @param s the name
   * @return the direction if known
   */
  public static Optional<Direction> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s));
  }
}
