package io.zmanim.filter;

import java.util.Arrays;
import java.util.Optional;

/** Classification of a formula tag. */
public enum TagType {
  /** A calendar event such as {@code shabbos}; matched against the day's active event codes. */
  EVENT("event"),
  /** A Jewish-calendar day; filtered the same way as {@link #EVENT}. */
  JEWISH_DAY("jewish_day"),
  /** A timing modifier: {@code day_before} or {@code motzei}. */
  TIMING("timing"),
  /** A calculation tradition. Never affects visibility. */
  SHITA("shita");

  private final String displayName;

  TagType(String displayName) {
    this.displayName = displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }

  /** Returns true for tags matched against active event codes. */
  public boolean isEvent() {
    return this == EVENT || this == JEWISH_DAY;
  }

  /**
   * Parses a tag type name.
   *
   * @param s the name
   * @return the tag type if known
   */
  public static Optional<TagType> parse(String s) {
    return Arrays.stream(values()).filter(t -> t.displayName.equals(s)).findFirst();
  }
}
