package io.zmanim;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Optional;

/** How a calculated time is rounded to whole minutes for display. */
public enum DisplayRounding {
  /** Thirty seconds or more round up. */
  MATH("math"),
  /** Seconds are dropped. */
  FLOOR("floor"),
  /** Any seconds round up. */
  CEIL("ceil");

  private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

  private final String displayName;

  DisplayRounding(String displayName) {
    this.displayName = displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Rounds a time of day to the minute. Rounding past 23:59 wraps to 00:00.
   *
   * @param time the time, already truncated to seconds
   * @return the rounded time
   */
  public LocalTime round(LocalTime time) {
    LocalTime minute = time.truncatedTo(ChronoUnit.MINUTES);
    int seconds = time.getSecond();
    boolean up =
        switch (this) {
          case MATH -> seconds >= 30;
          case FLOOR -> false;
          case CEIL -> seconds > 0;
        };
    return up ? minute.plusMinutes(1) : minute;
  }

  /**
   * Rounds and formats a time of day as {@code HH:mm}.
   *
   * @param time the time
   * @return the display text
   */
  public String format(LocalTime time) {
    return HH_MM.format(round(time));
  }

  /**
   * Parses a rounding mode name.
   *
   * @param s the name
   * @return the rounding mode if known
   */
  public static Optional<DisplayRounding> parse(String s) {
    return Arrays.stream(values()).filter(r -> r.displayName.equals(s)).findFirst();
  }
}
