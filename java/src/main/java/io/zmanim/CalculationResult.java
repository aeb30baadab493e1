package io.zmanim;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * The outcome of calculating one formula on one day: a time, an error, or hidden because the
 * formula's tags exclude that day.
 */
public final class CalculationResult {
  private static final DateTimeFormatter HH_MM_SS = DateTimeFormatter.ofPattern("HH:mm:ss");

  private final String key;
  private final ZonedDateTime time;
  private final DisplayRounding rounding;
  private final ZmanimException error;
  private final boolean hidden;

  private CalculationResult(
      String key,
      ZonedDateTime time,
      DisplayRounding rounding,
      ZmanimException error,
      boolean hidden) {
    this.key = key;
    this.time = time;
    this.rounding = rounding;
    this.error = error;
    this.hidden = hidden;
  }

  /**
   * Creates a successful result. The time is truncated to whole seconds.
   *
   * @param key the formula key
   * @param time the calculated time in the location's zone
   * @param rounding the display rounding
   * @return the result
   */
  public static CalculationResult success(
      String key, ZonedDateTime time, DisplayRounding rounding) {
    return new CalculationResult(
        key, time.truncatedTo(ChronoUnit.SECONDS), rounding, null, false);
  }

  /**
   * Creates a failed result.
   *
   * @param key the formula key
   * @param error the error
   * @return the result
   */
  public static CalculationResult failure(String key, ZmanimException error) {
    return new CalculationResult(key, null, null, error, false);
  }

  /**
   * Creates a result for a formula not shown on the day.
   *
   * @param key the formula key
   * @return the result
   */
  public static CalculationResult hidden(String key) {
    return new CalculationResult(key, null, null, null, true);
  }

  public String key() {
    return key;
  }

  /** Returns true if a time was calculated. */
  public boolean isSuccess() {
    return time != null;
  }

  /** Returns true if the formula's tags exclude the day. */
  public boolean isHidden() {
    return hidden;
  }

  /** Returns the calculated time in the location's zone, to the second. */
  public Optional<ZonedDateTime> dateTime() {
    return Optional.ofNullable(time);
  }

  /** Returns the calculated instant. */
  public Optional<Instant> instant() {
    return dateTime().map(ZonedDateTime::toInstant);
  }

  /** Returns the exact local time as {@code HH:mm:ss}. */
  public Optional<String> time() {
    return dateTime().map(HH_MM_SS::format);
  }

  /** Returns the local time rounded to the minute as {@code HH:mm}. */
  public Optional<String> rounded() {
    return dateTime().map(t -> rounding.format(t.toLocalTime()));
  }

  /** Returns the local time. */
  public Optional<LocalTime> localTime() {
    return dateTime().map(ZonedDateTime::toLocalTime);
  }

  public Optional<ZmanimException> error() {
    return Optional.ofNullable(error);
  }

  public Optional<ErrorKind> errorKind() {
    return error().map(ZmanimException::kind);
  }

  @Override
  public String toString() {
    if (hidden) {
      return key + ": hidden";
    }
    if (error != null) {
      return key + ": " + error.kind() + " error: " + error.getMessage();
    }
    return key + ": " + time().orElseThrow();
  }
}
