package io.zmanim.filter;

import java.util.Objects;

/**
 * A tag attached to a formula.
 *
 * @param key the tag key, e.g. {@code shabbos} or {@code day_before}
 * @param type the tag type
 * @param negated true if the formula must not show when the tag matches
 */
public record FormulaTag(String key, TagType type, boolean negated) {
  /** Timing key that moves an event tag to the day before the event. */
  public static final String DAY_BEFORE = "day_before";

  /** Timing key for the close of an event. */
  public static final String MOTZEI = "motzei";

  public FormulaTag {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(type, "type");
  }

  /** Creates a non-negated event tag. */
  public static FormulaTag event(String key) {
    return new FormulaTag(key, TagType.EVENT, false);
  }

  /** Creates a negated event tag. */
  public static FormulaTag notEvent(String key) {
    return new FormulaTag(key, TagType.EVENT, true);
  }

  /** Creates a timing tag. */
  public static FormulaTag timing(String key) {
    return new FormulaTag(key, TagType.TIMING, false);
  }

  @Override
  public String toString() {
    return (negated ? "!" : "") + key + ":" + type;
  }
}
