package io.zmanim;

import io.zmanim.filter.FormulaTag;
import java.util.List;
import java.util.Objects;

/** A named formula as published: its key, source text, tags and display rounding. */
public final class Formula {
  private final String key;
  private final String source;
  private final List<FormulaTag> tags;
  private final DisplayRounding rounding;

  /**
   * Creates a formula.
   *
   * @param key the formula key
   * @param source the formula text
   * @param tags the tags that decide on which days the formula shows
   * @param rounding how its time is rounded for display
   */
  public Formula(String key, String source, List<FormulaTag> tags, DisplayRounding rounding) {
    this.key = Objects.requireNonNull(key, "key");
    this.source = Objects.requireNonNull(source, "source");
    this.tags = List.copyOf(tags);
    this.rounding = Objects.requireNonNull(rounding, "rounding");
  }

  /** Creates an untagged formula with {@link DisplayRounding#MATH} rounding. */
  public static Formula of(String key, String source) {
    return new Formula(key, source, List.of(), DisplayRounding.MATH);
  }

  /** Creates a tagged formula with {@link DisplayRounding#MATH} rounding. */
  public static Formula of(String key, String source, FormulaTag... tags) {
    return new Formula(key, source, List.of(tags), DisplayRounding.MATH);
  }

  public String key() {
    return key;
  }

  public String source() {
    return source;
  }

  public List<FormulaTag> tags() {
    return tags;
  }

  public DisplayRounding rounding() {
    return rounding;
  }

  @Override
  public String toString() {
    return key + ": " + source;
  }
}
