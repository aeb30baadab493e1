package io.zmanim.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a formula is shown on a day, from its tags and the day's active event codes.
 *
 * <p>Formulas without event tags always show. Otherwise each event tag is looked up in the
 * active codes, with timing tags changing what is looked up:
 *
 * <ul>
 *   <li>{@code day_before}: a non-negated tag {@code k} matches only {@code erev_k}, never
 *       {@code k} itself.
 *   <li>{@code motzei}: {@code k} matches {@code k}; the caller puts the codes of events that
 *       end that day into the active set.
 *   <li>no timing tag: {@code k} matches {@code k}.
 * </ul>
 *
 * Negated tags are always looked up by their own key. A matching negated tag hides the formula.
 * If any non-negated event tag exists, at least one must match.
 */
public final class EventVisibilityFilter {
  private static final Logger log = LoggerFactory.getLogger(EventVisibilityFilter.class);

  static final String EREV_PREFIX = "erev_";

  private EventVisibilityFilter() {}

  /**
   * Returns true if a formula with the given tags is shown on a day.
   *
   * @param tags the formula's tags
   * @param activeEventCodes the event codes active that day
   * @return true to show, false to hide
   */
  public static boolean shouldShow(Collection<FormulaTag> tags, Set<String> activeEventCodes) {
    log.debug("shouldShow: tags={} active={}", tags, activeEventCodes);

    List<FormulaTag> eventTags = new ArrayList<>();
    boolean dayBefore = false;
    boolean motzei = false;
    for (FormulaTag tag : tags) {
      if (tag.type().isEvent()) {
        eventTags.add(tag);
      } else if (tag.type() == TagType.TIMING) {
        dayBefore |= tag.key().equals(FormulaTag.DAY_BEFORE);
        motzei |= tag.key().equals(FormulaTag.MOTZEI);
      }
    }
    log.debug(
        "shouldShow: eventTags={} dayBefore={} motzei={}", eventTags, dayBefore, motzei);

    if (eventTags.isEmpty()) {
      log.debug("shouldShow: show, no event tags");
      return true;
    }

    List<String> positiveMatches = new ArrayList<>();
    List<String> negativeMatches = new ArrayList<>();
    boolean hasPositive = false;
    for (FormulaTag tag : eventTags) {
      String target = tag.key();
      if (dayBefore && !tag.negated()) {
        target = EREV_PREFIX + tag.key();
      }
      boolean active = activeEventCodes.contains(target);
      if (tag.negated()) {
        if (active) {
          negativeMatches.add(tag.key());
        }
      } else {
        hasPositive = true;
        if (active) {
          positiveMatches.add(target);
        }
      }
    }
    log.debug("shouldShow: positive={} negative={}", positiveMatches, negativeMatches);

    if (!negativeMatches.isEmpty()) {
      log.debug("shouldShow: hide, negated tag matched {}", negativeMatches);
      return false;
    }
    if (hasPositive && positiveMatches.isEmpty()) {
      log.debug("shouldShow: hide, no event tag matched");
      return false;
    }
    log.debug("shouldShow: show");
    return true;
  }
}
