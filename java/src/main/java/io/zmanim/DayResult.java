package io.zmanim;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The results of a formula set on one day, keyed by formula key in input order.
 *
 * @param date the day
 * @param results every formula's result, hidden ones included
 */
public record DayResult(LocalDate date, Map<String, CalculationResult> results) {
  public DayResult {
    results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
  }

  /**
   * Returns the result of one formula.
   *
   * @param key the formula key
   * @return the result, or empty if the key was not in the set
   */
  public Optional<CalculationResult> result(String key) {
    return Optional.ofNullable(results.get(key));
  }

  /** Returns the keys of the formulas shown on this day. */
  public List<String> visibleKeys() {
    return results.values().stream()
        .filter(r -> !r.isHidden())
        .map(CalculationResult::key)
        .collect(Collectors.toList());
  }

  /** Returns the keys of the formulas that failed. */
  public List<String> failedKeys() {
    return results.values().stream()
        .filter(r -> r.error().isPresent())
        .map(CalculationResult::key)
        .collect(Collectors.toList());
  }
}
