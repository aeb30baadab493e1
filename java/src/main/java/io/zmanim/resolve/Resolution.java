package io.zmanim.resolve;

import io.zmanim.ZmanimException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of resolving a formula set: the evaluation order and, per key, either a time or the
 * error that stopped it.
 *
 * @param order the keys in the order they were resolved
 * @param times the successful results
 * @param errors the failed formulas
 */
public record Resolution(
    List<String> order, Map<String, Instant> times, Map<String, ZmanimException> errors) {
  public Resolution {
    order = List.copyOf(order);
    times = Collections.unmodifiableMap(new LinkedHashMap<>(times));
    errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
  }

  /**
   * Returns the time of a formula.
   *
   * @param key the formula key
   * @return the time, or empty if the formula failed or was not part of the set
   */
  public Optional<Instant> time(String key) {
    return Optional.ofNullable(times.get(key));
  }

  /**
   * Returns the error of a formula.
   *
   * @param key the formula key
   * @return the error, or empty if the formula succeeded or was not part of the set
   */
  public Optional<ZmanimException> error(String key) {
    return Optional.ofNullable(errors.get(key));
  }

  /** Returns true if every formula produced a time. */
  public boolean isComplete() {
    return errors.isEmpty();
  }
}
