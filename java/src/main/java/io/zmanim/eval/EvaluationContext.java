package io.zmanim.eval;

import io.zmanim.ast.Primitive;
import io.zmanim.astro.AstronomicalPrimitiveProvider;
import io.zmanim.astro.GeoLocation;
import io.zmanim.astro.SolarDay;
import java.time.Duration;
import java.time.LocalDate;
import java.time.Month;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Everything an expression can read during evaluation: the date, the location, the day's
 * astronomical primitives and the values of formulas resolved so far.
 *
 * <p>Instances are immutable apart from the resolved-values view, which reflects the map the
 * dependency resolver fills in topological order.
 */
public final class EvaluationContext {
  /** The reference date for equinox-scaled calculations: March 20 of the evaluation year. */
  static final int EQUINOX_DAY = 20;

  private final LocalDate date;
  private final GeoLocation location;
  private final EngineOptions options;
  private final AstronomicalPrimitiveProvider provider;
  private final SolarDay solarDay;
  private final Map<String, Value> resolved;
  private volatile SolarDay equinoxDay;

  private EvaluationContext(
      LocalDate date,
      GeoLocation location,
      EngineOptions options,
      AstronomicalPrimitiveProvider provider,
      SolarDay solarDay,
      Map<String, Value> resolved) {
    this.date = date;
    this.location = location;
    this.options = options;
    this.provider = provider;
    this.solarDay = solarDay;
    this.resolved = Collections.unmodifiableMap(resolved);
  }

  /**
   * Creates a context with no resolved formulas, computing the day's primitives.
   *
   * @param date the local calendar date
   * @param location the location
   * @param options the evaluation options
   * @return the context
   */
  public static EvaluationContext create(
      LocalDate date, GeoLocation location, EngineOptions options) {
    AstronomicalPrimitiveProvider provider =
        new AstronomicalPrimitiveProvider(options.ignoreElevation());
    return new EvaluationContext(
        date, location, options, provider, provider.primitives(date, location), Map.of());
  }

  /**
   * Returns a context for the same day and place that reads formula values from {@code
   * resolved}. The map is not copied; later additions to it are visible.
   *
   * @param resolved the resolved formula values
   * @return the new context
   */
  public EvaluationContext withResolved(Map<String, Value> resolved) {
    EvaluationContext ctx =
        new EvaluationContext(date, location, options, provider, solarDay, resolved);
    ctx.equinoxDay = equinoxDay;
    return ctx;
  }

  public LocalDate date() {
    return date;
  }

  public GeoLocation location() {
    return location;
  }

  public EngineOptions options() {
    return options;
  }

  public SolarDay solarDay() {
    return solarDay;
  }

  /**
   * Returns the primitives of March 20 of the evaluation year at the same location.
   *
   * @return the equinox day
   */
  public SolarDay equinoxDay() {
    SolarDay day = equinoxDay;
    if (day == null) {
      day = provider.primitives(LocalDate.of(date.getYear(), Month.MARCH, EQUINOX_DAY), location);
      equinoxDay = day;
    }
    return day;
  }

  /**
   * Returns the value of a resolved formula.
   *
   * @param key the formula key
   * @return the value, or empty if the key has not been resolved
   */
  public Optional<Value> resolved(String key) {
    return Optional.ofNullable(resolved.get(key));
  }

  /**
   * Returns a read-only view of every resolved formula value.
   *
   * @return the resolved values by key
   */
  public Map<String, Value> resolvedValues() {
    return resolved;
  }

  /**
   * Returns the value of an astronomical primitive.
   *
   * @param primitive the primitive
   * @return a time, or a failure when the event does not occur that day
   */
  public Value primitive(Primitive primitive) {
    return solarDay
        .get(primitive)
        .<Value>map(TimeValue::new)
        .orElseGet(
            () ->
                new FailureValue(
                    primitive
                        + " does not occur on "
                        + date
                        + " at latitude "
                        + location.latitude()));
  }

  /**
   * Returns visible sunset minus visible sunrise.
   *
   * @return a duration, or a failure when either event is missing
   */
  public Value dayLength() {
    Optional<Duration> length = solarDay.dayLength();
    if (length.isEmpty()) {
      return new FailureValue("day length is undefined on " + date + " at this latitude");
    }
    return new DurationValue(length.get());
  }

  public Season season() {
    return Season.of(date.getMonthValue(), location.latitude());
  }
}
