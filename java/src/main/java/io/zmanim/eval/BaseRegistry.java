package io.zmanim.eval;

import io.zmanim.ast.Base;
import io.zmanim.ast.Primitive;
import io.zmanim.astro.GeoLocation;
import io.zmanim.astro.SolarAngleSolver;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Day-boundary rules for every named {@link Base}. {@link Base#CUSTOM} has no entry here; its
 * bounds come from the two expressions written in the formula.
 */
public final class BaseRegistry {
  /** Computes the day boundaries of one base. */
  @FunctionalInterface
  public interface BoundsRule {
    /**
     * Returns the day boundaries for the context's date and location.
     *
     * @param ctx the evaluation context
     * @return the bounds, or empty if an event they depend on does not occur that day
     */
    Optional<DayBounds> bounds(EvaluationContext ctx);
  }

  /** Depression of the sun for the Baal HaTanya's netz and shkiah amiti. */
  static final double BAAL_HATANYA_DEPRESSION = 1.583;

  private static final BaseRegistry STANDARD = new BaseRegistry(standardRules());

  private final Map<Base, BoundsRule> rules;

  /**
   * Creates a registry from explicit rules.
   *
   * @param rules the rule for each supported base
   */
  public BaseRegistry(Map<Base, BoundsRule> rules) {
    this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
  }

  /**
   * Returns the registry holding the built-in rules.
   *
   * @return the standard registry
   */
  public static BaseRegistry standard() {
    return STANDARD;
  }

  /**
   * Returns the rule for a base.
   *
   * @param base the base
   * @return the rule, or empty if the base is not registered
   */
  public Optional<BoundsRule> rule(Base base) {
    return Optional.ofNullable(rules.get(base));
  }

  private static Map<Base, BoundsRule> standardRules() {
    Map<Base, BoundsRule> rules = new EnumMap<>(Base.class);
    rules.put(Base.GRA, BaseRegistry::sunriseToSunset);
    rules.put(Base.MGA, fixedMinutes(72));
    rules.put(Base.MGA_60, fixedMinutes(60));
    rules.put(Base.MGA_72, fixedMinutes(72));
    rules.put(Base.MGA_90, fixedMinutes(90));
    rules.put(Base.MGA_96, fixedMinutes(96));
    rules.put(Base.MGA_120, fixedMinutes(120));
    rules.put(Base.MGA_72_ZMANIS, dayFraction(10));
    rules.put(Base.MGA_90_ZMANIS, dayFraction(8));
    rules.put(Base.MGA_96_ZMANIS, dayFraction(7.5));
    rules.put(Base.MGA_16_1, depression(16.1));
    rules.put(Base.MGA_18, depression(18));
    rules.put(Base.MGA_19_8, depression(19.8));
    rules.put(Base.MGA_26, depression(26));
    rules.put(Base.BAAL_HATANYA, depression(BAAL_HATANYA_DEPRESSION));
    rules.put(
        Base.ATERET_TORAH,
        ctx ->
            sunriseToSunset(ctx)
                .map(b -> new DayBounds(b.start(), b.end().plus(Duration.ofMinutes(40)))));
    return rules;
  }

  private static Optional<DayBounds> sunriseToSunset(EvaluationContext ctx) {
    Optional<Instant> sunrise = ctx.solarDay().get(Primitive.VISIBLE_SUNRISE);
    Optional<Instant> sunset = ctx.solarDay().get(Primitive.VISIBLE_SUNSET);
    if (sunrise.isEmpty() || sunset.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new DayBounds(sunrise.get(), sunset.get()));
  }

  private static BoundsRule fixedMinutes(long minutes) {
    return ctx -> sunriseToSunset(ctx).map(b -> b.widen(Duration.ofMinutes(minutes)));
  }

  /** Widens sunrise..sunset by {@code dayLength / divisor} at each end. */
  private static BoundsRule dayFraction(double divisor) {
    return ctx ->
        sunriseToSunset(ctx)
            .map(
                b -> {
                  long nanos = Duration.between(b.start(), b.end()).toNanos();
                  return b.widen(Duration.ofNanos(Math.round(nanos / divisor)));
                });
  }

  private static BoundsRule depression(double degrees) {
    return ctx -> {
      GeoLocation loc = ctx.location();
      Optional<Instant> dawn =
          SolarAngleSolver.depression(
              ctx.date(), loc.latitude(), loc.longitude(), degrees, true);
      Optional<Instant> dusk =
          SolarAngleSolver.depression(
              ctx.date(), loc.latitude(), loc.longitude(), degrees, false);
      if (dawn.isEmpty() || dusk.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(new DayBounds(dawn.get(), dusk.get()));
    };
  }
}
