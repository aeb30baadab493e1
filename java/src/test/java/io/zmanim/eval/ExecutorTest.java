package io.zmanim.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.zmanim.ErrorKind;
import io.zmanim.ZmanimException;
import io.zmanim.ast.Primitive;
import io.zmanim.astro.GeoLocation;
import io.zmanim.parser.Parser;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class ExecutorTest {
  private static final GeoLocation JERUSALEM =
      GeoLocation.of(31.7683, 35.2137, ZoneId.of("Asia/Jerusalem"));
  private static final GeoLocation EQUATOR = GeoLocation.of(0, 0, ZoneOffset.UTC);
  private static final GeoLocation TROMSO = GeoLocation.of(70, 20, ZoneOffset.UTC);
  private static final LocalDate EQUINOX = LocalDate.of(2024, 3, 20);
  private static final LocalDate SOLSTICE = LocalDate.of(2024, 6, 21);

  private final Executor executor = new Executor();

  private static EvaluationContext context(LocalDate date, GeoLocation location) {
    return EvaluationContext.create(date, location, EngineOptions.DEFAULT);
  }

  private Value eval(String formula, EvaluationContext ctx) throws ZmanimException {
    return executor.evaluate(Parser.parse(formula), ctx);
  }

  private Instant time(String formula, EvaluationContext ctx) throws ZmanimException {
    return executor.evaluateTime(Parser.parse(formula), ctx);
  }

  private static Instant primitive(EvaluationContext ctx, Primitive primitive) {
    return ctx.solarDay().get(primitive).orElseThrow();
  }

  private static void assertClose(Instant expected, Instant actual, long seconds) {
    long diff = Math.abs(Duration.between(expected, actual).getSeconds());
    assertTrue(diff <= seconds, "expected " + expected + " but got " + actual);
  }

  @Test
  void testOffsetFromPrimitive() throws ZmanimException {
    EvaluationContext ctx = context(EQUINOX, JERUSALEM);
    Instant sunrise = primitive(ctx, Primitive.VISIBLE_SUNRISE);
    assertEquals(sunrise.minus(Duration.ofMinutes(72)), time("sunrise - 72min", ctx));
    assertEquals(sunrise.plus(Duration.ofMinutes(90)), time("sunrise + 1h 30min", ctx));
  }

  @Test
  void testSolarAngle() throws ZmanimException {
    EvaluationContext ctx = context(EQUINOX, JERUSALEM);
    Instant sunrise = primitive(ctx, Primitive.VISIBLE_SUNRISE);
    Instant alos = time("solar(16.1, before_sunrise)", ctx);
    assertEquals(72.16, Duration.between(alos, sunrise).toMillis() / 60_000.0, 0.1);
  }

  @Test
  void testFirstValidFallsBackAtHighLatitude() throws ZmanimException {
    EvaluationContext ctx = context(SOLSTICE, TROMSO);
    assertTrue(eval("solar(40, before_sunrise)", ctx).isFailure());
    assertEquals(
        primitive(ctx, Primitive.SOLAR_MIDNIGHT),
        time("first_valid(solar(40, before_sunrise), solar_midnight)", ctx));
  }

  @Test
  void testFailureReachingTopIsEvalError() {
    EvaluationContext ctx = context(SOLSTICE, TROMSO);
    ZmanimException e =
        assertThrows(ZmanimException.class, () -> time("solar(40, before_sunrise) + 5min", ctx));
    assertEquals(ErrorKind.EVAL, e.kind());
  }

  @Test
  void testAllAlternativesFailing() throws ZmanimException {
    EvaluationContext ctx = context(SOLSTICE, TROMSO);
    Value value = eval("first_valid(solar(40, before_sunrise), sunrise)", ctx);
    assertTrue(value.isFailure());
  }

  @Test
  void testMidpointOfSunriseAndSunsetIsNoonAtEquator() throws ZmanimException {
    EvaluationContext ctx = context(EQUINOX, EQUATOR);
    assertClose(
        primitive(ctx, Primitive.SOLAR_NOON), time("midpoint(sunrise, sunset)", ctx), 2);
    assertClose(
        time("midpoint(sunrise, sunset)", ctx),
        time("sunrise + (sunset - sunrise) / 2", ctx),
        0);
  }

  @Test
  void testProportionalHoursGra() throws ZmanimException {
    EvaluationContext ctx = context(EQUINOX, JERUSALEM);
    Instant sunset = primitive(ctx, Primitive.VISIBLE_SUNSET);
    assertClose(sunset, time("proportional_hours(12, gra)", ctx), 0);
    LocalTime shema =
        time("proportional_hours(3, gra)", ctx).atZone(JERUSALEM.zone()).toLocalTime();
    assertTrue(
        Math.abs(Duration.between(LocalTime.of(8, 44, 39), shema).getSeconds()) <= 5,
        shema.toString());
  }

  @Test
  void testProportionalHoursMga() throws ZmanimException {
    EvaluationContext ctx = context(SOLSTICE, JERUSALEM);
    Instant start = primitive(ctx, Primitive.VISIBLE_SUNRISE).minus(Duration.ofMinutes(72));
    Instant end = primitive(ctx, Primitive.VISIBLE_SUNSET).plus(Duration.ofMinutes(72));
    Instant expected = start.plus(Duration.between(start, end).dividedBy(4));
    assertClose(expected, time("proportional_hours(3, mga)", ctx), 0);
    assertClose(expected, time("proportional_hours(3, mga_72)", ctx), 0);
    assertClose(
        expected,
        time("proportional_hours(3, custom(sunrise - 72min, sunset + 72min))", ctx),
        0);
  }

  @Test
  void testProportionalHoursAngleBaseFailsWithoutTwilight() throws ZmanimException {
    EvaluationContext ctx = context(SOLSTICE, TROMSO);
    assertTrue(eval("proportional_hours(3, mga_16_1)", ctx).isFailure());
  }

  @Test
  void testDayBoundsAtZeroIsStart() {
    Instant start = Instant.parse("2024-03-20T03:42:35Z");
    DayBounds bounds = new DayBounds(start, start.plus(Duration.ofHours(12)));
    assertEquals(start, bounds.at(0));
    assertEquals(start.plus(Duration.ofHours(3)), bounds.at(3));
  }

  @Test
  void testProportionalMinutes() throws ZmanimException {
    EvaluationContext ctx = context(SOLSTICE, JERUSALEM);
    Instant sunrise = primitive(ctx, Primitive.VISIBLE_SUNRISE);
    Duration dayLength = ctx.solarDay().dayLength().orElseThrow();
    Instant expected = sunrise.minus(Duration.ofNanos(Math.round(dayLength.toNanos() * 0.1)));
    assertClose(expected, time("proportional_minutes(72, before_sunrise)", ctx), 0);
  }

  @Test
  void testSeasonalSolarScalesEquinoxOffset() throws ZmanimException {
    EvaluationContext ctx = context(SOLSTICE, JERUSALEM);
    LocalTime alos =
        time("seasonal_solar(16.1, before_sunrise)", ctx).atZone(JERUSALEM.zone()).toLocalTime();
    long diff = Duration.between(LocalTime.of(4, 8, 41), alos).getSeconds();
    assertTrue(Math.abs(diff) <= 5, alos.toString());
  }

  @Test
  void testSeasonalSolarOnEquinoxDay() throws ZmanimException {
    EvaluationContext ctx = context(EQUINOX, JERUSALEM);
    Instant sunrise = primitive(ctx, Primitive.VISIBLE_SUNRISE);
    Instant dawn = time("solar(16.1, before_sunrise)", ctx);
    double ratio = ctx.solarDay().dayLength().orElseThrow().toNanos() / (720 * 60e9);
    Instant expected =
        sunrise.minus(
            Duration.ofNanos(Math.round(Duration.between(dawn, sunrise).toNanos() * ratio)));
    assertClose(expected, time("seasonal_solar(16.1, before_sunrise)", ctx), 0);
  }

  @Test
  void testEarlierAndLaterOf() throws ZmanimException {
    EvaluationContext ctx = context(EQUINOX, JERUSALEM);
    Instant sunrise = primitive(ctx, Primitive.VISIBLE_SUNRISE);
    Instant civil = primitive(ctx, Primitive.CIVIL_DAWN);
    assertEquals(civil, time("earlier_of(sunrise, civil_dawn)", ctx));
    assertEquals(sunrise, time("later_of(civil_dawn, sunrise)", ctx));
  }

  @Test
  void testEarlierOfDoesNotFallBack() throws ZmanimException {
    EvaluationContext ctx = context(SOLSTICE, TROMSO);
    assertTrue(eval("earlier_of(solar(40, before_sunrise), solar_noon)", ctx).isFailure());
  }

  @Test
  void testConditionOnDate() throws ZmanimException {
    EvaluationContext ctx = context(EQUINOX, JERUSALEM);
    assertEquals(
        primitive(ctx, Primitive.VISIBLE_SUNRISE),
        time("if (date >= 21-Mar) { sunset } else { sunrise }", ctx));
    assertEquals(
        primitive(ctx, Primitive.VISIBLE_SUNSET),
        time("if (date == 20-Mar && day == 20 && month == 3) { sunset } else { sunrise }", ctx));
  }

  @Test
  void testConditionOnSeasonAndDayLength() throws ZmanimException {
    EvaluationContext north = context(EQUINOX, JERUSALEM);
    assertEquals(
        primitive(north, Primitive.VISIBLE_SUNSET),
        time("if (season == \"spring\" && day_length > 12h) { sunset } else { sunrise }", north));

    GeoLocation sydney = GeoLocation.of(-33.87, 151.21, ZoneId.of("Australia/Sydney"));
    EvaluationContext south = context(EQUINOX, sydney);
    assertEquals(
        primitive(south, Primitive.VISIBLE_SUNRISE),
        time("if (season == \"spring\") { sunset } else { sunrise }", south));
  }

  @Test
  void testConditionOnLatitudeAndLongitude() throws ZmanimException {
    EvaluationContext ctx = context(EQUINOX, JERUSALEM);
    assertEquals(
        primitive(ctx, Primitive.CIVIL_DAWN),
        time(
            "if (latitude > 60) { sunrise } else if (longitude > 30) { civil_dawn } "
                + "else { sunset }",
            ctx));
  }

  @Test
  void testLeapDayLiteralInCommonYear() {
    EvaluationContext ctx = context(LocalDate.of(2023, 3, 1), JERUSALEM);
    ZmanimException e =
        assertThrows(
            ZmanimException.class,
            () -> time("if (date > 29-Feb) { sunset } else { sunrise }", ctx));
    assertEquals(ErrorKind.TYPE, e.kind());
  }

  @Test
  void testNestedConditionalWithoutMatchIsFailure() throws ZmanimException {
    EvaluationContext ctx = context(EQUINOX, JERUSALEM);
    assertTrue(eval("earlier_of(if (month == 6) { sunrise }, sunset)", ctx).isFailure());
    assertEquals(
        primitive(ctx, Primitive.VISIBLE_SUNSET),
        time("first_valid(if (month == 6) { sunrise }, sunset)", ctx));
  }

  @Test
  void testReferences() throws ZmanimException {
    EvaluationContext base = context(EQUINOX, JERUSALEM);
    Instant alos = Instant.parse("2024-03-20T02:30:00Z");
    EvaluationContext ctx = base.withResolved(Map.of("alos", new TimeValue(alos)));
    assertEquals(alos.plus(Duration.ofMinutes(30)), time("@alos + 30min", ctx));

    ZmanimException e = assertThrows(ZmanimException.class, () -> time("@tzeis", ctx));
    assertEquals(ErrorKind.REFERENCE, e.kind());
    assertEquals("undefined reference: @tzeis", e.getMessage());
  }

  @Test
  void testFailedReferenceFlowsIntoFirstValid() throws ZmanimException {
    EvaluationContext ctx =
        context(EQUINOX, JERUSALEM).withResolved(Map.of("alos", new FailureValue("no dawn")));
    assertTrue(eval("@alos - 5min", ctx).isFailure());
    assertEquals(
        primitive(ctx, Primitive.CIVIL_DAWN), time("first_valid(@alos, civil_dawn)", ctx));
  }

  @Test
  void testComputedDivisionByZero() {
    EvaluationContext ctx = context(EQUINOX, JERUSALEM);
    ZmanimException e =
        assertThrows(ZmanimException.class, () -> time("sunrise + 10min / (month - 3)", ctx));
    assertEquals(ErrorKind.TYPE, e.kind());
    assertEquals("division by zero", e.getMessage());
  }

  @Test
  void testComputedArgumentOutOfRange() {
    EvaluationContext ctx = context(LocalDate.of(2024, 12, 1), JERUSALEM);
    ZmanimException e =
        assertThrows(
            ZmanimException.class, () -> time("solar(month * 10, before_sunrise)", ctx));
    assertEquals(ErrorKind.TYPE, e.kind());
    assertEquals("solar() degrees must be between 0 and 90, got 120", e.getMessage());
  }

  @Test
  void testLongDurationsDoNotOverflowScaling() throws ZmanimException {
    EvaluationContext ctx = context(EQUINOX, JERUSALEM);
    Instant sunrise = primitive(ctx, Primitive.VISIBLE_SUNRISE);
    // The sum exceeds a long count of nanoseconds before it is halved.
    assertEquals(
        sunrise.plus(Duration.ofHours(2_000_000)),
        time("sunrise + (2000000h + 2000000h) / 2", ctx));
  }

  @Test
  void testScaledDurationOverflowIsTypeError() {
    EvaluationContext ctx = context(EQUINOX, JERUSALEM);
    ZmanimException e =
        assertThrows(
            ZmanimException.class, () -> time("sunrise + (2000000h + 2000000h) * 2", ctx));
    assertEquals(ErrorKind.TYPE, e.kind());
    assertEquals("duration overflow", e.getMessage());
  }

  @Test
  void testOverlongCustomDayIsTypeError() {
    EvaluationContext ctx = context(EQUINOX, JERUSALEM);
    ZmanimException e =
        assertThrows(
            ZmanimException.class,
            () ->
                time(
                    "proportional_hours(6, custom(sunrise, sunrise + 2000000h + 2000000h))",
                    ctx));
    assertEquals(ErrorKind.TYPE, e.kind());
    assertTrue(e.getMessage().startsWith("time arithmetic out of range"), e.getMessage());
  }

  @Test
  void testDurationArithmetic() throws ZmanimException {
    EvaluationContext ctx = context(EQUINOX, JERUSALEM);
    Instant sunset = primitive(ctx, Primitive.VISIBLE_SUNSET);
    assertEquals(sunset.plus(Duration.ofMinutes(60)), time("sunset + 30min * 2", ctx));
    assertEquals(sunset.plus(Duration.ofMinutes(60)), time("sunset + 2 * 30min", ctx));
    assertEquals(sunset.plus(Duration.ofMinutes(15)), time("sunset + 30min / 2", ctx));
    assertEquals(sunset.minus(Duration.ofMinutes(10)), time("sunset + (5min - 15min)", ctx));
  }

  @Test
  void testSeason() {
    assertEquals(Season.SPRING, Season.of(3, 31.7));
    assertEquals(Season.AUTUMN, Season.of(3, -33.8));
    assertEquals(Season.WINTER, Season.of(12, 0));
    assertEquals(Season.SUMMER, Season.of(1, -0.1));
  }
}
