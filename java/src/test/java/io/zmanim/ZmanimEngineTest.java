package io.zmanim;

import static org.junit.jupiter.api.Assertions.*;

import io.zmanim.ast.Expr;
import io.zmanim.astro.GeoLocation;
import io.zmanim.eval.EngineOptions;
import io.zmanim.filter.FormulaTag;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class ZmanimEngineTest {
  private static final GeoLocation JERUSALEM =
      GeoLocation.of(31.7683, 35.2137, ZoneId.of("Asia/Jerusalem"));
  private static final LocalDate DATE = LocalDate.of(2024, 3, 20);

  private final ZmanimEngine engine = new ZmanimEngine(new EngineOptions(false), 1);

  private LocalTime localTime(String source) {
    CalculationResult result = engine.calculate(Formula.of("x", source), DATE, JERUSALEM);
    assertTrue(result.isSuccess(), result.toString());
    return result.localTime().orElseThrow();
  }

  @Test
  void testCalculateSunrise() {
    CalculationResult result =
        engine.calculate(Formula.of("hanetz", "visible_sunrise"), DATE, JERUSALEM);
    assertTrue(result.isSuccess());
    assertFalse(result.isHidden());
    LocalTime sunrise = result.localTime().orElseThrow();
    long diff = Duration.between(LocalTime.of(5, 42, 35), sunrise).getSeconds();
    assertTrue(Math.abs(diff) <= 5, sunrise.toString());
    assertEquals(0, sunrise.getNano());
    assertEquals("05:43", result.rounded().orElseThrow());
  }

  @Test
  void testOffsetIsExact() {
    LocalTime sunrise = localTime("sunrise");
    assertEquals(sunrise.minusMinutes(72), localTime("sunrise - 72min"));
  }

  @Test
  void testCalculateWithReferences() {
    Instant alos = Instant.parse("2024-03-20T02:30:00Z");
    CalculationResult result =
        engine.calculate(
            Formula.of("misheyakir", "@alos + 35min"),
            DATE,
            JERUSALEM,
            Map.of("alos", alos),
            Set.of());
    assertEquals("05:05:00", result.time().orElseThrow());
    assertEquals(alos.plus(Duration.ofMinutes(35)), result.instant().orElseThrow());
  }

  @Test
  void testCalculateFailureIsReturned() {
    GeoLocation tromso = GeoLocation.of(70, 20, ZoneOffset.UTC);
    CalculationResult result =
        engine.calculate(
            Formula.of("alos", "solar(40, before_sunrise)"), LocalDate.of(2024, 6, 21), tromso);
    assertFalse(result.isSuccess());
    assertEquals(ErrorKind.EVAL, result.errorKind().orElseThrow());
    assertTrue(result.time().isEmpty());

    CalculationResult parseError =
        engine.calculate(Formula.of("bad", "sunrise +"), DATE, JERUSALEM);
    assertEquals(ErrorKind.PARSE, parseError.errorKind().orElseThrow());
  }

  @Test
  void testCalculateHidden() {
    Formula candles =
        Formula.of(
            "candle_lighting",
            "sunset - 18min",
            FormulaTag.event("shabbos"),
            FormulaTag.timing(FormulaTag.DAY_BEFORE));
    CalculationResult hidden =
        engine.calculate(candles, DATE, JERUSALEM, Map.of(), Set.of("shabbos"));
    assertTrue(hidden.isHidden());
    assertTrue(hidden.error().isEmpty());
    CalculationResult shown =
        engine.calculate(candles, DATE, JERUSALEM, Map.of(), Set.of("erev_shabbos"));
    assertTrue(shown.isSuccess());
  }

  @Test
  void testCalculateDay() throws ZmanimException {
    List<Formula> formulas =
        List.of(
            Formula.of("misheyakir", "@alos + 30min"),
            Formula.of("alos", "solar(16.1, before_sunrise)"),
            Formula.of(
                "candle_lighting",
                "sunset - 18min",
                FormulaTag.event("shabbos"),
                FormulaTag.timing(FormulaTag.DAY_BEFORE)),
            Formula.of(
                "havdalah",
                "sunset + 42min",
                FormulaTag.event("shabbos"),
                FormulaTag.timing(FormulaTag.MOTZEI)),
            Formula.of("after_havdalah", "@havdalah + 5min"),
            Formula.of("broken", "sunrise +"),
            Formula.of("fallback", "first_valid(@broken, sunrise)"));

    DayResult day = engine.calculateDay(formulas, DATE, JERUSALEM, Set.of("erev_shabbos"));

    assertEquals(
        List.of(
            "misheyakir",
            "alos",
            "candle_lighting",
            "havdalah",
            "after_havdalah",
            "broken",
            "fallback"),
        List.copyOf(day.results().keySet()));
    LocalTime alos = day.result("alos").orElseThrow().localTime().orElseThrow();
    assertEquals(
        alos.plusMinutes(30), day.result("misheyakir").orElseThrow().localTime().orElseThrow());
    assertTrue(day.result("candle_lighting").orElseThrow().isSuccess());
    assertTrue(day.result("havdalah").orElseThrow().isHidden());
    assertEquals(
        ErrorKind.REFERENCE, day.result("after_havdalah").orElseThrow().errorKind().orElseThrow());
    assertEquals(ErrorKind.PARSE, day.result("broken").orElseThrow().errorKind().orElseThrow());
    assertEquals(
        localTime("sunrise"), day.result("fallback").orElseThrow().localTime().orElseThrow());

    assertFalse(day.visibleKeys().contains("havdalah"));
    assertEquals(List.of("after_havdalah", "broken"), day.failedKeys());
    assertTrue(day.result("missing").isEmpty());
  }

  @Test
  void testCalculateDayCycle() {
    List<Formula> formulas =
        List.of(Formula.of("zman_a", "@zman_b + 1min"), Formula.of("zman_b", "@zman_a - 1min"));
    ZmanimException e =
        assertThrows(
            ZmanimException.class, () -> engine.calculateDay(formulas, DATE, JERUSALEM, Set.of()));
    assertEquals(ErrorKind.CIRCULAR_REFERENCE, e.kind());
  }

  @Test
  void testParallelEngineAgrees() throws ZmanimException {
    List<Formula> formulas =
        List.of(
            Formula.of("alos", "solar(16.1, before_sunrise)"),
            Formula.of("misheyakir", "@alos + 30min"),
            Formula.of("shema", "proportional_hours(3, custom(@alos, @tzeis))"),
            Formula.of("tzeis", "solar(8.5, after_sunset)"),
            Formula.of("chatzos", "midpoint(@alos, @tzeis)"));
    DayResult sequential = engine.calculateDay(formulas, DATE, JERUSALEM, Set.of());
    try (ZmanimEngine parallelEngine = new ZmanimEngine(new EngineOptions(false), 3)) {
      for (int day = 0; day < 5; day++) {
        LocalDate date = DATE.plusDays(day);
        DayResult expected = engine.calculateDay(formulas, date, JERUSALEM, Set.of());
        DayResult parallel = parallelEngine.calculateDay(formulas, date, JERUSALEM, Set.of());
        for (Formula formula : formulas) {
          assertEquals(
              expected.result(formula.key()).orElseThrow().time(),
              parallel.result(formula.key()).orElseThrow().time());
        }
      }
      assertEquals(
          sequential.result("shema").orElseThrow().time(),
          parallelEngine
              .calculateDay(formulas, DATE, JERUSALEM, Set.of())
              .result("shema")
              .orElseThrow()
              .time());
    }
  }

  @Test
  void testClosedEngineRejectsBatches() throws ZmanimException {
    ZmanimEngine parallelEngine = new ZmanimEngine(new EngineOptions(false), 2);
    List<Formula> formulas =
        List.of(Formula.of("a", "sunrise"), Formula.of("b", "@a + 10min"));
    assertTrue(
        parallelEngine.calculateDay(formulas, DATE, JERUSALEM, Set.of()).failedKeys().isEmpty());
    parallelEngine.close();
    assertThrows(
        IllegalStateException.class,
        () -> parallelEngine.calculateDay(formulas, DATE, JERUSALEM, Set.of()));
    // Single formulas never use the pool.
    assertTrue(parallelEngine.calculate(formulas.get(0), DATE, JERUSALEM).isSuccess());
  }

  @Test
  void testDurationOverflowIsReturnedAsError() throws ZmanimException {
    Formula overflow = Formula.of("overflow", "sunrise + (2000000h + 2000000h) * 2");
    CalculationResult result = engine.calculate(overflow, DATE, JERUSALEM);
    assertEquals(ErrorKind.TYPE, result.errorKind().orElseThrow());

    CalculationResult halved =
        engine.calculate(
            Formula.of("far", "sunrise + (2000000h + 2000000h) / 2"), DATE, JERUSALEM);
    assertTrue(halved.isSuccess(), halved.toString());

    DayResult day =
        engine.calculateDay(
            List.of(overflow, Formula.of("hanetz", "sunrise")), DATE, JERUSALEM, Set.of());
    assertEquals(List.of("overflow"), day.failedKeys());
    assertTrue(day.result("hanetz").orElseThrow().isSuccess());
  }

  @Test
  void testValidate() throws ZmanimException {
    engine.validate("misheyakir", "@alos + 30min", Set.of("alos", "tzeis"));

    ZmanimException self =
        assertThrows(
            ZmanimException.class,
            () -> engine.validate("alos", "@alos - 1min", Set.of("alos")));
    assertEquals(ErrorKind.REFERENCE, self.kind());
    assertEquals("formula @alos references itself", self.getMessage());

    ZmanimException unknown =
        assertThrows(
            ZmanimException.class,
            () -> engine.validate("misheyakir", "@also + 30min", Set.of("alos", "tzeis")));
    assertEquals(ErrorKind.REFERENCE, unknown.kind());
    assertEquals("undefined reference: @also", unknown.getMessage());
    assertEquals("@alos", unknown.suggestion().orElseThrow());
    assertEquals(0, unknown.span().orElseThrow().start());

    ZmanimException parse =
        assertThrows(
            ZmanimException.class, () -> engine.validate("x", "sunrise + sunset", Set.of()));
    assertEquals(ErrorKind.TYPE, parse.kind());
  }

  @Test
  void testParseCache() throws ZmanimException {
    Expr first = engine.parse("sunrise - 72min");
    assertSame(first, engine.parse("sunrise - 72min"));
    assertNotSame(first, engine.parse("sunrise - 90min"));
  }

  @Test
  void testParseCacheIsBounded() throws ZmanimException {
    ZmanimEngine small = new ZmanimEngine(new EngineOptions(false), 1, 2);
    Expr alos = small.parse("sunrise - 72min");
    small.parse("sunrise - 90min");
    assertSame(alos, small.parse("sunrise - 72min"));
    Expr tzeis = small.parse("sunset + 18min");

    assertEquals(2, small.cachedFormulaCount());
    assertSame(alos, small.parse("sunrise - 72min"));
    assertSame(tzeis, small.parse("sunset + 18min"));
    assertEquals(2, small.cachedFormulaCount());
  }

  @Test
  void testValidateDoesNotCacheDrafts() throws ZmanimException {
    ZmanimEngine fresh = new ZmanimEngine(new EngineOptions(false), 1);
    for (int i = 0; i < 10; i++) {
      fresh.validate("draft", "sunrise - " + i + "min", Set.of());
    }
    assertEquals(0, fresh.cachedFormulaCount());
  }

  @Test
  void testParseCacheSizeMustBePositive() {
    assertThrows(
        IllegalArgumentException.class, () -> new ZmanimEngine(new EngineOptions(false), 1, 0));
  }

  @Test
  void testSecondsAreTruncated() {
    CalculationResult result =
        CalculationResult.success(
            "x",
            Instant.parse("2024-03-20T03:42:35.900Z").atZone(ZoneOffset.UTC),
            DisplayRounding.MATH);
    assertEquals("03:42:35", result.time().orElseThrow());
    assertEquals("03:43", result.rounded().orElseThrow());
    assertEquals(
        Instant.parse("2024-03-20T03:42:35Z"),
        result.instant().orElseThrow().truncatedTo(ChronoUnit.SECONDS));
    assertEquals(0, result.localTime().orElseThrow().getNano());
  }
}
