package io.zmanim.display;

import static org.junit.jupiter.api.Assertions.*;

import io.zmanim.ZmanimException;
import io.zmanim.ast.Expr;
import io.zmanim.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class DisplayTest {

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "sunrise | visible_sunrise",
        "sunset - 18min | visible_sunset - 18min",
        "sunset + 1h 30min | visible_sunset + 90min",
        "solar(16.1, before_sunrise) | solar(16.1, before_visible_sunrise)",
        "solar(8.50, after_sunset) | solar(8.5, after_visible_sunset)",
        "proportional_hours(3, gra) | proportional_hours(3, gra)",
        "sunrise + (30min * 2) | visible_sunrise + 30min * 2",
        "sunrise - (20min - 2min) | visible_sunrise - (20min - 2min)",
        "sunrise+-5min | visible_sunrise + -5min",
        "midpoint(@alos, @tzeis) | midpoint(@alos, @tzeis)",
      })
  void testCanonicalText(String input, String canonical) throws ZmanimException {
    assertEquals(canonical, Display.render(Parser.parse(input)));
  }

  @Test
  void testConditionalRendering() throws ZmanimException {
    Expr expr =
        Parser.parse(
            "if (latitude>60&&!(month==6)) {civil_dawn} else if (date >= 21-May) {sunrise} "
                + "else {sunrise - 72min}");
    assertEquals(
        "if (latitude > 60 && !(month == 6)) { civil_dawn } "
            + "else if (date >= 21-May) { visible_sunrise } "
            + "else { visible_sunrise - 72min }",
        Display.render(expr));
  }

  @Test
  void testOrInsideAndKeepsParentheses() throws ZmanimException {
    Expr expr =
        Parser.parse(
            "if ((month == 6 || month == 7) && latitude > 50) { civil_dawn } else { sunrise }");
    assertTrue(
        Display.render(expr).startsWith("if ((month == 6 || month == 7) && latitude > 50)"));
  }

  @Test
  void testFormatNumber() {
    assertEquals("0", Display.formatNumber(0.0));
    assertEquals("72", Display.formatNumber(72.0));
    assertEquals("16.1", Display.formatNumber(16.1));
    assertEquals("-1.5", Display.formatNumber(-1.5));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "sunrise - 72min",
        "solar(19.8, before_sunrise)",
        "seasonal_solar(16.1, after_sunset)",
        "proportional_minutes(72, before_sunrise)",
        "proportional_hours(4, custom(solar(16.1, before_sunrise), solar(16.1, after_sunset)))",
        "first_valid(solar(16.1, before_sunrise), @alos_72, civil_dawn)",
        "later_of(solar(8.5, after_sunset), sunset + 13.5min)",
        "sunset + day_length / 10 - 2min",
        "if (season == \"winter\") { sunset + 20min } else if (day_length > 14h) { sunset } "
            + "else { sunset + 30min }",
        "if (date >= 1-Mar && date < 1-Nov || latitude < -40) { civil_dusk } else { sunset }",
        "/* comment */ midpoint(sunrise, sunset) // chatzos"
      })
  void testRoundTrip(String input) throws ZmanimException {
    Expr parsed = Parser.parse(input);
    Expr reparsed = Parser.parse(Display.render(parsed));
    assertEquals(parsed, reparsed);
  }
}
