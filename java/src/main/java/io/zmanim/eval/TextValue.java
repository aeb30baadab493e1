package io.zmanim.eval;

/**
 * A text value, such as the season name.
 *
 * @param value the text
 */
public record TextValue(String value) implements Value {
  @Override
  public String typeName() {
    return "text";
  }
}
