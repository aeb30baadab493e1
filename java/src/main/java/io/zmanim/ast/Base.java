package io.zmanim.ast;

import java.util.Arrays;
import java.util.Optional;

/** A named day-boundary policy used by {@code proportional_hours}. */
public enum Base {
  GRA("gra"),
  BAAL_HATANYA("baal_hatanya"),
  MGA("mga"),
  MGA_60("mga_60"),
  MGA_72("mga_72"),
  MGA_90("mga_90"),
  MGA_96("mga_96"),
  MGA_120("mga_120"),
  MGA_72_ZMANIS("mga_72_zmanis"),
  MGA_90_ZMANIS("mga_90_zmanis"),
  MGA_96_ZMANIS("mga_96_zmanis"),
  MGA_16_1("mga_16_1"),
  MGA_18("mga_18"),
  MGA_19_8("mga_19_8"),
  MGA_26("mga_26"),
  ATERET_TORAH("ateret_torah"),
  /** Day start and end given as two expressions: {@code custom(start, end)}. */
  CUSTOM("custom");

  private final String displayName;

  Base(String displayName) {
    this.displayName = displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Parses a base name.
   *
   * @param s the name
   * @return the base if known
   */
  public static Optional<Base> parse(String s) {
    return Arrays.stream(values()).filter(b -> b.displayName.equals(s)).findFirst();
  }
}
