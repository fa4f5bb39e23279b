package uk.ac.ebi.biostudies.index_core.index;

import java.util.Locale;
import java.util.OptionalDouble;

/** Strict text-to-double conversion used for numeric fields. */
final class NumericParser {

  private NumericParser() {}

  /**
   * Parses a decimal or scientific number. Java type suffixes ({@code 1d}, {@code 2f}), hex
   * literals and NaN are rejected; infinities are accepted. Leading whitespace is skipped, any
   * trailing character, whitespace included, makes the text invalid.
   *
   * @param text the text to parse, may be null
   * @return the value, or empty if the text is not a number
   */
  static OptionalDouble parse(String text) {
    if (text == null) {
      return OptionalDouble.empty();
    }
    String trimmed = text.stripLeading();
    if (trimmed.isEmpty() || Character.isWhitespace(trimmed.charAt(trimmed.length() - 1))) {
      return OptionalDouble.empty();
    }
    char last = Character.toLowerCase(trimmed.charAt(trimmed.length() - 1));
    if (last == 'd' || last == 'f' || trimmed.toLowerCase(Locale.ROOT).contains("x")) {
      return OptionalDouble.empty();
    }
    try {
      double value = Double.parseDouble(trimmed);
      return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
    } catch (NumberFormatException e) {
      return OptionalDouble.empty();
    }
  }
}
