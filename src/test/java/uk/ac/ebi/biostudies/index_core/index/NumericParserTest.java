package uk.ac.ebi.biostudies.index_core.index;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class NumericParserTest {

  @Test
  void parsesDecimalAndScientificValues() {
    assertEquals(42.0, NumericParser.parse(" 42").getAsDouble());
    assertEquals(-0.5, NumericParser.parse("-.5").getAsDouble());
    assertEquals(1500.0, NumericParser.parse("1.5e3").getAsDouble());
    assertEquals(Double.POSITIVE_INFINITY, NumericParser.parse("Infinity").getAsDouble());
  }

  @Test
  void rejectsNonNumbers() {
    assertTrue(NumericParser.parse(null).isEmpty());
    assertTrue(NumericParser.parse("").isEmpty());
    assertTrue(NumericParser.parse("abc").isEmpty());
    assertTrue(NumericParser.parse("1d").isEmpty());
    assertTrue(NumericParser.parse("2F").isEmpty());
    assertTrue(NumericParser.parse("0x1A").isEmpty());
    assertTrue(NumericParser.parse("NaN").isEmpty());
    assertTrue(NumericParser.parse("42 ").isEmpty());
    assertTrue(NumericParser.parse("42\n").isEmpty());
    assertTrue(NumericParser.parse("   ").isEmpty());
  }
}
