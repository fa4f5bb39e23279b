package uk.ac.ebi.biostudies.index_core.analysis;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Test;
import uk.ac.ebi.biostudies.index_core.analysis.analyzers.FullTextAnalyzer;

class AnalyzerManagerTest {

  private final AnalyzerManager manager = new AnalyzerManager();

  @Test
  void defaultLanguageIsStemmed() {
    FullTextAnalyzer analyzer = manager.getAnalyzer(Set.of(), null);

    assertTrue(analyzer.isStemming());
    assertFalse(analyzer.isPhonetics());
  }

  @Test
  void noStemOptionAndForeignLanguageDisableStemming() {
    assertFalse(manager.getAnalyzer(EnumSet.of(TokenizeOption.NO_STEM), "english").isStemming());
    assertFalse(manager.getAnalyzer(Set.of(), "german").isStemming());
    assertTrue(manager.getAnalyzer(Set.of(), "EN").isStemming());
  }

  @Test
  void analyzersAreSharedPerConfiguration() {
    FullTextAnalyzer first = manager.getAnalyzer(EnumSet.of(TokenizeOption.PHONETICS), null);
    FullTextAnalyzer second = manager.getAnalyzer(EnumSet.of(TokenizeOption.PHONETICS), "en");

    assertSame(first, second);
    assertTrue(first.isPhonetics());
    assertNotSame(first, manager.getAnalyzer(Set.of(), null));
  }
}
