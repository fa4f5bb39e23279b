package uk.ac.ebi.biostudies.index_core.analysis.analyzers;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.en.PorterStemFilter;
import org.apache.lucene.analysis.miscellaneous.ASCIIFoldingFilter;
import org.apache.lucene.analysis.miscellaneous.KeywordRepeatFilter;
import org.apache.lucene.analysis.miscellaneous.RemoveDuplicatesTokenFilter;
import org.apache.lucene.analysis.phonetic.DoubleMetaphoneFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Analyzer used to tokenize full-text document fields.
 *
 * <p>Pipeline order:
 *
 * <ol>
 *   <li>{@link StandardTokenizer}: splits text on Unicode word boundaries.
 *   <li>{@link ASCIIFoldingFilter}: removes accents.
 *   <li>{@link LowerCaseFilter}: normalizes case.
 *   <li>{@link StopFilter}: removes English stop words.
 *   <li>{@link KeywordRepeatFilter}, {@link PorterStemFilter}, {@link RemoveDuplicatesTokenFilter}:
 *       when stemming, emits the stem next to the original token at the same position.
 *   <li>{@link DoubleMetaphoneFilter}: when phonetic, injects the phonetic code at the same
 *       position.
 * </ol>
 */
public final class FullTextAnalyzer extends Analyzer {

  private static final int MAX_PHONETIC_CODE_LENGTH = 4;

  private final boolean stemming;
  private final boolean phonetics;
  private final CharArraySet stopWords;

  public FullTextAnalyzer(boolean stemming, boolean phonetics) {
    this(stemming, phonetics, EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);
  }

  public FullTextAnalyzer(boolean stemming, boolean phonetics, CharArraySet stopWords) {
    this.stemming = stemming;
    this.phonetics = phonetics;
    this.stopWords = stopWords;
  }

  @Override
  protected TokenStreamComponents createComponents(String fieldName) {
    StandardTokenizer source = new StandardTokenizer();
    TokenStream filter = new ASCIIFoldingFilter(source);
    filter = new LowerCaseFilter(filter);
    filter = new StopFilter(filter, stopWords);
    if (stemming) {
      filter = new KeywordRepeatFilter(filter);
      filter = new PorterStemFilter(filter);
      filter = new RemoveDuplicatesTokenFilter(filter);
    }
    if (phonetics) {
      filter = new DoubleMetaphoneFilter(filter, MAX_PHONETIC_CODE_LENGTH, true);
    }
    return new TokenStreamComponents(source, filter);
  }

  @Override
  protected TokenStream normalize(String fieldName, TokenStream in) {
    return new LowerCaseFilter(new ASCIIFoldingFilter(in));
  }

  public boolean isStemming() {
    return stemming;
  }

  public boolean isPhonetics() {
    return phonetics;
  }
}
