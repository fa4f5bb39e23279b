package uk.ac.ebi.biostudies.index_core.analysis;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;

/**
 * Runs an analyzer over field text and reports each token with its absolute position and byte
 * offset. Positions continue from a caller-supplied starting point so that all full-text fields of
 * a document share one position space.
 */
public final class TextTokenizer {

  private TextTokenizer() {}

  /** Receives tokens from {@link #tokenize}. */
  @FunctionalInterface
  public interface TokenConsumer {
    void accept(String term, int position, int byteOffset);
  }

  /**
   * Tokenizes text.
   *
   * @param analyzer the analyzer to run
   * @param fieldName field name passed to the analyzer
   * @param text the field text
   * @param lastPosition position of the last token already emitted for the document
   * @param consumer token receiver
   * @return position of the last token emitted, or {@code lastPosition} if the text had no tokens
   */
  public static int tokenize(
      Analyzer analyzer, String fieldName, String text, int lastPosition, TokenConsumer consumer) {
    int position = lastPosition;
    try (TokenStream stream = analyzer.tokenStream(fieldName, text)) {
      CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
      PositionIncrementAttribute posInc = stream.addAttribute(PositionIncrementAttribute.class);
      OffsetAttribute offset = stream.addAttribute(OffsetAttribute.class);
      stream.reset();

      int charCursor = 0;
      int byteCursor = 0;
      while (stream.incrementToken()) {
        position += posInc.getPositionIncrement();
        int start = offset.startOffset();
        if (start < charCursor) {
          charCursor = 0;
          byteCursor = 0;
        }
        byteCursor += utf8Length(text, charCursor, start);
        charCursor = start;
        consumer.accept(term.toString(), position, byteCursor);
      }
      stream.end();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to tokenize field " + fieldName, e);
    }
    return position;
  }

  private static int utf8Length(String text, int from, int to) {
    if (from >= to) {
      return 0;
    }
    return text.substring(from, to).getBytes(StandardCharsets.UTF_8).length;
  }
}
