package uk.ac.ebi.biostudies.index_core.analysis;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.index_core.analysis.analyzers.FullTextAnalyzer;

/**
 * Hands out the full-text analyzers used by the indexing pipeline, one per combination of stemming
 * and phonetics. Analyzers are created lazily and shared; Lucene analyzers are thread-safe.
 *
 * <p>Stemming is only applied to English text. Documents in any other language are indexed
 * without stemming.
 */
@Slf4j
@Component
public class AnalyzerManager {

  public static final String DEFAULT_LANGUAGE = "english";

  private static final Set<String> STEMMED_LANGUAGES = Set.of("english", "en");

  private final Map<String, FullTextAnalyzer> analyzers = new ConcurrentHashMap<>();

  /**
   * Returns the analyzer for a field.
   *
   * @param options the field's tokenize options
   * @param language document language, null for the default
   * @return a shared analyzer instance
   */
  public FullTextAnalyzer getAnalyzer(Set<TokenizeOption> options, String language) {
    boolean stemming = !options.contains(TokenizeOption.NO_STEM) && supportsStemming(language);
    boolean phonetics = options.contains(TokenizeOption.PHONETICS);
    String key = (stemming ? "stem" : "nostem") + (phonetics ? "+phonetic" : "");
    return analyzers.computeIfAbsent(
        key,
        k -> {
          log.debug("Creating full-text analyzer {}", k);
          return new FullTextAnalyzer(stemming, phonetics);
        });
  }

  public boolean supportsStemming(String language) {
    if (language == null || language.isBlank()) {
      return true;
    }
    return STEMMED_LANGUAGES.contains(language.toLowerCase(Locale.ROOT));
  }
}
