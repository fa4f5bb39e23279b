package uk.ac.ebi.biostudies.index_core.index;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Transient term map of one document, built by the full-text preprocessor and written to the term
 * postings at commit.
 */
public class ForwardIndex {

  private final Map<String, ForwardIndexEntry> entries = new LinkedHashMap<>();
  @Getter private int totalFreq;
  @Getter private int maxFreq;

  /**
   * Records one occurrence of a term.
   *
   * @param term the token text
   * @param ftId full-text field id of the field the token came from
   * @param fieldWeight weight of that field
   * @param position token position within the document
   */
  public void add(String term, int ftId, double fieldWeight, int position) {
    ForwardIndexEntry entry = entries.computeIfAbsent(term, ForwardIndexEntry::new);
    entry.add(ftId, fieldWeight, position);
    totalFreq++;
    maxFreq = Math.max(maxFreq, entry.getFreq());
  }

  public ForwardIndexEntry get(String term) {
    return entries.get(term);
  }

  public Collection<ForwardIndexEntry> getEntries() {
    return Collections.unmodifiableCollection(entries.values());
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }
}
