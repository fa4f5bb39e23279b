package uk.ac.ebi.biostudies.index_core.store;

import uk.ac.ebi.biostudies.index_core.store.geo.GeoIndex;
import uk.ac.ebi.biostudies.index_core.store.numeric.NumericRangeTree;
import uk.ac.ebi.biostudies.index_core.store.postings.InvertedIndex;
import uk.ac.ebi.biostudies.index_core.store.tag.TagIndex;

/**
 * Keyspace holding the per-field index structures. Keys are formatted by the owning index (see
 * {@code IndexSpec#getFormattedKey}).
 *
 * <p>Every open operation returns null when the key is missing and {@code create} is false, or
 * when the key holds a structure of a different kind.
 */
public interface IndexStore {

  InvertedIndex openInvertedIndex(String keyName, boolean create);

  NumericRangeTree openNumericIndex(String keyName, boolean create);

  TagIndex openTagIndex(String keyName, boolean create);

  GeoIndex openGeoIndex(String keyName, boolean create);

  /**
   * Removes every key starting with the given prefix.
   *
   * @param prefix key prefix
   * @return number of keys removed
   */
  int dropKeys(String prefix);
}
