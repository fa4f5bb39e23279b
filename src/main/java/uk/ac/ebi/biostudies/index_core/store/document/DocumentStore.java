package uk.ac.ebi.biostudies.index_core.store.document;

import java.util.Map;

/**
 * Source of truth for raw document fields. Indexing reads from it when a partial update forces a
 * full reindex.
 */
public interface DocumentStore {

  /**
   * Writes the fields of a document.
   *
   * @param key document key
   * @param fields field name to raw text
   * @param merge true to merge into existing fields, false to replace them
   */
  void save(String key, Map<String, String> fields, boolean merge);

  /**
   * Loads the stored fields of a document.
   *
   * @param key document key
   * @return field name to raw text in stored order, or null if the document is unknown
   */
  Map<String, String> load(String key);

  boolean delete(String key);
}
