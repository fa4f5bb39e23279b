package uk.ac.ebi.biostudies.index_core.index.management;

/** Looks up the live index currently registered under a name. */
@FunctionalInterface
public interface IndexResolver {

  /**
   * Resolves an index by name.
   *
   * @param indexName the index name
   * @return the live index, or null if no index is registered under the name
   */
  IndexSpec resolve(String indexName);
}
