package uk.ac.ebi.biostudies.index_core.gc;

import lombok.Getter;
import uk.ac.ebi.biostudies.index_core.index.management.IndexResolver;
import uk.ac.ebi.biostudies.index_core.index.management.IndexSpec;

/**
 * Identity check for an index held across a yield. The guard remembers the index name and the
 * uniqueId seen when the work started; {@link #revalidate()} re-resolves the name and only returns
 * the index if it is still the same incarnation.
 */
@Getter
public final class IndexGuard {

  private final IndexResolver resolver;
  private final String indexName;
  private final long uniqueId;

  public IndexGuard(IndexResolver resolver, String indexName, long uniqueId) {
    this.resolver = resolver;
    this.indexName = indexName;
    this.uniqueId = uniqueId;
  }

  /**
   * Re-resolves the index.
   *
   * @return the index, or null if it was dropped or replaced by a new incarnation
   */
  public IndexSpec revalidate() {
    IndexSpec spec = resolver.resolve(indexName);
    if (spec == null || spec.getUniqueId() != uniqueId) {
      return null;
    }
    return spec;
  }
}
