package uk.ac.ebi.biostudies.index_core.index.management;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Holder of the live indexes, keyed by name. It does not manage their lifecycle; that is the job
 * of {@link IndexManager}.
 */
@Slf4j
@Component
public class IndexContainer implements IndexResolver {

  private final Map<String, IndexSpec> indexes = new ConcurrentHashMap<>();

  @Override
  public IndexSpec resolve(String indexName) {
    return indexName == null ? null : indexes.get(indexName);
  }

  /**
   * Retrieves an index that must exist.
   *
   * @param indexName the index name
   * @return the live index
   * @throws IllegalStateException if no index is registered under the name
   */
  public IndexSpec getIndex(String indexName) {
    IndexSpec spec = resolve(indexName);
    if (spec == null) {
      String errorMessage =
          String.format("Tried to retrieve index %s, but it does not exist", indexName);
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    return spec;
  }

  /**
   * Registers an index, replacing any previous index with the same name.
   *
   * @return the replaced index, or null
   */
  public IndexSpec put(IndexSpec spec) {
    IndexSpec previous = indexes.put(spec.getName(), spec);
    log.debug("Index {} registered with uniqueId {}", spec.getName(), spec.getUniqueId());
    return previous;
  }

  public IndexSpec remove(String indexName) {
    return indexes.remove(indexName);
  }

  public boolean contains(String indexName) {
    return indexes.containsKey(indexName);
  }

  public Collection<IndexSpec> getAll() {
    return Collections.unmodifiableCollection(indexes.values());
  }
}
