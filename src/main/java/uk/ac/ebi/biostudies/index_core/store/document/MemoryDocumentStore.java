package uk.ac.ebi.biostudies.index_core.store.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Heap-backed {@link DocumentStore}. */
@Component
public class MemoryDocumentStore implements DocumentStore {

  private final Map<String, Map<String, String>> documents = new ConcurrentHashMap<>();

  @Override
  public void save(String key, Map<String, String> fields, boolean merge) {
    documents.compute(
        key,
        (k, existing) -> {
          Map<String, String> target =
              merge && existing != null ? new LinkedHashMap<>(existing) : new LinkedHashMap<>();
          target.putAll(fields);
          return target;
        });
  }

  @Override
  public Map<String, String> load(String key) {
    Map<String, String> fields = documents.get(key);
    return fields == null ? null : Collections.unmodifiableMap(fields);
  }

  @Override
  public boolean delete(String key) {
    return documents.remove(key) != null;
  }
}
