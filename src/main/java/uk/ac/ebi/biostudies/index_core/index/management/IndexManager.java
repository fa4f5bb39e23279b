package uk.ac.ebi.biostudies.index_core.index.management;

import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.index_core.config.GcConfig;
import uk.ac.ebi.biostudies.index_core.gc.GarbageCollector;
import uk.ac.ebi.biostudies.index_core.gc.GarbageCollectorTask;
import uk.ac.ebi.biostudies.index_core.gc.SnapshotLoadingProbe;
import uk.ac.ebi.biostudies.index_core.index.DocumentIndexer;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexSchema;
import uk.ac.ebi.biostudies.index_core.store.IndexStore;
import uk.ac.ebi.biostudies.index_core.store.document.DocumentMetadata;
import uk.ac.ebi.biostudies.index_core.store.document.DocumentStore;

/**
 * Manages the lifecycle of live indexes: creation from a schema, drop, rebuild, document deletion,
 * and the garbage collector attached to each index.
 */
@Slf4j
@Component
public class IndexManager {

  private final IndexContainer container;
  private final IndexStore indexStore;
  private final DocumentStore documentStore;
  private final DocumentIndexer documentIndexer;
  private final SnapshotLoadingProbe loadingProbe;
  private final GcConfig gcConfig;
  private final AtomicLong uniqueIds = new AtomicLong();
  private final Map<String, GarbageCollectorTask> gcTasks = new ConcurrentHashMap<>();

  public IndexManager(
      IndexContainer container,
      IndexStore indexStore,
      DocumentStore documentStore,
      DocumentIndexer documentIndexer,
      SnapshotLoadingProbe loadingProbe,
      GcConfig gcConfig) {
    this.container = container;
    this.indexStore = indexStore;
    this.documentStore = documentStore;
    this.documentIndexer = documentIndexer;
    this.loadingProbe = loadingProbe;
    this.gcConfig = gcConfig;
  }

  /**
   * Creates a live index from a schema and starts its collector if collectors are enabled.
   *
   * @param schema the index schema
   * @return the new index
   * @throws IllegalStateException if an index with the same name exists
   */
  public IndexSpec createIndex(IndexSchema schema) {
    if (container.contains(schema.getIndexName())) {
      throw new IllegalStateException("Index already exists: " + schema.getIndexName());
    }
    IndexSpec spec = new IndexSpec(schema, uniqueIds.incrementAndGet());
    spec.setGc(
        new GarbageCollector(
            spec, container, indexStore, loadingProbe, gcConfig, new Random()));
    container.put(spec);
    log.info(
        "Index {} created with {} fields (uniqueId {})",
        spec.getName(),
        schema.getFields().size(),
        spec.getUniqueId());
    if (gcConfig.isEnabled()) {
      startGc(spec);
    }
    return spec;
  }

  /**
   * Drops an index and all of its structures.
   *
   * @param indexName the index name
   * @param deleteDocuments also delete the stored documents of the index
   * @return true if the index existed
   */
  public boolean dropIndex(String indexName, boolean deleteDocuments) {
    IndexSpec spec = container.remove(indexName);
    if (spec == null) {
      return false;
    }
    stopGc(indexName);
    List<String> keys = new ArrayList<>();
    spec.getLock().lock();
    try {
      dropKeys(spec);
      if (deleteDocuments) {
        spec.getDocs().forEachKey(keys::add);
      }
    } finally {
      spec.getLock().unlock();
    }
    keys.forEach(documentStore::delete);
    log.info("Index {} dropped (uniqueId {})", indexName, spec.getUniqueId());
    return true;
  }

  /**
   * Replaces an index with an empty one built from the same schema. The new index gets a new
   * uniqueId, so work still holding the old one detects the change.
   *
   * @param indexName the index name
   * @return the new index
   * @throws IllegalStateException if the index does not exist
   */
  public IndexSpec rebuildIndex(String indexName) {
    IndexSpec old = container.getIndex(indexName);
    dropIndex(indexName, false);
    return createIndex(old.getSchema());
  }

  /**
   * Deletes a document. Its postings stay in place until the collector reclaims them, except for
   * geo entries which are removed at once. The collector is hinted to speed up.
   *
   * @param indexName the index name
   * @param key document key
   * @param deleteStored also delete the stored document fields
   * @return true if the document existed
   * @throws IllegalStateException if the index does not exist
   */
  public boolean deleteDocument(String indexName, String key, boolean deleteStored) {
    IndexSpec spec = container.getIndex(indexName);
    DocumentMetadata md;
    spec.getLock().lock();
    try {
      md = spec.getDocs().delete(key);
      if (md == null) {
        return false;
      }
      documentIndexer.removeOnDemandEntries(spec, md);
      spec.getStats().documentRemoved();
    } finally {
      spec.getLock().unlock();
    }
    if (deleteStored) {
      documentStore.delete(key);
    }
    GarbageCollector gc = spec.getGc();
    if (gc != null) {
      gc.onDelete();
    }
    log.debug("Deleted document {} (docId {}) from {}", key, md.getId(), indexName);
    return true;
  }

  public IndexSpec getIndex(String indexName) {
    return container.getIndex(indexName);
  }

  public void startGc(IndexSpec spec) {
    GarbageCollectorTask task = new GarbageCollectorTask(spec.getGc());
    GarbageCollectorTask previous = gcTasks.put(spec.getName(), task);
    if (previous != null) {
      previous.stop();
    }
    task.start();
  }

  public void stopGc(String indexName) {
    GarbageCollectorTask task = gcTasks.remove(indexName);
    if (task != null) {
      task.stop();
    }
  }

  public boolean isGcRunning(String indexName) {
    GarbageCollectorTask task = gcTasks.get(indexName);
    return task != null && task.isRunning();
  }

  @PreDestroy
  public void shutdown() {
    log.info("Stopping {} garbage collectors", gcTasks.size());
    gcTasks.values().forEach(GarbageCollectorTask::stop);
    gcTasks.clear();
  }

  private void dropKeys(IndexSpec spec) {
    int dropped = 0;
    for (IndexFieldType type : IndexFieldType.values()) {
      dropped += indexStore.dropKeys(spec.getKeyPrefix(type));
    }
    log.debug("Dropped {} structures of index {}", dropped, spec.getName());
  }
}
