package uk.ac.ebi.biostudies.index_core.index;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import uk.ac.ebi.biostudies.index_core.exceptions.IndexingException;
import uk.ac.ebi.biostudies.index_core.exceptions.QueryErrorCode;
import uk.ac.ebi.biostudies.index_core.index.management.IndexSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.FieldSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;
import uk.ac.ebi.biostudies.index_core.store.IndexStore;
import uk.ac.ebi.biostudies.index_core.store.geo.GeoIndex;
import uk.ac.ebi.biostudies.index_core.store.numeric.NumericRangeTree;
import uk.ac.ebi.biostudies.index_core.store.tag.TagIndex;

/**
 * Commits the preprocessed non-text values of one document. Structures opened for a field are
 * cached per type and key for the rest of the add, and dropped by {@link #release()}.
 *
 * <p>Full-text values are not committed here; they reach the postings through the forward index.
 */
public class IndexBulkData {

  private final IndexStore store;
  private final IndexSpec spec;
  private final Map<IndexFieldType, Map<String, Object>> handles =
      new EnumMap<>(IndexFieldType.class);

  public IndexBulkData(IndexStore store, IndexSpec spec) {
    this.store = store;
    this.spec = spec;
  }

  /**
   * Commits every non-text type of a field.
   *
   * @throws IndexingException with {@link QueryErrorCode#GENERIC} if a structure cannot be opened
   *     or a value cannot be indexed
   */
  public void add(
      long docId, FieldSpec fs, Set<IndexFieldType> types, FieldIndexerData data) {
    for (IndexFieldType type : IndexFieldType.values()) {
      if (!types.contains(type)) {
        continue;
      }
      switch (type) {
        case FULLTEXT -> {
          // written with the forward index
        }
        case NUMERIC -> numericIndexer(docId, fs, data);
        case GEO -> geoIndexer(docId, fs, data);
        case TAG -> tagIndexer(docId, fs, data);
        default -> throw new IndexingException(
            QueryErrorCode.GENERIC, "BUG: invalid index type " + type);
      }
    }
  }

  private void numericIndexer(long docId, FieldSpec fs, FieldIndexerData data) {
    NumericRangeTree tree =
        open(IndexFieldType.NUMERIC, fs, key -> store.openNumericIndex(key, true));
    if (tree == null) {
      throw new IndexingException(
          QueryErrorCode.GENERIC, "Could not open numeric index for indexing");
    }
    int bytes = tree.add(docId, data.getNumeric());
    spec.getStats().recordsAdded(1, bytes);
  }

  private void geoIndexer(long docId, FieldSpec fs, FieldIndexerData data) {
    GeoIndex geo = open(IndexFieldType.GEO, fs, key -> store.openGeoIndex(key, true));
    if (geo == null) {
      throw new IndexingException(QueryErrorCode.GENERIC, "Could not open geo index for indexing");
    }
    if (!geo.addStrings(docId, data.getGeoLongitude(), data.getGeoLatitude())) {
      throw new IndexingException(QueryErrorCode.GENERIC, "Could not index geo value");
    }
  }

  private void tagIndexer(long docId, FieldSpec fs, FieldIndexerData data) {
    if (!data.hasTags()) {
      return;
    }
    TagIndex tags = open(IndexFieldType.TAG, fs, key -> store.openTagIndex(key, true));
    if (tags == null) {
      throw new IndexingException(QueryErrorCode.GENERIC, "Could not open tag index for indexing");
    }
    long bytes = tags.index(data.getTags(), docId);
    spec.getStats().recordsAdded(data.getTags().size(), bytes);
  }

  @SuppressWarnings("unchecked")
  private <T> T open(IndexFieldType type, FieldSpec fs, Function<String, T> opener) {
    Map<String, Object> byKey = handles.computeIfAbsent(type, t -> new HashMap<>());
    return (T) byKey.computeIfAbsent(spec.getFormattedKey(fs, type), opener::apply);
  }

  /** Returns the number of structures opened so far. */
  public int getOpenHandleCount() {
    return handles.values().stream().mapToInt(Map::size).sum();
  }

  public void release() {
    handles.clear();
  }
}
