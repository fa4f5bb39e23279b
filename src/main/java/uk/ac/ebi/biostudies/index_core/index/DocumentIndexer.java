package uk.ac.ebi.biostudies.index_core.index;

import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.index_core.exceptions.IndexingException;
import uk.ac.ebi.biostudies.index_core.exceptions.QueryErrorCode;
import uk.ac.ebi.biostudies.index_core.gc.GarbageCollector;
import uk.ac.ebi.biostudies.index_core.index.management.IndexResolver;
import uk.ac.ebi.biostudies.index_core.index.management.IndexSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.FieldSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;
import uk.ac.ebi.biostudies.index_core.store.IndexStore;
import uk.ac.ebi.biostudies.index_core.store.document.DocumentFlag;
import uk.ac.ebi.biostudies.index_core.store.document.DocumentMetadata;
import uk.ac.ebi.biostudies.index_core.store.document.DocumentTable;
import uk.ac.ebi.biostudies.index_core.store.geo.GeoIndex;
import uk.ac.ebi.biostudies.index_core.store.postings.IndexRecord;
import uk.ac.ebi.biostudies.index_core.store.postings.InvertedIndex;

/**
 * Writes a fully preprocessed document into its index: assigns the document id, writes the term
 * postings from the forward index, then commits the other field types one field at a time.
 *
 * <p>The whole commit runs under the index lock. A failure part way through leaves what was already
 * written in place. Replacing a document hints the index's collector, as a delete does.
 */
@Slf4j
@Component
public class DocumentIndexer {

  private final IndexResolver indexResolver;
  private final IndexStore indexStore;

  public DocumentIndexer(IndexResolver indexResolver, IndexStore indexStore) {
    this.indexResolver = indexResolver;
    this.indexStore = indexStore;
  }

  /**
   * Commits the document bound to the context.
   *
   * @param ctx a context whose fields have all been preprocessed
   * @throws IndexingException if the index is gone, the document already exists and the add is not
   *     a replace, or a structure cannot be written
   */
  public void commit(AddDocumentContext ctx) {
    IndexSpec spec = indexResolver.resolve(ctx.getSpec().getName());
    if (spec == null || spec.getUniqueId() != ctx.getSpec().getUniqueId()) {
      throw new IndexingException(
          QueryErrorCode.GENERIC, "Index " + ctx.getSpec().getName() + " no longer exists");
    }

    Document doc = ctx.getDocument();
    IndexBulkData bulk = new IndexBulkData(indexStore, spec);
    boolean replaced = false;
    spec.getLock().lock();
    try {
      boolean existed = spec.getDocs().getByKey(doc.getKey()) != null;
      long docId = assignDocId(spec, ctx);
      replaced = existed;
      writeTerms(spec, ctx.getForwardIndex(), docId);

      List<DocumentField> fields = doc.getFields();
      for (int i = 0; i < fields.size(); i++) {
        FieldSpec fs = ctx.getFieldSpecs().get(i);
        Set<IndexFieldType> types = ctx.getFieldTypes().get(i);
        if (fs.isEmpty() || types.isEmpty() || !fs.isIndexable()) {
          continue;
        }
        bulk.add(docId, fs, types, ctx.getFieldData().get(i));
      }
    } finally {
      spec.getLock().unlock();
      bulk.release();
      if (replaced) {
        hintCollector(spec);
      }
    }
  }

  private static void hintCollector(IndexSpec spec) {
    GarbageCollector gc = spec.getGc();
    if (gc != null) {
      gc.onDelete();
    }
  }

  private long assignDocId(IndexSpec spec, AddDocumentContext ctx) {
    Document doc = ctx.getDocument();
    DocumentTable docs = spec.getDocs();
    DocumentMetadata existing = docs.getByKey(doc.getKey());
    if (existing != null) {
      if (!ctx.isReplace()) {
        throw new IndexingException(QueryErrorCode.GENERIC, "Document already exists");
      }
      removeOnDemandEntries(spec, existing);
      spec.getStats().documentRemoved();
    }

    DocumentMetadata md =
        docs.put(doc.getKey(), doc.getScore(), ctx.getDocFlags(), doc.getPayload());
    if (ctx.getSortVector() != null) {
      md.setSortVector(ctx.getSortVector());
      md.getFlags().add(DocumentFlag.HAS_SORT_VECTOR);
    }
    if (ctx.getByteOffsets() != null) {
      md.setByteOffsets(ctx.getByteOffsets());
      md.getFlags().add(DocumentFlag.HAS_OFFSET_VECTOR);
    }
    doc.setDocId(md.getId());
    spec.getStats().documentAdded();
    if (existing != null) {
      log.debug("Replaced document {} ({} -> {})", doc.getKey(), existing.getId(), md.getId());
    }
    return md.getId();
  }

  private void writeTerms(IndexSpec spec, ForwardIndex forwardIndex, long docId) {
    for (ForwardIndexEntry entry : forwardIndex.getEntries()) {
      InvertedIndex postings = indexStore.openInvertedIndex(spec.getTermKey(entry.getTerm()), true);
      if (postings == null) {
        throw new IndexingException(
            QueryErrorCode.GENERIC, "Could not open inverted index for term " + entry.getTerm());
      }
      int bytes =
          postings.append(
              IndexRecord.term(
                  docId, entry.getFreq(), entry.getFieldMask(), entry.getPositions()));
      spec.getStats().recordsAdded(1, bytes);
      spec.recordTerm(entry.getTerm());
    }
  }

  /**
   * Removes the eagerly deleted entries (geo points) of a document that is going away. Callers hold
   * the index lock.
   */
  public void removeOnDemandEntries(IndexSpec spec, DocumentMetadata md) {
    if (!md.hasFlag(DocumentFlag.HAS_ON_DEMAND_DELETABLE)) {
      return;
    }
    for (FieldSpec fs : spec.getFieldsByType(IndexFieldType.GEO)) {
      GeoIndex geo = indexStore.openGeoIndex(spec.getFormattedKey(fs, IndexFieldType.GEO), false);
      if (geo != null) {
        geo.remove(md.getId());
      }
    }
  }
}
