package uk.ac.ebi.biostudies.index_core.index;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import uk.ac.ebi.biostudies.index_core.exceptions.IndexingException;
import uk.ac.ebi.biostudies.index_core.exceptions.QueryErrorCode;
import uk.ac.ebi.biostudies.index_core.index.management.IndexResolver;
import uk.ac.ebi.biostudies.index_core.index.management.IndexSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.FieldSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexSchema;
import uk.ac.ebi.biostudies.index_core.store.document.DocumentMetadata;
import uk.ac.ebi.biostudies.index_core.store.document.DocumentStore;
import uk.ac.ebi.biostudies.index_core.store.document.DocumentTable;
import uk.ac.ebi.biostudies.index_core.store.document.SortingVector;

/**
 * Entry point of the document indexing pipeline.
 *
 * <p>An add binds the document to the index schema, then either:
 *
 * <ul>
 *   <li>updates metadata only, for a partial update that touches no indexable field;
 *   <li>reloads the stored document and reindexes it in full, for any other partial update;
 *   <li>indexes the document in full.
 * </ul>
 *
 * <p>Full indexing runs inline unless the document carries at least {@code
 * indexer.self-exec-threshold} bytes of full-text or tag content, in which case it is handed to a
 * bounded worker pool. Either way the returned future completes exactly once with the {@link
 * IndexingResult}; it never completes exceptionally.
 */
@Slf4j
@Service
public class DocumentIndexingService {

  private final IndexResolver indexResolver;
  private final DocumentStore documentStore;
  private final FieldPreprocessors preprocessors;
  private final DocumentIndexer documentIndexer;
  private final AtomicInteger threadCounter = new AtomicInteger();
  private ThreadPoolExecutor threadPoolExecutor;

  @Value("${indexer.thread-count:8}")
  private int threadCount;

  @Value("${indexer.queue-capacity:100}")
  private int queueCapacity;

  @Value("${indexer.self-exec-threshold:1024}")
  private long selfExecThreshold;

  public DocumentIndexingService(
      IndexResolver indexResolver,
      DocumentStore documentStore,
      FieldPreprocessors preprocessors,
      DocumentIndexer documentIndexer) {
    this.indexResolver = indexResolver;
    this.documentStore = documentStore;
    this.preprocessors = preprocessors;
    this.documentIndexer = documentIndexer;
  }

  @PostConstruct
  public void init() {
    threadPoolExecutor =
        new ThreadPoolExecutor(
            threadCount,
            threadCount,
            60L,
            TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            r -> {
              Thread t = new Thread(r, "indexer-" + threadCounter.incrementAndGet());
              t.setDaemon(true);
              return t;
            },
            new ThreadPoolExecutor.CallerRunsPolicy());
    log.info(
        "DocumentIndexingService initialized: threads={}, queue={}, selfExecThreshold={}",
        threadCount,
        queueCapacity,
        selfExecThreshold);
  }

  @PreDestroy
  public void shutdown() {
    if (threadPoolExecutor != null) {
      threadPoolExecutor.shutdown();
    }
  }

  /**
   * Adds a document to an index.
   *
   * @param indexName target index
   * @param document the document; it is copied, later changes by the caller are not seen
   * @param options add options
   * @return a future completed with the outcome of the add
   */
  public CompletableFuture<IndexingResult> addDocument(
      String indexName, Document document, Set<AddOptions> options) {
    CompletableFuture<IndexingResult> future = new CompletableFuture<>();
    IndexSpec spec = indexResolver.resolve(indexName);
    if (spec == null) {
      future.complete(
          IndexingResult.builder()
              .key(document.getKey())
              .code(QueryErrorCode.GENERIC)
              .detailCode(QueryErrorCode.GENERIC)
              .message("Unknown index: " + indexName)
              .build());
      return future;
    }

    AddDocumentContext ctx = new AddDocumentContext(spec, options, future::complete);
    Document doc = document.copy();
    try {
      ctx.setDocument(spec.getSchema(), doc);
      if (!ctx.isReplace() && exists(spec, doc.getKey())) {
        throw new IndexingException(QueryErrorCode.GENERIC, "Document already exists");
      }
      if (!ctx.hasOption(AddOptions.NO_SAVE)) {
        documentStore.save(doc.getKey(), doc.toFieldMap(), ctx.hasOption(AddOptions.PARTIAL));
      }
    } catch (IndexingException e) {
      log.debug("Rejected document {}: {}", doc.getKey(), e.getMessage());
      ctx.fail(e);
      return future;
    }

    submit(ctx);
    return future;
  }

  /**
   * Submits a bound context for indexing. Partial updates are resolved first; full indexing runs
   * inline or on the worker pool depending on the document size.
   */
  public void submit(AddDocumentContext ctx) {
    if (ctx.hasOption(AddOptions.PARTIAL) && handlePartialUpdate(ctx)) {
      return;
    }

    long totalSize = indexedContentSize(ctx);
    if (totalSize >= selfExecThreshold && ctx.isBlockable() && !threadPoolExecutor.isShutdown()) {
      log.debug(
          "Handing document {} ({} bytes) to worker pool", ctx.getDocument().getKey(), totalSize);
      threadPoolExecutor.execute(() -> addToIndexes(ctx));
    } else {
      addToIndexes(ctx);
    }
  }

  /** Returns true if the partial update was completed here. */
  private boolean handlePartialUpdate(AddDocumentContext ctx) {
    if (ctx.hasFlag(ContextFlag.HAS_INDEXABLES)) {
      return replaceMerge(ctx);
    }
    updateNoIndex(ctx);
    return true;
  }

  /**
   * Reloads the stored fields of the document, overlays the submitted fields on them and rebinds
   * the context to the result, so that the document is reindexed in full under a new id. Submitted
   * values replace stored ones of the same name, matched ignoring case.
   *
   * @return true if the add was completed with an error, false if indexing should proceed
   */
  boolean replaceMerge(AddDocumentContext ctx) {
    Document current = ctx.getDocument();
    Map<String, String> stored = documentStore.load(current.getKey());
    if (stored == null) {
      ctx.fail(QueryErrorCode.NO_SUCH_DOCUMENT, "Could not load existing document");
      return true;
    }

    IndexSchema schema = ctx.getSpec().getSchema();
    Document merged = current.withoutFields();
    for (Map.Entry<String, String> entry : stored.entrySet()) {
      if (schema.getField(entry.getKey()) != null
          && current.getField(entry.getKey()) == null) {
        merged.addField(entry.getKey(), entry.getValue());
      }
    }
    for (DocumentField field : current.getFields()) {
      merged.addField(field.getName(), field.getText(), field.getIndexAs());
    }
    try {
      ctx.setDocument(schema, merged);
    } catch (IndexingException e) {
      ctx.fail(e);
      return true;
    }
    return false;
  }

  /**
   * Updates score, payload and sortable values of an existing document without touching any index
   * structure. Completes the add.
   */
  void updateNoIndex(AddDocumentContext ctx) {
    IndexSpec spec = ctx.getSpec();
    Document doc = ctx.getDocument();
    spec.getLock().lock();
    try {
      DocumentTable docs = spec.getDocs();
      long docId = docs.getId(doc.getKey());
      if (docId == 0) {
        ctx.fail(QueryErrorCode.NO_SUCH_DOCUMENT, "Couldn't load old document");
        return;
      }
      DocumentMetadata md = docs.get(docId);
      if (md == null) {
        ctx.fail(QueryErrorCode.NO_SUCH_DOCUMENT, "Couldn't load document metadata");
        return;
      }

      md.setScore(doc.getScore());
      if (doc.getPayload() != null) {
        docs.setPayload(docId, doc.getPayload());
      }

      if (ctx.hasFlag(ContextFlag.HAS_SORTABLES)) {
        updateSortables(ctx, spec.getSchema(), md);
        if (ctx.isFinished()) {
          return;
        }
      }
      doc.setDocId(docId);
    } finally {
      spec.getLock().unlock();
    }
    ctx.finish();
  }

  private void updateSortables(AddDocumentContext ctx, IndexSchema schema, DocumentMetadata md) {
    BitSet dedupe = new BitSet();
    for (DocumentField field : ctx.getDocument().getFields()) {
      FieldSpec fs = schema.getField(field.getName());
      if (fs == null || !fs.isSortable()) {
        continue;
      }
      if (dedupe.get(fs.getIndex())) {
        ctx.fail(QueryErrorCode.DUPLICATE_FIELD, "Requested to index field twice");
        return;
      }
      dedupe.set(fs.getIndex());

      int idx = schema.getFieldSortingIndex(field.getName());
      if (idx < 0) {
        continue;
      }
      if (md.getSortVector() == null) {
        md.setSortVector(new SortingVector(schema.getSortableCount()));
      }
      if (fs.isDynamic()) {
        ctx.fail(QueryErrorCode.GENERIC, "Dynamic field cannot use PARTIAL");
        return;
      }

      if (fs.isOnly(IndexFieldType.FULLTEXT) || fs.isOnly(IndexFieldType.TAG)) {
        md.getSortVector().putString(idx, field.getText());
      } else if (fs.isOnly(IndexFieldType.NUMERIC)) {
        OptionalDouble value = NumericParser.parse(field.getText());
        if (value.isEmpty()) {
          ctx.fail(QueryErrorCode.NOT_NUMERIC, "Could not parse numeric index value");
          return;
        }
        md.getSortVector().putNumber(idx, value.getAsDouble());
      } else {
        ctx.fail(QueryErrorCode.GENERIC, "Unsupported sortable type");
        return;
      }
    }
  }

  /**
   * Preprocesses every field of the document in order, then commits it. Completes the add.
   *
   * <p>A failing preprocessor stops the add; the reported code is {@link QueryErrorCode#GENERIC}
   * with the preprocessor's code as detail.
   */
  void addToIndexes(AddDocumentContext ctx) {
    Document doc = ctx.getDocument();
    try {
      List<DocumentField> fields = doc.getFields();
      for (int i = 0; i < fields.size(); i++) {
        DocumentField field = fields.get(i);
        FieldSpec fs = ctx.getFieldSpecs().get(i);
        Set<IndexFieldType> types = ctx.getFieldTypes().get(i);
        if (fs.isEmpty() || types.isEmpty()) {
          log.debug("Skipping field {} not in index", field.getName());
          continue;
        }
        FieldIndexerData data = ctx.getFieldData().get(i);
        for (IndexFieldType type : IndexFieldType.values()) {
          if (types.contains(type)) {
            preprocessors.preprocess(type, ctx, field, fs, data);
          }
        }
      }
    } catch (IndexingException e) {
      log.debug("Preprocessing of document {} failed: {}", doc.getKey(), e.getMessage());
      ctx.fail(QueryErrorCode.GENERIC, e.getCode(), e.getMessage());
      return;
    } catch (RuntimeException e) {
      log.error("Unexpected error preprocessing document {}", doc.getKey(), e);
      ctx.fail(QueryErrorCode.GENERIC, e.getMessage());
      return;
    }

    try {
      documentIndexer.commit(ctx);
    } catch (IndexingException e) {
      log.debug("Commit of document {} failed: {}", doc.getKey(), e.getMessage());
      ctx.fail(e);
      return;
    } catch (RuntimeException e) {
      log.error("Unexpected error committing document {}", doc.getKey(), e);
      ctx.fail(QueryErrorCode.GENERIC, e.getMessage());
      return;
    }
    ctx.finish();
  }

  private long indexedContentSize(AddDocumentContext ctx) {
    long totalSize = 0;
    List<DocumentField> fields = ctx.getDocument().getFields();
    for (int i = 0; i < fields.size(); i++) {
      Set<IndexFieldType> types = ctx.getFieldTypes().get(i);
      if (ctx.getFieldSpecs().get(i).isEmpty()) {
        continue;
      }
      if (types.contains(IndexFieldType.FULLTEXT) || types.contains(IndexFieldType.TAG)) {
        totalSize += fields.get(i).getText().getBytes(StandardCharsets.UTF_8).length;
      }
    }
    return totalSize;
  }

  private boolean exists(IndexSpec spec, String key) {
    spec.getLock().lock();
    try {
      return spec.getDocs().exists(key);
    } finally {
      spec.getLock().unlock();
    }
  }
}
