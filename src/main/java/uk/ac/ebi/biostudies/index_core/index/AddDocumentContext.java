package uk.ac.ebi.biostudies.index_core.index;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import uk.ac.ebi.biostudies.index_core.exceptions.IndexingException;
import uk.ac.ebi.biostudies.index_core.exceptions.QueryErrorCode;
import uk.ac.ebi.biostudies.index_core.index.management.IndexSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.FieldSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexSchema;
import uk.ac.ebi.biostudies.index_core.store.document.ByteOffsets;
import uk.ac.ebi.biostudies.index_core.store.document.DocumentFlag;
import uk.ac.ebi.biostudies.index_core.store.document.SortingVector;

/**
 * Staging unit of one document add.
 *
 * <p>{@link #setDocument(IndexSchema, Document)} binds a document to the schema: every document
 * field gets a resolved {@link FieldSpec} (or {@link FieldSpec#EMPTY} if the schema does not know
 * it), the set of types it will be indexed as, and a scratch {@link FieldIndexerData} slot. The
 * lists are parallel to {@link Document#getFields()}.
 *
 * <p>The completion callback is invoked exactly once, by {@link #finish()} or {@link
 * #fail(QueryErrorCode, QueryErrorCode, String)}, after which the context releases its staging
 * data.
 */
@Slf4j
@Getter
public class AddDocumentContext {

  private final IndexSpec spec;
  private final Set<AddOptions> options;
  private final Consumer<IndexingResult> completion;

  private Document document;
  private final List<FieldSpec> fieldSpecs = new ArrayList<>();
  private final List<Set<IndexFieldType>> fieldTypes = new ArrayList<>();
  private final List<FieldIndexerData> fieldData = new ArrayList<>();
  private ForwardIndex forwardIndex = new ForwardIndex();
  private SortingVector sortVector;
  private ByteOffsets byteOffsets;
  @Setter private int totalTokens;

  private final Set<ContextFlag> stateFlags = EnumSet.noneOf(ContextFlag.class);
  private final Set<DocumentFlag> docFlags = EnumSet.noneOf(DocumentFlag.class);

  private final AtomicBoolean finished = new AtomicBoolean();

  public AddDocumentContext(
      IndexSpec spec, Set<AddOptions> options, Consumer<IndexingResult> completion) {
    this.spec = spec;
    this.options =
        options == null || options.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(options));
    this.completion = completion;
    if (this.options.contains(AddOptions.NO_BLOCK)) {
      stateFlags.add(ContextFlag.NO_BLOCK);
    }
  }

  /**
   * Binds a document to the schema, replacing any previously bound document.
   *
   * @param schema the index schema
   * @param doc the document; the context takes ownership of it
   * @throws IndexingException with {@link QueryErrorCode#DUPLICATE_FIELD} if two fields map to the
   *     same schema field, or {@link QueryErrorCode#UNSUPPORTED_TYPE} if a field asks for a type
   *     the schema does not allow
   */
  public void setDocument(IndexSchema schema, Document doc) {
    stateFlags.remove(ContextFlag.HAS_INDEXABLES);
    stateFlags.remove(ContextFlag.TEXT_INDEXED);
    stateFlags.remove(ContextFlag.OTHER_INDEXED);
    fieldSpecs.clear();
    fieldTypes.clear();
    fieldData.clear();
    doc.setDocId(0);
    this.document = doc;

    BitSet dedupe = new BitSet();
    int numTextIndexable = 0;
    boolean hasTextFields = false;
    boolean hasOtherFields = false;

    for (DocumentField field : doc.getFields()) {
      fieldData.add(new FieldIndexerData());
      FieldSpec fs = schema.getField(field.getName());
      if (fs == null || field.getText() == null) {
        fieldSpecs.add(FieldSpec.EMPTY);
        fieldTypes.add(Collections.emptySet());
        continue;
      }
      fieldSpecs.add(fs);

      if (dedupe.get(fs.getIndex())) {
        throw new IndexingException(
            QueryErrorCode.DUPLICATE_FIELD, "Tried to insert `" + fs.getName() + "` twice");
      }
      dedupe.set(fs.getIndex());

      if (fs.isSortable()) {
        stateFlags.add(ContextFlag.HAS_SORTABLES);
      }

      Set<IndexFieldType> types;
      if (!field.hasExplicitTypes()) {
        types = fs.getTypes();
      } else if (fs.getTypes().containsAll(field.getIndexAs())) {
        types = field.getIndexAs();
      } else {
        throw new IndexingException(
            QueryErrorCode.UNSUPPORTED_TYPE,
            "Tried to index field " + fs.getName() + " as type not specified in schema");
      }
      fieldTypes.add(types);

      if (fs.isIndexable()) {
        if (types.contains(IndexFieldType.FULLTEXT)) {
          numTextIndexable++;
          hasTextFields = true;
        }
        if (!(types.size() == 1 && types.contains(IndexFieldType.FULLTEXT))) {
          hasOtherFields = true;
        }
        if (types.contains(IndexFieldType.GEO)) {
          docFlags.add(DocumentFlag.HAS_ON_DEMAND_DELETABLE);
        }
      }
    }

    setFlag(ContextFlag.HAS_INDEXABLES, hasTextFields || hasOtherFields);
    setFlag(ContextFlag.TEXT_INDEXED, !hasTextFields);
    setFlag(ContextFlag.OTHER_INDEXED, !hasOtherFields);

    if (stateFlags.contains(ContextFlag.HAS_SORTABLES) && sortVector == null) {
      sortVector = new SortingVector(schema.getSortableCount());
    }
    if (sortVector == null && !hasTextFields && !hasOtherFields) {
      stateFlags.add(ContextFlag.EMPTY);
    }
    if (!options.contains(AddOptions.NO_SAVE)
        && numTextIndexable > 0
        && schema.isStoreByteOffsets()) {
      byteOffsets = new ByteOffsets(numTextIndexable);
    }
  }

  public boolean hasFlag(ContextFlag flag) {
    return stateFlags.contains(flag);
  }

  public boolean hasOption(AddOptions option) {
    return options.contains(option);
  }

  public boolean isReplace() {
    return options.contains(AddOptions.REPLACE) || options.contains(AddOptions.PARTIAL);
  }

  /** Returns true if the add may be handed off to the worker pool. */
  public boolean isBlockable() {
    return !stateFlags.contains(ContextFlag.NO_BLOCK);
  }

  public boolean isFinished() {
    return finished.get();
  }

  /** Completes the add successfully. */
  public void finish() {
    long docId = document == null ? 0 : document.getDocId();
    complete(IndexingResult.success(documentKey(), docId));
  }

  /** Completes the add with the error carried by the exception. */
  public void fail(IndexingException e) {
    fail(e.getCode(), e.getCode(), e.getMessage());
  }

  public void fail(QueryErrorCode code, String message) {
    fail(code, code, message);
  }

  /**
   * Completes the add with an error.
   *
   * @param code code reported to the caller
   * @param detailCode typed cause of the failure
   * @param message error message
   */
  public void fail(QueryErrorCode code, QueryErrorCode detailCode, String message) {
    complete(
        IndexingResult.builder()
            .key(documentKey())
            .docId(0)
            .code(code)
            .detailCode(detailCode)
            .message(message)
            .build());
  }

  private void complete(IndexingResult result) {
    if (!finished.compareAndSet(false, true)) {
      log.warn("Add of document {} already completed, ignoring {}", documentKey(), result);
      return;
    }
    try {
      completion.accept(result);
    } finally {
      release();
    }
  }

  private void release() {
    fieldSpecs.clear();
    fieldTypes.clear();
    fieldData.clear();
    forwardIndex = null;
  }

  private String documentKey() {
    return document == null ? null : document.getKey();
  }

  private void setFlag(ContextFlag flag, boolean value) {
    if (value) {
      stateFlags.add(flag);
    } else {
      stateFlags.remove(flag);
    }
  }
}
