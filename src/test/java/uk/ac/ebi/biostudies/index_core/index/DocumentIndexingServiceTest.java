package uk.ac.ebi.biostudies.index_core.index;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import uk.ac.ebi.biostudies.index_core.IndexTestDataFactory;
import uk.ac.ebi.biostudies.index_core.analysis.AnalyzerManager;
import uk.ac.ebi.biostudies.index_core.exceptions.QueryErrorCode;
import uk.ac.ebi.biostudies.index_core.gc.GarbageCollector;
import uk.ac.ebi.biostudies.index_core.index.management.IndexContainer;
import uk.ac.ebi.biostudies.index_core.index.management.IndexSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.FieldSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;
import uk.ac.ebi.biostudies.index_core.store.MemoryIndexStore;
import uk.ac.ebi.biostudies.index_core.store.document.DocumentFlag;
import uk.ac.ebi.biostudies.index_core.store.document.DocumentMetadata;
import uk.ac.ebi.biostudies.index_core.store.document.MemoryDocumentStore;
import uk.ac.ebi.biostudies.index_core.store.numeric.NumericRangeTree;
import uk.ac.ebi.biostudies.index_core.store.postings.IndexRecord;
import uk.ac.ebi.biostudies.index_core.store.postings.InvertedIndex;
import uk.ac.ebi.biostudies.index_core.store.tag.TagIndex;

class DocumentIndexingServiceTest {

  private static final String INDEX = IndexTestDataFactory.INDEX_NAME;

  private MemoryIndexStore indexStore;
  private MemoryDocumentStore documentStore;
  private IndexSpec spec;
  private DocumentIndexingService service;

  @BeforeEach
  void setUp() {
    IndexContainer container = new IndexContainer();
    indexStore = spy(new MemoryIndexStore(100, 512));
    documentStore = new MemoryDocumentStore();
    spec = new IndexSpec(IndexTestDataFactory.createSchema(), 1);
    container.put(spec);

    service =
        new DocumentIndexingService(
            container,
            documentStore,
            new FieldPreprocessors(new AnalyzerManager()),
            new DocumentIndexer(container, indexStore));
    // @Value is not processed outside a Spring context
    ReflectionTestUtils.setField(service, "threadCount", 2);
    ReflectionTestUtils.setField(service, "queueCapacity", 10);
    ReflectionTestUtils.setField(service, "selfExecThreshold", 1024L);
    service.init();
  }

  @AfterEach
  void tearDown() {
    service.shutdown();
  }

  @Test
  void givenNewDocument_whenAddDocument_thenEveryTypeIsCommitted() throws Exception {
    Document doc =
        new Document("d1", 0.8)
            .addField("body", "hello world")
            .addField("title", "Hello")
            .addField("price", "42")
            .addField("tags", "red, blue")
            .addField("location", "-122.4,37.7");

    IndexingResult result = add(doc, Set.of());

    assertTrue(result.isSuccess(), result.toString());
    assertEquals(1, result.docId());
    assertEquals(0, doc.getDocId(), "caller's document must not be modified");

    InvertedIndex hello = indexStore.openInvertedIndex(spec.getTermKey("hello"), false);
    assertEquals(1, hello.getNumDocs());
    IndexRecord record = hello.getRecords().get(0);
    assertEquals(2, record.getFreq());
    assertEquals(0b11L, record.getFieldMask());

    assertEquals(1, numericTree("price").getNumEntries());
    TagIndex tags = indexStore.openTagIndex(key("tags", IndexFieldType.TAG), false);
    assertEquals(2, tags.size());
    assertNotNull(
        indexStore.openGeoIndex(key("location", IndexFieldType.GEO), false).get(result.docId()));

    DocumentMetadata md = spec.getDocs().get(result.docId());
    assertEquals(0.8, md.getScore());
    assertEquals("hello", md.getSortVector().get(spec.getField("title").getSortIndex()));
    assertEquals(42.0, md.getSortVector().get(spec.getField("price").getSortIndex()));
    assertTrue(md.hasFlag(DocumentFlag.HAS_SORT_VECTOR));
    assertTrue(md.hasFlag(DocumentFlag.HAS_OFFSET_VECTOR));
    assertTrue(md.hasFlag(DocumentFlag.HAS_ON_DEMAND_DELETABLE));

    assertEquals(1, spec.getStats().getNumDocuments());
    assertEquals(2, spec.getStats().getNumTerms());
    assertEquals(5, spec.getStats().getNumRecords());
    assertEquals("red, blue", documentStore.load("d1").get("tags"));
  }

  @Test
  void givenUnknownIndex_whenAddDocument_thenGenericError() throws Exception {
    IndexingResult result =
        service
            .addDocument("missing", new Document("d1", 1.0).addField("body", "x"), Set.of())
            .get(5, TimeUnit.SECONDS);

    assertEquals(QueryErrorCode.GENERIC, result.code());
    assertEquals("d1", result.key());
  }

  @Test
  void givenExistingKey_whenAddWithoutReplace_thenDocumentAlreadyExists() throws Exception {
    add(new Document("d1", 1.0).addField("body", "hello"), Set.of());

    IndexingResult result = add(new Document("d1", 1.0).addField("body", "again"), Set.of());

    assertEquals(QueryErrorCode.GENERIC, result.code());
    assertEquals("Document already exists", result.message());
    assertEquals(1, spec.getDocs().getId("d1"));
  }

  @Test
  void givenExistingKey_whenReplace_thenNewIdAndOldGeoPointRemoved() throws Exception {
    add(new Document("d1", 1.0).addField("location", "1,2"), Set.of());

    IndexingResult result =
        add(
            new Document("d1", 1.0).addField("body", "replaced"),
            EnumSet.of(AddOptions.REPLACE));

    assertTrue(result.isSuccess(), result.toString());
    assertEquals(2, result.docId());
    assertFalse(spec.getDocs().isLive(1));
    assertEquals(0, indexStore.openGeoIndex(key("location", IndexFieldType.GEO), false).size());
    assertEquals(1, spec.getStats().getNumDocuments());
  }

  @Test
  void givenExistingKey_whenReplace_thenCollectorIsHinted() throws Exception {
    GarbageCollector gc = mock(GarbageCollector.class);
    spec.setGc(gc);
    add(new Document("d1", 1.0).addField("body", "first"), Set.of());
    verify(gc, never()).onDelete();

    IndexingResult result =
        add(new Document("d1", 1.0).addField("body", "second"), EnumSet.of(AddOptions.REPLACE));

    assertTrue(result.isSuccess(), result.toString());
    verify(gc).onDelete();
  }

  @Test
  void givenNonNumericValue_whenAddDocument_thenGenericWithNotNumericDetail() throws Exception {
    IndexingResult result =
        add(new Document("d1", 1.0).addField("body", "x").addField("price", "abc"), Set.of());

    assertEquals(QueryErrorCode.GENERIC, result.code());
    assertEquals(QueryErrorCode.NOT_NUMERIC, result.detailCode());
    assertFalse(spec.getDocs().exists("d1"));
  }

  @Test
  void givenInvalidGeoText_whenAddDocument_thenGenericWithGeoFormatDetail() throws Exception {
    IndexingResult result =
        add(new Document("d1", 1.0).addField("location", "nowhere"), Set.of());

    assertEquals(QueryErrorCode.GENERIC, result.code());
    assertEquals(QueryErrorCode.GEO_FORMAT, result.detailCode());
  }

  @Test
  void givenDuplicateField_whenAddDocument_thenDuplicateField() throws Exception {
    IndexingResult result =
        add(new Document("d1", 1.0).addField("price", "1").addField("Price", "2"), Set.of());

    assertEquals(QueryErrorCode.DUPLICATE_FIELD, result.code());
    assertNull(documentStore.load("d1"));
  }

  @Test
  void givenPartialUpdateOfSortableOnlyField_whenAdd_thenIndexStoreIsNotTouched()
      throws Exception {
    long docId = add(new Document("d1", 1.0).addField("body", "hello"), Set.of()).docId();
    clearInvocations(indexStore);

    Document update = new Document("d1", 0.25).addField("views", "7");
    update.setPayload(new byte[] {9});
    IndexingResult result = add(update, EnumSet.of(AddOptions.PARTIAL));

    assertTrue(result.isSuccess(), result.toString());
    assertEquals(docId, result.docId());
    verifyNoInteractions(indexStore);

    DocumentMetadata md = spec.getDocs().get(docId);
    assertEquals(0.25, md.getScore());
    assertArrayEquals(new byte[] {9}, md.getPayload());
    assertEquals(7.0, md.getSortVector().get(spec.getField("views").getSortIndex()));
    assertEquals(Map.of("body", "hello", "views", "7"), documentStore.load("d1"));
  }

  @Test
  void givenPartialUpdateOfMissingDocument_whenNoIndexables_thenNoSuchDocument()
      throws Exception {
    IndexingResult result =
        add(new Document("ghost", 1.0).addField("views", "1"), EnumSet.of(AddOptions.PARTIAL));

    assertEquals(QueryErrorCode.NO_SUCH_DOCUMENT, result.code());
  }

  @Test
  void givenPartialUpdateWithBadNumber_whenNoIndexables_thenNotNumeric() throws Exception {
    add(new Document("d1", 1.0).addField("body", "hello"), Set.of());

    IndexingResult result =
        add(new Document("d1", 1.0).addField("views", "many"), EnumSet.of(AddOptions.PARTIAL));

    assertEquals(QueryErrorCode.NOT_NUMERIC, result.code());
  }

  @Test
  void givenPartialUpdateOfIndexableField_whenAdd_thenDocumentIsReindexedUnderNewId()
      throws Exception {
    long oldId =
        add(new Document("d1", 1.0).addField("body", "hello").addField("price", "10"), Set.of())
            .docId();

    IndexingResult result =
        add(new Document("d1", 1.0).addField("price", "99"), EnumSet.of(AddOptions.PARTIAL));

    assertTrue(result.isSuccess(), result.toString());
    assertTrue(result.docId() > oldId);
    assertFalse(spec.getDocs().isLive(oldId));

    // the stored body was merged back in and indexed again
    InvertedIndex hello = indexStore.openInvertedIndex(spec.getTermKey("hello"), false);
    assertEquals(2, hello.getNumDocs());
    assertEquals(result.docId(), hello.getLastId());
    assertEquals(2, numericTree("price").getNumEntries());
    DocumentMetadata md = spec.getDocs().get(result.docId());
    assertEquals(99.0, md.getSortVector().get(spec.getField("price").getSortIndex()));
  }

  @Test
  void givenPartialNoSaveUpdateOfIndexableField_whenAdd_thenSubmittedValueIsIndexed()
      throws Exception {
    long oldId =
        add(new Document("d1", 1.0).addField("body", "hello").addField("price", "10"), Set.of())
            .docId();

    IndexingResult result =
        add(
            new Document("d1", 1.0).addField("BODY", "goodbye"),
            EnumSet.of(AddOptions.PARTIAL, AddOptions.NO_SAVE));

    assertTrue(result.isSuccess(), result.toString());
    assertTrue(result.docId() > oldId);
    InvertedIndex goodbye = indexStore.openInvertedIndex(spec.getTermKey("goodbye"), false);
    assertNotNull(goodbye);
    assertEquals(result.docId(), goodbye.getLastId());
    InvertedIndex hello = indexStore.openInvertedIndex(spec.getTermKey("hello"), false);
    assertEquals(1, hello.getNumDocs());
    assertEquals(oldId, hello.getLastId());
    // the stored price is merged back in, the stored body is not
    assertEquals(2, numericTree("price").getNumEntries());
    assertEquals(Map.of("body", "hello", "price", "10"), documentStore.load("d1"));
  }

  @Test
  void givenPartialUpdateWithoutStoredDocument_whenIndexable_thenNoSuchDocument()
      throws Exception {
    IndexingResult result =
        add(
            new Document("ghost", 1.0).addField("body", "x"),
            EnumSet.of(AddOptions.PARTIAL, AddOptions.NO_SAVE));

    assertEquals(QueryErrorCode.NO_SUCH_DOCUMENT, result.code());
    assertEquals("Could not load existing document", result.message());
  }

  @Test
  void givenLargeDocument_whenAddDocument_thenIndexedOnWorkerPool() throws Exception {
    String text = StringUtils.repeat("lorem ipsum ", 200);

    IndexingResult result = add(new Document("big", 1.0).addField("body", text), Set.of());

    assertTrue(result.isSuccess(), result.toString());
    InvertedIndex lorem = indexStore.openInvertedIndex(spec.getTermKey("lorem"), false);
    assertEquals(200, lorem.getRecords().get(0).getFreq());
  }

  @Test
  void givenLargeDocumentWithNoBlock_whenAddDocument_thenCompletesInline() {
    String text = StringUtils.repeat("lorem ipsum ", 200);

    CompletableFuture<IndexingResult> future =
        service.addDocument(
            INDEX,
            new Document("big", 1.0).addField("body", text),
            EnumSet.of(AddOptions.NO_BLOCK));

    assertTrue(future.isDone());
    assertTrue(future.join().isSuccess());
  }

  @Test
  void givenNoSave_whenAddDocument_thenNothingIsStored() throws Exception {
    IndexingResult result =
        add(new Document("d1", 1.0).addField("body", "hello"), EnumSet.of(AddOptions.NO_SAVE));

    assertTrue(result.isSuccess());
    assertNull(documentStore.load("d1"));
    assertNull(spec.getDocs().get(result.docId()).getByteOffsets());
  }

  private IndexingResult add(Document doc, Set<AddOptions> options) throws Exception {
    return service.addDocument(INDEX, doc, options).get(5, TimeUnit.SECONDS);
  }

  private NumericRangeTree numericTree(String field) {
    return indexStore.openNumericIndex(key(field, IndexFieldType.NUMERIC), false);
  }

  private String key(String field, IndexFieldType type) {
    FieldSpec fs = spec.getField(field);
    return spec.getFormattedKey(fs, type);
  }
}
