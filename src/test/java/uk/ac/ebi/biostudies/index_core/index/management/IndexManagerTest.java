package uk.ac.ebi.biostudies.index_core.index.management;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import uk.ac.ebi.biostudies.index_core.IndexTestDataFactory;
import uk.ac.ebi.biostudies.index_core.analysis.AnalyzerManager;
import uk.ac.ebi.biostudies.index_core.config.GcConfig;
import uk.ac.ebi.biostudies.index_core.gc.SnapshotLoadState;
import uk.ac.ebi.biostudies.index_core.index.Document;
import uk.ac.ebi.biostudies.index_core.index.DocumentIndexer;
import uk.ac.ebi.biostudies.index_core.index.DocumentIndexingService;
import uk.ac.ebi.biostudies.index_core.index.FieldPreprocessors;
import uk.ac.ebi.biostudies.index_core.index.IndexingResult;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexSchema;
import uk.ac.ebi.biostudies.index_core.store.MemoryIndexStore;
import uk.ac.ebi.biostudies.index_core.store.document.MemoryDocumentStore;

class IndexManagerTest {

  private static final String INDEX = IndexTestDataFactory.INDEX_NAME;

  private IndexContainer container;
  private MemoryIndexStore indexStore;
  private MemoryDocumentStore documentStore;
  private GcConfig gcConfig;
  private IndexManager manager;
  private DocumentIndexingService indexingService;

  @BeforeEach
  void setUp() {
    container = new IndexContainer();
    indexStore = new MemoryIndexStore(100, 512);
    documentStore = new MemoryDocumentStore();
    gcConfig = IndexTestDataFactory.createGcConfig(10);
    DocumentIndexer indexer = new DocumentIndexer(container, indexStore);
    manager =
        new IndexManager(
            container, indexStore, documentStore, indexer, new SnapshotLoadState(), gcConfig);

    indexingService =
        new DocumentIndexingService(
            container, documentStore, new FieldPreprocessors(new AnalyzerManager()), indexer);
    ReflectionTestUtils.setField(indexingService, "threadCount", 1);
    ReflectionTestUtils.setField(indexingService, "queueCapacity", 1);
    ReflectionTestUtils.setField(indexingService, "selfExecThreshold", Long.MAX_VALUE);
    indexingService.init();
  }

  @AfterEach
  void tearDown() {
    manager.shutdown();
    indexingService.shutdown();
  }

  @Test
  void createIndexRegistersSpecWithCollector() {
    IndexSpec spec = manager.createIndex(IndexTestDataFactory.createSchema());

    assertSame(spec, container.resolve(INDEX));
    assertNotNull(spec.getGc());
    assertEquals(spec.getUniqueId(), spec.getGc().getSpecUniqueId());
    assertFalse(manager.isGcRunning(INDEX));
  }

  @Test
  void createIndexTwiceFails() {
    IndexSchema schema = IndexTestDataFactory.createSchema();
    manager.createIndex(schema);

    assertThrows(IllegalStateException.class, () -> manager.createIndex(schema));
  }

  @Test
  void createIndexStartsCollectorWhenEnabled() {
    gcConfig.setEnabled(true);

    manager.createIndex(IndexTestDataFactory.createSchema());

    assertTrue(manager.isGcRunning(INDEX));
    manager.stopGc(INDEX);
    assertFalse(manager.isGcRunning(INDEX));
  }

  @Test
  void deleteDocumentLeavesPostingsButRemovesGeoPoint() throws Exception {
    IndexSpec spec = manager.createIndex(IndexTestDataFactory.createSchema());
    IndexingResult added = add("d1", "hello", "1,2");
    double hzBefore = spec.getGc().getHz();

    assertTrue(manager.deleteDocument(INDEX, "d1", true));

    assertFalse(spec.getDocs().isLive(added.docId()));
    assertEquals(0, spec.getStats().getNumDocuments());
    assertEquals(1, indexStore.openInvertedIndex(spec.getTermKey("hello"), false).getNumDocs());
    String geoKey = spec.getFormattedKey(spec.getField("location"), IndexFieldType.GEO);
    assertNull(indexStore.openGeoIndex(geoKey, false).get(added.docId()));
    assertNull(documentStore.load("d1"));
    assertTrue(spec.getGc().getHz() > hzBefore);

    assertFalse(manager.deleteDocument(INDEX, "d1", true));
  }

  @Test
  void dropIndexRemovesStructuresAndOptionallyDocuments() throws Exception {
    IndexSpec spec = manager.createIndex(IndexTestDataFactory.createSchema());
    add("d1", "hello", "1,2");

    assertTrue(manager.dropIndex(INDEX, true));

    assertNull(container.resolve(INDEX));
    assertNull(indexStore.openInvertedIndex(spec.getTermKey("hello"), false));
    assertNull(documentStore.load("d1"));
    assertFalse(manager.dropIndex(INDEX, true));
  }

  @Test
  void rebuildIndexCreatesNewIncarnation() throws Exception {
    IndexSpec old = manager.createIndex(IndexTestDataFactory.createSchema());
    add("d1", "hello", "1,2");

    IndexSpec rebuilt = manager.rebuildIndex(INDEX);

    assertNotEquals(old.getUniqueId(), rebuilt.getUniqueId());
    assertSame(rebuilt, container.resolve(INDEX));
    assertEquals(0, rebuilt.getDocs().size());
    assertEquals(Map.of("body", "hello", "location", "1,2"), documentStore.load("d1"));
  }

  private IndexingResult add(String key, String body, String location) throws Exception {
    Document doc = new Document(key, 1.0).addField("body", body).addField("location", location);
    IndexingResult result =
        indexingService.addDocument(INDEX, doc, Set.of()).get(5, TimeUnit.SECONDS);
    assertTrue(result.isSuccess(), result.toString());
    return result;
  }
}
