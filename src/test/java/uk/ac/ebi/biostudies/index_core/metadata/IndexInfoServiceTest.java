package uk.ac.ebi.biostudies.index_core.metadata;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.ac.ebi.biostudies.index_core.IndexTestDataFactory;
import uk.ac.ebi.biostudies.index_core.gc.GarbageCollector;
import uk.ac.ebi.biostudies.index_core.gc.SnapshotLoadState;
import uk.ac.ebi.biostudies.index_core.index.management.IndexContainer;
import uk.ac.ebi.biostudies.index_core.index.management.IndexManager;
import uk.ac.ebi.biostudies.index_core.index.management.IndexSpec;
import uk.ac.ebi.biostudies.index_core.registry.mapper.SchemaRegistryMapper;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexSchema;
import uk.ac.ebi.biostudies.index_core.store.MemoryIndexStore;

@ExtendWith(MockitoExtension.class)
class IndexInfoServiceTest {

  @Mock private IndexManager indexManager;

  private IndexContainer container;
  private IndexInfoService service;

  @BeforeEach
  void setUp() {
    container = new IndexContainer();
    service = new IndexInfoService(container, indexManager);
  }

  @Test
  void getIndexInfoReportsCountersAndCollectorStats() {
    IndexSpec spec = new IndexSpec(IndexTestDataFactory.createSchema(), 3);
    spec.setGc(
        new GarbageCollector(
            spec,
            container,
            new MemoryIndexStore(100, 512),
            new SnapshotLoadState(),
            IndexTestDataFactory.createGcConfig(10),
            new Random(1)));
    spec.getStats().documentAdded();
    spec.getStats().recordsAdded(4, 40);
    spec.recordTerm("hello");
    container.put(spec);
    when(indexManager.isGcRunning("test")).thenReturn(true);

    IndexInfoDto info = service.getIndexInfo("test");

    assertEquals("test", info.getName());
    assertEquals(3, info.getUniqueId());
    assertEquals(1, info.getNumberOfDocuments());
    assertEquals(1, info.getNumberOfTerms());
    assertEquals(4, info.getNumberOfRecords());
    assertEquals(40, info.getInvertedSize());
    assertTrue(info.isGcRunning());
    assertEquals(10.0, info.getGcStats().get("current_hz"));
  }

  @Test
  void getAllIndexesInfoIsSortedByName() {
    SchemaRegistryMapper mapper = new SchemaRegistryMapper();
    for (String name : new String[] {"zeta", "alpha"}) {
      IndexSchema schema =
          mapper
              .fromJson(
                  "[{\"indexName\":\""
                      + name
                      + "\",\"fields\":[{\"name\":\"f\",\"types\":[\"fulltext\"]}]}]")
              .get(0);
      container.put(new IndexSpec(schema, 1));
    }

    List<IndexInfoDto> infos = service.getAllIndexesInfo();

    assertEquals(List.of("alpha", "zeta"), infos.stream().map(IndexInfoDto::getName).toList());
    assertTrue(infos.get(0).getGcStats().isEmpty());
  }

  @Test
  void getIndexInfoOfMissingIndexThrows() {
    assertThrows(IllegalStateException.class, () -> service.getIndexInfo("missing"));
  }
}
