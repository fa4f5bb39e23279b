package uk.ac.ebi.biostudies.index_core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import uk.ac.ebi.biostudies.index_core.index.management.IndexContainer;
import uk.ac.ebi.biostudies.index_core.index.management.IndexManager;

@SpringBootTest
@ActiveProfiles(Constants.TEST_PROFILE)
class IndexCoreApplicationTests {

  @Autowired private IndexContainer indexContainer;

  @Autowired private IndexManager indexManager;

  @Test
  void contextLoads() {}

  @Test
  void declaredIndexesAreCreatedAtStartup() {
    assertTrue(indexContainer.contains(IndexTestDataFactory.INDEX_NAME));
    assertFalse(indexManager.isGcRunning(IndexTestDataFactory.INDEX_NAME));
  }
}
