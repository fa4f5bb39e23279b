package uk.ac.ebi.biostudies.index_core.store;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import uk.ac.ebi.biostudies.index_core.store.postings.InvertedIndex;

class MemoryIndexStoreTest {

  private final MemoryIndexStore store = new MemoryIndexStore(100, 512);

  @Test
  void openWithoutCreateReturnsNullForMissingKey() {
    assertNull(store.openInvertedIndex("ft:idx/missing", false));
  }

  @Test
  void openReturnsTheSameStructure() {
    InvertedIndex created = store.openInvertedIndex("ft:idx/term", true);

    assertSame(created, store.openInvertedIndex("ft:idx/term", false));
  }

  @Test
  void openWithWrongTypeReturnsNull() {
    store.openTagIndex("tag:idx/colour", true);

    assertNull(store.openNumericIndex("tag:idx/colour", true));
  }

  @Test
  void dropKeysRemovesOnlyMatchingPrefix() {
    store.openInvertedIndex("ft:idx/a", true);
    store.openInvertedIndex("ft:idx/b", true);
    store.openInvertedIndex("ft:other/a", true);

    assertEquals(2, store.dropKeys("ft:idx/"));

    assertNull(store.openInvertedIndex("ft:idx/a", false));
    assertNotNull(store.openInvertedIndex("ft:other/a", false));
  }
}
