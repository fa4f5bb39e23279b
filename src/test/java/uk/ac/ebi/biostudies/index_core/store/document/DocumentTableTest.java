package uk.ac.ebi.biostudies.index_core.store.document;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DocumentTableTest {

  private final DocumentTable table = new DocumentTable();

  @Test
  void putAssignsIncreasingIds() {
    DocumentMetadata first = table.put("a", 1.0, Set.of(), null);
    DocumentMetadata second = table.put("b", 0.5, Set.of(), new byte[] {1});

    assertEquals(1, first.getId());
    assertEquals(2, second.getId());
    assertTrue(second.hasFlag(DocumentFlag.HAS_PAYLOAD));
    assertEquals(2, table.size());
    assertEquals(2, table.getMaxDocId());
  }

  @Test
  void putOfExistingKeyDeletesThePreviousDocument() {
    DocumentMetadata old = table.put("a", 1.0, Set.of(), null);
    DocumentMetadata replacement =
        table.put("a", 1.0, EnumSet.of(DocumentFlag.HAS_ON_DEMAND_DELETABLE), null);

    assertTrue(old.isDeleted());
    assertFalse(table.isLive(old.getId()));
    assertTrue(table.isLive(replacement.getId()));
    assertEquals(replacement.getId(), table.getId("a"));
    assertEquals(1, table.size());
  }

  @Test
  void deleteForgetsTheKeyButNotTheIdSequence() {
    DocumentMetadata md = table.put("a", 1.0, Set.of(), null);

    assertSame(md, table.delete("a"));
    assertNull(table.delete("a"));
    assertEquals(0, table.getId("a"));
    assertNull(table.get(md.getId()));
    assertFalse(table.exists("a"));

    assertEquals(2, table.put("a", 1.0, Set.of(), null).getId());
  }

  @Test
  void setPayloadOnUnknownIdIsIgnored() {
    table.setPayload(42, new byte[] {1});

    assertNull(table.get(42));
  }
}
