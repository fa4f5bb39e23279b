package uk.ac.ebi.biostudies.index_core.store.numeric;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class NumericRangeTreeTest {

  @Test
  void newTreeHasSingleEmptyLeaf() {
    NumericRangeTree tree = new NumericRangeTree();

    assertTrue(tree.getRoot().isLeaf());
    assertEquals(0, tree.getRevisionId());
    assertEquals(1, tree.getNumRanges());
  }

  @Test
  void leafSplitsPastThresholdAndBumpsRevision() {
    NumericRangeTree tree = new NumericRangeTree(4, 100);
    for (int i = 1; i <= 5; i++) {
      tree.add(i, i * 10.0);
    }

    assertFalse(tree.getRoot().isLeaf());
    assertNull(tree.getRoot().getRange());
    assertEquals(1, tree.getRevisionId());
    assertEquals(2, tree.getNumRanges());
    assertEquals(5, tree.getNumEntries());

    NumericRange left = tree.getRoot().getLeft().getRange();
    NumericRange right = tree.getRoot().getRight().getRange();
    assertEquals(5, left.size() + right.size());
    assertTrue(left.getMaxVal() < right.getMinVal());
  }

  @Test
  void identicalValuesNeverSplit() {
    NumericRangeTree tree = new NumericRangeTree(2, 100);
    for (int i = 1; i <= 10; i++) {
      tree.add(i, 7.0);
    }

    assertTrue(tree.getRoot().isLeaf());
    assertEquals(0, tree.getRevisionId());
    assertTrue(tree.getRoot().getRange().contains(7.0));
  }

  @Test
  void addAfterOutlierWasRepairedAwayDoesNotSplitEqualValues() {
    NumericRangeTree tree = new NumericRangeTree(4, 100);
    tree.add(1, 7.0);
    tree.add(2, 5.0);
    tree.add(3, 5.0);
    NumericRange range = tree.getRoot().getRange();
    long removed = range.getEntries().repair(docId -> docId != 1, 0, 10).docsRemoved();
    tree.entriesRemoved(removed);
    tree.add(4, 5.0);
    tree.add(5, 5.0);

    assertDoesNotThrow(() -> tree.add(6, 5.0));

    assertTrue(tree.getRoot().isLeaf());
    assertEquals(0, tree.getRevisionId());
    assertEquals(5, tree.getNumEntries());
    assertEquals(5.0, range.getMinVal());
    assertEquals(5.0, range.getMaxVal());

    tree.add(7, 9.0);

    assertFalse(tree.getRoot().isLeaf());
    assertEquals(9.0, tree.getRoot().getValue());
    assertEquals(5, tree.getRoot().getLeft().getRange().size());
    assertEquals(1, tree.getRoot().getRight().getRange().size());
  }

  @Test
  void iteratorVisitsEveryNodeOnce() {
    NumericRangeTree tree = new NumericRangeTree(2, 100);
    for (int i = 1; i <= 12; i++) {
      tree.add(i, i);
    }

    List<NumericRangeNode> nodes = new ArrayList<>();
    NumericRangeTreeIterator iterator = tree.iterator();
    NumericRangeNode node;
    while ((node = iterator.next()) != null) {
      nodes.add(node);
    }

    long leaves = nodes.stream().filter(NumericRangeNode::isLeaf).count();
    assertEquals(tree.getNumRanges(), leaves);
    assertEquals(2 * leaves - 1, nodes.size());
    assertNull(iterator.next());
  }

  @Test
  void entriesRemovedAdjustsCount() {
    NumericRangeTree tree = new NumericRangeTree();
    tree.add(1, 1.0);
    tree.add(2, 2.0);

    tree.entriesRemoved(1);

    assertEquals(1, tree.getNumEntries());
  }
}
