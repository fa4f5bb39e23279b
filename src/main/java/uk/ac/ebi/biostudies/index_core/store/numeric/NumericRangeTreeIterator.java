package uk.ac.ebi.biostudies.index_core.store.numeric;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Depth-first forward iterator over all nodes of a tree. It is not restartable in place; create a
 * new iterator to start over.
 */
public class NumericRangeTreeIterator {

  private final Deque<NumericRangeNode> stack = new ArrayDeque<>();

  public NumericRangeTreeIterator(NumericRangeTree tree) {
    stack.push(tree.getRoot());
  }

  /**
   * Returns the next node, or null once the tree is exhausted.
   *
   * @return the next node in pre-order
   */
  public NumericRangeNode next() {
    NumericRangeNode node = stack.poll();
    if (node == null) {
      return null;
    }
    if (node.getRight() != null) {
      stack.push(node.getRight());
    }
    if (node.getLeft() != null) {
      stack.push(node.getLeft());
    }
    return node;
  }
}
