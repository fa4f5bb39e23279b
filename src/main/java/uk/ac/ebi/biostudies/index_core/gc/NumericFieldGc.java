package uk.ac.ebi.biostudies.index_core.gc;

import lombok.Getter;
import uk.ac.ebi.biostudies.index_core.store.numeric.NumericRangeNode;
import uk.ac.ebi.biostudies.index_core.store.numeric.NumericRangeTree;
import uk.ac.ebi.biostudies.index_core.store.numeric.NumericRangeTreeIterator;

/**
 * Collector cursor over one numeric field. It remembers the tree and the tree revision it was
 * created for, and walks the tree across cycles so a full traversal is spread over many cycles.
 *
 * <p>The cursor is only valid while the tree's revision equals the captured one.
 */
@Getter
public class NumericFieldGc {

  private final NumericRangeTree tree;
  private final long revisionId;
  private NumericRangeTreeIterator iterator;

  public NumericFieldGc(NumericRangeTree tree) {
    this.tree = tree;
    this.revisionId = tree.getRevisionId();
    this.iterator = tree.iterator();
  }

  /** Returns true if this cursor was built for the given tree at its current revision. */
  public boolean isValidFor(NumericRangeTree current) {
    return tree == current && revisionId == current.getRevisionId();
  }

  /** Returns true if the tree was restructured since the cursor was created. */
  public boolean isStale() {
    return revisionId != tree.getRevisionId();
  }

  /**
   * Advances to the next node that holds a range, restarting from the root once if the iterator
   * is exhausted.
   *
   * @return the next leaf node
   * @throws IllegalStateException if a restarted iterator finds no range either
   */
  public NumericRangeNode nextGcNode() {
    IteratorPass pass = IteratorPass.FRESH;
    for (;;) {
      NumericRangeNode node;
      while ((node = iterator.next()) != null) {
        if (node.getRange() != null) {
          return node;
        }
      }
      if (pass == IteratorPass.RESTARTED) {
        throw new IllegalStateException("Restarted numeric tree iterator found no range");
      }
      iterator = tree.iterator();
      pass = IteratorPass.RESTARTED;
    }
  }
}
