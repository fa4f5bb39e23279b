package uk.ac.ebi.biostudies.index_core.store.numeric;

import lombok.Getter;

/**
 * Node of a {@link NumericRangeTree}. Leaves carry a {@link NumericRange}; inner nodes route by
 * {@link #getValue()} and carry no range.
 */
@Getter
public class NumericRangeNode {

  private double value;
  private NumericRangeNode left;
  private NumericRangeNode right;
  private NumericRange range;

  NumericRangeNode(NumericRange range) {
    this.range = range;
  }

  public boolean isLeaf() {
    return left == null && right == null;
  }

  void becomeInner(double splitValue, NumericRangeNode left, NumericRangeNode right) {
    this.value = splitValue;
    this.left = left;
    this.right = right;
    this.range = null;
  }
}
