package uk.ac.ebi.biostudies.index_core.store.numeric;

import lombok.Getter;
import uk.ac.ebi.biostudies.index_core.store.postings.IndexRecord;
import uk.ac.ebi.biostudies.index_core.store.postings.InvertedIndex;

/** Value bounds of a tree node plus the postings of every entry falling inside them. */
@Getter
public class NumericRange {

  private double minVal = Double.POSITIVE_INFINITY;
  private double maxVal = Double.NEGATIVE_INFINITY;
  private final InvertedIndex entries;

  NumericRange(int blockCapacity) {
    this.entries = new InvertedIndex(blockCapacity);
  }

  int add(long docId, double value) {
    return add(IndexRecord.numeric(docId, value));
  }

  int add(IndexRecord record) {
    double value = record.getNumericValue();
    minVal = Math.min(minVal, value);
    maxVal = Math.max(maxVal, value);
    return entries.append(record);
  }

  /** Resets the bounds to those of the given sorted values, the live entries of this range. */
  void narrowBounds(double[] sortedValues) {
    if (sortedValues.length == 0) {
      minVal = Double.POSITIVE_INFINITY;
      maxVal = Double.NEGATIVE_INFINITY;
    } else {
      minVal = sortedValues[0];
      maxVal = sortedValues[sortedValues.length - 1];
    }
  }

  public boolean contains(double value) {
    return value >= minVal && value <= maxVal;
  }

  public long size() {
    return entries.getNumDocs();
  }
}
