package uk.ac.ebi.biostudies.index_core.store.numeric;

import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import uk.ac.ebi.biostudies.index_core.store.postings.IndexRecord;
import uk.ac.ebi.biostudies.index_core.store.postings.InvertedIndex;

/**
 * Range tree holding the numeric entries of one field.
 *
 * <p>Entries go to the leaf whose bounds route them. A leaf whose range grows beyond the split
 * threshold while holding more than one distinct value is split at its median into two leaves. Each
 * split is a structural change and bumps {@link #getRevisionId()}; holders of iterators or node
 * references compare revisions to detect that their view is stale.
 *
 * <p>Not thread-safe: callers hold the owning index's lock.
 */
@Slf4j
public class NumericRangeTree {

  public static final int DEFAULT_SPLIT_THRESHOLD = 512;

  private final int splitThreshold;
  private final int blockCapacity;

  @Getter private NumericRangeNode root;
  @Getter private long revisionId;
  @Getter private long numEntries;
  @Getter private int numRanges;

  public NumericRangeTree() {
    this(DEFAULT_SPLIT_THRESHOLD, InvertedIndex.DEFAULT_BLOCK_CAPACITY);
  }

  public NumericRangeTree(int splitThreshold, int blockCapacity) {
    if (splitThreshold < 2) {
      throw new IllegalArgumentException("Split threshold must be at least 2: " + splitThreshold);
    }
    this.splitThreshold = splitThreshold;
    this.blockCapacity = blockCapacity;
    this.root = new NumericRangeNode(new NumericRange(blockCapacity));
    this.numRanges = 1;
  }

  /**
   * Adds a value for a document.
   *
   * @param docId document id; must not be lower than previously added ids
   * @param value the value
   * @return bytes added to the postings
   */
  public int add(long docId, double value) {
    NumericRangeNode node = root;
    while (!node.isLeaf()) {
      node = value < node.getValue() ? node.getLeft() : node.getRight();
    }
    int size = node.getRange().add(docId, value);
    numEntries++;
    NumericRange range = node.getRange();
    if (range.size() > splitThreshold && range.getMinVal() < range.getMaxVal()) {
      split(node);
    }
    return size;
  }

  /** Records that a collector removed entries from one of the ranges. */
  public void entriesRemoved(long count) {
    numEntries -= count;
  }

  public NumericRangeTreeIterator iterator() {
    return new NumericRangeTreeIterator(this);
  }

  private void split(NumericRangeNode leaf) {
    List<IndexRecord> records = leaf.getRange().getEntries().getRecords();
    double[] values = records.stream().mapToDouble(IndexRecord::getNumericValue).sorted().toArray();
    if (values.length == 0 || values[0] == values[values.length - 1]) {
      // bounds went stale after a repair removed the outliers
      leaf.getRange().narrowBounds(values);
      return;
    }
    double splitValue = values[values.length / 2];
    if (splitValue == values[0]) {
      // keep the left side non-empty
      int i = values.length / 2;
      while (values[i] == splitValue) {
        i++;
      }
      splitValue = values[i];
    }

    NumericRange leftRange = new NumericRange(blockCapacity);
    NumericRange rightRange = new NumericRange(blockCapacity);
    for (IndexRecord record : records) {
      if (record.getNumericValue() < splitValue) {
        leftRange.add(record);
      } else {
        rightRange.add(record);
      }
    }
    leaf.becomeInner(
        splitValue, new NumericRangeNode(leftRange), new NumericRangeNode(rightRange));
    numRanges++;
    revisionId++;
    log.debug(
        "Split numeric range at {} ({} / {} entries), revision {}",
        splitValue,
        leftRange.size(),
        rightRange.size(),
        revisionId);
  }
}
