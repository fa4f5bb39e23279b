package uk.ac.ebi.biostudies.index_core.store.postings;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * Append-only, block-structured postings list for one term, tag value or numeric range.
 *
 * <p>Records are appended in increasing document id order. Removal happens only through {@link
 * #repair(DocumentLiveness, int, int)}, which walks a bounded number of blocks per call and returns
 * a cursor to resume from. Blocks are kept in place even when emptied so that a cursor stays valid
 * between chunks.
 *
 * <p>Not thread-safe: callers hold the owning index's lock.
 */
public class InvertedIndex {

  public static final int DEFAULT_BLOCK_CAPACITY = 100;

  private final int blockCapacity;
  private final List<IndexBlock> blocks = new ArrayList<>();

  @Getter private long numDocs;
  @Getter private long lastId;
  @Getter private long totalBytes;

  public InvertedIndex() {
    this(DEFAULT_BLOCK_CAPACITY);
  }

  public InvertedIndex(int blockCapacity) {
    if (blockCapacity <= 0) {
      throw new IllegalArgumentException("Block capacity must be positive: " + blockCapacity);
    }
    this.blockCapacity = blockCapacity;
  }

  /**
   * Appends a record.
   *
   * @param record the record; its document id must not be lower than the last appended one
   * @return the number of bytes the record added
   * @throws IllegalArgumentException if document ids are appended out of order
   */
  public int append(IndexRecord record) {
    if (record.getDocId() < lastId) {
      throw new IllegalArgumentException(
          "Postings must be appended in document order: " + record.getDocId() + " < " + lastId);
    }
    if (blocks.isEmpty() || blocks.get(blocks.size() - 1).size() >= blockCapacity) {
      blocks.add(new IndexBlock(blockCapacity));
    }
    blocks.get(blocks.size() - 1).add(record);
    lastId = record.getDocId();
    numDocs++;
    totalBytes += record.getEncodedSize();
    return record.getEncodedSize();
  }

  /**
   * Removes records of deleted documents from at most {@code limit} blocks starting at {@code
   * cursor}.
   *
   * @param liveness decides which document ids are still live
   * @param cursor block to start from, 0 for the beginning
   * @param limit maximum number of blocks to visit
   * @return progress of this chunk; {@link RepairResult#nextCursor()} is 0 once the last block was
   *     visited
   */
  public RepairResult repair(DocumentLiveness liveness, int cursor, int limit) {
    if (cursor < 0 || cursor >= blocks.size()) {
      return new RepairResult(0, 0, 0);
    }
    int end = Math.min(blocks.size(), cursor + Math.max(1, limit));
    IndexBlock.RepairAccumulator acc = new IndexBlock.RepairAccumulator();
    for (int i = cursor; i < end; i++) {
      blocks.get(i).repair(liveness, acc);
    }
    numDocs -= acc.docsRemoved;
    totalBytes -= acc.bytesFreed;
    int next = end < blocks.size() ? end : 0;
    return new RepairResult(next, acc.docsRemoved, acc.bytesFreed);
  }

  public int getBlockCount() {
    return blocks.size();
  }

  /** Returns a snapshot of all records in document order. */
  public List<IndexRecord> getRecords() {
    List<IndexRecord> records = new ArrayList<>();
    for (IndexBlock block : blocks) {
      records.addAll(block.getRecords());
    }
    return records;
  }

  public boolean isEmpty() {
    return numDocs == 0;
  }
}
