package uk.ac.ebi.biostudies.index_core.store.postings;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/** A bounded run of postings records, the unit a repair chunk is measured in. */
class IndexBlock {

  private final List<IndexRecord> records;
  private long bytes;

  IndexBlock(int capacity) {
    this.records = new ArrayList<>(capacity);
  }

  void add(IndexRecord record) {
    records.add(record);
    bytes += record.getEncodedSize();
  }

  int size() {
    return records.size();
  }

  long getBytes() {
    return bytes;
  }

  List<IndexRecord> getRecords() {
    return records;
  }

  /**
   * Removes records of documents that are no longer live.
   *
   * @param liveness decides which document ids are still live
   * @param result accumulator for removed records and bytes
   */
  void repair(DocumentLiveness liveness, RepairAccumulator result) {
    Iterator<IndexRecord> it = records.iterator();
    while (it.hasNext()) {
      IndexRecord record = it.next();
      if (!liveness.isLive(record.getDocId())) {
        it.remove();
        bytes -= record.getEncodedSize();
        result.docsRemoved++;
        result.bytesFreed += record.getEncodedSize();
      }
    }
  }

  static final class RepairAccumulator {
    long docsRemoved;
    long bytesFreed;
  }
}
